/*
 * Copyright [2013-2015] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.bikeshare.core;

import ml.shifu.bikeshare.container.PredictionResult;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.util.Constants;

/**
 * Single record prediction on a {@link FittedPipeline}. Label of the input record is ignored.
 */
public class PredictionEngine {

    private final FittedPipeline pipeline;

    private final double threshold;

    public PredictionEngine(FittedPipeline pipeline) {
        this(pipeline, Constants.DEFAULT_PROBABILITY_THRESHOLD);
    }

    public PredictionEngine(FittedPipeline pipeline, double threshold) {
        this.pipeline = pipeline;
        this.threshold = threshold;
    }

    public PredictionResult predict(RentalRecord record) {
        double score = pipeline.score(record);
        double probability = pipeline.convertToProbability(score);
        return new PredictionResult(probability > threshold, probability, score);
    }

}
