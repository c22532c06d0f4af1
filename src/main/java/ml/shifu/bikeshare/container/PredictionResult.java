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
package ml.shifu.bikeshare.container;

/**
 * Prediction of one record.
 */
public class PredictionResult {

    private final boolean predictedLabel;

    /**
     * Probability of {@link #predictedLabel} being true.
     */
    private final double probability;

    private final double score;

    public PredictionResult(boolean predictedLabel, double probability, double score) {
        this.predictedLabel = predictedLabel;
        this.probability = probability;
        this.score = score;
    }

    public boolean getPredictedLabel() {
        return predictedLabel;
    }

    public double getProbability() {
        return probability;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "PredictionResult [predictedLabel=" + predictedLabel + ", probability=" + probability + ", score="
                + score + "]";
    }

}
