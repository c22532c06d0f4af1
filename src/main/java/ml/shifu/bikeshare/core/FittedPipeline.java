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

import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.core.dtrain.dt.IndependentTreeModel;
import ml.shifu.bikeshare.core.norm.FeatureTransformer;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;

/**
 * Fitted feature transformer with the tree model trained on its output.
 */
public class FittedPipeline {

    private final FeatureTransformer transformer;

    private final IndependentTreeModel model;

    public FittedPipeline(FeatureTransformer transformer, IndependentTreeModel model) {
        if(transformer == null || model == null) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODEL_NOT_FITTED);
        }
        if(!transformer.getFeatureNames().equals(model.getFeatureNames())) {
            throw new IllegalArgumentException("Model features " + model.getFeatureNames()
                    + " are not the same as transformer features " + transformer.getFeatureNames());
        }
        this.transformer = transformer;
        this.model = model;
    }

    /**
     * @param record
     *            raw record
     * @return raw model score of the record
     */
    public double score(RentalRecord record) {
        return model.compute(transformer.transform(record));
    }

    public double convertToProbability(double score) {
        return model.convertToProbability(score);
    }

    public FeatureTransformer getTransformer() {
        return transformer;
    }

    public IndependentTreeModel getModel() {
        return model;
    }

}
