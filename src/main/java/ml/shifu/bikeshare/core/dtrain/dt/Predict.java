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
package ml.shifu.bikeshare.core.dtrain.dt;

/**
 * Predict value of a tree node, in GBT it is the mean of residuals fallen into such node.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public class Predict {

    private final double predict;

    public Predict(double predict) {
        this.predict = predict;
    }

    public double getPredict() {
        return predict;
    }

    @Override
    public String toString() {
        return "Predict [predict=" + predict + "]";
    }

}
