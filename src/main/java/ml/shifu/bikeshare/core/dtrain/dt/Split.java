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
 * Split info of one tree node. All engineered features are continuous, a value less than {@link #threshold} goes to
 * the left child, else to the right child.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public class Split {

    /**
     * Index of the feature in engineered feature vector.
     */
    private final int columnNum;

    private final double threshold;

    public Split(int columnNum, double threshold) {
        this.columnNum = columnNum;
        this.threshold = threshold;
    }

    public int getColumnNum() {
        return columnNum;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isLeft(double value) {
        return value < this.threshold;
    }

    @Override
    public String toString() {
        return "Split [columnNum=" + columnNum + ", threshold=" + threshold + "]";
    }

}
