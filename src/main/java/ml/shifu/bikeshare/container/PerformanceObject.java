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
 * One point of performance curves like ROC and PR.
 */
public class PerformanceObject {

    /**
     * Lowest score of records predicted as positive.
     */
    public double binLowestScore;

    /**
     * Action rate, (TP + FP) / Total
     */
    public double actionRate;

    /**
     * Recall or true positive rate, TP / (TP + FN)
     */
    public double recall;

    /**
     * Precision, TP / (TP + FP)
     */
    public double precision;

    /**
     * False positive rate, FP / (FP + TN)
     */
    public double fpr;

    public double tp;

    public double fp;

    public double tn;

    public double fn;

    @Override
    public String toString() {
        return "PerformanceObject [binLowestScore=" + binLowestScore + ", recall=" + recall + ", precision="
                + precision + ", fpr=" + fpr + "]";
    }

}
