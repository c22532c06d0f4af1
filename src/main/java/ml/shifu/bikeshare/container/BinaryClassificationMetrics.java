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
 * Evaluation result of binary classification on one data set.
 */
public class BinaryClassificationMetrics {

    private final double auc;

    private final double f1Score;

    private final double accuracy;

    private final double precision;

    private final double recall;

    /**
     * Mean of -(y * ln(p) + (1 - y) * ln(1 - p)).
     */
    private final double logLoss;

    private final ConfusionMatrixObject confusionMatrix;

    public BinaryClassificationMetrics(double auc, double f1Score, double accuracy, double precision, double recall,
            double logLoss, ConfusionMatrixObject confusionMatrix) {
        this.auc = auc;
        this.f1Score = f1Score;
        this.accuracy = accuracy;
        this.precision = precision;
        this.recall = recall;
        this.logLoss = logLoss;
        this.confusionMatrix = confusionMatrix;
    }

    public double getAuc() {
        return auc;
    }

    public double getF1Score() {
        return f1Score;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getPrecision() {
        return precision;
    }

    public double getRecall() {
        return recall;
    }

    public double getLogLoss() {
        return logLoss;
    }

    public ConfusionMatrixObject getConfusionMatrix() {
        return new ConfusionMatrixObject(confusionMatrix);
    }

    @Override
    public String toString() {
        return "BinaryClassificationMetrics [auc=" + auc + ", f1Score=" + f1Score + ", accuracy=" + accuracy
                + ", precision=" + precision + ", recall=" + recall + ", logLoss=" + logLoss + ", confusionMatrix="
                + confusionMatrix + "]";
    }

}
