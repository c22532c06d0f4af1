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
 * Confusion matrix counts when records with score not less than {@link #score} are predicted as positive.
 */
public class ConfusionMatrixObject {

    public ConfusionMatrixObject() {
        this.tp = 0.0;
        this.fn = 0.0;
        this.fp = 0.0;
        this.tn = 0.0;
    }

    public ConfusionMatrixObject(ConfusionMatrixObject cmo) {
        this.tp = cmo.tp;
        this.fn = cmo.fn;
        this.fp = cmo.fp;
        this.tn = cmo.tn;
        this.score = cmo.score;
    }

    private double tp, fp, tn, fn;

    private double score;

    public double getTp() {
        return tp;
    }

    public void setTp(double tp) {
        this.tp = tp;
    }

    public double getFp() {
        return fp;
    }

    public void setFp(double fp) {
        this.fp = fp;
    }

    public double getTn() {
        return tn;
    }

    public void setTn(double tn) {
        this.tn = tn;
    }

    public double getFn() {
        return fn;
    }

    public void setFn(double fn) {
        this.fn = fn;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public double getTotal() {
        return this.tp + this.fp + this.fn + this.tn;
    }

    @Override
    public String toString() {
        return "ConfusionMatrixObject [tp=" + tp + ", fp=" + fp + ", tn=" + tn + ", fn=" + fn + ", score=" + score
                + "]";
    }

}
