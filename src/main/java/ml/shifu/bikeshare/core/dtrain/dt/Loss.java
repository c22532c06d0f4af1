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
 * Loss computation for gradient boost decision tree. Labels are 0 or 1.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public interface Loss {

    /**
     * Gradient of loss at current model score. Negative gradient is the residual the next tree fits.
     * 
     * @param predict
     *            current raw score
     * @param label
     *            label 0 or 1
     * @return gradient
     */
    public double computeGradient(double predict, float label);

    public double computeError(double predict, float label);

    /**
     * Convert raw score to the probability of label 1.
     * 
     * @param score
     *            raw score
     * @return probability in [0, 1]
     */
    public double convertToProbability(double score);

}

/**
 * Squared error, raw score is used as probability after cutting into [0, 1].
 */
class SquaredLoss implements Loss {

    @Override
    public double computeGradient(double predict, float label) {
        return 2d * (predict - label);
    }

    @Override
    public double computeError(double predict, float label) {
        double error = predict - label;
        return error * error;
    }

    @Override
    public double convertToProbability(double score) {
        return Math.max(0d, Math.min(1d, score));
    }

}

/**
 * Binomial log loss with labels mapped to -1/+1, reference https://statweb.stanford.edu/~jhf/ftp/trebst.pdf
 */
class LogLoss implements Loss {

    @Override
    public double computeGradient(double predict, float label) {
        double y = 2d * label - 1d;
        return -2d * y / (1d + Math.exp(2d * y * predict));
    }

    @Override
    public double computeError(double predict, float label) {
        double y = 2d * label - 1d;
        return Math.log1p(Math.exp(-2d * y * predict));
    }

    @Override
    public double convertToProbability(double score) {
        return 1d / (1d + Math.min(1.0E19, Math.exp(-2d * score)));
    }

}
