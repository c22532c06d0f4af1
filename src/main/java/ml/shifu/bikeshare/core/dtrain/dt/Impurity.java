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

import java.util.ArrayList;
import java.util.List;

/**
 * Different {@link Impurity} strategies to compute impurity and gain for each tree node.
 * 
 * <p>
 * Bin statistics of one feature are kept in one flat array, {@link #statsSize} values per bin.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public abstract class Impurity {

    /**
     * # of values collected per bin, for example in {@link Variance}, count, sum and squaredSum are collected,
     * statsSize is 3.
     */
    protected int statsSize;

    /**
     * Per child node, min weighted instances, if less than this value, such split will be ignored.
     */
    protected int minInstancesPerNode = 1;

    /**
     * Min info gain, if not larger than this value, such split will be ignored.
     */
    protected double minInfoGain = 0d;

    /**
     * Compute the best split of one feature by its bin statistics.
     * 
     * @param stats
     *            the stats array of all bins
     * @param columnNum
     *            index of the feature
     * @param binBoundary
     *            bin boundary list of the feature, first element is negative infinity
     * @return gain info of the best split, null if no valid split
     */
    public abstract GainInfo computeImpurity(double[] stats, int columnNum, List<Double> binBoundary);

    /**
     * Update bin stats value per feature.
     * 
     * @param featureStatistic
     *            the stats array
     * @param binIndex
     *            the bin index
     * @param label
     *            the label, in GBT it is the residual
     * @param weight
     *            the weight
     */
    public abstract void featureUpdate(double[] featureStatistic, int binIndex, double label, double weight);

    public int getStatsSize() {
        return statsSize;
    }

    public static Impurity of(String name, int minInstancesPerNode, double minInfoGain) {
        if("variance".equalsIgnoreCase(name)) {
            return new Variance(minInstancesPerNode, minInfoGain);
        } else if("friedmanmse".equalsIgnoreCase(name)) {
            return new FriedmanMSE(minInstancesPerNode, minInfoGain);
        }
        throw new IllegalArgumentException("Impurity " + name + " is not supported, only variance and friedmanmse.");
    }

}

/**
 * Variance impurity value is computed by ((sumSquare - (sum * sum) / count) / count).
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
class Variance extends Impurity {

    public Variance(int minInstancesPerNode, double minInfoGain) {
        // 3 are count, sum and sumSquare
        super.statsSize = 3;
        super.minInstancesPerNode = minInstancesPerNode;
        super.minInfoGain = minInfoGain;
    }

    @Override
    public GainInfo computeImpurity(double[] stats, int columnNum, List<Double> binBoundary) {
        double count = 0d, sum = 0d, sumSquare = 0d;
        int binSize = stats.length / super.statsSize;
        for(int i = 0; i < binSize; i++) {
            count += stats[i * super.statsSize];
            sum += stats[i * super.statsSize + 1];
            sumSquare += stats[i * super.statsSize + 2];
        }

        double impurity = getImpurity(count, sum, sumSquare);
        Predict predict = new Predict(count == 0d ? 0d : sum / count);

        double leftCount = 0d, leftSum = 0d, leftSumSquare = 0d;
        double rightCount = 0d, rightSum = 0d, rightSumSquare = 0d;
        List<GainInfo> internalGainList = new ArrayList<GainInfo>();
        for(int i = 0; i < (binSize - 1); i++) {
            leftCount += stats[i * super.statsSize];
            leftSum += stats[i * super.statsSize + 1];
            leftSumSquare += stats[i * super.statsSize + 2];
            rightCount = count - leftCount;
            rightSum = sum - leftSum;
            rightSumSquare = sumSquare - leftSumSquare;

            if(leftCount < minInstancesPerNode || rightCount < minInstancesPerNode) {
                continue;
            }

            double leftImpurity = getImpurity(leftCount, leftSum, leftSumSquare);
            double rightImpurity = getImpurity(rightCount, rightSum, rightSumSquare);
            double gain = computeGain(impurity, count, leftCount, leftSum, leftImpurity, rightCount, rightSum,
                    rightImpurity);
            if(gain <= minInfoGain) {
                continue;
            }

            Split split = new Split(columnNum, binBoundary.get(i + 1));
            Predict leftPredict = new Predict(leftSum / leftCount);
            Predict rightPredict = new Predict(rightSum / rightCount);
            internalGainList.add(new GainInfo(gain, impurity, predict, leftImpurity, rightImpurity, leftPredict,
                    rightPredict, split, count));
        }
        return GainInfo.getGainInfoByMaxGain(internalGainList);
    }

    protected double computeGain(double impurity, double count, double leftCount, double leftSum,
            double leftImpurity, double rightCount, double rightSum, double rightImpurity) {
        double leftWeight = leftCount / count;
        double rightWeight = rightCount / count;
        return impurity - leftWeight * leftImpurity - rightWeight * rightImpurity;
    }

    protected double getImpurity(double count, double sum, double sumSquare) {
        return (count != 0d) ? ((sumSquare - (sum * sum) / count) / count) : 0d;
    }

    @Override
    public void featureUpdate(double[] featureStatistic, int binIndex, double label, double weight) {
        featureStatistic[binIndex * super.statsSize] += weight;
        featureStatistic[binIndex * super.statsSize + 1] += (label * weight);
        featureStatistic[binIndex * super.statsSize + 2] += (label * label * weight);
    }

}

/**
 * Reference from:
 * 
 * https://github.com/scikit-learn/scikit-learn/blob/master/sklearn/tree/_criterion.pyx#L1264
 * J. Friedman, Greedy Function Approximation: A Gradient Boosting Machine, The Annals of Statistics, Vol. 29, No. 5,
 * 2001.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
class FriedmanMSE extends Variance {

    public FriedmanMSE(int minInstancesPerNode, double minInfoGain) {
        super(minInstancesPerNode, minInfoGain);
    }

    @Override
    protected double computeGain(double impurity, double count, double leftCount, double leftSum,
            double leftImpurity, double rightCount, double rightSum, double rightImpurity) {
        double diff = rightCount * leftSum - leftCount * rightSum;
        return (diff * diff) / (leftCount * rightCount * (leftCount + rightCount));
    }

}
