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

import java.util.List;

/**
 * Gain info of one candidate split, computed from bin statistics by {@link Impurity}.
 * 
 * @author Zhang David (pengzhang@paypal.com)
 */
public class GainInfo {

    private final double gain;

    private final double impurity;

    private final Predict predict;

    private final double leftImpurity;

    private final double rightImpurity;

    private final Predict leftPredict;

    private final Predict rightPredict;

    /**
     * Weighted count of records in current node.
     */
    private final double wgtCnt;

    private final Split split;

    public GainInfo(double gain, double impurity, Predict predict, double leftImpurity, double rightImpurity,
            Predict leftPredict, Predict rightPredict, Split split, double wgtCnt) {
        this.gain = gain;
        this.impurity = impurity;
        this.predict = predict;
        this.leftImpurity = leftImpurity;
        this.rightImpurity = rightImpurity;
        this.leftPredict = leftPredict;
        this.rightPredict = rightPredict;
        this.split = split;
        this.wgtCnt = wgtCnt;
    }

    public double getGain() {
        return gain;
    }

    public double getImpurity() {
        return impurity;
    }

    public Predict getPredict() {
        return predict;
    }

    public double getLeftImpurity() {
        return leftImpurity;
    }

    public double getRightImpurity() {
        return rightImpurity;
    }

    public Predict getLeftPredict() {
        return leftPredict;
    }

    public Predict getRightPredict() {
        return rightPredict;
    }

    public Split getSplit() {
        return split;
    }

    public double getWgtCnt() {
        return wgtCnt;
    }

    /**
     * Pick the gain info with max gain, the first one wins on ties.
     * 
     * @param gainList
     *            the gain info list
     * @return max {@link GainInfo} instance, null if list is empty
     */
    public static GainInfo getGainInfoByMaxGain(List<GainInfo> gainList) {
        double maxGain = Double.MIN_VALUE;
        int maxGainIndex = -1;
        for(int i = 0; i < gainList.size(); i++) {
            double gain = gainList.get(i).getGain();
            if(gain > maxGain) {
                maxGain = gain;
                maxGainIndex = i;
            }
        }
        if(maxGainIndex == -1) {
            return null;
        }
        return gainList.get(maxGainIndex);
    }

    @Override
    public String toString() {
        return "GainInfo [gain=" + gain + ", impurity=" + impurity + ", predict=" + predict + ", leftImpurity="
                + leftImpurity + ", rightImpurity=" + rightImpurity + ", leftPredict=" + leftPredict
                + ", rightPredict=" + rightPredict + ", split=" + split + "]";
    }

}
