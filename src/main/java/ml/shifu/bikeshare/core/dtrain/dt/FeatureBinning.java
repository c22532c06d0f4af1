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
import java.util.Arrays;
import java.util.List;

/**
 * Bin boundaries of continuous features for tree training. A boundary list always starts with negative infinity and
 * bin i covers [boundary(i), boundary(i+1)).
 */
public final class FeatureBinning {

    private FeatureBinning() {
    }

    /**
     * Compute bin boundaries. If # of distinct values is not larger than maxBins, each distinct value gets its own bin
     * and boundaries are middle points of neighbor values; else cut points are picked by equal frequency.
     * 
     * @param values
     *            all values of one feature
     * @param maxBins
     *            max # of bins
     * @return bin boundary list
     */
    public static List<Double> computeBinBoundary(double[] values, int maxBins) {
        if(maxBins < 2) {
            throw new IllegalArgumentException("Max bins should be at least 2, but is " + maxBins);
        }
        List<Double> binBoundary = new ArrayList<Double>();
        binBoundary.add(Double.NEGATIVE_INFINITY);
        if(values == null || values.length == 0) {
            return binBoundary;
        }

        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);

        int distinct = 1;
        for(int i = 1; i < sorted.length; i++) {
            if(Double.compare(sorted[i], sorted[i - 1]) != 0) {
                distinct += 1;
            }
        }

        if(distinct <= maxBins) {
            for(int i = 1; i < sorted.length; i++) {
                if(Double.compare(sorted[i], sorted[i - 1]) != 0) {
                    binBoundary.add((sorted[i] + sorted[i - 1]) / 2d);
                }
            }
            return binBoundary;
        }

        for(int i = 1; i < maxBins; i++) {
            int index = (int) ((long) i * sorted.length / maxBins);
            // move to the first value larger than the cut value so equal values stay in one bin
            double cutValue = sorted[index - 1];
            int next = index;
            while(next < sorted.length && Double.compare(sorted[next], cutValue) == 0) {
                next += 1;
            }
            if(next >= sorted.length) {
                break;
            }
            double boundary = (cutValue + sorted[next]) / 2d;
            if(boundary > binBoundary.get(binBoundary.size() - 1)) {
                binBoundary.add(boundary);
            }
        }
        return binBoundary;
    }

    /**
     * Binary search bin index of a value.
     * 
     * @param value
     *            the value
     * @param binBoundary
     *            the bin boundary list
     * @return the bin index
     */
    public static int getBinIndex(double value, List<Double> binBoundary) {
        if(binBoundary.size() <= 1) {
            return 0;
        }

        // the last bin if positive infinity
        if(value == Double.POSITIVE_INFINITY) {
            return binBoundary.size() - 1;
        }

        int low = 0, high = binBoundary.size() - 1;
        while(low <= high) {
            int mid = (low + high) >>> 1;
            double lowThreshold = binBoundary.get(mid);
            double highThreshold = mid == binBoundary.size() - 1 ? Double.POSITIVE_INFINITY : binBoundary.get(mid + 1);
            if(value >= lowThreshold && value < highThreshold) {
                return mid;
            }
            if(value >= highThreshold) {
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        // NaN
        return 0;
    }

}
