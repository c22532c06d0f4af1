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

import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

public class FeatureBinningTest {

    @Test
    public void testDistinctValues() {
        List<Double> boundary = FeatureBinning.computeBinBoundary(new double[] { 3d, 1d, 2d, 2d, 1d }, 255);
        Assert.assertEquals(boundary, Arrays.asList(Double.NEGATIVE_INFINITY, 1.5d, 2.5d));

        Assert.assertEquals(FeatureBinning.getBinIndex(-5d, boundary), 0);
        Assert.assertEquals(FeatureBinning.getBinIndex(1d, boundary), 0);
        Assert.assertEquals(FeatureBinning.getBinIndex(1.5d, boundary), 1);
        Assert.assertEquals(FeatureBinning.getBinIndex(2d, boundary), 1);
        Assert.assertEquals(FeatureBinning.getBinIndex(3d, boundary), 2);
        Assert.assertEquals(FeatureBinning.getBinIndex(100d, boundary), 2);
        Assert.assertEquals(FeatureBinning.getBinIndex(Double.POSITIVE_INFINITY, boundary), 2);
    }

    @Test
    public void testEqualFrequency() {
        double[] values = new double[] { 1d, 2d, 3d, 4d, 5d, 6d, 7d, 8d, 9d, 10d };
        Assert.assertEquals(FeatureBinning.computeBinBoundary(values, 2),
                Arrays.asList(Double.NEGATIVE_INFINITY, 5.5d));

        double[] many = new double[1000];
        for(int i = 0; i < many.length; i++) {
            many[i] = i % 500;
        }
        List<Double> boundary = FeatureBinning.computeBinBoundary(many, 10);
        Assert.assertTrue(boundary.size() <= 10);
        for(int i = 1; i < boundary.size(); i++) {
            Assert.assertTrue(boundary.get(i) > boundary.get(i - 1));
        }
    }

    @Test
    public void testConstantAndEmpty() {
        Assert.assertEquals(FeatureBinning.computeBinBoundary(new double[] { 4d, 4d, 4d }, 10),
                Arrays.asList(Double.NEGATIVE_INFINITY));
        Assert.assertEquals(FeatureBinning.computeBinBoundary(new double[0], 10),
                Arrays.asList(Double.NEGATIVE_INFINITY));
        Assert.assertEquals(FeatureBinning.getBinIndex(4d, Arrays.asList(Double.NEGATIVE_INFINITY)), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidMaxBins() {
        FeatureBinning.computeBinBoundary(new double[] { 1d }, 1);
    }

}
