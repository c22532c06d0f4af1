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
package ml.shifu.bikeshare.core.eval;

import java.util.ArrayList;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import ml.shifu.bikeshare.container.PerformanceObject;

public class AreaUnderCurveTest {

    @Test
    public void testTrapezoid() {
        Assert.assertEquals(AreaUnderCurve.trapezoid(0d, 0d, 1d, 1d), 0.5d, 1e-9);
        Assert.assertEquals(AreaUnderCurve.trapezoid(0.2d, 1d, 0.6d, 1d), 0.4d, 1e-9);
    }

    @Test
    public void testRoc() {
        List<PerformanceObject> roc = new ArrayList<PerformanceObject>();
        roc.add(point(0d, 0d, 1d));
        roc.add(point(0d, 0.5d, 1d));
        roc.add(point(0.5d, 1d, 0.67d));
        roc.add(point(1d, 1d, 0.5d));
        Assert.assertEquals(AreaUnderCurve.ofRoc(roc), 0.875d, 1e-9);
    }

    @Test
    public void testPr() {
        List<PerformanceObject> pr = new ArrayList<PerformanceObject>();
        pr.add(point(0d, 0d, 1d));
        pr.add(point(0.5d, 1d, 0.5d));
        Assert.assertEquals(AreaUnderCurve.ofPr(pr), 0.75d, 1e-9);
    }

    @Test
    public void testTooFewPoints() {
        Assert.assertEquals(AreaUnderCurve.ofRoc(null), 0d, 1e-9);
        List<PerformanceObject> single = new ArrayList<PerformanceObject>();
        single.add(point(0d, 0d, 1d));
        Assert.assertEquals(AreaUnderCurve.ofRoc(single), 0d, 1e-9);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullExtractor() {
        List<PerformanceObject> roc = new ArrayList<PerformanceObject>();
        roc.add(point(0d, 0d, 1d));
        roc.add(point(1d, 1d, 0.5d));
        AreaUnderCurve.calculateArea(roc, Performances.fpr(), null);
    }

    private static PerformanceObject point(double fpr, double recall, double precision) {
        PerformanceObject po = new PerformanceObject();
        po.fpr = fpr;
        po.recall = recall;
        po.precision = precision;
        return po;
    }

}
