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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.PerformanceObject;

/**
 * Area under ROC and PR curves by the trapezoidal rule.
 */
public final class AreaUnderCurve {

    private static final Logger LOG = LoggerFactory.getLogger(AreaUnderCurve.class);

    private AreaUnderCurve() {
    }

    /**
     * Area between the x axis and the segment (x1, y1) - (x2, y2), x2 &gt;= x1 is expected.
     */
    public static double trapezoid(double x1, double y1, double x2, double y2) {
        return (x2 - x1) * (y1 + y2) / 2d;
    }

    /**
     * @param roc
     *            curve points ordered by fpr ascending
     * @return AUC, 0 for null or single point curve
     */
    public static double ofRoc(List<PerformanceObject> roc) {
        return calculateArea(roc, Performances.fpr(), Performances.recall());
    }

    /**
     * @param pr
     *            curve points ordered by recall ascending
     * @return area under precision-recall curve, 0 for null or single point curve
     */
    public static double ofPr(List<PerformanceObject> pr) {
        return calculateArea(pr, Performances.recall(), Performances.precision());
    }

    /**
     * Sum of trapezoids between neighbor points, x and y of a point are taken by the extractors.
     * 
     * @throws IllegalArgumentException
     *             if any extractor is null
     */
    public static double calculateArea(List<PerformanceObject> points, PerformanceExtractor xExtractor,
            PerformanceExtractor yExtractor) {
        if(points == null || points.size() < 2) {
            LOG.warn("Area needs at least 2 curve points, but got {}, 0 is returned.",
                    points == null ? 0 : points.size());
            return 0d;
        }
        if(xExtractor == null || yExtractor == null) {
            throw new IllegalArgumentException("Extractors of x and y should not be null.");
        }

        double area = 0d;
        double prevX = xExtractor.extract(points.get(0));
        double prevY = yExtractor.extract(points.get(0));
        for(int i = 1; i < points.size(); i++) {
            double x = xExtractor.extract(points.get(i));
            double y = yExtractor.extract(points.get(i));
            area += trapezoid(prevX, prevY, x, y);
            prevX = x;
            prevY = y;
        }
        return area;
    }

}
