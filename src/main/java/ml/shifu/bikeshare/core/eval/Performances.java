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

import ml.shifu.bikeshare.container.PerformanceObject;

/**
 * Common {@link PerformanceExtractor} instances.
 */
public final class Performances {

    private Performances() {
    }

    private static Fpr fpr = new Fpr();
    private static Recall recall = new Recall();
    private static Precision precision = new Precision();

    public static PerformanceExtractor fpr() {
        return fpr;
    }

    public static PerformanceExtractor recall() {
        return recall;
    }

    public static PerformanceExtractor precision() {
        return precision;
    }
}

/**
 * Extractor used to extract fpr from PerformanceObject.
 */
class Fpr implements PerformanceExtractor {

    @Override
    public double extract(PerformanceObject perform) {
        return perform.fpr;
    }

}

/**
 * Extractor used to extract recall from PerformanceObject.
 */
class Recall implements PerformanceExtractor {

    @Override
    public double extract(PerformanceObject perform) {
        return perform.recall;
    }

}

/**
 * Extractor used to extract precision from PerformanceObject.
 */
class Precision implements PerformanceExtractor {

    @Override
    public double extract(PerformanceObject perform) {
        return perform.precision;
    }

}
