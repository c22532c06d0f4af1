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
package ml.shifu.bikeshare.container.obj;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ml.shifu.bikeshare.util.Constants;

/**
 * Train/test split settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelSplitConf {

    private Double testFraction = Constants.DEFAULT_TEST_FRACTION;

    private Long seed = Constants.DEFAULT_SEED;

    public Double getTestFraction() {
        return testFraction;
    }

    public void setTestFraction(Double testFraction) {
        this.testFraction = testFraction;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

}
