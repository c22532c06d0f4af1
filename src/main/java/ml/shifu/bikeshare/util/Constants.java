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
package ml.shifu.bikeshare.util;

/**
 * Global constants class
 */
public interface Constants {

    public static final String version = "0.1.0";

    public static final String MODEL_CONFIG_JSON_FILE_NAME = "ModelConfig.json";

    public static final String DEFAULT_DATA_PATH = "bike_sharing.csv";

    public static final String DEFAULT_DELIMITER = ",";

    public static final double DEFAULT_TEST_FRACTION = 0.1d;

    public static final long DEFAULT_SEED = 0L;

    public static final String TARGET_COLUMN_NAME = "RentalType";

    public static final String GBT = "GBT";

    // train params keys, same names as in ModelConfig.json#train#params
    public static final String TREE_NUM = "TreeNum";
    public static final String LEARNING_RATE = "LearningRate";
    public static final String MAX_DEPTH = "MaxDepth";
    public static final String MAX_LEAVES = "MaxLeaves";
    public static final String MIN_INSTANCES_PER_NODE = "MinInstancesPerNode";
    public static final String MIN_INFO_GAIN = "MinInfoGain";
    public static final String MAX_BINS = "MaxBins";
    public static final String BAGGING_SAMPLE_RATE = "BaggingSampleRate";
    public static final String BAGGING_SAMPLE_SEED = "BaggingSampleSeed";
    public static final String LOSS = "Loss";
    public static final String IMPURITY = "Impurity";

    // defaults of the boosted tree trainer
    public static final int DEFAULT_TREE_NUM = 100;
    public static final double DEFAULT_LEARNING_RATE = 0.2d;
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_LEAVES = 20;
    public static final int DEFAULT_MIN_INSTANCES_PER_NODE = 10;
    public static final double DEFAULT_MIN_INFO_GAIN = 0d;
    public static final int DEFAULT_MAX_BINS = 255;
    public static final double DEFAULT_BAGGING_SAMPLE_RATE = 1d;
    public static final String DEFAULT_LOSS = "log";
    public static final String DEFAULT_IMPURITY = "friedmanmse";

    /**
     * Probability over such threshold is predicted as positive.
     */
    public static final double DEFAULT_PROBABILITY_THRESHOLD = 0.5d;

    public static final String CONTACT_MESSAGE = "Please check the error message above and your input data.";

}
