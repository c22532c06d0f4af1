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
package ml.shifu.bikeshare.exception;

/**
 * Bike share error code
 */
public enum BikeShareErrorCode {
    /**
     * Configuration Error 400 ~ 500
     */
    ERROR_BIKESHARE_CONFIG(400, "Errors happen when loading bikeshare config"),

    /**
     * Configuration Error 500 ~ 600
     */
    ERROR_MODELCONFIG_VALIDATION(500, "Errors happen when validating ModelConfig.json"),

    /*
     * File/System error: 1001 - 1050
     */
    ERROR_INPUT_NOT_FOUND(1001, "The input data is not found"), ERROR_LOAD_MODELCONFIG(1003,
            "Could not load ModelConfig"), ERROR_CLOSE_READER(1009, "Could not close the reader"), ERROR_NO_EVAL_SET(
            1015, "There is no record in evaluation data set"),

    /*
     * data validate 1151 - 1200
     */
    ERROR_EXCEED_COL(1151, "The input data length is more than column config"), ERROR_LESS_COL(1152,
            "The input data length is less than column config"), ERROR_NO_TARGET_COLUMN(1154,
            "There is no target column in training data"), ERROR_INVALID_TARGET_VALUE(1155,
            "Invalid target value, target value must be 1/0 or true/false"), ERROR_INVALID_DATA_FORMAT(1156,
            "Invalid numeric value in input data"), ERROR_UNKNOWN_COLUMN(1157, "Column name is not in rental schema"),
    ERROR_NO_FEATURE_COLUMN(1158, "There is no feature column in training data"),

    /*
     * model validate 1201 - 1250
     */
    ERROR_NO_TRAINING_DATA(1201, "There is no record in training data set"), ERROR_MODEL_NOT_FITTED(1202,
            "Feature pipeline or model is not fitted"),

    /*
     * eval error 1251 - 1300
     */
    ERROR_EVAL_SINGLE_CLASS(1251, "Evaluation data set must contain both positive and negative records");

    private int code;
    private String description;

    private BikeShareErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "[" + code + " - " + description + "]";
    }
}
