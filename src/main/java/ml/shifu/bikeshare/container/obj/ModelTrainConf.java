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

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ml.shifu.bikeshare.util.Constants;

/**
 * Train part of ModelConfig.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelTrainConf {

    public static enum ALGORITHM {
        GBT
    }

    private String algorithm = ALGORITHM.GBT.name();

    /**
     * Model params for training like learning rate, tree depth ...
     */
    private Map<String, Object> params;

    public ModelTrainConf() {
        this.params = createParamsByAlg(ALGORITHM.GBT);
    }

    public static Map<String, Object> createParamsByAlg(ALGORITHM alg) {
        Map<String, Object> params = new HashMap<String, Object>();
        if(ALGORITHM.GBT.equals(alg)) {
            params.put(Constants.TREE_NUM, Constants.DEFAULT_TREE_NUM);
            params.put(Constants.LEARNING_RATE, Constants.DEFAULT_LEARNING_RATE);
            params.put(Constants.MAX_DEPTH, Constants.DEFAULT_MAX_DEPTH);
            params.put(Constants.MAX_LEAVES, Constants.DEFAULT_MAX_LEAVES);
            params.put(Constants.MIN_INSTANCES_PER_NODE, Constants.DEFAULT_MIN_INSTANCES_PER_NODE);
            params.put(Constants.MIN_INFO_GAIN, Constants.DEFAULT_MIN_INFO_GAIN);
            params.put(Constants.MAX_BINS, Constants.DEFAULT_MAX_BINS);
            params.put(Constants.BAGGING_SAMPLE_RATE, Constants.DEFAULT_BAGGING_SAMPLE_RATE);
            params.put(Constants.BAGGING_SAMPLE_SEED, Constants.DEFAULT_SEED);
            params.put(Constants.LOSS, Constants.DEFAULT_LOSS);
            params.put(Constants.IMPURITY, Constants.DEFAULT_IMPURITY);
        }
        return params;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public void setParams(Map<String, Object> params) {
        this.params = params;
    }

    @JsonIgnore
    public int getIntParam(String key, int defValue) {
        Object value = params == null ? null : params.get(key);
        return value == null ? defValue : Integer.parseInt(value.toString().trim());
    }

    @JsonIgnore
    public double getDoubleParam(String key, double defValue) {
        Object value = params == null ? null : params.get(key);
        return value == null ? defValue : Double.parseDouble(value.toString().trim());
    }

    @JsonIgnore
    public String getStringParam(String key, String defValue) {
        Object value = params == null ? null : params.get(key);
        return value == null ? defValue : value.toString().trim();
    }

    @JsonIgnore
    public Long getLongParam(String key, Long defValue) {
        Object value = params == null ? null : params.get(key);
        return value == null ? defValue : Long.valueOf(value.toString().trim());
    }

}
