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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Feature engineering part of ModelConfig.json.
 *
 * <p>
 * {@link #featureColumns} is the concatenation order of the final feature vector. Columns in
 * {@link #oneHotColumns} are encoded as one-hot, columns in {@link #maxMinColumns} are scaled by min and max of
 * training data, others are used as is.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelNormalizeConf {

    /**
     * Normalization type per column.
     */
    public static enum NormType {
        ASIS, ONEHOT, MAXMIN
    }

    private List<String> oneHotColumns = new ArrayList<String>(Arrays.asList("Season", "WeatherCondition"));

    private List<String> maxMinColumns = new ArrayList<String>(Arrays.asList("Temperature", "Humidity", "Windspeed"));

    private List<String> featureColumns = new ArrayList<String>(Arrays.asList("Season", "Month", "Hour", "Holiday",
            "Weekday", "WorkingDay", "WeatherCondition", "Temperature", "Humidity", "Windspeed"));

    public List<String> getOneHotColumns() {
        return oneHotColumns;
    }

    public void setOneHotColumns(List<String> oneHotColumns) {
        this.oneHotColumns = oneHotColumns;
    }

    public List<String> getMaxMinColumns() {
        return maxMinColumns;
    }

    public void setMaxMinColumns(List<String> maxMinColumns) {
        this.maxMinColumns = maxMinColumns;
    }

    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public void setFeatureColumns(List<String> featureColumns) {
        this.featureColumns = featureColumns;
    }

    /**
     * Norm type of one column by name, ONEHOT wins if a column is configured in both lists.
     *
     * @param columnName
     *            the column name
     * @return norm type
     */
    public NormType getNormType(String columnName) {
        if(containsIgnoreCase(oneHotColumns, columnName)) {
            return NormType.ONEHOT;
        }
        if(containsIgnoreCase(maxMinColumns, columnName)) {
            return NormType.MAXMIN;
        }
        return NormType.ASIS;
    }

    private static boolean containsIgnoreCase(List<String> names, String name) {
        if(names == null) {
            return false;
        }
        for(String n: names) {
            if(n != null && n.trim().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

}
