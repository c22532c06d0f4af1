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
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ml.shifu.bikeshare.container.obj.ModelNormalizeConf.NormType;

/**
 * ColumnConfig class record the basic information and fitted statistics for one feature column.
 *
 * <p>
 * {@link #binCategory} is learned for {@link NormType#ONEHOT} columns, {@link #min} and {@link #max} are learned for
 * {@link NormType#MAXMIN} columns. Both are set only once in feature pipeline fitting.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnConfig {

    /**
     * Column number in rental schema
     */
    private Integer columnNum;

    private String columnName;

    private ColumnType columnType = ColumnType.N;

    private NormType normType = NormType.ASIS;

    /**
     * Sorted categories learned from training data
     */
    private List<String> binCategory;

    private Double min;

    private Double max;

    public ColumnConfig() {
    }

    /**
     * Copy constructor, {@link #binCategory} of the copy is read-only.
     */
    public ColumnConfig(ColumnConfig other) {
        this.columnNum = other.columnNum;
        this.columnName = other.columnName;
        this.columnType = other.columnType;
        this.normType = other.normType;
        this.binCategory = other.binCategory == null ? null : Collections.unmodifiableList(new ArrayList<String>(
                other.binCategory));
        this.min = other.min;
        this.max = other.max;
    }

    public Integer getColumnNum() {
        return columnNum;
    }

    public void setColumnNum(Integer columnNum) {
        this.columnNum = columnNum;
    }

    public String getColumnName() {
        return columnName;
    }

    public void setColumnName(String columnName) {
        this.columnName = columnName;
    }

    public ColumnType getColumnType() {
        return columnType;
    }

    public void setColumnType(ColumnType columnType) {
        this.columnType = columnType;
    }

    public NormType getNormType() {
        return normType;
    }

    public void setNormType(NormType normType) {
        this.normType = normType;
    }

    public List<String> getBinCategory() {
        return binCategory;
    }

    public void setBinCategory(List<String> binCategory) {
        this.binCategory = binCategory;
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }

    @JsonIgnore
    public boolean isCategorical() {
        return columnType != null && columnType.isCategorical();
    }

    @JsonIgnore
    public boolean isNumerical() {
        return columnType != null && columnType.isNumerical();
    }

    /**
     * @return how many values this column contributes to the final feature vector
     */
    @JsonIgnore
    public int getNormWidth() {
        if(normType == NormType.ONEHOT) {
            // last one is for categories not seen in training
            return (binCategory == null ? 0 : binCategory.size()) + 1;
        }
        return 1;
    }

    @Override
    public String toString() {
        return "ColumnConfig [columnNum=" + columnNum + ", columnName=" + columnName + ", columnType=" + columnType
                + ", normType=" + normType + ", binCategory=" + binCategory + ", min=" + min + ", max=" + max + "]";
    }

}
