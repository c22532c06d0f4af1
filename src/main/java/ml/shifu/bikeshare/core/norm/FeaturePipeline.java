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
package ml.shifu.bikeshare.core.norm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.container.obj.ColumnConfig;
import ml.shifu.bikeshare.container.obj.ColumnType;
import ml.shifu.bikeshare.container.obj.ModelNormalizeConf;
import ml.shifu.bikeshare.container.obj.ModelNormalizeConf.NormType;
import ml.shifu.bikeshare.container.obj.RentalColumn;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.CommonUtils;

/**
 * Unfitted feature pipeline. {@link #fit(List)} learns one-hot categories and min/max bounds from training records
 * only and returns the {@link FeatureTransformer} which concatenates all feature columns.
 */
public class FeaturePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(FeaturePipeline.class);

    private final ModelNormalizeConf normalizeConf;

    private final List<RentalColumn> featureColumns;

    public FeaturePipeline(ModelNormalizeConf normalizeConf) {
        this.normalizeConf = normalizeConf;
        this.featureColumns = resolveFeatureColumns(normalizeConf);
    }

    private static List<RentalColumn> resolveFeatureColumns(ModelNormalizeConf normalizeConf) {
        // unknown names in one-hot or max-min lists are as bad as unknown feature names
        for(String name: nullToEmpty(normalizeConf.getOneHotColumns())) {
            RentalColumn.of(name.trim());
        }
        for(String name: nullToEmpty(normalizeConf.getMaxMinColumns())) {
            RentalColumn.of(name.trim());
        }

        List<RentalColumn> columns = new ArrayList<RentalColumn>();
        Set<RentalColumn> columnSet = new HashSet<RentalColumn>();
        for(String name: nullToEmpty(normalizeConf.getFeatureColumns())) {
            RentalColumn column = RentalColumn.of(name.trim());
            if(column.isTarget()) {
                throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION, "Target column "
                        + column.getColumnName() + " cannot be a feature column.");
            }
            if(!columnSet.add(column)) {
                throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION, "Feature column "
                        + column.getColumnName() + " is configured more than once.");
            }
            columns.add(column);
        }
        if(columns.isEmpty()) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_NO_FEATURE_COLUMN);
        }
        return columns;
    }

    private static List<String> nullToEmpty(List<String> list) {
        return list == null ? new ArrayList<String>() : list;
    }

    /**
     * Learn column stats from training records.
     * 
     * @param trainSet
     *            training records
     * @return the fitted transformer
     */
    public FeatureTransformer fit(List<RentalRecord> trainSet) {
        if(trainSet == null || trainSet.isEmpty()) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_NO_TRAINING_DATA,
                    "Feature pipeline cannot be fitted on empty data.");
        }

        List<ColumnConfig> columnConfigList = new ArrayList<ColumnConfig>(featureColumns.size());
        for(RentalColumn column: featureColumns) {
            ColumnConfig config = new ColumnConfig();
            config.setColumnNum(column.getColumnNum());
            config.setColumnName(column.getColumnName());
            NormType normType = normalizeConf.getNormType(column.getColumnName());
            config.setNormType(normType);

            switch(normType) {
                case ONEHOT:
                    config.setColumnType(ColumnType.C);
                    config.setBinCategory(collectCategories(trainSet, column));
                    break;
                case MAXMIN:
                    config.setColumnType(ColumnType.N);
                    computeMinMax(trainSet, column, config);
                    break;
                case ASIS:
                default:
                    config.setColumnType(ColumnType.N);
                    break;
            }
            LOG.debug("Fitted column {}", config);
            columnConfigList.add(config);
        }

        FeatureTransformer transformer = new FeatureTransformer(columnConfigList);
        LOG.info("Feature pipeline is fitted on {} records with {} columns, feature vector size {}.", new Object[] {
                trainSet.size(), columnConfigList.size(), transformer.getFeatureWidth() });
        return transformer;
    }

    private static List<String> collectCategories(List<RentalRecord> records, RentalColumn column) {
        TreeSet<Double> values = new TreeSet<Double>();
        for(RentalRecord record: records) {
            values.add((double) record.getValue(column));
        }
        List<String> categories = new ArrayList<String>(values.size());
        for(Double value: values) {
            categories.add(CommonUtils.formatCategory(value));
        }
        return categories;
    }

    private static void computeMinMax(List<RentalRecord> records, RentalColumn column, ColumnConfig config) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for(RentalRecord record: records) {
            double value = record.getValue(column);
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        config.setMin(min);
        config.setMax(max);
    }

    public List<RentalColumn> getFeatureColumns() {
        return featureColumns;
    }

}
