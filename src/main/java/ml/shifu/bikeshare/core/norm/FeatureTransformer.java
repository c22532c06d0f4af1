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
import java.util.Collections;
import java.util.List;

import ml.shifu.bikeshare.container.FeatureMatrix;
import ml.shifu.bikeshare.container.obj.ColumnConfig;
import ml.shifu.bikeshare.container.obj.ModelNormalizeConf.NormType;
import ml.shifu.bikeshare.container.obj.RentalColumn;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.core.Normalizer;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;

/**
 * Fitted feature pipeline. Normalizes each configured column by its {@link ColumnConfig} and concatenates the results
 * in column order.
 */
public class FeatureTransformer {

    /**
     * Name suffix of the one-hot slot for categories not seen in training.
     */
    public static final String UNSEEN_CATEGORY = "other";

    private final List<ColumnConfig> columnConfigList;

    private final List<String> featureNames;

    FeatureTransformer(List<ColumnConfig> columnConfigList) {
        this.columnConfigList = Collections.unmodifiableList(copyOf(columnConfigList));
        List<String> names = new ArrayList<String>();
        for(ColumnConfig config: this.columnConfigList) {
            if(config.getNormType() == NormType.ONEHOT) {
                for(String category: config.getBinCategory()) {
                    names.add(config.getColumnName() + "_" + category);
                }
                names.add(config.getColumnName() + "_" + UNSEEN_CATEGORY);
            } else {
                names.add(config.getColumnName());
            }
        }
        this.featureNames = Collections.unmodifiableList(names);
    }

    /**
     * Transform one record into feature vector.
     * 
     * @param record
     *            the record, label is not needed
     * @return feature vector in {@link #getFeatureNames()} order
     */
    public double[] transform(RentalRecord record) {
        double[] features = new double[featureNames.size()];
        int index = 0;
        for(ColumnConfig config: columnConfigList) {
            RentalColumn column = RentalColumn.values()[config.getColumnNum()];
            for(Double value: Normalizer.normalize(config, record.getValue(column))) {
                features[index++] = value;
            }
        }
        return features;
    }

    /**
     * Transform labeled records into feature matrix for training.
     * 
     * @param records
     *            the records with labels
     * @param labelColumnName
     *            label column name in the matrix
     * @return feature matrix
     */
    public FeatureMatrix transform(List<RentalRecord> records, String labelColumnName) {
        FeatureMatrix matrix = new FeatureMatrix(featureNames, labelColumnName);
        for(RentalRecord record: records) {
            if(!record.hasRentalType()) {
                throw new BikeShareException(BikeShareErrorCode.ERROR_INVALID_TARGET_VALUE,
                        "Record without label cannot be used in training: " + record);
            }
            matrix.addRow(transform(record), record.getRentalType());
        }
        return matrix;
    }

    /**
     * @return copies of the fitted column configs, changes on them never reach the transformer
     */
    public List<ColumnConfig> getColumnConfigList() {
        return copyOf(columnConfigList);
    }

    private static List<ColumnConfig> copyOf(List<ColumnConfig> configs) {
        List<ColumnConfig> copies = new ArrayList<ColumnConfig>(configs.size());
        for(ColumnConfig config: configs) {
            copies.add(new ColumnConfig(config));
        }
        return copies;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int getFeatureWidth() {
        return featureNames.size();
    }

}
