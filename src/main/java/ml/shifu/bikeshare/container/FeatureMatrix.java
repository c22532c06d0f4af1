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
package ml.shifu.bikeshare.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Engineered feature rows with their label column, the input of tree training.
 */
public class FeatureMatrix {

    private final List<String> featureNames;

    private final String labelColumnName;

    private final List<double[]> rows;

    /**
     * 0 or 1 per row, same order as {@link #rows}.
     */
    private final List<Float> labels;

    public FeatureMatrix(List<String> featureNames, String labelColumnName) {
        this.featureNames = Collections.unmodifiableList(new ArrayList<String>(featureNames));
        this.labelColumnName = labelColumnName;
        this.rows = new ArrayList<double[]>();
        this.labels = new ArrayList<Float>();
    }

    public void addRow(double[] features, boolean label) {
        if(features.length != featureNames.size()) {
            throw new IllegalArgumentException("Row size " + features.length + " is not the same as feature size "
                    + featureNames.size());
        }
        rows.add(features);
        labels.add(label ? 1f : 0f);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public String getLabelColumnName() {
        return labelColumnName;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getFeatureCount() {
        return featureNames.size();
    }

    public double[] getRow(int index) {
        return rows.get(index);
    }

    public float getLabel(int index) {
        return labels.get(index);
    }

    /**
     * @param columnIndex
     *            feature index
     * @return all values of one feature column
     */
    public double[] getColumn(int columnIndex) {
        double[] column = new double[rows.size()];
        for(int i = 0; i < rows.size(); i++) {
            column[i] = rows.get(i)[columnIndex];
        }
        return column;
    }

}
