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
package ml.shifu.bikeshare.core;

import java.util.Arrays;
import java.util.List;

import ml.shifu.bikeshare.container.obj.ColumnConfig;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.CommonUtils;

/**
 * Util normalization class which is used for any kind of transformation.
 */
public final class Normalizer {

    private Normalizer() {
    }

    /**
     * Normalize the raw value according to the fitted {@link ColumnConfig} and its norm type.
     * 
     * @param config
     *            ColumnConfig to normalize data
     * @param raw
     *            raw input value
     * @return normalized values, size is {@link ColumnConfig#getNormWidth()}
     */
    public static List<Double> normalize(ColumnConfig config, double raw) {
        switch(config.getNormType()) {
            case ONEHOT:
                return oneHotNormalize(config, raw);
            case MAXMIN:
                return Arrays.asList(getMaxMinScore(config, raw));
            case ASIS:
            default:
                return Arrays.asList(raw);
        }
    }

    /**
     * Get category index of a raw value.
     * 
     * @param config
     *            categorical column config
     * @param raw
     *            raw value
     * @return index in {@link ColumnConfig#getBinCategory()}, -1 if not found
     */
    public static int getBinNum(ColumnConfig config, double raw) {
        if(config.getBinCategory() == null) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODEL_NOT_FITTED, "Column "
                    + config.getColumnName() + " has no categories.");
        }
        return config.getBinCategory().indexOf(CommonUtils.formatCategory(raw));
    }

    private static List<Double> oneHotNormalize(ColumnConfig config, double raw) {
        Double[] normData = new Double[config.getNormWidth()];
        Arrays.fill(normData, 0.0d);
        int binNum = getBinNum(config, raw);
        if(binNum < 0) {
            // not seen in training
            binNum = normData.length - 1;
        }
        normData[binNum] = 1.0d;
        return Arrays.asList(normData);
    }

    /**
     * (value - min) / (max - min), no cut off for values out of [min, max]. A constant column is normalized to 0.
     */
    private static Double getMaxMinScore(ColumnConfig config, double raw) {
        if(config.getMin() == null || config.getMax() == null) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODEL_NOT_FITTED, "Column "
                    + config.getColumnName() + " has no min/max.");
        }
        double range = config.getMax() - config.getMin();
        if(range == 0d) {
            return 0d;
        }
        return (raw - config.getMin()) / range;
    }

}
