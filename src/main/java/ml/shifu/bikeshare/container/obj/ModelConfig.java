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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.Constants;
import ml.shifu.bikeshare.util.Environment;
import ml.shifu.bikeshare.util.JSONUtils;

/**
 * ModelConfig class, mapping to ModelConfig.json. Default values are the same as the ones in the bundled
 * ModelConfig.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ModelConfig.class);

    private String modelSetName = "BikeSharingPrediction";

    private ModelSourceDataConf dataSet = new ModelSourceDataConf();

    private ModelSplitConf split = new ModelSplitConf();

    private ModelNormalizeConf normalize = new ModelNormalizeConf();

    private ModelTrainConf train = new ModelTrainConf();

    /**
     * Load model config. Order: file in {@link Environment#MODEL_CONFIG_PATH}, ModelConfig.json in classpath, default
     * values. {@link Environment#DATA_PATH} overrides the data path at last.
     *
     * @return validated model config
     */
    public static ModelConfig loadModelConfig() {
        ModelConfig modelConfig;
        String configPath = Environment.getProperty(Environment.MODEL_CONFIG_PATH);
        try {
            if(StringUtils.isNotBlank(configPath)) {
                LOG.info("Load model config from {}", configPath);
                modelConfig = JSONUtils.readValue(new File(configPath.trim()), ModelConfig.class);
            } else {
                InputStream in = ModelConfig.class.getResourceAsStream("/" + Constants.MODEL_CONFIG_JSON_FILE_NAME);
                if(in == null) {
                    LOG.info("No {} in classpath, use default model config.", Constants.MODEL_CONFIG_JSON_FILE_NAME);
                    modelConfig = new ModelConfig();
                } else {
                    try {
                        modelConfig = JSONUtils.readValue(in, ModelConfig.class);
                    } finally {
                        in.close();
                    }
                }
            }
        } catch (IOException e) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_LOAD_MODELCONFIG, e);
        }

        String dataPath = Environment.getProperty(Environment.DATA_PATH);
        if(StringUtils.isNotBlank(dataPath)) {
            modelConfig.getDataSet().setDataPath(dataPath.trim());
        }

        modelConfig.validate();
        return modelConfig;
    }

    /**
     * Check settings which would make the pipeline fail later with an unclear message.
     */
    public void validate() {
        if(dataSet == null || StringUtils.isBlank(dataSet.getDataPath())) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION, "dataSet#dataPath is empty.");
        }
        if(StringUtils.isEmpty(dataSet.getDataDelimiter())) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION,
                    "dataSet#dataDelimiter is empty.");
        }
        Double fraction = split == null ? null : split.getTestFraction();
        if(fraction == null || fraction < 0d || fraction >= 1d) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION,
                    "split#testFraction should be in [0, 1), but is " + fraction);
        }
        if(train == null || !ModelTrainConf.ALGORITHM.GBT.name().equalsIgnoreCase(train.getAlgorithm())) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION,
                    "Only GBT algorithm is supported, but is " + (train == null ? null : train.getAlgorithm()));
        }
        if(normalize == null || normalize.getFeatureColumns() == null || normalize.getFeatureColumns().isEmpty()) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_MODELCONFIG_VALIDATION,
                    "normalize#featureColumns is empty.");
        }
    }

    public String getModelSetName() {
        return modelSetName;
    }

    public void setModelSetName(String modelSetName) {
        this.modelSetName = modelSetName;
    }

    public ModelSourceDataConf getDataSet() {
        return dataSet;
    }

    public void setDataSet(ModelSourceDataConf dataSet) {
        this.dataSet = dataSet;
    }

    public ModelSplitConf getSplit() {
        return split;
    }

    public void setSplit(ModelSplitConf split) {
        this.split = split;
    }

    public ModelNormalizeConf getNormalize() {
        return normalize;
    }

    public void setNormalize(ModelNormalizeConf normalize) {
        this.normalize = normalize;
    }

    public ModelTrainConf getTrain() {
        return train;
    }

    public void setTrain(ModelTrainConf train) {
        this.train = train;
    }

}
