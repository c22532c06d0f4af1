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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ml.shifu.bikeshare.util.Constants;

/**
 * ModelSourceDataConf class
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelSourceDataConf {

    private String dataPath = Constants.DEFAULT_DATA_PATH;

    private String dataDelimiter = Constants.DEFAULT_DELIMITER;

    private Boolean hasHeader = Boolean.TRUE;

    private String targetColumnName = Constants.TARGET_COLUMN_NAME;

    public String getDataPath() {
        return dataPath;
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public String getDataDelimiter() {
        return dataDelimiter;
    }

    public void setDataDelimiter(String dataDelimiter) {
        this.dataDelimiter = dataDelimiter;
    }

    public Boolean getHasHeader() {
        return hasHeader;
    }

    public void setHasHeader(Boolean hasHeader) {
        this.hasHeader = hasHeader;
    }

    public String getTargetColumnName() {
        return targetColumnName;
    }

    public void setTargetColumnName(String targetColumnName) {
        this.targetColumnName = targetColumnName;
    }

}
