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
package ml.shifu.bikeshare.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;

/**
 * {@link Environment} is used to store common env like 'BIKESHARE_HOME' and return to user by calling
 * {@link #getProperty(String)} method.
 *
 * <p>
 * JVM system properties (-Dkey=value) always override values from config files.
 */
public class Environment {

    public static final String BIKESHARE_HOME = "BIKESHARE_HOME";

    /**
     * Path of an alternative ModelConfig.json, if not set the one in classpath is used.
     */
    public static final String MODEL_CONFIG_PATH = "bikeshare.modelConfig";

    /**
     * Override of ModelConfig.json#dataSet#dataPath.
     */
    public static final String DATA_PATH = "bikeshare.dataPath";

    /**
     * If true, no key press is waited before exit.
     */
    public static final String NO_PAUSE = "bikeshare.noPause";

    private static Logger logger = LoggerFactory.getLogger(Environment.class);
    private static Properties properties = new Properties();
    private static boolean loaded = false;

    /**
     * Config files are loaded on first access, so a broken file fails the caller with {@link BikeShareException}
     * instead of failing class initialization.
     */
    private static synchronized void ensureLoaded() {
        if(loaded) {
            return;
        }
        // set first, a failed load is not retried on every access
        loaded = true;
        String homePath = ((System.getenv(BIKESHARE_HOME) == null) ? System.getProperty(BIKESHARE_HOME) : System
                .getenv(BIKESHARE_HOME));
        properties.put(BIKESHARE_HOME, ((homePath == null) ? "" : homePath));

        try {
            loadBikeShareConfig();
        } catch (IOException e) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_BIKESHARE_CONFIG, e);
        }

        if(properties.size() == 1) {
            logger.debug("No bikeshare config is found or there is no content in it");
        }
    }

    /*
     * Load properties from
     * 1. ${BIKESHARE_HOME}/conf/bikeshare.config
     * 2. ~/.bikeshareconfig
     */
    public static synchronized void loadBikeShareConfig() throws IOException {
        String home = System.getProperty(BIKESHARE_HOME);
        if(home == null) {
            home = properties.getProperty(BIKESHARE_HOME);
        }
        if(StringUtils.isNotBlank(home)) {
            loadProperties(properties, home + File.separator + "conf" + File.separator + "bikeshare.config");
        }

        String userHome = System.getProperty("user.home");
        loadProperties(properties, userHome + File.separator + ".bikeshareconfig");
    }

    /**
     * Drop all loaded properties, next access loads config files again.
     */
    static synchronized void reset() {
        properties = new Properties();
        loaded = false;
    }

    /*
     * Get global property by property name, system properties go first
     */
    public static String getProperty(String propertyName) {
        ensureLoaded();
        String value = System.getProperty(propertyName);
        return value == null ? properties.getProperty(propertyName) : value;
    }

    public static void setProperty(String propertyName, String propertyValue) {
        ensureLoaded();
        properties.put(propertyName, propertyValue);
    }

    /*
     * Get property, if null return default value
     */
    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return (propertyValue == null) ? defValue : propertyValue;
    }

    /*
     * Get property as Boolean value, if null return default value
     */
    public static Boolean getBoolean(String propertyName, Boolean defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Boolean.valueOf(propertyValue.trim());
    }

    private static void loadProperties(Properties props, String fileName) throws IOException {
        File file = new File(fileName);
        if(!file.exists() || !file.isFile()) {
            return;
        }

        logger.info("Load bikeshare config from {}", file.getAbsolutePath());
        InputStream in = null;
        try {
            in = new FileInputStream(file);
            props.load(in);
        } catch (IllegalArgumentException e) {
            // malformed unicode escape
            throw new BikeShareException(BikeShareErrorCode.ERROR_BIKESHARE_CONFIG, e, "Cannot load bikeshare config "
                    + "from " + file.getAbsolutePath() + ": " + e.getMessage());
        } finally {
            IOUtils.closeQuietly(in);
        }
    }
}
