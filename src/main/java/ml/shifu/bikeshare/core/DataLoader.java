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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

import ml.shifu.bikeshare.container.obj.ModelSourceDataConf;
import ml.shifu.bikeshare.container.obj.RentalColumn;
import ml.shifu.bikeshare.container.obj.RentalRecord;
import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;
import ml.shifu.bikeshare.util.CommonUtils;

/**
 * Load delimited rental data file into {@link RentalRecord} list. Columns are read by position in
 * {@link RentalColumn} order, blank lines are skipped.
 */
public class DataLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DataLoader.class);

    private static final char BOM = '\uFEFF';

    /**
     * Plain decimal, no NaN, Infinity, hex form or type suffix like 'f' and 'd'.
     */
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final String delimiter;

    private final boolean hasHeader;

    private final Splitter splitter;

    public DataLoader(ModelSourceDataConf dataConf) {
        this(dataConf.getDataDelimiter(), Boolean.TRUE.equals(dataConf.getHasHeader()));
    }

    public DataLoader(String delimiter, boolean hasHeader) {
        if(StringUtils.isEmpty(delimiter)) {
            throw new IllegalArgumentException("Delimiter should not be empty.");
        }
        this.delimiter = delimiter;
        this.hasHeader = hasHeader;
        this.splitter = Splitter.on(delimiter).trimResults();
    }

    /**
     * Load all records of a data file.
     * 
     * @param dataPath
     *            path of data file
     * @return records in file order
     * @throws BikeShareException
     *             if file is not found or any line is invalid
     */
    public List<RentalRecord> load(String dataPath) {
        File file = new File(dataPath);
        if(!file.isFile()) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_INPUT_NOT_FOUND, "Data file " + dataPath
                    + " is not found.");
        }

        LOG.info("Loading data from {} with delimiter '{}', hasHeader {}", file.getAbsolutePath(), delimiter,
                hasHeader);
        List<RentalRecord> records = new ArrayList<RentalRecord>();
        try (LineIterator iterator = FileUtils.lineIterator(file, "UTF-8")) {
            int lineNum = 0;
            boolean headerSkipped = !hasHeader;
            while(iterator.hasNext()) {
                String line = iterator.nextLine();
                lineNum += 1;
                if(lineNum == 1 && line.length() > 0 && line.charAt(0) == BOM) {
                    line = line.substring(1);
                }
                if(StringUtils.isBlank(line)) {
                    continue;
                }
                if(!headerSkipped) {
                    headerSkipped = true;
                    LOG.debug("Header: {}", line);
                    continue;
                }
                records.add(parseLine(line, lineNum));
            }
        } catch (IOException e) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_INPUT_NOT_FOUND, e, "Cannot read data file "
                    + dataPath);
        }

        LOG.info("{} records are loaded.", records.size());
        return records;
    }

    /**
     * Parse one data line.
     * 
     * @param line
     *            the line
     * @param lineNum
     *            1-based line number for error message
     * @return the record
     */
    RentalRecord parseLine(String line, int lineNum) {
        List<String> fields = CommonUtils.splitAndReturnList(line, splitter);
        if(fields.size() > RentalColumn.COLUMN_COUNT) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_EXCEED_COL, "Line " + lineNum + " has "
                    + fields.size() + " columns, but " + RentalColumn.COLUMN_COUNT + " columns are expected.");
        }
        if(fields.size() < RentalColumn.COLUMN_COUNT) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_LESS_COL, "Line " + lineNum + " has "
                    + fields.size() + " columns, but " + RentalColumn.COLUMN_COUNT + " columns are expected.");
        }

        float[] values = new float[RentalColumn.COLUMN_COUNT - 1];
        for(RentalColumn column: RentalColumn.values()) {
            if(column.isTarget()) {
                continue;
            }
            String raw = fields.get(column.getColumnNum());
            float value;
            try {
                if(!DECIMAL.matcher(raw).matches()) {
                    throw new NumberFormatException("Not a plain decimal: " + raw);
                }
                value = Float.parseFloat(raw);
            } catch (NumberFormatException e) {
                throw new BikeShareException(BikeShareErrorCode.ERROR_INVALID_DATA_FORMAT, e, "Line " + lineNum
                        + ", column " + column.getColumnName() + " has invalid numeric value '" + raw + "'.");
            }
            if(Float.isInfinite(value)) {
                throw new BikeShareException(BikeShareErrorCode.ERROR_INVALID_DATA_FORMAT, "Line " + lineNum
                        + ", column " + column.getColumnName() + " value '" + raw + "' is out of range.");
            }
            values[column.getColumnNum()] = value;
        }

        String rawLabel = fields.get(RentalColumn.RENTAL_TYPE.getColumnNum());
        Boolean label = CommonUtils.parseLabel(rawLabel);
        if(label == null) {
            throw new BikeShareException(BikeShareErrorCode.ERROR_INVALID_TARGET_VALUE, "Line " + lineNum
                    + " has invalid " + RentalColumn.RENTAL_TYPE.getColumnName() + " value '" + rawLabel + "'.");
        }
        return RentalRecord.of(values, label);
    }

}
