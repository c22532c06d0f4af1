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

import ml.shifu.bikeshare.exception.BikeShareErrorCode;
import ml.shifu.bikeshare.exception.BikeShareException;

/**
 * Fixed schema of bike sharing input file. {@link #getColumnNum()} is the position of the column in one data row.
 */
public enum RentalColumn {

    SEASON("Season", 0), MONTH("Month", 1), HOUR("Hour", 2), HOLIDAY("Holiday", 3), WEEKDAY("Weekday", 4), WORKING_DAY(
            "WorkingDay", 5), WEATHER_CONDITION("WeatherCondition", 6), TEMPERATURE("Temperature", 7), HUMIDITY(
            "Humidity", 8), WINDSPEED("Windspeed", 9), RENTAL_TYPE("RentalType", 10);

    /**
     * Number of columns in one data row, label included.
     */
    public static final int COLUMN_COUNT = values().length;

    private final String columnName;

    private final int columnNum;

    private RentalColumn(String columnName, int columnNum) {
        this.columnName = columnName;
        this.columnNum = columnNum;
    }

    public String getColumnName() {
        return columnName;
    }

    public int getColumnNum() {
        return columnNum;
    }

    public boolean isTarget() {
        return this == RENTAL_TYPE;
    }

    /**
     * Find column by name, case insensitive.
     *
     * @param columnName
     *            the column name like 'Season'
     * @return the column
     * @throws BikeShareException
     *             if no such column in schema
     */
    public static RentalColumn of(String columnName) {
        for(RentalColumn column: values()) {
            if(column.columnName.equalsIgnoreCase(columnName)) {
                return column;
            }
        }
        throw new BikeShareException(BikeShareErrorCode.ERROR_UNKNOWN_COLUMN, "Cannot find column " + columnName
                + " in rental schema.");
    }

}
