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

import java.util.Arrays;

/**
 * One bike rental data row. Immutable once created.
 *
 * <p>
 * {@link #rentalType} is the label, it can be null for records only used in prediction.
 */
public final class RentalRecord {

    /**
     * Feature values in {@link RentalColumn} order, label excluded.
     */
    private final float[] values;

    private final Boolean rentalType;

    private RentalRecord(float[] values, Boolean rentalType) {
        this.values = values;
        this.rentalType = rentalType;
    }

    /**
     * @param values
     *            feature values in {@link RentalColumn} order without label
     * @param rentalType
     *            label, null if unknown
     * @return new record
     */
    public static RentalRecord of(float[] values, Boolean rentalType) {
        if(values == null || values.length != RentalColumn.COLUMN_COUNT - 1) {
            throw new IllegalArgumentException("Rental record needs " + (RentalColumn.COLUMN_COUNT - 1)
                    + " feature values.");
        }
        return new RentalRecord(Arrays.copyOf(values, values.length), rentalType);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get value by column, for {@link RentalColumn#RENTAL_TYPE} 1f/0f is returned for true/false.
     *
     * @param column
     *            the column
     * @return the float value
     */
    public float getValue(RentalColumn column) {
        if(column.isTarget()) {
            if(rentalType == null) {
                throw new IllegalStateException("Rental type of such record is unknown.");
            }
            return rentalType ? 1f : 0f;
        }
        return values[column.getColumnNum()];
    }

    public float getSeason() {
        return values[RentalColumn.SEASON.getColumnNum()];
    }

    public float getMonth() {
        return values[RentalColumn.MONTH.getColumnNum()];
    }

    public float getHour() {
        return values[RentalColumn.HOUR.getColumnNum()];
    }

    public float getHoliday() {
        return values[RentalColumn.HOLIDAY.getColumnNum()];
    }

    public float getWeekday() {
        return values[RentalColumn.WEEKDAY.getColumnNum()];
    }

    public float getWorkingDay() {
        return values[RentalColumn.WORKING_DAY.getColumnNum()];
    }

    public float getWeatherCondition() {
        return values[RentalColumn.WEATHER_CONDITION.getColumnNum()];
    }

    public float getTemperature() {
        return values[RentalColumn.TEMPERATURE.getColumnNum()];
    }

    public float getHumidity() {
        return values[RentalColumn.HUMIDITY.getColumnNum()];
    }

    public float getWindspeed() {
        return values[RentalColumn.WINDSPEED.getColumnNum()];
    }

    public Boolean getRentalType() {
        return rentalType;
    }

    public boolean hasRentalType() {
        return rentalType != null;
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof RentalRecord)) {
            return false;
        }
        RentalRecord other = (RentalRecord) obj;
        return Arrays.equals(values, other.values)
                && (rentalType == null ? other.rentalType == null : rentalType.equals(other.rentalType));
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + (rentalType == null ? 0 : rentalType.hashCode());
    }

    @Override
    public String toString() {
        return "RentalRecord [values=" + Arrays.toString(values) + ", rentalType=" + rentalType + "]";
    }

    /**
     * Builder for hand written records, unset values are 0.
     */
    public static class Builder {

        private final float[] values = new float[RentalColumn.COLUMN_COUNT - 1];

        private Boolean rentalType;

        public Builder season(float season) {
            return set(RentalColumn.SEASON, season);
        }

        public Builder month(float month) {
            return set(RentalColumn.MONTH, month);
        }

        public Builder hour(float hour) {
            return set(RentalColumn.HOUR, hour);
        }

        public Builder holiday(float holiday) {
            return set(RentalColumn.HOLIDAY, holiday);
        }

        public Builder weekday(float weekday) {
            return set(RentalColumn.WEEKDAY, weekday);
        }

        public Builder workingDay(float workingDay) {
            return set(RentalColumn.WORKING_DAY, workingDay);
        }

        public Builder weatherCondition(float weatherCondition) {
            return set(RentalColumn.WEATHER_CONDITION, weatherCondition);
        }

        public Builder temperature(float temperature) {
            return set(RentalColumn.TEMPERATURE, temperature);
        }

        public Builder humidity(float humidity) {
            return set(RentalColumn.HUMIDITY, humidity);
        }

        public Builder windspeed(float windspeed) {
            return set(RentalColumn.WINDSPEED, windspeed);
        }

        public Builder rentalType(Boolean rentalType) {
            this.rentalType = rentalType;
            return this;
        }

        public Builder set(RentalColumn column, float value) {
            if(column.isTarget()) {
                throw new IllegalArgumentException("Use rentalType(Boolean) to set label.");
            }
            values[column.getColumnNum()] = value;
            return this;
        }

        public RentalRecord build() {
            return RentalRecord.of(values, rentalType);
        }
    }

}
