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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Splitter;

/**
 * {@link CommonUtils} is used to for almost all kinds of utility function in this framework.
 */
public final class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Common split function to ignore special character like '|'.
     *
     * @param raw
     *            raw string
     * @param splitter
     *            the splitter to split the string
     * @return list of split Strings
     * @throws IllegalArgumentException
     *             {@code raw} and {@code splitter} is null or empty.
     */
    public static List<String> splitAndReturnList(String raw, Splitter splitter) {
        if(StringUtils.isEmpty(raw) || splitter == null) {
            throw new IllegalArgumentException(String.format(
                    "raw and delimeter should not be null or empty, raw:%s, splitter:%s", raw, splitter));
        }
        List<String> list = new ArrayList<String>();
        for(String str: splitter.split(raw)) {
            list.add(str);
        }
        return list;
    }

    /**
     * Category name of a numeric category value, integral values have no decimal part: 1.0 is '1'.
     *
     * @param value
     *            the value
     * @return category name
     */
    public static String formatCategory(double value) {
        if(!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Parse a boolean label. Accepted values (case insensitive): 'true', 'false', '1', '0', '1.0', '0.0'.
     *
     * @param raw
     *            raw label string
     * @return the label, null if cannot be parsed
     */
    public static Boolean parseLabel(String raw) {
        if(raw == null) {
            return null;
        }
        String value = raw.trim();
        if("true".equalsIgnoreCase(value) || "1".equals(value) || "1.0".equals(value)) {
            return Boolean.TRUE;
        }
        if("false".equalsIgnoreCase(value) || "0".equals(value) || "0.0".equals(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

}
