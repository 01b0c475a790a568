/*
 * Copyright [2012-2014] PayPal Software Foundation
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
package ml.shifu.monitor.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * {@link CommonUtils} is used to for almost all kinds of utility function in this framework.
 */
public final class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Division which yields NaN instead of infinity when the denominator is zero, so that undefined group metrics stay
     * undefined.
     */
    public static double safeDivide(double numerator, double denominator) {
        if(denominator == 0d) {
            return Double.NaN;
        }
        return numerator / denominator;
    }

    /**
     * Map a NaN or infinite value to null. Null is how an undefined metric is represented in the report.
     */
    public static Double nanToNull(double value) {
        if(Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return value;
    }

    /**
     * Round half-even to the given number of decimals, NaN is kept as is.
     */
    public static double round(double value, int scale) {
        if(Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(Double.toString(value)).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Convert a raw field value into double. Returns null if the value is null or cannot be parsed.
     */
    public static Double toDouble(Object value) {
        if(value == null) {
            return null;
        }
        if(value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String str = StringUtils.trimToEmpty(value.toString());
        if(NumberUtils.isParsable(str)) {
            return Double.parseDouble(str);
        }
        return null;
    }

    /**
     * Format a numeric group value: integral values lose their decimals, so 1.0 becomes "1".
     */
    public static String formatNumber(double value) {
        if(value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

}
