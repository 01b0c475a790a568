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

/**
 * Global constants class
 */
public interface Constants {

    public static final String MONITOR_CONFIG_JSON_FILE_NAME = "MonitorConfig.json";

    /*
     * Record fields
     */
    public static final String ID = "id";
    public static final String HOME_OWNERSHIP = "home_ownership";
    public static final String INT_RATE = "int_rate";
    public static final String LOAN_STATUS = "loan_status";
    public static final String FORTY_PLUS_INDICATOR = "forty_plus_indicator";

    /*
     * Derived fields
     */
    public static final String RENT_INDICATOR = "rent_indicator";
    public static final String PROBABILITY = "probability";
    public static final String PREDICTION = "prediction";

    public static final String RENT = "RENT";
    public static final String UNDER_FORTY = "Under Forty";

    /*
     * Group columns of the fairness tables
     */
    public static final String ATTRIBUTE_NAME = "attribute_name";
    public static final String ATTRIBUTE_VALUE = "attribute_value";
    public static final String DISPARITY_SUFFIX = "_disparity";
    public static final String SIGNIFICANCE_SUFFIX = "_significance";

    /**
     * Group label of records without a value for a protected attribute
     */
    public static final String MISSING_GROUP = "None";

    public static final double DEFAULT_ALPHA = 0.05d;

    public static final int ABSOLUTE_METRICS_SCALE = 2;

    /**
     * Numeric attributes with more distinct values than this are binned into quartiles
     */
    public static final int MAX_DISCRETE_ATTRIBUTE_VALUES = 4;

    public static final double TOLERANCE = 0.00001d;

}
