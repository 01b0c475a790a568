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
package ml.shifu.monitor.exception;

/**
 * Monitor error code
 */
public enum MonitorErrorCode {
    /*
     * Initialization error: 400 - 500
     */
    ERROR_MODEL_PROVIDER_INIT(401, "Model provider is missing a required field"), ERROR_LOAD_MONITOR_CONFIG(402,
            "Could not load the monitor config"),

    /*
     * Batch data error: 1151 - 1200
     */
    ERROR_MISSING_FEATURE(1151, "The batch lacks a feature required by the model"),

    /*
     * Collaborator output error: 1251 - 1300
     */
    ERROR_MODEL_OUTPUT(1251, "The model returned an unexpected number of probabilities"), ERROR_EXPLAINER_OUTPUT(1252,
            "The explainer returned attribution values of an unexpected shape");

    private int code;

    private String description;

    /**
     * Constructor, not public
     * 
     * @param code
     *            the code
     * @param description
     *            the description
     */
    private MonitorErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }

}
