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
package ml.shifu.monitor.container;

import org.apache.commons.lang3.StringUtils;

/**
 * Ground truth of a loan, negative class first. The declaration order is the label order of the confusion matrix.
 */
public enum LoanStatus {

    CHARGED_OFF(0, "Charged Off"), FULLY_PAID(1, "Fully Paid");

    private final int value;

    private final String label;

    private LoanStatus(int value, String label) {
        this.value = value;
        this.label = label;
    }

    public int getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public boolean isPositive() {
        return this == FULLY_PAID;
    }

    public static LoanStatus of(int value) {
        for(LoanStatus status: values()) {
            if(status.value == value) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid loan status value " + value + ", must be 1 or 0");
    }

    /**
     * Parse ground truth from a raw field value: 0/1 numbers, their text form, or the label text.
     *
     * @param raw
     *            raw value, may be null
     * @return the status, null if raw is null or blank
     * @throws IllegalArgumentException
     *             if the value is not a known loan status
     */
    public static LoanStatus parse(Object raw) {
        if(raw == null) {
            return null;
        }
        if(raw instanceof LoanStatus) {
            return (LoanStatus) raw;
        }
        if(raw instanceof Number) {
            return of(((Number) raw).intValue());
        }
        String str = StringUtils.trimToNull(raw.toString());
        if(str == null) {
            return null;
        }
        for(LoanStatus status: values()) {
            if(status.label.equalsIgnoreCase(str) || status.name().equalsIgnoreCase(str)
                    || Integer.toString(status.value).equals(str)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid loan status value " + str);
    }

}
