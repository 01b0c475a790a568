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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ml.shifu.monitor.util.Constants;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Disparity ratios of one (attribute name, attribute value) group against the reference group of the attribute.
 *
 * <p>
 * A ratio is null when it is undefined or when it is masked as not statistically significant. The significance flags,
 * present only when significance masking is on, tell the two apart.
 */
@JsonPropertyOrder({ Constants.ATTRIBUTE_NAME, Constants.ATTRIBUTE_VALUE })
public class DisparityRow {

    private final String attributeName;

    private final String attributeValue;

    private final boolean referenceGroup;

    private final Map<String, Double> disparities;

    private final Map<String, Boolean> significance;

    public DisparityRow(String attributeName, String attributeValue, boolean referenceGroup,
            Map<String, Double> disparities, Map<String, Boolean> significance) {
        this.attributeName = attributeName;
        this.attributeValue = attributeValue;
        this.referenceGroup = referenceGroup;
        this.disparities = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(disparities));
        this.significance = Collections.unmodifiableMap(new LinkedHashMap<String, Boolean>(significance));
    }

    @JsonProperty(Constants.ATTRIBUTE_NAME)
    public String getAttributeName() {
        return attributeName;
    }

    @JsonProperty(Constants.ATTRIBUTE_VALUE)
    public String getAttributeValue() {
        return attributeValue;
    }

    @JsonIgnore
    public boolean isReferenceGroup() {
        return referenceGroup;
    }

    /**
     * @return disparity ratio by metric name, null when undefined or masked
     */
    @JsonIgnore
    public Map<String, Double> getDisparities() {
        return disparities;
    }

    /**
     * @return significance flag by metric name, empty if significance masking is off
     */
    @JsonIgnore
    public Map<String, Boolean> getSignificance() {
        return significance;
    }

    public Double getDisparity(String metric) {
        return disparities.get(metric);
    }

    @JsonAnyGetter
    public Map<String, Object> getColumns() {
        Map<String, Object> columns = new LinkedHashMap<String, Object>();
        for(Map.Entry<String, Double> entry: disparities.entrySet()) {
            columns.put(entry.getKey() + Constants.DISPARITY_SUFFIX, entry.getValue());
        }
        for(Map.Entry<String, Boolean> entry: significance.entrySet()) {
            columns.put(entry.getKey() + Constants.SIGNIFICANCE_SUFFIX, entry.getValue());
        }
        return columns;
    }

    @Override
    public String toString() {
        return "DisparityRow [attributeName=" + attributeName + ", attributeValue=" + attributeValue
                + ", disparities=" + disparities + ", significance=" + significance + "]";
    }

}
