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

import ml.shifu.monitor.util.CommonUtils;
import ml.shifu.monitor.util.Constants;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One (attribute name, attribute value) group of the fairness cross tab with its confusion counts and absolute
 * metrics.
 *
 * <p>
 * Serialized as a flat row: the two group columns followed by one column per absolute metric. An undefined metric,
 * e.g. precision of a group without predicted positives, is written as explicit null.
 */
@JsonPropertyOrder({ Constants.ATTRIBUTE_NAME, Constants.ATTRIBUTE_VALUE })
public class CrossTabRow {

    private final String attributeName;

    private final String attributeValue;

    private final long tp, fp, tn, fn;

    /**
     * Number of records of all groups of the attribute
     */
    private final long totalEntities;

    /**
     * Number of predicted positives of all groups of the attribute
     */
    private final long k;

    /**
     * Absolute metrics by name, NaN when undefined
     */
    private final Map<String, Double> metrics;

    public CrossTabRow(String attributeName, String attributeValue, long tp, long fp, long tn, long fn,
            long totalEntities, long k, Map<String, Double> metrics) {
        this.attributeName = attributeName;
        this.attributeValue = attributeValue;
        this.tp = tp;
        this.fp = fp;
        this.tn = tn;
        this.fn = fn;
        this.totalEntities = totalEntities;
        this.k = k;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(metrics));
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
    public long getTp() {
        return tp;
    }

    @JsonIgnore
    public long getFp() {
        return fp;
    }

    @JsonIgnore
    public long getTn() {
        return tn;
    }

    @JsonIgnore
    public long getFn() {
        return fn;
    }

    @JsonIgnore
    public long getGroupSize() {
        return tp + fp + tn + fn;
    }

    @JsonIgnore
    public long getTotalEntities() {
        return totalEntities;
    }

    @JsonIgnore
    public long getK() {
        return k;
    }

    @JsonIgnore
    public Map<String, Double> getMetrics() {
        return metrics;
    }

    /**
     * @return metric value, NaN if undefined for this group or not computed
     */
    public double getMetric(String name) {
        Double value = metrics.get(name);
        return value == null ? Double.NaN : value;
    }

    @JsonAnyGetter
    public Map<String, Double> getMetricColumns() {
        Map<String, Double> columns = new LinkedHashMap<String, Double>();
        for(Map.Entry<String, Double> entry: metrics.entrySet()) {
            columns.put(entry.getKey(), entry.getValue() == null ? null : CommonUtils.nanToNull(entry.getValue()));
        }
        return columns;
    }

    /**
     * @return a copy of this row with every metric rounded half-even to the given scale
     */
    public CrossTabRow rounded(int scale) {
        Map<String, Double> roundedMetrics = new LinkedHashMap<String, Double>();
        for(Map.Entry<String, Double> entry: metrics.entrySet()) {
            roundedMetrics.put(entry.getKey(), CommonUtils.round(entry.getValue(), scale));
        }
        return new CrossTabRow(attributeName, attributeValue, tp, fp, tn, fn, totalEntities, k, roundedMetrics);
    }

    @Override
    public String toString() {
        return "CrossTabRow [attributeName=" + attributeName + ", attributeValue=" + attributeValue + ", tp=" + tp
                + ", fp=" + fp + ", tn=" + tn + ", fn=" + fn + ", metrics=" + metrics + "]";
    }

}
