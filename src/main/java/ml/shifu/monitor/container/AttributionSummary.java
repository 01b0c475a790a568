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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.monitor.util.CommonUtils;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableList;

/**
 * Feature attributions ranked from the lowest to the highest impact. Serialized as a json object whose key order is
 * the rank order.
 */
public class AttributionSummary {

    private final List<FeatureAttribution> attributions;

    public AttributionSummary(List<FeatureAttribution> attributions) {
        this.attributions = ImmutableList.copyOf(attributions);
    }

    public List<FeatureAttribution> getAttributions() {
        return attributions;
    }

    public int size() {
        return attributions.size();
    }

    @JsonValue
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<String, Double>();
        for(FeatureAttribution attribution: attributions) {
            map.put(attribution.getFeature(), CommonUtils.nanToNull(attribution.getValue()));
        }
        return map;
    }

    @Override
    public String toString() {
        return "AttributionSummary " + attributions;
    }

}
