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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Model health metrics of one batch.
 *
 * <p>
 * Performance and bias sections are only present for validated batches; absent sections are left out of the json
 * output, while nulls inside a present section are kept.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "performance", "bias", "drift", "attribution" })
public class MetricsReport {

    private final PerformanceReport performance;

    private final BiasReport bias;

    private final DriftReport drift;

    private final AttributionSummary attribution;

    public MetricsReport(PerformanceReport performance, BiasReport bias, DriftReport drift,
            AttributionSummary attribution) {
        this.performance = performance;
        this.bias = bias;
        this.drift = drift;
        this.attribution = attribution;
    }

    @JsonProperty("performance")
    public PerformanceReport getPerformance() {
        return performance;
    }

    @JsonProperty("bias")
    public BiasReport getBias() {
        return bias;
    }

    @JsonProperty("drift")
    public DriftReport getDrift() {
        return drift;
    }

    @JsonProperty("attribution")
    public AttributionSummary getAttribution() {
        return attribution;
    }

    public boolean hasPerformance() {
        return performance != null;
    }

    public boolean hasBias() {
        return bias != null;
    }

}
