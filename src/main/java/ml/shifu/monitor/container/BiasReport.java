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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Group fairness tables of a validated batch.
 */
@JsonPropertyOrder({ "absolute_metrics", "disparity_metrics" })
public class BiasReport {

    /**
     * Absolute group metrics, rounded to the configured scale
     */
    private final List<CrossTabRow> absoluteMetrics;

    private final List<DisparityRow> disparityMetrics;

    public BiasReport(List<CrossTabRow> absoluteMetrics, List<DisparityRow> disparityMetrics) {
        this.absoluteMetrics = absoluteMetrics;
        this.disparityMetrics = disparityMetrics;
    }

    @JsonProperty("absolute_metrics")
    public List<CrossTabRow> getAbsoluteMetrics() {
        return absoluteMetrics;
    }

    @JsonProperty("disparity_metrics")
    public List<DisparityRow> getDisparityMetrics() {
        return disparityMetrics;
    }

}
