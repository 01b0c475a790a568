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
import java.util.Map;

import ml.shifu.monitor.util.CommonUtils;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Classification performance of a validated batch.
 */
@JsonPropertyOrder({ "f1", "confusion_matrix", "auc", "roc" })
public class PerformanceReport {

    private final Double f1;

    /**
     * One row per true class, each row maps predicted class label to count. Label order is "Charged Off", "Fully Paid".
     */
    private final List<Map<String, Long>> confusionMatrix;

    private final Double auc;

    private final List<RocPoint> roc;

    public PerformanceReport(double f1, List<Map<String, Long>> confusionMatrix, double auc, List<RocPoint> roc) {
        this.f1 = CommonUtils.nanToNull(f1);
        this.confusionMatrix = confusionMatrix;
        this.auc = CommonUtils.nanToNull(auc);
        this.roc = roc;
    }

    @JsonProperty("f1")
    public Double getF1() {
        return f1;
    }

    @JsonProperty("confusion_matrix")
    public List<Map<String, Long>> getConfusionMatrix() {
        return confusionMatrix;
    }

    @JsonProperty("auc")
    public Double getAuc() {
        return auc;
    }

    @JsonProperty("roc")
    public List<RocPoint> getRoc() {
        return roc;
    }

}
