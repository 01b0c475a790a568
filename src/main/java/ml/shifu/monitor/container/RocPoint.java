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

import ml.shifu.monitor.util.CommonUtils;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One point of the ROC curve, a rate is null if the class it is computed over is absent.
 */
@JsonPropertyOrder({ "fpr", "tpr" })
public class RocPoint {

    private final Double fpr;

    private final Double tpr;

    public RocPoint(double fpr, double tpr) {
        this.fpr = CommonUtils.nanToNull(fpr);
        this.tpr = CommonUtils.nanToNull(tpr);
    }

    @JsonProperty("fpr")
    public Double getFpr() {
        return fpr;
    }

    @JsonProperty("tpr")
    public Double getTpr() {
        return tpr;
    }

    @Override
    public String toString() {
        return "RocPoint [fpr=" + fpr + ", tpr=" + tpr + "]";
    }

}
