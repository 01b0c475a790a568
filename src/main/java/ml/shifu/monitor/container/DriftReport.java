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
 * P-values of the three drift tests. A p-value which cannot be computed for the batch is null.
 */
@JsonPropertyOrder({ "renters_binom_pvalue", "output_logprob_pvalue", "int_rate_ttest_pvalue" })
public class DriftReport {

    private final Double rentersBinomPvalue;

    private final Double outputLogprobPvalue;

    private final Double intRateTtestPvalue;

    public DriftReport(double rentersBinomPvalue, double outputLogprobPvalue, double intRateTtestPvalue) {
        this.rentersBinomPvalue = CommonUtils.nanToNull(rentersBinomPvalue);
        this.outputLogprobPvalue = CommonUtils.nanToNull(outputLogprobPvalue);
        this.intRateTtestPvalue = CommonUtils.nanToNull(intRateTtestPvalue);
    }

    @JsonProperty("renters_binom_pvalue")
    public Double getRentersBinomPvalue() {
        return rentersBinomPvalue;
    }

    @JsonProperty("output_logprob_pvalue")
    public Double getOutputLogprobPvalue() {
        return outputLogprobPvalue;
    }

    @JsonProperty("int_rate_ttest_pvalue")
    public Double getIntRateTtestPvalue() {
        return intRateTtestPvalue;
    }

    @Override
    public String toString() {
        return "DriftReport [rentersBinomPvalue=" + rentersBinomPvalue + ", outputLogprobPvalue="
                + outputLogprobPvalue + ", intRateTtestPvalue=" + intRateTtestPvalue + "]";
    }

}
