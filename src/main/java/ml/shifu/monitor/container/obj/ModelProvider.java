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
package ml.shifu.monitor.container.obj;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import ml.shifu.monitor.di.spi.Explainer;
import ml.shifu.monitor.di.spi.ProbabilityModel;
import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;

import org.apache.commons.collections.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Read-only model artifacts shared by all scoring and metrics calls: the model, its decision threshold and ordered
 * feature list, the explainer, and the reference parameters of the drift tests captured at training time.
 *
 * <p>
 * Instances are built once through {@link Builder} and never change afterwards, so one instance can be used by any
 * number of concurrent callers.
 */
public final class ModelProvider {

    private final ProbabilityModel model;

    private final double threshold;

    private final List<String> features;

    private final Explainer explainer;

    /**
     * Expected proportion of renters
     */
    private final double rentRatio;

    private final GammaArgs gammaArgs;

    /**
     * Reference mean of the interest rate
     */
    private final double intRateMean;

    private ModelProvider(Builder builder) {
        this.model = builder.model;
        this.threshold = builder.threshold;
        this.features = ImmutableList.copyOf(builder.features);
        this.explainer = builder.explainer;
        this.rentRatio = builder.rentRatio;
        this.gammaArgs = builder.gammaArgs;
        this.intRateMean = builder.intRateMean;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProbabilityModel getModel() {
        return model;
    }

    public double getThreshold() {
        return threshold;
    }

    public List<String> getFeatures() {
        return features;
    }

    public Explainer getExplainer() {
        return explainer;
    }

    public double getRentRatio() {
        return rentRatio;
    }

    public GammaArgs getGammaArgs() {
        return gammaArgs;
    }

    public double getIntRateMean() {
        return intRateMean;
    }

    @Override
    public String toString() {
        return "ModelProvider [threshold=" + threshold + ", features=" + features + ", rentRatio=" + rentRatio
                + ", gammaArgs=" + gammaArgs + ", intRateMean=" + intRateMean + "]";
    }

    public static class Builder {

        private ProbabilityModel model;
        private Double threshold;
        private List<String> features;
        private Explainer explainer;
        private Double rentRatio;
        private GammaArgs gammaArgs;
        private Double intRateMean;

        private Builder() {
        }

        public Builder model(ProbabilityModel model) {
            this.model = model;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder features(List<String> features) {
            this.features = features;
            return this;
        }

        public Builder explainer(Explainer explainer) {
            this.explainer = explainer;
            return this;
        }

        public Builder rentRatio(double rentRatio) {
            this.rentRatio = rentRatio;
            return this;
        }

        public Builder gammaArgs(GammaArgs gammaArgs) {
            this.gammaArgs = gammaArgs;
            return this;
        }

        public Builder intRateMean(double intRateMean) {
            this.intRateMean = intRateMean;
            return this;
        }

        /**
         * @throws MonitorException
         *             with {@link MonitorErrorCode#ERROR_MODEL_PROVIDER_INIT} if a field is missing or invalid
         */
        public ModelProvider build() {
            require(model != null, "model");
            require(explainer != null, "explainer");
            require(gammaArgs != null, "gammaArgs");
            require(threshold != null && !threshold.isNaN(), "threshold");
            require(intRateMean != null && !intRateMean.isNaN(), "intRateMean");
            require(rentRatio != null && rentRatio >= 0d && rentRatio <= 1d, "rentRatio");
            require(CollectionUtils.isNotEmpty(features), "features");

            Set<String> names = new HashSet<String>();
            for(String feature: features) {
                if(StringUtils.isBlank(feature) || !names.add(feature)) {
                    throw new MonitorException(MonitorErrorCode.ERROR_MODEL_PROVIDER_INIT,
                            "Feature list has a blank or duplicated name: " + features);
                }
            }
            return new ModelProvider(this);
        }

        private static void require(boolean condition, String field) {
            if(!condition) {
                throw new MonitorException(MonitorErrorCode.ERROR_MODEL_PROVIDER_INIT,
                        "Model provider field '" + field + "' is missing or invalid");
            }
        }
    }

}
