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

/**
 * Mean absolute attribution of one feature over a batch.
 */
public class FeatureAttribution {

    private final String feature;

    private final double value;

    public FeatureAttribution(String feature, double value) {
        this.feature = feature;
        this.value = value;
    }

    public String getFeature() {
        return feature;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return feature + "=" + value;
    }

}
