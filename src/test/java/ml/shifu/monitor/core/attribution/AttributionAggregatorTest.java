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
package ml.shifu.monitor.core.attribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import ml.shifu.monitor.MonitorTestData;
import ml.shifu.monitor.container.AttributionSummary;
import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.FeatureAttribution;
import ml.shifu.monitor.container.obj.ModelProvider;
import ml.shifu.monitor.core.FeatureDeriver;
import ml.shifu.monitor.di.spi.Explainer;
import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;
import ml.shifu.monitor.util.Constants;
import ml.shifu.monitor.util.JSONUtils;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AttributionAggregatorTest {

    private final FeatureDeriver deriver = new FeatureDeriver();

    @Test
    public void testMeanAbsoluteAttribution() {
        // attributions: (0.56, 0) and (0.24, -0.24)
        Batch batch = deriver.derive(Batch.of(MonitorTestData.record("1", Constants.RENT, 12d, "Forty+", null),
                MonitorTestData.record("2", "OWN", 14d, "Forty+", null)));
        AttributionSummary summary = new AttributionAggregator(MonitorTestData.provider()).summarize(batch);

        List<FeatureAttribution> attributions = summary.getAttributions();
        Assert.assertEquals(summary.size(), 2);
        Assert.assertEquals(attributions.get(0).getFeature(), Constants.INT_RATE);
        Assert.assertEquals(attributions.get(0).getValue(), 0.12, Constants.TOLERANCE);
        Assert.assertEquals(attributions.get(1).getFeature(), Constants.RENT_INDICATOR);
        Assert.assertEquals(attributions.get(1).getValue(), 0.4, Constants.TOLERANCE);
    }

    @Test
    public void testTiesKeepFeatureOrder() {
        ModelProvider provider = MonitorTestData.providerBuilder().explainer(constant(-1d)).build();
        AttributionSummary summary = new AttributionAggregator(provider).summarize(deriver
                .derive(MonitorTestData.validatedBatch(4)));

        Assert.assertEquals(summary.getAttributions().get(0).getFeature(), Constants.RENT_INDICATOR);
        Assert.assertEquals(summary.getAttributions().get(1).getFeature(), Constants.INT_RATE);
        Assert.assertEquals(summary.getAttributions().get(1).getValue(), 1d);
    }

    @Test
    public void testJsonKeyOrder() throws Exception {
        Batch batch = deriver.derive(MonitorTestData.validatedBatch(10));
        AttributionSummary summary = new AttributionAggregator(MonitorTestData.provider()).summarize(batch);

        Map<String, Object> json = JSONUtils.readTree(JSONUtils.writeValueAsString(summary));
        List<String> keys = new ArrayList<String>(json.keySet());
        Assert.assertEquals(keys.get(0), summary.getAttributions().get(0).getFeature());
        Assert.assertEquals(keys.size(), MonitorTestData.FEATURES.size());
        Assert.assertTrue(summary.getAttributions().get(0).getValue() <= summary.getAttributions().get(1).getValue());
    }

    @Test
    public void testEmptyBatch() throws Exception {
        AttributionSummary summary = new AttributionAggregator(MonitorTestData.provider())
                .summarize(MonitorTestData.validatedBatch(0));

        Assert.assertEquals(summary.size(), 2);
        Assert.assertTrue(Double.isNaN(summary.getAttributions().get(0).getValue()));
        Map<String, Object> json = JSONUtils.readTree(JSONUtils.writeValueAsString(summary));
        Assert.assertTrue(json.containsKey(Constants.INT_RATE));
        Assert.assertNull(json.get(Constants.INT_RATE));
    }

    @Test
    public void testWrongExplainerShape() {
        Explainer broken = new Explainer() {
            @Override
            public double[][] explain(double[][] features) {
                return new double[features.length][1];
            }
        };
        ModelProvider provider = MonitorTestData.providerBuilder().explainer(broken).build();
        try {
            new AttributionAggregator(provider).summarize(deriver.derive(MonitorTestData.validatedBatch(3)));
            Assert.fail("Explainer output of a wrong shape should fail");
        } catch (MonitorException e) {
            Assert.assertEquals(e.getError(), MonitorErrorCode.ERROR_EXPLAINER_OUTPUT);
        }
    }

    private static Explainer constant(final double value) {
        return new Explainer() {
            @Override
            public double[][] explain(double[][] features) {
                double[][] attributions = new double[features.length][];
                for(int i = 0; i < features.length; i++) {
                    attributions[i] = new double[features[i].length];
                    Arrays.fill(attributions[i], value);
                }
                return attributions;
            }
        };
    }

}
