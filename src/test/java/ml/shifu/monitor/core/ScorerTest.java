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
package ml.shifu.monitor.core;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.monitor.MonitorTestData;
import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.Record;
import ml.shifu.monitor.container.ScoredRecord;
import ml.shifu.monitor.container.obj.ModelProvider;
import ml.shifu.monitor.di.spi.ProbabilityModel;
import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;
import ml.shifu.monitor.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ScorerTest {

    /**
     * Returns the first feature as probability and keeps the last matrix it was called with.
     */
    private static class FirstFeatureModel implements ProbabilityModel {

        private double[][] lastMatrix;

        @Override
        public double[] predictProba(double[][] features) {
            this.lastMatrix = features;
            double[] probabilities = new double[features.length];
            for(int i = 0; i < features.length; i++) {
                probabilities[i] = features[i][0];
            }
            return probabilities;
        }
    }

    @Test
    public void testStrictThreshold() {
        Assert.assertEquals(Scorer.predict(0.5, 0.5), 0);
        Assert.assertEquals(Scorer.predict(0.5000001, 0.5), 1);
        Assert.assertEquals(Scorer.predict(0.2, 0.5), 0);
    }

    @Test
    public void testScoreKeepsOrderAndFeatureOrder() {
        FirstFeatureModel model = new FirstFeatureModel();
        ModelProvider provider = MonitorTestData.providerBuilder().model(model)
                .features(Arrays.asList("score", Constants.INT_RATE)).threshold(0.5).build();

        Batch batch = Batch.of(record("a", 0.9, 11d), record("b", 0.5, 12d), record("c", 0.1, 13d));
        List<ScoredRecord> scored = new Scorer(provider).score(batch);

        Assert.assertEquals(scored.size(), 3);
        Assert.assertEquals(scored.get(0).getId(), "a");
        Assert.assertEquals(scored.get(0).getPrediction(), 1);
        Assert.assertEquals(scored.get(1).getId(), "b");
        Assert.assertEquals(scored.get(1).getPrediction(), 0);
        Assert.assertEquals(scored.get(2).getProbability(), 0.1);

        // columns follow the provider's feature list, extra fields are ignored
        Assert.assertEquals(model.lastMatrix[2], new double[] { 0.1, 13d });
        for(ScoredRecord record: scored) {
            Assert.assertEquals(record.getPrediction(), record.getProbability() > 0.5 ? 1 : 0);
        }
    }

    @Test
    public void testScoreWithLogisticRegression() {
        Scorer scorer = new Scorer(MonitorTestData.provider());
        Batch batch = new FeatureDeriver().derive(MonitorTestData.validatedBatch(20));
        List<ScoredRecord> scored = scorer.score(batch);

        Assert.assertEquals(scored.size(), 20);
        for(ScoredRecord record: scored) {
            Assert.assertTrue(record.getProbability() >= 0d && record.getProbability() <= 1d);
        }
        double[] probabilities = scorer.predictProba(batch);
        Assert.assertEquals(probabilities[7], scored.get(7).getProbability());
    }

    @Test
    public void testEmptyBatch() {
        Scorer scorer = new Scorer(MonitorTestData.provider());
        Assert.assertTrue(scorer.score(MonitorTestData.validatedBatch(0)).isEmpty());
    }

    @Test
    public void testMissingFeature() {
        Scorer scorer = new Scorer(MonitorTestData.provider());
        // rent indicator is not derived
        try {
            scorer.score(MonitorTestData.validatedBatch(2));
            Assert.fail("Scoring a record without a model feature should fail");
        } catch (MonitorException e) {
            Assert.assertEquals(e.getError(), MonitorErrorCode.ERROR_MISSING_FEATURE);
        }
    }

    @Test(expectedExceptions = MonitorException.class)
    public void testNonNumericFeature() {
        Batch batch = new FeatureDeriver().derive(Batch.of(MonitorTestData.record("1", "RENT", 10d, "Forty+", null)
                .withField(Constants.INT_RATE, "high")));
        new Scorer(MonitorTestData.provider()).score(batch);
    }

    @Test(expectedExceptions = MonitorException.class)
    public void testModelOutputSizeMismatch() {
        ProbabilityModel broken = new ProbabilityModel() {
            @Override
            public double[] predictProba(double[][] features) {
                return new double[] { 0.5 };
            }
        };
        ModelProvider provider = MonitorTestData.providerBuilder().model(broken).build();
        new Scorer(provider).score(new FeatureDeriver().derive(MonitorTestData.validatedBatch(3)));
    }

    private static Record record(String id, double score, double intRate) {
        Map<String, Object> fields = new LinkedHashMap<String, Object>();
        fields.put(Constants.INT_RATE, intRate);
        fields.put("score", score);
        fields.put("grade", "B");
        return new Record(id, fields);
    }

}
