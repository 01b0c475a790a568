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

import java.util.ArrayList;
import java.util.List;

import ml.shifu.monitor.container.AttributionSummary;
import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.BiasReport;
import ml.shifu.monitor.container.DriftReport;
import ml.shifu.monitor.container.MetricsReport;
import ml.shifu.monitor.container.PerformanceReport;
import ml.shifu.monitor.container.ScoreResult;
import ml.shifu.monitor.container.ScoredRecord;
import ml.shifu.monitor.core.attribution.AttributionAggregator;
import ml.shifu.monitor.core.drift.DriftDetector;
import ml.shifu.monitor.core.eval.PerformanceEvaluator;
import ml.shifu.monitor.core.fairness.FairnessEvaluator;
import ml.shifu.monitor.exception.MonitorException;
import ml.shifu.monitor.util.JSONUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.inject.Inject;

/**
 * MetricsRunner is the entry of batch scoring and model monitoring. It provides two APIs:
 * <ul>
 * <li>{@link #score(Batch)}: probability and prediction per record;</li>
 * <li>{@link #metrics(Batch)}: performance, fairness, drift and attribution metrics of the batch.</li>
 * </ul>
 * <p>
 * Performance and fairness metrics need ground truth, so they are only computed for validated batches. Drift and
 * attribution are always computed. A call either completes over the whole batch or fails with a
 * {@link MonitorException}; no partial report is returned.
 * </p>
 * The runner keeps no state between calls, one instance can serve any number of batches and threads.
 */
public class MetricsRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsRunner.class);

    private final FeatureDeriver featureDeriver;

    private final Scorer scorer;

    private final PerformanceEvaluator performanceEvaluator;

    private final FairnessEvaluator fairnessEvaluator;

    private final DriftDetector driftDetector;

    private final AttributionAggregator attributionAggregator;

    @Inject
    public MetricsRunner(FeatureDeriver featureDeriver, Scorer scorer, PerformanceEvaluator performanceEvaluator,
            FairnessEvaluator fairnessEvaluator, DriftDetector driftDetector,
            AttributionAggregator attributionAggregator) {
        this.featureDeriver = featureDeriver;
        this.scorer = scorer;
        this.performanceEvaluator = performanceEvaluator;
        this.fairnessEvaluator = fairnessEvaluator;
        this.driftDetector = driftDetector;
        this.attributionAggregator = attributionAggregator;
    }

    /**
     * @return id, probability and prediction of every record, in input order
     */
    public List<ScoreResult> score(Batch batch) {
        List<ScoredRecord> scored = scorer.score(featureDeriver.derive(batch));
        List<ScoreResult> results = new ArrayList<ScoreResult>(scored.size());
        for(ScoredRecord record: scored) {
            results.add(record.toScoreResult());
        }
        LOG.info("Scored batch of {} records.", results.size());
        return results;
    }

    /**
     * Monitoring report of a batch. Drift and attribution are always computed, performance and bias only when every
     * record carries ground truth.
     *
     * @throws MonitorException
     *             if a record lacks a model feature or a collaborator returns a wrongly shaped result
     */
    public MetricsReport metrics(Batch batch) {
        Batch derived = featureDeriver.derive(batch);
        List<ScoredRecord> scored = scorer.score(derived);

        PerformanceReport performance = null;
        BiasReport bias = null;
        if(derived.isValidated()) {
            performance = performanceEvaluator.evaluate(scored);
            bias = fairnessEvaluator.evaluate(scored);
        } else {
            LOG.info("Batch of {} records is not validated, performance and bias metrics are skipped.",
                    derived.size());
        }

        double[] probabilities = new double[scored.size()];
        for(int i = 0; i < probabilities.length; i++) {
            probabilities[i] = scored.get(i).getProbability();
        }
        DriftReport drift = driftDetector.detect(derived, probabilities);
        AttributionSummary attribution = attributionAggregator.summarize(derived);

        return new MetricsReport(performance, bias, drift, attribution);
    }

    public static String toJson(MetricsReport report) throws JsonProcessingException {
        return JSONUtils.writeValueAsString(report);
    }

}
