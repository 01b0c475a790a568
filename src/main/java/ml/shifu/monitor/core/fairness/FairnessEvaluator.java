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
package ml.shifu.monitor.core.fairness;

import java.util.ArrayList;
import java.util.List;

import ml.shifu.monitor.container.BiasReport;
import ml.shifu.monitor.container.CrossTabRow;
import ml.shifu.monitor.container.DisparityRow;
import ml.shifu.monitor.container.ScoredRecord;
import ml.shifu.monitor.container.obj.MonitorConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

/**
 * Group fairness of scored records carrying ground truth: absolute metrics per protected attribute group and their
 * disparity against reference groups.
 */
public class FairnessEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(FairnessEvaluator.class);

    private final MonitorConfig config;

    private final AttributePreprocessor preprocessor = new AttributePreprocessor();

    private final GroupCrossTab crossTab = new GroupCrossTab();

    private final DisparityCalculator disparityCalculator;

    @Inject
    public FairnessEvaluator(MonitorConfig config) {
        this.config = config;
        this.disparityCalculator = new DisparityCalculator(config);
    }

    public BiasReport evaluate(List<ScoredRecord> scored) {
        List<String> attributes = config.getProtectedAttributes();
        List<FairnessInput> inputs = preprocessor.process(scored, attributes);

        List<CrossTabRow> rows = crossTab.compute(inputs, attributes);
        List<DisparityRow> disparities = disparityCalculator.compute(rows, inputs, attributes);

        List<CrossTabRow> absolute = new ArrayList<CrossTabRow>(rows.size());
        for(CrossTabRow row: rows) {
            absolute.add(row.rounded(config.getAbsoluteMetricsScale()));
        }
        LOG.info("Computed fairness metrics of {} groups over {} protected attributes.", rows.size(),
                attributes.size());
        return new BiasReport(absolute, disparities);
    }

}
