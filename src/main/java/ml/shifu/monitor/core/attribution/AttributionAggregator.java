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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import ml.shifu.monitor.container.AttributionSummary;
import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.FeatureAttribution;
import ml.shifu.monitor.container.obj.ModelProvider;
import ml.shifu.monitor.core.Scorer;
import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

/**
 * Reduces per-record attributions of the explainer to the mean absolute attribution per feature, ranked ascending.
 */
public class AttributionAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(AttributionAggregator.class);

    /**
     * Ascending by value, NaN last, ties keep feature order.
     */
    private static final Comparator<FeatureAttribution> ASCENDING = new Comparator<FeatureAttribution>() {
        @Override
        public int compare(FeatureAttribution o1, FeatureAttribution o2) {
            return Double.compare(o1.getValue(), o2.getValue());
        }
    };

    private final ModelProvider modelProvider;

    @Inject
    public AttributionAggregator(ModelProvider modelProvider) {
        this.modelProvider = modelProvider;
    }

    /**
     * @param batch
     *            derived batch
     */
    public AttributionSummary summarize(Batch batch) {
        List<String> features = modelProvider.getFeatures();
        double[] sums = new double[features.size()];

        if(!batch.isEmpty()) {
            double[][] matrix = Scorer.buildFeatureMatrix(batch, features);
            double[][] attributions = modelProvider.getExplainer().explain(matrix);
            checkShape(attributions, batch.size(), features.size());
            for(double[] row: attributions) {
                for(int j = 0; j < row.length; j++) {
                    sums[j] += Math.abs(row[j]);
                }
            }
        } else {
            LOG.warn("Empty batch, every feature attribution is undefined.");
        }

        List<FeatureAttribution> result = new ArrayList<FeatureAttribution>(features.size());
        for(int j = 0; j < features.size(); j++) {
            double mean = batch.isEmpty() ? Double.NaN : sums[j] / batch.size();
            result.add(new FeatureAttribution(features.get(j), mean));
        }
        // stable sort
        Collections.sort(result, ASCENDING);
        return new AttributionSummary(result);
    }

    private static void checkShape(double[][] attributions, int rows, int columns) {
        if(attributions == null || attributions.length != rows) {
            throw new MonitorException(MonitorErrorCode.ERROR_EXPLAINER_OUTPUT, "Explainer returned "
                    + (attributions == null ? 0 : attributions.length) + " rows for " + rows + " records");
        }
        for(double[] row: attributions) {
            if(row == null || row.length != columns) {
                throw new MonitorException(MonitorErrorCode.ERROR_EXPLAINER_OUTPUT, "Explainer returned a row of "
                        + (row == null ? 0 : row.length) + " values for " + columns + " features");
            }
        }
    }

}
