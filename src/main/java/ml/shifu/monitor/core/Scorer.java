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

import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.Record;
import ml.shifu.monitor.container.ScoredRecord;
import ml.shifu.monitor.container.obj.ModelProvider;
import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

/**
 * Scorer, calculate the probability and thresholded prediction of every record of a derived batch.
 */
public class Scorer {

    private static Logger log = LoggerFactory.getLogger(Scorer.class);

    private final ModelProvider modelProvider;

    @Inject
    public Scorer(ModelProvider modelProvider) {
        this.modelProvider = modelProvider;
    }

    /**
     * Score a batch whose derived features are already computed.
     *
     * @param batch
     *            derived batch
     * @return one scored record per input record, in input order
     * @throws MonitorException
     *             if a record lacks a model feature
     */
    public List<ScoredRecord> score(Batch batch) {
        double[] probabilities = predictProba(batch);
        double threshold = modelProvider.getThreshold();

        List<ScoredRecord> scored = new ArrayList<ScoredRecord>(batch.size());
        for(int i = 0; i < batch.size(); i++) {
            scored.add(new ScoredRecord(batch.get(i), probabilities[i], predict(probabilities[i], threshold)));
        }
        return scored;
    }

    /**
     * Probability of class 1 for every record, in input order.
     */
    public double[] predictProba(Batch batch) {
        if(batch.isEmpty()) {
            return new double[0];
        }
        double[][] matrix = buildFeatureMatrix(batch, modelProvider.getFeatures());
        double[] probabilities = modelProvider.getModel().predictProba(matrix);
        if(probabilities == null || probabilities.length != batch.size()) {
            throw new MonitorException(MonitorErrorCode.ERROR_MODEL_OUTPUT, "Model returned "
                    + (probabilities == null ? 0 : probabilities.length) + " probabilities for " + batch.size()
                    + " records");
        }
        log.debug("Scored {} records.", batch.size());
        return probabilities;
    }

    /**
     * Strictly greater than: a probability equal to the threshold predicts 0.
     */
    public static int predict(double probability, double threshold) {
        return probability > threshold ? 1 : 0;
    }

    /**
     * Build the feature matrix in exactly the given feature order, extra fields are ignored.
     *
     * @throws MonitorException
     *             with {@link MonitorErrorCode#ERROR_MISSING_FEATURE} if a feature is absent or not numeric
     */
    public static double[][] buildFeatureMatrix(Batch batch, List<String> features) {
        double[][] matrix = new double[batch.size()][features.size()];
        for(int i = 0; i < batch.size(); i++) {
            Record record = batch.get(i);
            for(int j = 0; j < features.size(); j++) {
                matrix[i][j] = requireNumeric(record, features.get(j));
            }
        }
        return matrix;
    }

    static double requireNumeric(Record record, String feature) {
        Double value = record.getNumeric(feature);
        if(value == null) {
            throw new MonitorException(MonitorErrorCode.ERROR_MISSING_FEATURE, "Feature '" + feature
                    + "' is missing or not numeric in record " + record.getId());
        }
        return value;
    }

}
