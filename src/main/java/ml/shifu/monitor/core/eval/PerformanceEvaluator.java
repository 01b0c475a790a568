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
package ml.shifu.monitor.core.eval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.monitor.container.ConfusionMatrixObject;
import ml.shifu.monitor.container.LoanStatus;
import ml.shifu.monitor.container.PerformanceReport;
import ml.shifu.monitor.container.ScoredRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classification performance of scored records carrying ground truth: F1, confusion matrix, ROC curve and AUC.
 * "Fully Paid" is the positive class.
 */
public class PerformanceEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(PerformanceEvaluator.class);

    /**
     * @param scored
     *            scored records, every one with ground truth
     */
    public PerformanceReport evaluate(List<ScoredRecord> scored) {
        ConfusionMatrixObject matrix = confusionMatrix(scored);

        double[] scores = new double[scored.size()];
        int[] labels = new int[scored.size()];
        for(int i = 0; i < scored.size(); i++) {
            scores[i] = scored.get(i).getProbability();
            labels[i] = scored.get(i).getLabelValue();
        }
        RocCurve roc = RocCurve.of(scores, labels);
        double auc = AreaUnderCurve.ofRoc(roc);
        double f1 = f1Score(matrix);

        LOG.info("Performance of {} records: f1 {}, auc {}, {}.", scored.size(), f1, auc, matrix);
        return new PerformanceReport(f1, toRows(matrix), auc, roc.toPoints());
    }

    public static ConfusionMatrixObject confusionMatrix(List<ScoredRecord> scored) {
        ConfusionMatrixObject matrix = new ConfusionMatrixObject();
        for(ScoredRecord record: scored) {
            matrix.add(record.getLabelValue(), record.getPrediction());
        }
        return matrix;
    }

    /**
     * F1 = 2tp / (2tp + fp + fn). If there is neither a positive label nor a positive prediction the score is 0.
     */
    public static double f1Score(ConfusionMatrixObject matrix) {
        double denominator = 2d * matrix.getTp() + matrix.getFp() + matrix.getFn();
        if(denominator == 0d) {
            LOG.warn("F1 score is ill-defined without positive labels and predictions, set to 0.");
            return 0d;
        }
        return 2d * matrix.getTp() / denominator;
    }

    /**
     * One row per true class in label order, each row maps predicted label to count.
     */
    public static List<Map<String, Long>> toRows(ConfusionMatrixObject matrix) {
        List<Map<String, Long>> rows = new ArrayList<Map<String, Long>>();
        for(LoanStatus truth: LoanStatus.values()) {
            Map<String, Long> row = new LinkedHashMap<String, Long>();
            for(LoanStatus prediction: LoanStatus.values()) {
                row.put(prediction.getLabel(), matrix.get(truth.getValue(), prediction.getValue()));
            }
            rows.add(row);
        }
        return rows;
    }

}
