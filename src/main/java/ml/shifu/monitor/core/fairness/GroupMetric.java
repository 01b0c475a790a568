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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ml.shifu.monitor.container.CrossTabRow;
import ml.shifu.monitor.util.CommonUtils;

/**
 * Group metrics of the fairness cross tab.
 *
 * <p>
 * Each metric knows how it is computed from the confusion counts of a group and which per-record 0/1 indicator
 * sample it is the mean of, the latter being what the significance tests compare.
 */
public enum GroupMetric {

    TPR("tpr") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(tp, tp + fn);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getLabelValue() == 1 ? (double) input.getScore() : null;
        }
    },
    TNR("tnr") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(tn, tn + fp);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getLabelValue() == 0 ? (double) (1 - input.getScore()) : null;
        }
    },
    FOR("for") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(fn, fn + tn);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getScore() == 0 ? (double) input.getLabelValue() : null;
        }
    },
    FDR("fdr") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(fp, fp + tp);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getScore() == 1 ? (double) (1 - input.getLabelValue()) : null;
        }
    },
    FPR("fpr") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(fp, fp + tn);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getLabelValue() == 0 ? (double) input.getScore() : null;
        }
    },
    FNR("fnr") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(fn, fn + tp);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getLabelValue() == 1 ? (double) (1 - input.getScore()) : null;
        }
    },
    NPV("npv") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(tn, tn + fn);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getScore() == 0 ? (double) (1 - input.getLabelValue()) : null;
        }
    },
    PRECISION("precision") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(tp, tp + fp);
        }

        @Override
        Double indicator(FairnessInput input) {
            return input.getScore() == 1 ? (double) input.getLabelValue() : null;
        }
    },
    /**
     * Predicted positive ratio: share of the attribute's predicted positives falling into the group
     */
    PPR("ppr") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(tp + fp, k);
        }

        @Override
        Double indicator(FairnessInput input) {
            return (double) input.getScore();
        }
    },
    /**
     * Predicted prevalence: predicted positives over group size
     */
    PPREV("pprev") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(tp + fp, tp + fp + tn + fn);
        }

        @Override
        Double indicator(FairnessInput input) {
            return (double) input.getScore();
        }
    },
    /**
     * Prevalence: label positives over group size
     */
    PREV("prev") {
        @Override
        double compute(long tp, long fp, long tn, long fn, long k) {
            return CommonUtils.safeDivide(tp + fn, tp + fp + tn + fn);
        }

        @Override
        Double indicator(FairnessInput input) {
            return (double) input.getLabelValue();
        }
    };

    /**
     * Metrics of the absolute metrics table, in column order
     */
    public static final List<GroupMetric> ABSOLUTE = Collections.unmodifiableList(Arrays.asList(TPR, TNR, FOR, FDR,
            FPR, FNR, NPV, PRECISION, PPR, PPREV, PREV));

    /**
     * Metrics with a disparity ratio, in column order
     */
    public static final List<GroupMetric> DISPARITY = Collections.unmodifiableList(Arrays.asList(PPR, PPREV,
            PRECISION, FDR, FOR, FPR, FNR, TPR, TNR, NPV));

    private final String key;

    private GroupMetric(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * @param k
     *            number of predicted positives over all groups of the attribute
     * @return metric value, NaN if undefined for the group
     */
    abstract double compute(long tp, long fp, long tn, long fn, long k);

    /**
     * @return the 0/1 indicator of the record for this metric, null if the record is outside the metric's population
     */
    abstract Double indicator(FairnessInput input);

    public double compute(CrossTabRow row) {
        return compute(row.getTp(), row.getFp(), row.getTn(), row.getFn(), row.getK());
    }

}
