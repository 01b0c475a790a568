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
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import ml.shifu.monitor.container.RocPoint;

import com.google.common.base.Preconditions;

/**
 * ROC curve of binary scores.
 *
 * <p>
 * Thresholds are the distinct scores in decreasing order. Points lying on a straight line between their neighbours
 * are dropped, and a leading (0, 0) point is added so the curve always starts at the origin. If the batch has no
 * negative (positive) record the fpr (tpr) of every point is NaN.
 */
public final class RocCurve {

    private final double[] fpr;

    private final double[] tpr;

    private final double[] thresholds;

    private RocCurve(double[] fpr, double[] tpr, double[] thresholds) {
        this.fpr = fpr;
        this.tpr = tpr;
        this.thresholds = thresholds;
    }

    /**
     * @param scores
     *            positive class probabilities
     * @param labels
     *            true classes, 0 or 1
     */
    public static RocCurve of(final double[] scores, int[] labels) {
        Preconditions.checkArgument(scores.length == labels.length, "Scores and labels have different sizes");
        int n = scores.length;
        if(n == 0) {
            return new RocCurve(new double[] { Double.NaN }, new double[] { Double.NaN },
                    new double[] { Double.POSITIVE_INFINITY });
        }

        // stable sort by decreasing score
        Integer[] order = new Integer[n];
        for(int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, new Comparator<Integer>() {
            @Override
            public int compare(Integer o1, Integer o2) {
                return Double.compare(scores[o2], scores[o1]);
            }
        });

        // cumulative counts at the last index of each distinct score
        List<double[]> counts = new ArrayList<double[]>();
        double cumTp = 0d;
        for(int i = 0; i < n; i++) {
            cumTp += labels[order[i]];
            if(i == n - 1 || scores[order[i]] != scores[order[i + 1]]) {
                counts.add(new double[] { cumTp, 1d + i - cumTp, scores[order[i]] });
            }
        }

        List<double[]> kept = dropIntermediate(counts);

        int size = kept.size() + 1;
        double[] tps = new double[size];
        double[] fps = new double[size];
        double[] thresholds = new double[size];
        thresholds[0] = Double.POSITIVE_INFINITY;
        for(int i = 1; i < size; i++) {
            double[] point = kept.get(i - 1);
            tps[i] = point[0];
            fps[i] = point[1];
            thresholds[i] = point[2];
        }

        double totalPos = tps[size - 1];
        double totalNeg = fps[size - 1];
        double[] fpr = new double[size];
        double[] tpr = new double[size];
        for(int i = 0; i < size; i++) {
            fpr[i] = totalNeg > 0 ? fps[i] / totalNeg : Double.NaN;
            tpr[i] = totalPos > 0 ? tps[i] / totalPos : Double.NaN;
        }
        return new RocCurve(fpr, tpr, thresholds);
    }

    /**
     * Keep the first and last points and every point where the slope of the curve changes.
     */
    private static List<double[]> dropIntermediate(List<double[]> counts) {
        if(counts.size() <= 2) {
            return counts;
        }
        List<double[]> kept = new ArrayList<double[]>();
        kept.add(counts.get(0));
        for(int i = 1; i < counts.size() - 1; i++) {
            double[] prev = counts.get(i - 1);
            double[] curr = counts.get(i);
            double[] next = counts.get(i + 1);
            double tpCurvature = next[0] - 2 * curr[0] + prev[0];
            double fpCurvature = next[1] - 2 * curr[1] + prev[1];
            if(tpCurvature != 0d || fpCurvature != 0d) {
                kept.add(curr);
            }
        }
        kept.add(counts.get(counts.size() - 1));
        return kept;
    }

    public double[] getFpr() {
        return fpr.clone();
    }

    public double[] getTpr() {
        return tpr.clone();
    }

    public double[] getThresholds() {
        return thresholds.clone();
    }

    public int size() {
        return fpr.length;
    }

    /**
     * @return true if both classes are present, i.e. every rate is defined
     */
    public boolean isDefined() {
        for(int i = 0; i < fpr.length; i++) {
            if(Double.isNaN(fpr[i]) || Double.isNaN(tpr[i])) {
                return false;
            }
        }
        return true;
    }

    public List<RocPoint> toPoints() {
        List<RocPoint> points = new ArrayList<RocPoint>(fpr.length);
        for(int i = 0; i < fpr.length; i++) {
            points.add(new RocPoint(fpr[i], tpr[i]));
        }
        return points;
    }

}
