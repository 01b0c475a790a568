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
 * Binary confusion counts, positive class is 1.
 */
public class ConfusionMatrixObject {

    private long tp, fp, tn, fn;

    public ConfusionMatrixObject() {
    }

    public ConfusionMatrixObject(long tp, long fp, long tn, long fn) {
        this.tp = tp;
        this.fp = fp;
        this.tn = tn;
        this.fn = fn;
    }

    /**
     * Count one observation.
     *
     * @param truth
     *            true class, 0 or 1
     * @param prediction
     *            predicted class, 0 or 1
     */
    public void add(int truth, int prediction) {
        if(truth == 1) {
            if(prediction == 1) {
                tp++;
            } else {
                fn++;
            }
        } else {
            if(prediction == 1) {
                fp++;
            } else {
                tn++;
            }
        }
    }

    public long getTp() {
        return tp;
    }

    public long getFp() {
        return fp;
    }

    public long getTn() {
        return tn;
    }

    public long getFn() {
        return fn;
    }

    /**
     * Count of records with the given true and predicted class.
     */
    public long get(int truth, int prediction) {
        if(truth == 1) {
            return prediction == 1 ? tp : fn;
        }
        return prediction == 1 ? fp : tn;
    }

    @Override
    public String toString() {
        return "ConfusionMatrixObject [tp=" + tp + ", fp=" + fp + ", tn=" + tn + ", fn=" + fn + "]";
    }

}
