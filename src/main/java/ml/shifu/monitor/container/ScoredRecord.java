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
 * A derived record with its model probability and thresholded prediction.
 */
public class ScoredRecord {

    private final Record record;

    private final double probability;

    private final int prediction;

    public ScoredRecord(Record record, double probability, int prediction) {
        this.record = record;
        this.probability = probability;
        this.prediction = prediction;
    }

    public Record getRecord() {
        return record;
    }

    public String getId() {
        return record.getId();
    }

    public double getProbability() {
        return probability;
    }

    public int getPrediction() {
        return prediction;
    }

    /**
     * @return ground truth as 0/1, record must carry ground truth
     */
    public int getLabelValue() {
        return record.getLoanStatus().getValue();
    }

    public ScoreResult toScoreResult() {
        return new ScoreResult(record.getId(), probability, prediction);
    }

}
