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

import ml.shifu.monitor.util.Constants;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Output of the score entry point, one per input record.
 */
@JsonPropertyOrder({ Constants.ID, Constants.PROBABILITY, Constants.PREDICTION })
public class ScoreResult {

    private final String id;

    private final double probability;

    private final int prediction;

    public ScoreResult(String id, double probability, int prediction) {
        this.id = id;
        this.probability = probability;
        this.prediction = prediction;
    }

    @JsonProperty(Constants.ID)
    public String getId() {
        return id;
    }

    @JsonProperty(Constants.PROBABILITY)
    public double getProbability() {
        return probability;
    }

    @JsonProperty(Constants.PREDICTION)
    public int getPrediction() {
        return prediction;
    }

    @Override
    public String toString() {
        return "ScoreResult [id=" + id + ", probability=" + probability + ", prediction=" + prediction + "]";
    }

}
