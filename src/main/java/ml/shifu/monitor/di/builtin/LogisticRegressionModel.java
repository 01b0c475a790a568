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
package ml.shifu.monitor.di.builtin;

import java.util.Arrays;

import ml.shifu.monitor.di.spi.ProbabilityModel;

import com.google.common.base.Preconditions;

/**
 * Logistic regression model, weights are stored in feature order with the bias as last element.
 */
public class LogisticRegressionModel implements ProbabilityModel {

    private final double[] weights;

    public LogisticRegressionModel(double[] weights) {
        Preconditions.checkArgument(weights != null && weights.length > 1,
                "Logistic regression needs at least one weight and a bias");
        this.weights = weights.clone();
    }

    @Override
    public double[] predictProba(double[][] features) {
        double[] probabilities = new double[features.length];
        for(int i = 0; i < features.length; i++) {
            probabilities[i] = sigmoid(features[i]);
        }
        return probabilities;
    }

    public int getInputCount() {
        // minus bias
        return this.weights.length - 1;
    }

    public double[] getWeights() {
        return this.weights.clone();
    }

    public double getBias() {
        return this.weights[weights.length - 1];
    }

    /**
     * Compute sigmoid value by dot operation of two vectors.
     */
    private double sigmoid(double[] inputs) {
        Preconditions.checkArgument(inputs.length == getInputCount(), "Expect %s inputs but got %s",
                getInputCount(), inputs.length);
        double value = 0.0d;
        for(int i = 0; i < inputs.length; i++) {
            value += weights[i] * inputs[i];
        }
        // append bias
        value += getBias();
        return 1.0d / (1.0d + Math.exp(-1 * value));
    }

    @Override
    public String toString() {
        return Arrays.toString(this.weights);
    }

}
