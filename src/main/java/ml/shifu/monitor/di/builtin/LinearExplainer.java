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

import ml.shifu.monitor.di.spi.Explainer;

import com.google.common.base.Preconditions;

/**
 * Exact SHAP values of a linear model under feature independence: the attribution of feature i is
 * {@code w_i * (x_i - mean_i)} in log-odds space, mean_i being the feature mean of the background data.
 */
public class LinearExplainer implements Explainer {

    private final double[] coefficients;

    private final double[] featureMeans;

    public LinearExplainer(double[] coefficients, double[] featureMeans) {
        Preconditions.checkArgument(coefficients.length == featureMeans.length,
                "Coefficients and feature means have different sizes: %s vs %s", coefficients.length,
                featureMeans.length);
        this.coefficients = coefficients.clone();
        this.featureMeans = featureMeans.clone();
    }

    /**
     * Explainer of a {@link LogisticRegressionModel}, the bias does not contribute to attributions.
     */
    public static LinearExplainer of(LogisticRegressionModel model, double[] featureMeans) {
        double[] weights = model.getWeights();
        double[] coefficients = new double[model.getInputCount()];
        System.arraycopy(weights, 0, coefficients, 0, coefficients.length);
        return new LinearExplainer(coefficients, featureMeans);
    }

    @Override
    public double[][] explain(double[][] features) {
        double[][] attributions = new double[features.length][];
        for(int i = 0; i < features.length; i++) {
            Preconditions.checkArgument(features[i].length == coefficients.length, "Expect %s features but got %s",
                    coefficients.length, features[i].length);
            attributions[i] = new double[coefficients.length];
            for(int j = 0; j < coefficients.length; j++) {
                attributions[i][j] = coefficients[j] * (features[i][j] - featureMeans[j]);
            }
        }
        return attributions;
    }

}
