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

import ml.shifu.monitor.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class LinearExplainerTest {

    @Test
    public void testExplain() {
        LinearExplainer explainer = new LinearExplainer(new double[] { 2d, -1d }, new double[] { 0.5, 10d });
        double[][] attributions = explainer.explain(new double[][] { { 1d, 12d }, { 0d, 10d } });

        Assert.assertEquals(attributions[0][0], 1d, Constants.TOLERANCE);
        Assert.assertEquals(attributions[0][1], -2d, Constants.TOLERANCE);
        Assert.assertEquals(attributions[1][0], -1d, Constants.TOLERANCE);
        Assert.assertEquals(attributions[1][1], 0d, Constants.TOLERANCE);
    }

    @Test
    public void testOfModelIgnoresBias() {
        LogisticRegressionModel model = new LogisticRegressionModel(new double[] { 3d, 100d });
        LinearExplainer explainer = LinearExplainer.of(model, new double[] { 1d });
        Assert.assertEquals(explainer.explain(new double[][] { { 2d } })[0][0], 3d, Constants.TOLERANCE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMismatchedMeans() {
        new LinearExplainer(new double[] { 1d, 2d }, new double[] { 0d });
    }

}
