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

import ml.shifu.monitor.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AreaUnderCurveTest {

    @Test
    public void trapezoidTest() {
        double area = AreaUnderCurve.trapezoid(1, 1, 3, 4);
        Assert.assertEquals(area, 5.0);
    }

    @Test
    public void calculateAreaTest() {
        Assert.assertEquals(AreaUnderCurve.calculateArea(new double[0], new double[0]), 0.0);
        Assert.assertEquals(AreaUnderCurve.calculateArea(new double[] { 0.5 }, new double[] { 0.5 }), 0.0);

        double area = AreaUnderCurve.calculateArea(new double[] { 0d, 0.5, 1d }, new double[] { 0d, 0.6, 1d });
        Assert.assertEquals(area, 0.55, Constants.TOLERANCE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void calculateAreaSizeMismatchTest() {
        AreaUnderCurve.calculateArea(new double[] { 0d, 1d }, new double[] { 0d });
    }

}
