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

import java.util.List;

import ml.shifu.monitor.container.RocPoint;
import ml.shifu.monitor.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class RocCurveTest {

    @Test
    public void testCurve() {
        RocCurve roc = RocCurve.of(new double[] { 0.1, 0.4, 0.35, 0.8 }, new int[] { 0, 0, 1, 1 });

        Assert.assertEquals(roc.getFpr(), new double[] { 0d, 0d, 0.5, 0.5, 1d }, Constants.TOLERANCE);
        Assert.assertEquals(roc.getTpr(), new double[] { 0d, 0.5, 0.5, 1d, 1d }, Constants.TOLERANCE);
        Assert.assertEquals(roc.getThresholds()[0], Double.POSITIVE_INFINITY);
        Assert.assertEquals(roc.getThresholds()[1], 0.8);
        Assert.assertTrue(roc.isDefined());
        Assert.assertEquals(AreaUnderCurve.ofRoc(roc), 0.75, Constants.TOLERANCE);
    }

    @Test
    public void testCollinearPointsDropped() {
        RocCurve roc = RocCurve.of(new double[] { 0.9, 0.8, 0.7, 0.6 }, new int[] { 1, 1, 0, 0 });

        Assert.assertEquals(roc.size(), 4);
        Assert.assertEquals(roc.getFpr(), new double[] { 0d, 0d, 0d, 1d }, Constants.TOLERANCE);
        Assert.assertEquals(roc.getTpr(), new double[] { 0d, 0.5, 1d, 1d }, Constants.TOLERANCE);
        Assert.assertEquals(roc.getThresholds()[3], 0.6);
        Assert.assertEquals(AreaUnderCurve.ofRoc(roc), 1d, Constants.TOLERANCE);
    }

    @Test
    public void testTiedScores() {
        RocCurve roc = RocCurve.of(new double[] { 0.5, 0.5 }, new int[] { 0, 1 });

        Assert.assertEquals(roc.getFpr(), new double[] { 0d, 1d }, Constants.TOLERANCE);
        Assert.assertEquals(roc.getTpr(), new double[] { 0d, 1d }, Constants.TOLERANCE);
        Assert.assertEquals(AreaUnderCurve.ofRoc(roc), 0.5, Constants.TOLERANCE);
    }

    @Test
    public void testSingleClass() {
        RocCurve roc = RocCurve.of(new double[] { 0.9, 0.3, 0.6 }, new int[] { 1, 1, 1 });

        Assert.assertFalse(roc.isDefined());
        Assert.assertTrue(Double.isNaN(roc.getFpr()[1]));
        Assert.assertEquals(roc.getTpr()[roc.size() - 1], 1d, Constants.TOLERANCE);
        Assert.assertTrue(Double.isNaN(AreaUnderCurve.ofRoc(roc)));

        List<RocPoint> points = roc.toPoints();
        Assert.assertNull(points.get(1).getFpr());
        Assert.assertNotNull(points.get(1).getTpr());
    }

    @Test
    public void testEmpty() {
        RocCurve roc = RocCurve.of(new double[0], new int[0]);
        Assert.assertEquals(roc.size(), 1);
        Assert.assertFalse(roc.isDefined());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSizeMismatch() {
        RocCurve.of(new double[] { 0.1 }, new int[] { 0, 1 });
    }

}
