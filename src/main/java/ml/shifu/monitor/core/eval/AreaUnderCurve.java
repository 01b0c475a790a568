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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class for computing area under curve.
 */
public final class AreaUnderCurve {

    private AreaUnderCurve() {
    }

    private static final Logger LOG = LoggerFactory.getLogger(AreaUnderCurve.class);

    /**
     * Compute the area under the line connecting the two input points by the trapezoidal rule. The point
     * is stored as two double value which refer to x-coordinate and y-coordinate respectively.
     *
     * <p>
     * Note: x2 is considered to be no less than x1, so that (x2 - x1) &gt;= 0 and the return value is always a nonnegative
     * </p>
     *
     * @param x1
     *            x-coordinate of first point.
     * @param y1
     *            y-coordinate of first point.
     * @param x2
     *            x-coordinate of second point.
     * @param y2
     *            y-coordinate of second point.
     * @return trapezoid area.
     */
    public static double trapezoid(double x1, double y1, double x2, double y2) {
        return (y2 + y1) * (x2 - x1) / 2.0;
    }

    /**
     * Calculate area under ROC curve.
     *
     * @param roc
     *            the ROC curve
     * @return area under ROC. NaN if the curve is undefined because one class is absent.
     */
    public static double ofRoc(RocCurve roc) {
        if(!roc.isDefined()) {
            LOG.warn("Only one class is present in ground truth, area under ROC is not defined.");
            return Double.NaN;
        }
        return calculateArea(roc.getFpr(), roc.getTpr());
    }

    /**
     * Calculate curve area by trapezoidal rule.
     *
     * @param x
     *            x-coordinates, non-decreasing
     * @param y
     *            y-coordinates
     * @return the area under the curve. Return 0 if the curve has less than 2 points.
     * @throws IllegalArgumentException
     *             if x and y have different sizes
     */
    public static double calculateArea(double[] x, double[] y) {
        if(x.length != y.length) {
            throw new IllegalArgumentException("The x and y coordinates have different sizes!");
        }

        if(x.length < 2) {
            LOG.warn("We need at least 2 point to calculate area! Maybe you should check the input.");
            return 0;
        }

        // accumulate the trapezoid area of every successive two points in the curve.
        double sum = 0.0;
        for(int i = 1; i < x.length; i++) {
            sum += trapezoid(x[i - 1], y[i - 1], x[i], y[i]);
        }
        return sum;
    }

}
