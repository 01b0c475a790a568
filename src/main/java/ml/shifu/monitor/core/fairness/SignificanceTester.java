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
package ml.shifu.monitor.core.fairness;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.inference.OneWayAnova;
import org.apache.commons.math3.stat.inference.TTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tests whether a group's indicator sample differs significantly from the reference group's.
 *
 * <p>
 * Variance equality is checked first with the Brown-Forsythe variant of Levene's test (one-way ANOVA over absolute
 * deviations from the group median); a two-sample t-test follows, pooled when variances are equal and Welch's
 * otherwise.
 */
public class SignificanceTester {

    private static final Logger LOG = LoggerFactory.getLogger(SignificanceTester.class);

    private final double alpha;

    private final TTest tTest = new TTest();

    private final OneWayAnova anova = new OneWayAnova();

    public SignificanceTester(double alpha) {
        this.alpha = alpha;
    }

    public double getAlpha() {
        return alpha;
    }

    public boolean isSignificant(double[] sample, double[] reference) {
        return pValue(sample, reference) < alpha;
    }

    /**
     * @return two-sided p-value, NaN if a sample has less than two observations or the test is degenerate
     */
    public double pValue(double[] sample, double[] reference) {
        if(sample.length < 2 || reference.length < 2) {
            return Double.NaN;
        }
        try {
            boolean equalVariance = !(levenepValue(sample, reference) < alpha);
            if(equalVariance) {
                return tTest.homoscedasticTTest(sample, reference);
            }
            return tTest.tTest(sample, reference);
        } catch (MathIllegalArgumentException e) {
            LOG.warn("Significance test is degenerate for samples of size {} and {}: {}", sample.length,
                    reference.length, e.getMessage());
            return Double.NaN;
        } catch (MathIllegalStateException e) {
            LOG.warn("Significance test did not converge for samples of size {} and {}: {}", sample.length,
                    reference.length, e.getMessage());
            return Double.NaN;
        }
    }

    double levenepValue(double[] sample, double[] reference) {
        List<double[]> deviations = new ArrayList<double[]>(2);
        deviations.add(absoluteDeviations(sample));
        deviations.add(absoluteDeviations(reference));
        return anova.anovaPValue(deviations);
    }

    private static double[] absoluteDeviations(double[] values) {
        double median = new Median().evaluate(values);
        double[] deviations = new double[values.length];
        for(int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return deviations;
    }

}
