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
package ml.shifu.monitor.core.drift;

import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.DriftReport;
import ml.shifu.monitor.container.Record;
import ml.shifu.monitor.container.obj.GammaArgs;
import ml.shifu.monitor.container.obj.ModelProvider;
import ml.shifu.monitor.core.FeatureDeriver;
import ml.shifu.monitor.core.Scorer;
import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;
import ml.shifu.monitor.util.Constants;

import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.apache.commons.math3.stat.inference.TTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.Inject;

/**
 * Statistical drift of a batch against the reference parameters captured at training time.
 *
 * <p>
 * Three independent tests, no correction for multiple comparisons:
 * <ul>
 * <li>two-sided binomial test of the renter count against the expected renter ratio;</li>
 * <li>one-sample two-sided t-test of the interest rate against its reference mean;</li>
 * <li>Kolmogorov-Smirnov test of the model's negative log-probabilities against the reference gamma distribution.</li>
 * </ul>
 * A test without enough observations yields a NaN p-value.
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    private static final double RELATIVE_TOLERANCE = 1e-7;

    private final ModelProvider modelProvider;

    private final Scorer scorer;

    private final TTest tTest = new TTest();

    private final KolmogorovSmirnovTest ksTest = new KolmogorovSmirnovTest();

    @Inject
    public DriftDetector(ModelProvider modelProvider, Scorer scorer) {
        this.modelProvider = modelProvider;
        this.scorer = scorer;
    }

    /**
     * @param batch
     *            derived batch
     */
    public DriftReport detect(Batch batch) {
        return detect(batch, scorer.predictProba(batch));
    }

    /**
     * @param batch
     *            derived batch
     * @param probabilities
     *            class 1 probabilities of the batch records, in order
     */
    public DriftReport detect(Batch batch, double[] probabilities) {
        double rentersPvalue = rentersBinomPvalue(batch);
        double logprobPvalue = outputLogprobPvalue(probabilities);
        double intRatePvalue = intRateTtestPvalue(batch);
        LOG.info("Drift p-values of {} records: renters {}, output log-probability {}, interest rate {}.",
                batch.size(), rentersPvalue, logprobPvalue, intRatePvalue);
        return new DriftReport(rentersPvalue, logprobPvalue, intRatePvalue);
    }

    public double rentersBinomPvalue(Batch batch) {
        if(batch.isEmpty()) {
            LOG.warn("Empty batch, renters binomial test is skipped.");
            return Double.NaN;
        }
        int renters = 0;
        for(Record record: batch) {
            Double indicator = record.getNumeric(Constants.RENT_INDICATOR);
            if(indicator == null) {
                indicator = FeatureDeriver.rentIndicator(record);
            }
            if(indicator == 1d) {
                renters++;
            }
        }
        return twoSidedBinomialPvalue(batch.size(), renters, modelProvider.getRentRatio());
    }

    /**
     * Two-sided binomial p-value: total probability of all outcomes no more likely than the observed one.
     */
    static double twoSidedBinomialPvalue(int trials, int successes, double probability) {
        BinomialDistribution distribution = new BinomialDistribution(null, trials, probability);
        // relative tolerance so the observed outcome and its ties are always counted
        double observed = distribution.probability(successes) * (1d + RELATIVE_TOLERANCE);
        double pValue = 0d;
        for(int i = 0; i <= trials; i++) {
            double p = distribution.probability(i);
            if(p <= observed) {
                pValue += p;
            }
        }
        return Math.min(1d, pValue);
    }

    public double intRateTtestPvalue(Batch batch) {
        double[] rates = new double[batch.size()];
        for(int i = 0; i < rates.length; i++) {
            Record record = batch.get(i);
            Double rate = record.getNumeric(Constants.INT_RATE);
            if(rate == null) {
                throw new MonitorException(MonitorErrorCode.ERROR_MISSING_FEATURE, "Feature '" + Constants.INT_RATE
                        + "' is missing or not numeric in record " + record.getId());
            }
            rates[i] = rate;
        }
        if(rates.length < 2) {
            LOG.warn("Interest rate t-test needs at least 2 records but got {}.", rates.length);
            return Double.NaN;
        }
        return tTest.tTest(modelProvider.getIntRateMean(), rates);
    }

    public double outputLogprobPvalue(double[] probabilities) {
        if(probabilities.length < 2) {
            LOG.warn("Output log-probability KS test needs at least 2 records but got {}.", probabilities.length);
            return Double.NaN;
        }
        GammaArgs gammaArgs = modelProvider.getGammaArgs();
        double[] shifted = new double[probabilities.length];
        for(int i = 0; i < probabilities.length; i++) {
            // negative log-probability, moved by loc onto the standard gamma support
            shifted[i] = -Math.log(probabilities[i]) - gammaArgs.getLoc();
        }
        return ksTest.kolmogorovSmirnovTest(gammaArgs.toDistribution(), shifted);
    }

}
