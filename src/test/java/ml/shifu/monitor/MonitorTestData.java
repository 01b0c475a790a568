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
package ml.shifu.monitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.LoanStatus;
import ml.shifu.monitor.container.Record;
import ml.shifu.monitor.container.obj.GammaArgs;
import ml.shifu.monitor.container.obj.ModelProvider;
import ml.shifu.monitor.di.builtin.LinearExplainer;
import ml.shifu.monitor.di.builtin.LogisticRegressionModel;
import ml.shifu.monitor.util.Constants;

/**
 * Shared records and model artifacts of the unit tests.
 */
public final class MonitorTestData {

    public static final List<String> FEATURES = Arrays.asList(Constants.RENT_INDICATOR, Constants.INT_RATE);

    /**
     * rent_indicator, int_rate, bias
     */
    public static final double[] WEIGHTS = { -0.8, -0.12, 2.5 };

    public static final double[] FEATURE_MEANS = { 0.3, 12d };

    private MonitorTestData() {
    }

    public static LogisticRegressionModel model() {
        return new LogisticRegressionModel(WEIGHTS);
    }

    public static ModelProvider.Builder providerBuilder() {
        LogisticRegressionModel model = model();
        return ModelProvider.builder().model(model).explainer(LinearExplainer.of(model, FEATURE_MEANS))
                .threshold(0.5).features(FEATURES).rentRatio(0.25).gammaArgs(GammaArgs.of(1.5, 0d, 0.5))
                .intRateMean(12d);
    }

    public static ModelProvider provider() {
        return providerBuilder().build();
    }

    public static Record record(String id, String homeOwnership, double intRate, String fortyPlus, LoanStatus status) {
        Map<String, Object> fields = new LinkedHashMap<String, Object>();
        fields.put(Constants.HOME_OWNERSHIP, homeOwnership);
        fields.put(Constants.INT_RATE, intRate);
        fields.put(Constants.FORTY_PLUS_INDICATOR, fortyPlus);
        return new Record(id, fields, status);
    }

    /**
     * A validated batch of the given size: every fourth record rents, the interest rate cycles through 8 to 19, every
     * third applicant is forty or older and every fifth loan is charged off.
     */
    public static Batch validatedBatch(int size) {
        List<Record> records = new ArrayList<Record>(size);
        for(int i = 0; i < size; i++) {
            records.add(record("r" + i, i % 4 == 0 ? Constants.RENT : "MORTGAGE", 8d + (i % 12), i % 3 == 0 ? "Forty+"
                    : Constants.UNDER_FORTY, i % 5 == 0 ? LoanStatus.CHARGED_OFF : LoanStatus.FULLY_PAID));
        }
        return new Batch(records);
    }

    /**
     * Same records as {@link #validatedBatch(int)} but without ground truth.
     */
    public static Batch unlabeledBatch(int size) {
        List<Record> records = new ArrayList<Record>(size);
        for(Record record: validatedBatch(size)) {
            records.add(new Record(record.getId(), record.getFields()));
        }
        return new Batch(records);
    }

}
