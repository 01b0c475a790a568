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
package ml.shifu.monitor.core;

import java.util.ArrayList;
import java.util.List;

import ml.shifu.monitor.container.Batch;
import ml.shifu.monitor.container.Record;
import ml.shifu.monitor.util.Constants;

/**
 * Adds the derived indicator features needed by the model and the drift tests. The input batch is left untouched.
 */
public class FeatureDeriver {

    public Batch derive(Batch batch) {
        List<Record> derived = new ArrayList<Record>(batch.size());
        for(Record record: batch) {
            derived.add(derive(record));
        }
        return new Batch(derived);
    }

    public Record derive(Record record) {
        return record.withField(Constants.RENT_INDICATOR, rentIndicator(record));
    }

    /**
     * @return 1 if the housing status is exactly RENT, else 0
     */
    public static double rentIndicator(Record record) {
        return Constants.RENT.equals(record.getString(Constants.HOME_OWNERSHIP)) ? 1d : 0d;
    }

}
