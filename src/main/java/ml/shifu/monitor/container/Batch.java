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
package ml.shifu.monitor.container;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Ordered collection of records sharing one schema.
 */
public class Batch implements Iterable<Record> {

    private final List<Record> records;

    public Batch(List<Record> records) {
        this.records = ImmutableList.copyOf(records);
    }

    public static Batch of(Record... records) {
        return new Batch(ImmutableList.copyOf(records));
    }

    public List<Record> getRecords() {
        return records;
    }

    public Record get(int index) {
        return records.get(index);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * A batch is validated iff it is not empty and every record carries ground truth. Only validated batches get
     * performance and fairness metrics.
     */
    public boolean isValidated() {
        if(records.isEmpty()) {
            return false;
        }
        for(Record record: records) {
            if(!record.hasGroundTruth()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<Record> iterator() {
        return records.iterator();
    }

}
