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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ml.shifu.monitor.util.CommonUtils;
import ml.shifu.monitor.util.Constants;

import com.google.common.base.Preconditions;

/**
 * One loan application of a batch.
 *
 * <p>
 * Records are immutable, {@link #withField(String, Object)} returns a copy carrying the extra field. Field values are
 * either numbers or strings, ground truth is kept apart from the input fields and may be absent.
 */
public class Record {

    private final String id;

    private final Map<String, Object> fields;

    private final LoanStatus loanStatus;

    public Record(String id, Map<String, ?> fields) {
        this(id, fields, null);
    }

    public Record(String id, Map<String, ?> fields, LoanStatus loanStatus) {
        Preconditions.checkNotNull(id, "Record id should not be null");
        Preconditions.checkNotNull(fields, "Record fields should not be null");
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(fields));
        this.loanStatus = loanStatus;
    }

    /**
     * Build a record from a raw row carrying its id in {@link Constants#ID} and, optionally, its ground truth in
     * {@link Constants#LOAN_STATUS}. Both columns are removed from the input fields.
     *
     * @throws IllegalArgumentException
     *             if the row has no id or an unknown loan status
     */
    public static Record fromRow(Map<String, ?> row) {
        Object id = row.get(Constants.ID);
        Preconditions.checkArgument(id != null, "Row has no '%s' column: %s", Constants.ID, row);
        Map<String, Object> fields = new LinkedHashMap<String, Object>(row);
        fields.remove(Constants.ID);
        LoanStatus loanStatus = LoanStatus.parse(fields.remove(Constants.LOAN_STATUS));
        return new Record(id.toString(), fields, loanStatus);
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public LoanStatus getLoanStatus() {
        return loanStatus;
    }

    public boolean hasGroundTruth() {
        return loanStatus != null;
    }

    public boolean has(String name) {
        return fields.get(name) != null;
    }

    public Object get(String name) {
        return fields.get(name);
    }

    /**
     * @return the numeric value of the field, null if absent or not a number
     */
    public Double getNumeric(String name) {
        return CommonUtils.toDouble(fields.get(name));
    }

    /**
     * @return the text of the field, null if absent
     */
    public String getString(String name) {
        Object value = fields.get(name);
        return value == null ? null : value.toString();
    }

    public Record withField(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<String, Object>(this.fields);
        copy.put(name, value);
        return new Record(this.id, copy, this.loanStatus);
    }

    @Override
    public String toString() {
        return "Record [id=" + id + ", fields=" + fields + ", loanStatus=" + loanStatus + "]";
    }

}
