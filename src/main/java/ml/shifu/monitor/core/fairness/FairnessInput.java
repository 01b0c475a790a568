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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of the group fairness computation: predicted class, true class and the group label of each protected
 * attribute of one record.
 */
public class FairnessInput {

    private final int score;

    private final int labelValue;

    private final Map<String, String> groups;

    public FairnessInput(int score, int labelValue, Map<String, String> groups) {
        this.score = score;
        this.labelValue = labelValue;
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<String, String>(groups));
    }

    public int getScore() {
        return score;
    }

    public int getLabelValue() {
        return labelValue;
    }

    public String getGroup(String attribute) {
        return groups.get(attribute);
    }

    public Map<String, String> getGroups() {
        return groups;
    }

}
