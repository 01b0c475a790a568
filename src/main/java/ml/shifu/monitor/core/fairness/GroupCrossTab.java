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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import ml.shifu.monitor.container.ConfusionMatrixObject;
import ml.shifu.monitor.container.CrossTabRow;

/**
 * Cross tabulation of predictions by protected attribute groups.
 */
public class GroupCrossTab {

    /**
     * One row per (attribute name, attribute value), attributes in the given order and values sorted within an
     * attribute.
     */
    public List<CrossTabRow> compute(List<FairnessInput> inputs, List<String> attributes) {
        List<CrossTabRow> rows = new ArrayList<CrossTabRow>();
        for(String attribute: attributes) {
            Map<String, ConfusionMatrixObject> groups = new TreeMap<String, ConfusionMatrixObject>();
            long k = 0;
            for(FairnessInput input: inputs) {
                String group = input.getGroup(attribute);
                ConfusionMatrixObject matrix = groups.get(group);
                if(matrix == null) {
                    matrix = new ConfusionMatrixObject();
                    groups.put(group, matrix);
                }
                matrix.add(input.getLabelValue(), input.getScore());
                k += input.getScore();
            }

            for(Map.Entry<String, ConfusionMatrixObject> entry: groups.entrySet()) {
                ConfusionMatrixObject matrix = entry.getValue();
                Map<String, Double> metrics = new LinkedHashMap<String, Double>();
                for(GroupMetric metric: GroupMetric.ABSOLUTE) {
                    metrics.put(metric.getKey(),
                            metric.compute(matrix.getTp(), matrix.getFp(), matrix.getTn(), matrix.getFn(), k));
                }
                rows.add(new CrossTabRow(attribute, entry.getKey(), matrix.getTp(), matrix.getFp(), matrix.getTn(),
                        matrix.getFn(), inputs.size(), k, metrics));
            }
        }
        return rows;
    }

}
