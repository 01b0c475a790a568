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

import ml.shifu.monitor.container.CrossTabRow;
import ml.shifu.monitor.container.DisparityRow;
import ml.shifu.monitor.container.obj.MonitorConfig;
import ml.shifu.monitor.util.CommonUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Disparity of each group against the reference group of its attribute.
 *
 * <p>
 * The disparity of a metric is the group's value divided by the reference group's value. The reference group's own
 * disparity is 1.0 whenever its metric is defined. With significance masking on, the ratio of a non-reference group
 * whose indicator sample does not differ significantly from the reference group's is replaced by null and flagged as
 * not significant. When the configured reference group is absent from the batch every ratio of the attribute is null.
 */
public class DisparityCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(DisparityCalculator.class);

    private final MonitorConfig config;

    private final SignificanceTester tester;

    public DisparityCalculator(MonitorConfig config) {
        this.config = config;
        this.tester = new SignificanceTester(config.getAlpha());
    }

    public List<DisparityRow> compute(List<CrossTabRow> crossTab, List<FairnessInput> inputs, List<String> attributes) {
        List<DisparityRow> rows = new ArrayList<DisparityRow>(crossTab.size());
        for(String attribute: attributes) {
            List<CrossTabRow> groups = rowsOf(crossTab, attribute);
            if(groups.isEmpty()) {
                continue;
            }
            CrossTabRow reference = findReference(attribute, groups);
            if(reference == null) {
                rows.addAll(undefined(attribute, groups));
                continue;
            }
            LOG.debug("Reference group of {} is {}.", attribute, reference.getAttributeValue());

            Map<GroupMetric, double[]> referenceSamples = config.isMaskSignificance() ? samples(inputs, attribute,
                    reference.getAttributeValue()) : null;

            for(CrossTabRow group: groups) {
                boolean isReference = group == reference;
                Map<GroupMetric, double[]> groupSamples = (config.isMaskSignificance() && !isReference) ? samples(
                        inputs, attribute, group.getAttributeValue()) : null;

                Map<String, Double> disparities = new LinkedHashMap<String, Double>();
                Map<String, Boolean> significance = new LinkedHashMap<String, Boolean>();
                for(GroupMetric metric: GroupMetric.DISPARITY) {
                    double ratio = ratio(metric, group, reference, isReference);
                    if(config.isMaskSignificance()) {
                        boolean significant = !isReference
                                && tester.isSignificant(groupSamples.get(metric), referenceSamples.get(metric));
                        significance.put(metric.getKey(), significant);
                        if(!isReference && !significant) {
                            ratio = Double.NaN;
                        }
                    }
                    disparities.put(metric.getKey(), CommonUtils.nanToNull(ratio));
                }
                rows.add(new DisparityRow(attribute, group.getAttributeValue(), isReference, disparities,
                        significance));
            }
        }
        return rows;
    }

    private List<DisparityRow> undefined(String attribute, List<CrossTabRow> groups) {
        List<DisparityRow> rows = new ArrayList<DisparityRow>(groups.size());
        for(CrossTabRow group: groups) {
            Map<String, Double> disparities = new LinkedHashMap<String, Double>();
            Map<String, Boolean> significance = new LinkedHashMap<String, Boolean>();
            for(GroupMetric metric: GroupMetric.DISPARITY) {
                disparities.put(metric.getKey(), null);
                if(config.isMaskSignificance()) {
                    significance.put(metric.getKey(), false);
                }
            }
            rows.add(new DisparityRow(attribute, group.getAttributeValue(), false, disparities, significance));
        }
        return rows;
    }

    static double ratio(GroupMetric metric, CrossTabRow group, CrossTabRow reference, boolean isReference) {
        double value = group.getMetric(metric.getKey());
        if(isReference) {
            return Double.isNaN(value) ? Double.NaN : 1d;
        }
        return CommonUtils.safeDivide(value, reference.getMetric(metric.getKey()));
    }

    /**
     * Configured reference group, or the largest group if none is configured for the attribute.
     *
     * @return null if the configured reference group is not in the batch
     */
    CrossTabRow findReference(String attribute, List<CrossTabRow> groups) {
        String configured = config.getReferenceGroup(attribute);
        if(configured != null) {
            for(CrossTabRow group: groups) {
                if(configured.equals(group.getAttributeValue())) {
                    return group;
                }
            }
            LOG.warn("Reference group '{}' of attribute {} is not in the batch, its disparities are undefined.",
                    configured, attribute);
            return null;
        }

        CrossTabRow largest = groups.get(0);
        for(CrossTabRow group: groups) {
            if(group.getGroupSize() > largest.getGroupSize()) {
                largest = group;
            }
        }
        LOG.info("No reference group configured for {}, use the largest group {}.", attribute,
                largest.getAttributeValue());
        return largest;
    }

    private static List<CrossTabRow> rowsOf(List<CrossTabRow> crossTab, String attribute) {
        List<CrossTabRow> rows = new ArrayList<CrossTabRow>();
        for(CrossTabRow row: crossTab) {
            if(row.getAttributeName().equals(attribute)) {
                rows.add(row);
            }
        }
        return rows;
    }

    private static Map<GroupMetric, double[]> samples(List<FairnessInput> inputs, String attribute, String value) {
        Map<GroupMetric, double[]> samples = new LinkedHashMap<GroupMetric, double[]>();
        for(GroupMetric metric: GroupMetric.DISPARITY) {
            List<Double> sample = new ArrayList<Double>();
            for(FairnessInput input: inputs) {
                if(!value.equals(input.getGroup(attribute))) {
                    continue;
                }
                Double indicator = metric.indicator(input);
                if(indicator != null) {
                    sample.add(indicator);
                }
            }
            double[] array = new double[sample.size()];
            for(int i = 0; i < array.length; i++) {
                array[i] = sample.get(i);
            }
            samples.put(metric, array);
        }
        return samples;
    }

}
