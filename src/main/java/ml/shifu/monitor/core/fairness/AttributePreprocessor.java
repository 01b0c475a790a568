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
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import ml.shifu.monitor.container.ScoredRecord;
import ml.shifu.monitor.util.CommonUtils;
import ml.shifu.monitor.util.Constants;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns protected attribute values into discrete group labels.
 *
 * <p>
 * Text values are trimmed and kept. Numeric attributes keep their values as labels when they have at most
 * {@link Constants#MAX_DISCRETE_ATTRIBUTE_VALUES} distinct values, otherwise they are binned into quartiles labelled
 * "lo-hi". Missing values go to the {@link Constants#MISSING_GROUP} group.
 */
public class AttributePreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(AttributePreprocessor.class);

    private static final double[] QUARTILES = { 25d, 50d, 75d };

    public List<FairnessInput> process(List<ScoredRecord> scored, List<String> attributes) {
        Map<String, String[]> labelsByAttribute = new HashMap<String, String[]>();
        for(String attribute: attributes) {
            labelsByAttribute.put(attribute, label(scored, attribute));
        }

        List<FairnessInput> inputs = new ArrayList<FairnessInput>(scored.size());
        for(int i = 0; i < scored.size(); i++) {
            ScoredRecord record = scored.get(i);
            Map<String, String> groups = new LinkedHashMap<String, String>();
            for(String attribute: attributes) {
                groups.put(attribute, labelsByAttribute.get(attribute)[i]);
            }
            inputs.add(new FairnessInput(record.getPrediction(), record.getLabelValue(), groups));
        }
        return inputs;
    }

    private String[] label(List<ScoredRecord> scored, String attribute) {
        boolean numeric = true;
        TreeSet<Double> distinct = new TreeSet<Double>();
        for(ScoredRecord record: scored) {
            Object raw = record.getRecord().get(attribute);
            if(raw == null) {
                continue;
            }
            Double value = raw instanceof Number ? Double.valueOf(((Number) raw).doubleValue()) : null;
            if(value == null) {
                numeric = false;
                break;
            }
            distinct.add(value);
        }

        double[] edges = null;
        if(numeric && distinct.size() > Constants.MAX_DISCRETE_ATTRIBUTE_VALUES) {
            edges = quartileEdges(scored, attribute);
            LOG.debug("Attribute {} has {} distinct values, binned by edges {}.", attribute, distinct.size(),
                    Arrays.toString(edges));
        }

        String[] labels = new String[scored.size()];
        for(int i = 0; i < labels.length; i++) {
            Object raw = scored.get(i).getRecord().get(attribute);
            String label;
            if(raw == null) {
                label = Constants.MISSING_GROUP;
            } else if(raw instanceof Number) {
                double value = ((Number) raw).doubleValue();
                label = edges == null ? CommonUtils.formatNumber(value) : binLabel(value, edges);
            } else {
                label = StringUtils.defaultIfBlank(StringUtils.trim(raw.toString()), Constants.MISSING_GROUP);
            }
            labels[i] = label;
        }
        return labels;
    }

    /**
     * Quartile edges with linear interpolation, duplicated edges dropped.
     */
    static double[] quartileEdges(List<ScoredRecord> scored, String attribute) {
        List<Double> values = new ArrayList<Double>();
        for(ScoredRecord record: scored) {
            Object raw = record.getRecord().get(attribute);
            if(raw instanceof Number) {
                values.add(((Number) raw).doubleValue());
            }
        }
        double[] data = new double[values.size()];
        for(int i = 0; i < data.length; i++) {
            data[i] = values.get(i);
        }

        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(data);
        TreeSet<Double> edges = new TreeSet<Double>();
        edges.add(StatUtils.min(data));
        for(double quartile: QUARTILES) {
            edges.add(percentile.evaluate(quartile));
        }
        edges.add(percentile.evaluate(100d));

        double[] result = new double[edges.size()];
        int i = 0;
        for(Double edge: edges) {
            result[i++] = edge;
        }
        return result;
    }

    /**
     * The first bin is closed on both sides, the others are (lo, hi].
     */
    static String binLabel(double value, double[] edges) {
        for(int i = 1; i < edges.length; i++) {
            if(value <= edges[i] || i == edges.length - 1) {
                return CommonUtils.formatNumber(edges[i - 1]) + "-" + CommonUtils.formatNumber(edges[i]);
            }
        }
        return CommonUtils.formatNumber(edges[0]);
    }

}
