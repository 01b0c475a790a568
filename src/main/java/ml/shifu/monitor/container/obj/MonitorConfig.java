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
package ml.shifu.monitor.container.obj;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;
import ml.shifu.monitor.util.Constants;
import ml.shifu.monitor.util.JSONUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * MonitorConfig is for MonitorConfig.json configurations of the fairness metrics.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitorConfig {

    @JsonIgnore
    private final static Logger LOG = LoggerFactory.getLogger(MonitorConfig.class);

    /**
     * Protected attributes to cross tabulate, in output order
     */
    private List<String> protectedAttributes = new ArrayList<String>();

    /**
     * Reference group value per protected attribute
     */
    private Map<String, String> referenceGroups = new LinkedHashMap<String, String>();

    /**
     * Confidence level of the disparity significance tests
     */
    private double alpha = Constants.DEFAULT_ALPHA;

    private boolean maskSignificance = true;

    /**
     * Decimals kept in the absolute metrics table
     */
    private int absoluteMetricsScale = Constants.ABSOLUTE_METRICS_SCALE;

    public static MonitorConfig createDefault() {
        MonitorConfig config = new MonitorConfig();
        config.protectedAttributes.add(Constants.FORTY_PLUS_INDICATOR);
        config.referenceGroups.put(Constants.FORTY_PLUS_INDICATOR, Constants.UNDER_FORTY);
        return config;
    }

    public static MonitorConfig load(File file) {
        try {
            return validate(JSONUtils.readValue(file, MonitorConfig.class));
        } catch (IOException e) {
            throw new MonitorException(MonitorErrorCode.ERROR_LOAD_MONITOR_CONFIG, e, "Could not load monitor config "
                    + file);
        }
    }

    public static MonitorConfig load(InputStream input) {
        try {
            return validate(JSONUtils.readValue(input, MonitorConfig.class));
        } catch (IOException e) {
            throw new MonitorException(MonitorErrorCode.ERROR_LOAD_MONITOR_CONFIG, e);
        }
    }

    private static MonitorConfig validate(MonitorConfig config) {
        if(config.alpha <= 0d || config.alpha >= 1d) {
            throw new MonitorException(MonitorErrorCode.ERROR_LOAD_MONITOR_CONFIG, "alpha should be in (0, 1) but is "
                    + config.alpha);
        }
        if(config.absoluteMetricsScale < 0) {
            throw new MonitorException(MonitorErrorCode.ERROR_LOAD_MONITOR_CONFIG,
                    "absoluteMetricsScale should not be negative");
        }
        for(String attribute: config.referenceGroups.keySet()) {
            if(!config.protectedAttributes.contains(attribute)) {
                LOG.warn("Reference group is set for {} which is not a protected attribute, it is ignored.",
                        attribute);
            }
        }
        return config;
    }

    public List<String> getProtectedAttributes() {
        return protectedAttributes;
    }

    public void setProtectedAttributes(List<String> protectedAttributes) {
        this.protectedAttributes = protectedAttributes;
    }

    public Map<String, String> getReferenceGroups() {
        return referenceGroups;
    }

    public void setReferenceGroups(Map<String, String> referenceGroups) {
        this.referenceGroups = referenceGroups;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public boolean isMaskSignificance() {
        return maskSignificance;
    }

    public void setMaskSignificance(boolean maskSignificance) {
        this.maskSignificance = maskSignificance;
    }

    public int getAbsoluteMetricsScale() {
        return absoluteMetricsScale;
    }

    public void setAbsoluteMetricsScale(int absoluteMetricsScale) {
        this.absoluteMetricsScale = absoluteMetricsScale;
    }

    @JsonIgnore
    public String getReferenceGroup(String attribute) {
        return referenceGroups == null ? null : referenceGroups.get(attribute);
    }

}
