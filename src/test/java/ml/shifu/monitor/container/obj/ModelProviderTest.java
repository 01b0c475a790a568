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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ml.shifu.monitor.MonitorTestData;
import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;
import ml.shifu.monitor.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * ModelProviderTest class
 */
public class ModelProviderTest {

    @Test
    public void testBuild() {
        ModelProvider provider = MonitorTestData.provider();
        Assert.assertEquals(provider.getThreshold(), 0.5);
        Assert.assertEquals(provider.getRentRatio(), 0.25);
        Assert.assertEquals(provider.getIntRateMean(), 12d);
        Assert.assertEquals(provider.getFeatures(), MonitorTestData.FEATURES);
        Assert.assertEquals(provider.getGammaArgs().getShape(), 1.5);
    }

    @Test
    public void testFeaturesAreCopied() {
        List<String> features = new ArrayList<String>(MonitorTestData.FEATURES);
        ModelProvider provider = MonitorTestData.providerBuilder().features(features).build();
        features.add("annual_inc");
        Assert.assertEquals(provider.getFeatures().size(), 2);
    }

    @Test
    public void testMissingModel() {
        try {
            MonitorTestData.providerBuilder().model(null).build();
            Assert.fail("Model provider without model should not be built");
        } catch (MonitorException e) {
            Assert.assertEquals(e.getError(), MonitorErrorCode.ERROR_MODEL_PROVIDER_INIT);
        }
    }

    @Test(expectedExceptions = MonitorException.class)
    public void testRentRatioOutOfRange() {
        MonitorTestData.providerBuilder().rentRatio(1.2).build();
    }

    @Test(expectedExceptions = MonitorException.class)
    public void testEmptyFeatures() {
        MonitorTestData.providerBuilder().features(Collections.<String> emptyList()).build();
    }

    @Test(expectedExceptions = MonitorException.class)
    public void testDuplicatedFeatures() {
        MonitorTestData.providerBuilder().features(Arrays.asList(Constants.INT_RATE, Constants.INT_RATE)).build();
    }

    @Test
    public void testGammaArgsDefaults() {
        GammaArgs shapeOnly = GammaArgs.of(2d);
        Assert.assertEquals(shapeOnly.getLoc(), 0d);
        Assert.assertEquals(shapeOnly.getScale(), 1d);

        GammaArgs withLoc = GammaArgs.of(2d, -0.1);
        Assert.assertEquals(withLoc.getLoc(), -0.1);
        Assert.assertEquals(withLoc.getScale(), 1d);

        GammaArgs full = GammaArgs.of(2d, 0d, 3d);
        Assert.assertEquals(full.toDistribution().getShape(), 2d);
        Assert.assertEquals(full.toDistribution().getScale(), 3d);
    }

    @Test(expectedExceptions = MonitorException.class)
    public void testGammaArgsInvalidShape() {
        GammaArgs.of(0d, 0d, 1d);
    }

    @Test(expectedExceptions = MonitorException.class)
    public void testGammaArgsTooManyValues() {
        GammaArgs.of(1d, 0d, 1d, 2d);
    }

}
