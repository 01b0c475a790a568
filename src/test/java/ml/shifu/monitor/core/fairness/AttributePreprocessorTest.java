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
import java.util.List;
import java.util.Map;

import ml.shifu.monitor.container.LoanStatus;
import ml.shifu.monitor.container.Record;
import ml.shifu.monitor.container.ScoredRecord;
import ml.shifu.monitor.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AttributePreprocessorTest {

    private final AttributePreprocessor preprocessor = new AttributePreprocessor();

    @Test
    public void testTextValues() {
        List<ScoredRecord> scored = Arrays.asList(scored("grade", " A "), scored("grade", "B"), scored("grade", null),
                scored("grade", "  "));
        List<FairnessInput> inputs = preprocessor.process(scored, Arrays.asList("grade"));

        Assert.assertEquals(inputs.get(0).getGroup("grade"), "A");
        Assert.assertEquals(inputs.get(1).getGroup("grade"), "B");
        Assert.assertEquals(inputs.get(2).getGroup("grade"), Constants.MISSING_GROUP);
        Assert.assertEquals(inputs.get(3).getGroup("grade"), Constants.MISSING_GROUP);
        Assert.assertEquals(inputs.get(0).getScore(), 1);
        Assert.assertEquals(inputs.get(0).getLabelValue(), 1);
    }

    @Test
    public void testFewNumericValues() {
        List<ScoredRecord> scored = Arrays.asList(scored("flag", 1d), scored("flag", 0d), scored("flag", 1d));
        List<FairnessInput> inputs = preprocessor.process(scored, Arrays.asList("flag"));

        Assert.assertEquals(inputs.get(0).getGroup("flag"), "1");
        Assert.assertEquals(inputs.get(1).getGroup("flag"), "0");
    }

    @Test
    public void testQuartileBins() {
        List<ScoredRecord> scored = new ArrayList<ScoredRecord>();
        for(int i = 1; i <= 8; i++) {
            scored.add(scored("age", (double) i));
        }
        double[] edges = AttributePreprocessor.quartileEdges(scored, "age");
        Assert.assertEquals(edges, new double[] { 1d, 2.75, 4.5, 6.25, 8d }, Constants.TOLERANCE);

        List<FairnessInput> inputs = preprocessor.process(scored, Arrays.asList("age"));
        Assert.assertEquals(inputs.get(0).getGroup("age"), "1-2.75");
        Assert.assertEquals(inputs.get(1).getGroup("age"), "1-2.75");
        Assert.assertEquals(inputs.get(2).getGroup("age"), "2.75-4.5");
        Assert.assertEquals(inputs.get(7).getGroup("age"), "6.25-8");
    }

    @Test
    public void testDuplicatedEdgesDropped() {
        List<ScoredRecord> scored = new ArrayList<ScoredRecord>();
        for(double value: new double[] { 1d, 1d, 1d, 1d, 1d, 1d, 2d, 3d, 4d, 5d }) {
            scored.add(scored("age", value));
        }
        double[] edges = AttributePreprocessor.quartileEdges(scored, "age");
        for(int i = 1; i < edges.length; i++) {
            Assert.assertTrue(edges[i] > edges[i - 1]);
        }
        Assert.assertEquals(AttributePreprocessor.binLabel(1d, edges), "1-" + edges[1]);
    }

    private static ScoredRecord scored(String attribute, Object value) {
        Map<String, Object> fields = new HashMap<String, Object>();
        fields.put(attribute, value);
        return new ScoredRecord(new Record("1", fields, LoanStatus.FULLY_PAID), 0.9, 1);
    }

}
