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

import java.util.Arrays;

import ml.shifu.monitor.exception.MonitorErrorCode;
import ml.shifu.monitor.exception.MonitorException;

import org.apache.commons.math3.distribution.GammaDistribution;

/**
 * Fitted parameters of the reference gamma distribution of negative log-probabilities, in the (a, loc, scale) layout
 * produced at training time.
 */
public class GammaArgs {

    private final double shape;

    private final double loc;

    private final double scale;

    public GammaArgs(double shape, double loc, double scale) {
        if(!(shape > 0d) || !(scale > 0d) || Double.isNaN(loc) || Double.isInfinite(loc)) {
            throw new MonitorException(MonitorErrorCode.ERROR_MODEL_PROVIDER_INIT, "Invalid gamma args: shape="
                    + shape + ", loc=" + loc + ", scale=" + scale);
        }
        this.shape = shape;
        this.loc = loc;
        this.scale = scale;
    }

    /**
     * Build from a (a), (a, loc) or (a, loc, scale) tuple, loc defaults to 0 and scale to 1.
     */
    public static GammaArgs of(double... args) {
        if(args == null || args.length < 1 || args.length > 3) {
            throw new MonitorException(MonitorErrorCode.ERROR_MODEL_PROVIDER_INIT, "Gamma args should have 1 to 3 "
                    + "values but got " + (args == null ? null : Arrays.toString(args)));
        }
        double loc = args.length > 1 ? args[1] : 0d;
        double scale = args.length > 2 ? args[2] : 1d;
        return new GammaArgs(args[0], loc, scale);
    }

    public double getShape() {
        return shape;
    }

    public double getLoc() {
        return loc;
    }

    public double getScale() {
        return scale;
    }

    /**
     * Gamma distribution with loc 0, callers shift observations by {@link #getLoc()}.
     */
    public GammaDistribution toDistribution() {
        return new GammaDistribution(shape, scale);
    }

    @Override
    public String toString() {
        return "GammaArgs [shape=" + shape + ", loc=" + loc + ", scale=" + scale + "]";
    }

}
