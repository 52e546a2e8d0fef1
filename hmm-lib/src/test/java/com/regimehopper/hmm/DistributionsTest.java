/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.regimehopper.hmm;

import com.regimehopper.util.exceptions.DimensionMismatchException;
import com.regimehopper.util.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static java.lang.Math.*;
import static org.junit.jupiter.api.Assertions.*;

public class DistributionsTest {

    private static final double DELTA = 1e-12;

    @Test
    public void testGaussianPdf() {
        assertEquals(1 / sqrt(2 * PI), Distributions.gaussianPdf(0, 0, 1), DELTA);
        assertEquals(0.24197072451914337, Distributions.gaussianPdf(1, 0, 1), DELTA);
        // variance 4 means sigma 2
        assertEquals(exp(-0.5) / (2 * sqrt(2 * PI)), Distributions.gaussianPdf(3, 1, 4), DELTA);
    }

    @Test
    public void testLogGaussianPdf() {
        assertEquals(log(Distributions.gaussianPdf(0.3, -0.2, 0.7)), Distributions.logGaussianPdf(0.3, -0.2, 0.7), DELTA);

        // far in the tail the density underflows but its logarithm is still accurate
        assertEquals(0, Distributions.gaussianPdf(100, 0, 1));
        assertEquals(-0.5 * log(2 * PI) - 5000, Distributions.logGaussianPdf(100, 0, 1), 1e-9);
    }

    @Test
    public void testNonPositiveVariance() {
        InvalidParameterException ex = assertThrows(InvalidParameterException.class, () -> Distributions.gaussianPdf(0, 0, 0));
        assertEquals("variance", ex.getParameter());
        assertThrows(InvalidParameterException.class, () -> Distributions.logGaussianPdf(0, 0, -1));
        assertThrows(InvalidParameterException.class, () -> Distributions.logGaussianPdf(0, 0, Double.NaN));
    }

    @Test
    public void testMultivariateIndependentPdf() {
        double[] x = {0.5, -1};
        double[] means = {0, 0};
        double[] variances = {1, 2};
        double expected = Distributions.gaussianPdf(0.5, 0, 1) * Distributions.gaussianPdf(-1, 0, 2);
        assertEquals(expected, Distributions.multivariateIndependentPdf(x, means, variances), DELTA);
        assertEquals(log(expected), Distributions.logMultivariateIndependentPdf(x, means, variances), DELTA);
    }

    @Test
    public void testDimensionMismatch() {
        DimensionMismatchException ex = assertThrows(DimensionMismatchException.class,
                () -> Distributions.multivariateIndependentPdf(new double[]{1, 2}, new double[]{0}, new double[]{1, 1}));
        assertEquals(2, ex.getExpected());
        assertEquals(1, ex.getActual());
        assertEquals(2, ex.getDetails().get("expected"));

        assertThrows(DimensionMismatchException.class,
                () -> Distributions.logMultivariateIndependentPdf(new double[]{1}, new double[]{0}, new double[]{1, 1}));
    }

    @Test
    public void testEmissionParams() {
        EmissionParams params = new EmissionParams(new double[]{1, -1}, new double[]{0.5, 2});
        assertEquals(2, params.getNumFeatures());
        double[] x = {0.8, 0.1};
        assertEquals(Distributions.logMultivariateIndependentPdf(x, new double[]{1, -1}, new double[]{0.5, 2}),
                params.emissionLogProbability(x), DELTA);
        assertEquals(Distributions.multivariateIndependentPdf(x, new double[]{1, -1}, new double[]{0.5, 2}),
                params.emissionProbability(x), 1e-15);

        // defensive copies
        params.getMeans()[0] = 42;
        assertEquals(1, params.getMean(0));
        assertEquals(new EmissionParams(new double[]{1, -1}, new double[]{0.5, 2}), params);
    }

    @Test
    public void testInvalidEmissionParams() {
        assertThrows(DimensionMismatchException.class, () -> new EmissionParams(new double[]{0, 1}, new double[]{1}));
        assertThrows(InvalidParameterException.class, () -> new EmissionParams(new double[]{0, 1}, new double[]{1, 0}));
        assertThrows(DimensionMismatchException.class,
                () -> new EmissionParams(new double[]{0}, new double[]{1}).emissionLogProbability(new double[]{0, 0}));
    }
}
