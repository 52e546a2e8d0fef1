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

import com.regimehopper.util.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static java.lang.Math.log;
import static org.junit.jupiter.api.Assertions.*;

public class LogMathTest {

    private static final double DELTA = 1e-9;

    @Test
    public void testLogSumExp() {
        double expected = log(0.2 + 0.3 + 0.5e-3);
        double actual = LogMath.logSumExp(log(0.2), log(0.3), log(0.5e-3));
        assertEquals(expected, actual, Math.abs(expected) * DELTA);

        // exp(-1000) underflows, the shifted sum does not
        assertEquals(-998.5923940355556, LogMath.logSumExp(-1000, -999, -1001), 1e-9);
        assertEquals(5.0, LogMath.logSumExp(5.0), DELTA);
    }

    @Test
    public void testLogSumExpWithZeroProbabilities() {
        assertEquals(log(0.25), LogMath.logSumExp(Double.NEGATIVE_INFINITY, log(0.25)), DELTA);

        double allZero = LogMath.logSumExp(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY);
        assertEquals(Double.NEGATIVE_INFINITY, allZero);
        assertFalse(Double.isNaN(allZero));

        assertEquals(Double.POSITIVE_INFINITY, LogMath.logSumExp(0, Double.POSITIVE_INFINITY));
    }

    @Test
    public void testLogSumExpOfEmptyInput() {
        InvalidParameterException ex = assertThrows(InvalidParameterException.class, () -> LogMath.logSumExp());
        assertEquals("logValues", ex.getParameter());
        assertEquals(Double.NEGATIVE_INFINITY, LogMath.logSumExpOrNegInf());
    }

    @Test
    public void testNormalizeVector() {
        assertArrayEquals(new double[]{0.1, 0.2, 0.3, 0.4}, LogMath.normalizeVector(new double[]{1, 2, 3, 4}), DELTA);

        double[] uniform = LogMath.normalizeVector(new double[]{0, 0, 0});
        assertArrayEquals(new double[]{1.0 / 3, 1.0 / 3, 1.0 / 3}, uniform, DELTA);
        assertEquals(0.33333, uniform[0], 1e-5);

        assertArrayEquals(new double[]{0.5, 0.5}, LogMath.normalizeVector(new double[]{Double.POSITIVE_INFINITY, 1}), DELTA);
        assertArrayEquals(new double[]{0.5, 0.5}, LogMath.normalizeVector(new double[]{Double.NaN, 1}), DELTA);
    }

    @Test
    public void testNormalizeVectorIsIdempotent() {
        double[] once = LogMath.normalizeVector(new double[]{3, 0.5, 7, 1e-4});
        double[] twice = LogMath.normalizeVector(once);
        assertArrayEquals(once, twice, DELTA);
    }

    @Test
    public void testNormalizeVectorDoesNotModifyInput() {
        double[] input = {2, 2};
        LogMath.normalizeVector(input);
        assertArrayEquals(new double[]{2, 2}, input);
    }

    @Test
    public void testNormalizeRows() {
        double[][] normalized = LogMath.normalizeRows(new double[][]{{1, 2, 3}, {4, 5, 6}, {0, 0, 0}});
        assertArrayEquals(new double[]{1.0 / 6, 2.0 / 6, 3.0 / 6}, normalized[0], DELTA);
        assertArrayEquals(new double[]{4.0 / 15, 5.0 / 15, 6.0 / 15}, normalized[1], DELTA);
        assertArrayEquals(new double[]{1.0 / 3, 1.0 / 3, 1.0 / 3}, normalized[2], DELTA);

        double[][] again = LogMath.normalizeRows(normalized);
        for (int i = 0; i < normalized.length; i++) {
            assertArrayEquals(normalized[i], again[i], DELTA);
        }
    }

    @Test
    public void testIsStochastic() {
        assertTrue(LogMath.isStochastic(new double[]{0.25, 0.75}, 1e-6));
        assertFalse(LogMath.isStochastic(new double[]{0.25, 0.7}, 1e-6));
        assertFalse(LogMath.isStochastic(new double[]{-0.25, 1.25}, 1e-6));
        assertFalse(LogMath.isStochastic(new double[]{Double.NaN, 1}, 1e-6));
    }
}
