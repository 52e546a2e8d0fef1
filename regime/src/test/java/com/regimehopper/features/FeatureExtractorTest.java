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
package com.regimehopper.features;

import com.regimehopper.util.exceptions.DimensionMismatchException;
import com.regimehopper.util.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class FeatureExtractorTest {

    private static double[] wavyPrices(int count) {
        double[] prices = new double[count];
        for (int i = 0; i < count; i++) {
            prices[i] = 100 + 10 * Math.sin(i * 0.7) + i;
        }
        return prices;
    }

    @Test
    public void testComputeReturns() {
        assertArrayEquals(new double[]{0.1, -0.1}, FeatureExtractor.computeReturns(new double[]{100, 110, 99}), 1e-12);
        assertEquals(29, FeatureExtractor.computeReturns(wavyPrices(30)).length);
    }

    @Test
    public void testInvalidPrices() {
        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.computeReturns(new double[]{100}));
        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.computeReturns(new double[0]));
        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.computeReturns(new double[]{100, 0, 101}));
        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.computeReturns(new double[]{100, -5}));
        InvalidParameterException ex = assertThrows(InvalidParameterException.class,
                () -> FeatureExtractor.computeReturns(new double[]{100, Double.NaN}));
        assertEquals("prices", ex.getParameter());
    }

    @Test
    public void testRollingVolatility() {
        // returns are 0.1, -0.1, 0.1
        double[] prices = {100, 110, 99, 108.9};
        assertArrayEquals(new double[]{0.1, 0.1}, FeatureExtractor.rollingVolatility(prices, 2), 1e-12);
        assertArrayEquals(new double[]{0, 0, 0}, FeatureExtractor.rollingVolatility(prices, 1), 1e-12);
        assertEquals(1, FeatureExtractor.rollingVolatility(prices, 3).length);

        assertEquals(0, FeatureExtractor.rollingVolatility(new double[]{1, 2}, 5).length);
        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.rollingVolatility(prices, 0));
    }

    @Test
    public void testExtractDefaultFeatures() {
        double[] prices = wavyPrices(30);
        double[][] features = FeatureExtractor.extractDefaultFeatures(prices, 5);
        assertEquals(25, features.length);
        for (int d = 0; d < 2; d++) {
            double[] column = new double[features.length];
            for (int t = 0; t < features.length; t++) {
                assertEquals(2, features[t].length);
                column[t] = features[t][d];
            }
            assertEquals(0, Statistics.mean(column), 1e-9);
            assertEquals(1, Statistics.variance(column), 1e-9);
        }

        // the returns column is trimmed from the start, i.e. the last row belongs to the last return
        double[] returns = Statistics.standardize(Arrays.copyOfRange(FeatureExtractor.computeReturns(prices), 4, 29));
        assertEquals(returns[24], features[24][0], 1e-12);
        assertEquals(returns[0], features[0][0], 1e-12);
    }

    @Test
    public void testFeatureOrderAndSelection() {
        double[] prices = wavyPrices(30);
        double[][] defaults = FeatureExtractor.extractDefaultFeatures(prices, 5);
        double[][] swapped = FeatureExtractor.extractFeatures(prices, Arrays.asList(FeatureType.VOLATILITY, FeatureType.RETURNS), 5);
        assertEquals(defaults.length, swapped.length);
        for (int t = 0; t < defaults.length; t++) {
            assertEquals(defaults[t][0], swapped[t][1], 1e-12);
            assertEquals(defaults[t][1], swapped[t][0], 1e-12);
        }

        double[][] returnsOnly = FeatureExtractor.extractFeatures(prices, Collections.singletonList(FeatureType.RETURNS), 5);
        assertEquals(29, returnsOnly.length);
        assertEquals(1, returnsOnly[0].length);

        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.extractFeatures(prices, Collections.emptyList(), 5));
    }

    @Test
    public void testNotEnoughData() {
        InvalidParameterException ex = assertThrows(InvalidParameterException.class,
                () -> FeatureExtractor.extractDefaultFeatures(wavyPrices(5), 10));
        assertTrue(ex.getMessage().startsWith("Not enough data to extract features"), ex.getMessage());
        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.extractDefaultFeatures(wavyPrices(5), 5));

        // a single row has zero variance in each column
        double[][] single = FeatureExtractor.extractDefaultFeatures(wavyPrices(6), 5);
        assertEquals(1, single.length);
        assertArrayEquals(new double[]{0, 0}, single[0]);
    }

    @Test
    public void testStandardizeFeatureMatrix() {
        double[][] standardized = FeatureExtractor.standardizeFeatureMatrix(new double[][]{{1, 5}, {2, 5}, {3, 5}});
        double stdDev = Math.sqrt(2.0 / 3);
        assertEquals(-1 / stdDev, standardized[0][0], 1e-12);
        assertEquals(0, standardized[1][0], 1e-12);
        assertEquals(1 / stdDev, standardized[2][0], 1e-12);
        for (double[] row : standardized) {
            assertEquals(0, row[1]);
        }

        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.standardizeFeatureMatrix(new double[0][]));
        assertThrows(InvalidParameterException.class, () -> FeatureExtractor.standardizeFeatureMatrix(new double[][]{{1}, {Double.POSITIVE_INFINITY}}));
        assertThrows(DimensionMismatchException.class, () -> FeatureExtractor.standardizeFeatureMatrix(new double[][]{{1, 2}, {3}}));
    }

    @Test
    public void testFeatureType() {
        assertEquals(FeatureType.RETURNS, FeatureType.find("returns"));
        assertEquals(FeatureType.VOLATILITY, FeatureType.find(" Volatility "));
        assertEquals("volatility", FeatureType.VOLATILITY.toString());
        assertThrows(IllegalArgumentException.class, () -> FeatureType.find("rsi"));
        assertThrows(IllegalArgumentException.class, () -> FeatureType.find(""));
    }
}
