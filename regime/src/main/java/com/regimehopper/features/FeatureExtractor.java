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

import com.carrotsearch.hppc.DoubleArrayList;
import com.regimehopper.hmm.HmmValidation;
import com.regimehopper.util.exceptions.InvalidParameterException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Derives the observation matrix of the HMM from a price series. Each column is standardized
 * independently with population mean and standard deviation.
 */
public class FeatureExtractor {

    public static final List<FeatureType> DEFAULT_FEATURES = Collections.unmodifiableList(
            Arrays.asList(FeatureType.RETURNS, FeatureType.VOLATILITY));

    private FeatureExtractor() {
    }

    /**
     * @return simple returns, one less than the number of prices
     */
    public static double[] computeReturns(double[] prices) {
        validatePrices(prices);
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = (prices[i] - prices[i - 1]) / prices[i - 1];
        }
        return returns;
    }

    /**
     * @return the population standard deviation of the returns over each trailing window, i.e.
     * one value per return index i &gt;= window - 1. Empty if there are fewer returns than window.
     */
    public static double[] rollingVolatility(double[] prices, int window) {
        if (window < 1)
            throw new InvalidParameterException("Window must be positive but was " + window, "window");

        double[] returns = computeReturns(prices);
        DoubleArrayList volatilities = new DoubleArrayList(Math.max(0, returns.length - window + 1));
        for (int i = window - 1; i < returns.length; i++) {
            volatilities.add(Statistics.standardDeviation(returns, i - window + 1, i + 1));
        }
        return volatilities.toArray();
    }

    /**
     * Returns and rolling volatility as a standardized T' x 2 matrix with
     * T' = prices.length - window.
     */
    public static double[][] extractDefaultFeatures(double[] prices, int window) {
        return extractFeatures(prices, DEFAULT_FEATURES, window);
    }

    /**
     * Computes the given features, aligns them to the shortest series by dropping the oldest
     * values and standardizes each column.
     */
    public static double[][] extractFeatures(double[] prices, List<FeatureType> featureTypes, int window) {
        validatePrices(prices);
        if (featureTypes == null || featureTypes.isEmpty())
            throw new InvalidParameterException("At least one feature type is required", "featureTypes");

        double[][] columns = new double[featureTypes.size()][];
        int minLength = Integer.MAX_VALUE;
        for (int d = 0; d < columns.length; d++) {
            columns[d] = compute(featureTypes.get(d), prices, window);
            minLength = Math.min(minLength, columns[d].length);
        }
        if (minLength == 0)
            throw new InvalidParameterException("Not enough data to extract features, got " + prices.length
                    + " prices for window " + window, "prices");

        double[][] features = new double[minLength][columns.length];
        for (int d = 0; d < columns.length; d++) {
            int trimStart = columns[d].length - minLength;
            for (int t = 0; t < minLength; t++) {
                features[t][d] = columns[d][trimStart + t];
            }
        }
        return standardizeColumns(features);
    }

    /**
     * Validates and standardizes a caller supplied T x D feature matrix.
     */
    public static double[][] standardizeFeatureMatrix(double[][] features) {
        HmmValidation.checkObservations(features);
        return standardizeColumns(features);
    }

    /**
     * @throws InvalidParameterException if there are fewer than 2 prices or a price is not a
     *                                   finite positive number
     */
    public static void validatePrices(double[] prices) {
        if (prices == null || prices.length < 2)
            throw new InvalidParameterException("At least 2 prices required", "prices");
        for (int i = 0; i < prices.length; i++) {
            if (!Double.isFinite(prices[i]))
                throw new InvalidParameterException("All prices must be finite numbers, see index " + i, "prices");
            if (prices[i] <= 0)
                throw new InvalidParameterException("All prices must be positive, see index " + i, "prices");
        }
    }

    private static double[] compute(FeatureType type, double[] prices, int window) {
        switch (type) {
            case RETURNS:
                return computeReturns(prices);
            case VOLATILITY:
                return rollingVolatility(prices, window);
            default:
                throw new IllegalArgumentException("Unsupported feature type " + type);
        }
    }

    private static double[][] standardizeColumns(double[][] features) {
        int timeSteps = features.length;
        int numFeatures = features[0].length;
        double[][] result = new double[timeSteps][numFeatures];
        double[] column = new double[timeSteps];
        for (int d = 0; d < numFeatures; d++) {
            for (int t = 0; t < timeSteps; t++) {
                column[t] = features[t][d];
            }
            double[] standardized = Statistics.standardize(column);
            for (int t = 0; t < timeSteps; t++) {
                result[t][d] = standardized[t];
            }
        }
        return result;
    }
}
