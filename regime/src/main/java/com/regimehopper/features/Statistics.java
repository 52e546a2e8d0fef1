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

import com.regimehopper.util.exceptions.InvalidParameterException;

/**
 * Population statistics, i.e. the variance divides by the number of values and not by n-1.
 */
public class Statistics {

    private Statistics() {
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * Mean of values[from], ..., values[to - 1].
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from)
            throw new InvalidParameterException("Cannot calculate mean of empty array", "values");

        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double variance(double[] values) {
        return variance(values, 0, values.length);
    }

    public static double variance(double[] values, int from, int to) {
        double mean = mean(values, from, to);
        double sum = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sum += diff * diff;
        }
        return sum / (to - from);
    }

    public static double standardDeviation(double[] values, int from, int to) {
        return Math.sqrt(variance(values, from, to));
    }

    /**
     * z-score normalization to mean 0 and variance 1. If all values are equal the variance is 0
     * and an array of zeros is returned.
     */
    public static double[] standardize(double[] values) {
        double[] result = new double[values.length];
        if (values.length == 0)
            return result;

        double mean = mean(values);
        double variance = variance(values);
        if (variance == 0)
            return result;

        double stdDev = Math.sqrt(variance);
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - mean) / stdDev;
        }
        return result;
    }
}
