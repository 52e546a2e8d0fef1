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

import java.util.Arrays;

/**
 * Numerically stable helpers for working with probabilities and log probabilities.
 * <p>
 * Zero-sum rows and vectors are not an error: they are replaced by the uniform distribution,
 * i.e. the distribution with maximum entropy.
 */
public class LogMath {

    private LogMath() {
    }

    /**
     * Computes log(sum(exp(logValues))) without overflow or underflow by factoring out the
     * maximum. Negative infinity stands for probability zero.
     *
     * @throws InvalidParameterException if no values are given
     */
    public static double logSumExp(double... logValues) {
        if (logValues.length == 0)
            throw new InvalidParameterException("Cannot compute logSumExp of an empty input", "logValues");

        return logSumExpOrNegInf(logValues);
    }

    /**
     * Same as {@link #logSumExp(double...)} but treats an empty input as "no mass" and returns
     * negative infinity.
     */
    public static double logSumExpOrNegInf(double... logValues) {
        double max = Double.NEGATIVE_INFINITY;
        for (double logValue : logValues) {
            if (logValue > max)
                max = logValue;
        }
        // all -Infinity (or empty) and +Infinity must not end up as NaN
        if (Double.isInfinite(max))
            return max;

        double sum = 0;
        for (double logValue : logValues) {
            sum += Math.exp(logValue - max);
        }
        return max + Math.log(sum);
    }

    /**
     * @return a new matrix where each row is divided by its sum. A row with a zero or non-finite
     * sum becomes uniform.
     */
    public static double[][] normalizeRows(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = normalizeVector(matrix[i]);
        }
        return result;
    }

    /**
     * @return a new vector divided by its sum, or the uniform vector if the sum is zero or not
     * finite
     */
    public static double[] normalizeVector(double[] values) {
        double sum = sum(values);
        double[] result = new double[values.length];
        if (sum == 0 || !Double.isFinite(sum)) {
            Arrays.fill(result, 1.0 / values.length);
            return result;
        }
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] / sum;
        }
        return result;
    }

    /**
     * @return true if all entries are within [0, 1] and sum up to 1 within the given tolerance
     */
    public static boolean isStochastic(double[] row, double tolerance) {
        double sum = 0;
        for (double p : row) {
            if (!(p >= 0 && p <= 1))
                return false;
            sum += p;
        }
        return Math.abs(sum - 1) <= tolerance;
    }

    static double sum(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum;
    }

    static double[][] copy(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
