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

import static java.lang.Math.*;

/**
 * Gaussian densities used as emission distributions. The multivariate variants assume
 * independent features, i.e. a diagonal covariance matrix.
 */
public class Distributions {

    private static final double LOG_2_PI = log(2.0 * PI);

    private Distributions() {
    }

    public static double gaussianPdf(double x, double mean, double variance) {
        checkVariance(variance);
        return 1.0 / sqrt(2.0 * PI * variance) * exp(-pow(x - mean, 2) / (2.0 * variance));
    }

    /**
     * Use this function instead of Math.log(gaussianPdf(x, mean, variance)) to avoid an
     * arithmetic underflow for very small probabilities.
     */
    public static double logGaussianPdf(double x, double mean, double variance) {
        checkVariance(variance);
        return -0.5 * (LOG_2_PI + log(variance)) - pow(x - mean, 2) / (2.0 * variance);
    }

    /**
     * Product of the univariate densities of each feature.
     */
    public static double multivariateIndependentPdf(double[] x, double[] means, double[] variances) {
        checkDimensions(x, means, variances);
        double product = 1;
        for (int d = 0; d < x.length; d++) {
            product *= gaussianPdf(x[d], means[d], variances[d]);
        }
        return product;
    }

    /**
     * Sum of the univariate log densities of each feature.
     */
    public static double logMultivariateIndependentPdf(double[] x, double[] means, double[] variances) {
        checkDimensions(x, means, variances);
        double sum = 0;
        for (int d = 0; d < x.length; d++) {
            sum += logGaussianPdf(x[d], means[d], variances[d]);
        }
        return sum;
    }

    private static void checkVariance(double variance) {
        // also rejects NaN
        if (!(variance > 0))
            throw new InvalidParameterException("Variance must be positive but was " + variance, "variance");
    }

    private static void checkDimensions(double[] x, double[] means, double[] variances) {
        if (means.length != x.length)
            throw new DimensionMismatchException("Means do not match the observation dimension", x.length, means.length);
        if (variances.length != x.length)
            throw new DimensionMismatchException("Variances do not match the observation dimension", x.length, variances.length);
    }
}
