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

import java.util.Arrays;

/**
 * Emission parameters of one hidden state: a mean and a variance per feature. Features are
 * treated as conditionally independent given the state, there is no covariance term.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public final class EmissionParams {

    private final double[] means;
    private final double[] variances;

    public EmissionParams(double[] means, double[] variances) {
        if (means == null || variances == null)
            throw new NullPointerException("means and variances must not be null");
        if (means.length != variances.length)
            throw new DimensionMismatchException("Means and variances must have the same length", means.length, variances.length);
        for (int d = 0; d < variances.length; d++) {
            if (!(variances[d] > 0))
                throw new InvalidParameterException("Variance of feature " + d + " must be positive but was " + variances[d], "variances");
        }

        this.means = means.clone();
        this.variances = variances.clone();
    }

    public int getNumFeatures() {
        return means.length;
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double getMean(int feature) {
        return means[feature];
    }

    public double[] getVariances() {
        return variances.clone();
    }

    public double getVariance(int feature) {
        return variances[feature];
    }

    /**
     * Computed as exp of the log density to stay consistent with {@link #emissionLogProbability(double[])}.
     */
    public double emissionProbability(double[] observation) {
        return Math.exp(emissionLogProbability(observation));
    }

    public double emissionLogProbability(double[] observation) {
        return Distributions.logMultivariateIndependentPdf(observation, means, variances);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        EmissionParams other = (EmissionParams) obj;
        return Arrays.equals(means, other.means) && Arrays.equals(variances, other.variances);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(means) + Arrays.hashCode(variances);
    }

    @Override
    public String toString() {
        return "EmissionParams [means=" + Arrays.toString(means) + ", variances=" + Arrays.toString(variances) + "]";
    }
}
