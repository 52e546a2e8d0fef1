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

import java.util.List;

/**
 * Shape and range checks for the inputs of the inference algorithms.
 */
public class HmmValidation {

    /**
     * Tolerance for rows of the transition matrix and the initial distribution to sum up to 1.
     */
    public static final double PROBABILITY_SUM_TOLERANCE = 1e-6;

    private HmmValidation() {
    }

    /**
     * Checks that the observations form a non-empty T x D matrix of finite values with D &gt;= 1.
     *
     * @return D, the number of features
     */
    public static int checkObservations(double[][] observations) {
        if (observations == null || observations.length == 0)
            throw new InvalidParameterException("At least one observation is required", "observations");

        int numFeatures = observations[0].length;
        if (numFeatures == 0)
            throw new InvalidParameterException("Each observation must have at least one feature", "observations");

        for (int t = 0; t < observations.length; t++) {
            if (observations[t].length != numFeatures)
                throw new DimensionMismatchException("All observations must have the same number of features, see observation " + t,
                        numFeatures, observations[t].length);
            for (double value : observations[t]) {
                if (!Double.isFinite(value))
                    throw new InvalidParameterException("All features must be finite numbers at observation " + t, "observations");
            }
        }
        return numFeatures;
    }

    /**
     * Checks that observations, transition matrix and emission parameters agree on the number of
     * states N (the number of emission records) and features D.
     *
     * @return N, the number of states
     */
    public static int checkShapes(double[][] observations, double[][] transitionMatrix, List<EmissionParams> emissionParams) {
        int numFeatures = checkObservations(observations);
        if (emissionParams == null || emissionParams.isEmpty())
            throw new InvalidParameterException("At least one state is required", "emissionParams");

        int numStates = emissionParams.size();
        checkSquare(transitionMatrix, numStates);
        for (int i = 0; i < numStates; i++) {
            EmissionParams params = emissionParams.get(i);
            if (params.getNumFeatures() != numFeatures)
                throw new DimensionMismatchException("Emission parameters of state " + i + " do not match the number of features",
                        numFeatures, params.getNumFeatures());
        }
        return numStates;
    }

    public static void checkSquare(double[][] transitionMatrix, int numStates) {
        if (transitionMatrix == null)
            throw new NullPointerException("transitionMatrix must not be null");
        if (transitionMatrix.length != numStates)
            throw new DimensionMismatchException("Transition matrix must have one row per state", numStates, transitionMatrix.length);
        for (int i = 0; i < numStates; i++) {
            if (transitionMatrix[i].length != numStates)
                throw new DimensionMismatchException("Row " + i + " of the transition matrix must have one column per state",
                        numStates, transitionMatrix[i].length);
        }
    }

    public static void checkLength(String name, double[] vector, int expected) {
        if (vector == null)
            throw new NullPointerException(name + " must not be null");
        if (vector.length != expected)
            throw new DimensionMismatchException(name + " has the wrong length", expected, vector.length);
    }

    /**
     * Checks that every transition row and the initial distribution are probability vectors.
     */
    public static void checkStochastic(double[][] transitionMatrix, double[] initialProbs) {
        for (int i = 0; i < transitionMatrix.length; i++) {
            if (!LogMath.isStochastic(transitionMatrix[i], PROBABILITY_SUM_TOLERANCE))
                throw new InvalidParameterException("Transition matrix row " + i + " must contain values between 0 and 1 that sum to 1",
                        "transitionMatrix");
        }
        if (!LogMath.isStochastic(initialProbs, PROBABILITY_SUM_TOLERANCE))
            throw new InvalidParameterException("Initial probabilities must contain values between 0 and 1 that sum to 1", "initialProbs");
    }
}
