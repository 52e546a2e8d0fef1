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

import java.util.List;

/**
 * Scaled backward algorithm. It has to be called with the scaling factors of the forward pass
 * for the same observations and model, see {@link ForwardResult#getScalingFactors()}. Only the
 * length of the scaling factors is checked, not where they come from.
 */
public class BackwardAlgorithm {

    private BackwardAlgorithm() {
    }

    public static BackwardResult compute(double[][] observations, double[][] transitionMatrix,
                                         List<EmissionParams> emissionParams, double[] scalingFactors) {
        int numStates = HmmValidation.checkShapes(observations, transitionMatrix, emissionParams);
        int timeSteps = observations.length;
        HmmValidation.checkLength("scalingFactors", scalingFactors, timeSteps);

        double[][] beta = new double[timeSteps][numStates];
        for (int i = 0; i < numStates; i++) {
            beta[timeSteps - 1][i] = 1;
        }
        divideBy(beta[timeSteps - 1], scalingFactors[timeSteps - 1]);

        for (int t = timeSteps - 2; t >= 0; t--) {
            double[] emissions = Emissions.probabilities(emissionParams, observations[t + 1]);
            double[] next = beta[t + 1];
            for (int i = 0; i < numStates; i++) {
                double sum = 0;
                for (int j = 0; j < numStates; j++) {
                    sum += transitionMatrix[i][j] * emissions[j] * next[j];
                }
                beta[t][i] = sum;
            }
            divideBy(beta[t], scalingFactors[t]);
        }
        return new BackwardResult(beta);
    }

    /**
     * Divides the row by the scaling factor of the forward pass, unless it is zero.
     */
    private static void divideBy(double[] row, double scalingFactor) {
        if (scalingFactor > 0) {
            for (int i = 0; i < row.length; i++) {
                row[i] /= scalingFactor;
            }
        }
    }
}
