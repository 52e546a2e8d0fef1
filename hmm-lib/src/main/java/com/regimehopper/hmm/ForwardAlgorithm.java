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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scaled forward algorithm, see Rabiner, A tutorial on hidden Markov models and selected
 * applications in speech recognition, Proc. IEEE 77(2), 1989.
 * <p>
 * Unscaled forward probabilities shrink geometrically with the number of time steps and
 * underflow to zero after a few dozen steps. Therefore each row of alpha is divided by its sum,
 * the scaling factor, and the log-likelihood is recovered as the sum of the logarithms of the
 * scaling factors.
 * <p>
 * If all states have zero probability at a time step, the scaling factor is zero, the row is
 * left unscaled and the step is skipped in the log-likelihood. Such steps are counted in
 * {@link ForwardResult#getZeroScaleSteps()}.
 */
public class ForwardAlgorithm {

    private static final Logger LOGGER = LoggerFactory.getLogger(ForwardAlgorithm.class);

    private ForwardAlgorithm() {
    }

    /**
     * @param observations    T x D matrix of observations
     * @param transitionMatrix N x N matrix, row i contains the probabilities of going from state i
     *                        to each state
     * @param emissionParams  emission parameters for each of the N states
     * @param initialProbs    initial probability of each state
     */
    public static ForwardResult compute(double[][] observations, double[][] transitionMatrix,
                                        List<EmissionParams> emissionParams, double[] initialProbs) {
        int numStates = HmmValidation.checkShapes(observations, transitionMatrix, emissionParams);
        HmmValidation.checkLength("initialProbs", initialProbs, numStates);

        int timeSteps = observations.length;
        double[][] alpha = new double[timeSteps][numStates];
        double[] scalingFactors = new double[timeSteps];

        double[] emissions = Emissions.probabilities(emissionParams, observations[0]);
        for (int i = 0; i < numStates; i++) {
            alpha[0][i] = initialProbs[i] * emissions[i];
        }
        scalingFactors[0] = scale(alpha[0]);

        for (int t = 1; t < timeSteps; t++) {
            emissions = Emissions.probabilities(emissionParams, observations[t]);
            double[] prev = alpha[t - 1];
            for (int j = 0; j < numStates; j++) {
                double sum = 0;
                for (int i = 0; i < numStates; i++) {
                    sum += prev[i] * transitionMatrix[i][j];
                }
                alpha[t][j] = sum * emissions[j];
            }
            scalingFactors[t] = scale(alpha[t]);
        }

        double logLikelihood = 0;
        int zeroScaleSteps = 0;
        for (int t = 0; t < timeSteps; t++) {
            if (scalingFactors[t] > 0) {
                logLikelihood += Math.log(scalingFactors[t]);
            } else {
                zeroScaleSteps++;
                LOGGER.debug("All states have zero forward probability at time step {}", t);
            }
        }
        if (zeroScaleSteps > 0)
            LOGGER.warn("{} of {} time steps had a zero scaling factor and were left out of the log-likelihood",
                    zeroScaleSteps, timeSteps);

        return new ForwardResult(alpha, scalingFactors, logLikelihood, zeroScaleSteps);
    }

    /**
     * Divides the row by its sum if the sum is positive.
     *
     * @return the sum of the row before scaling
     */
    static double scale(double[] row) {
        double sum = LogMath.sum(row);
        if (sum > 0) {
            for (int i = 0; i < row.length; i++) {
                row[i] /= sum;
            }
        }
        return sum;
    }
}
