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

import java.util.ArrayList;
import java.util.List;

/**
 * Implementation of the Viterbi algorithm for a stationary HMM with Gaussian emissions. The plain
 * Viterbi algorithm is described e.g. in Rabiner, Juang, An introduction to Hidden Markov Models,
 * IEEE ASSP Mag., pp 4-16, June 1986.
 * <p>
 * All computations happen in log space to prevent arithmetic underflows. Initial and transition
 * probabilities of exactly zero are clamped to {@link #PROBABILITY_FLOOR} before taking the
 * logarithm, so a forbidden transition becomes a large but finite penalty and never propagates
 * negative infinity.
 * <p>
 * Ties are broken in favor of the lowest state index. The whole observation sequence has to be
 * known in advance.
 */
public class ViterbiAlgorithm {

    public static final double PROBABILITY_FLOOR = 1e-300;

    private final boolean keepMessageHistory;

    private List<double[]> messageHistory; // For debugging only.

    /**
     * Does not keep the message history.
     */
    public ViterbiAlgorithm() {
        this(false);
    }

    /**
     * @param keepMessageHistory Whether to store intermediate forward messages
     *                           (log probabilities of intermediate most likely paths) for debugging.
     *                           An instance that keeps the history must not be shared between threads.
     */
    public ViterbiAlgorithm(boolean keepMessageHistory) {
        this.keepMessageHistory = keepMessageHistory;
    }

    /**
     * Computes the most likely sequence of states. Formally, this is argmax p(s_1, ..., s_T |
     * o_1, ..., o_T) with respect to s_1, ..., s_T.
     */
    public MostLikelySequence computeMostLikelySequence(double[][] observations, double[][] transitionMatrix,
                                                        List<EmissionParams> emissionParams, double[] initialProbs) {
        int numStates = HmmValidation.checkShapes(observations, transitionMatrix, emissionParams);
        HmmValidation.checkLength("initialProbs", initialProbs, numStates);
        if (keepMessageHistory)
            messageHistory = new ArrayList<>(observations.length);

        int timeSteps = observations.length;
        double[] logInitialProbs = new double[numStates];
        double[][] logTransitionMatrix = new double[numStates][numStates];
        for (int i = 0; i < numStates; i++) {
            logInitialProbs[i] = flooredLog(initialProbs[i]);
            for (int j = 0; j < numStates; j++) {
                logTransitionMatrix[i][j] = flooredLog(transitionMatrix[i][j]);
            }
        }

        // back pointers, psi[0] stays unused
        int[][] psi = new int[timeSteps][numStates];

        double[] message = Emissions.logProbabilities(emissionParams, observations[0]);
        for (int i = 0; i < numStates; i++) {
            message[i] += logInitialProbs[i];
        }
        addToHistory(message);

        for (int t = 1; t < timeSteps; t++) {
            double[] emissionLogProbabilities = Emissions.logProbabilities(emissionParams, observations[t]);
            double[] newMessage = new double[numStates];
            for (int j = 0; j < numStates; j++) {
                double maxLogProbability = Double.NEGATIVE_INFINITY;
                int maxPrevState = 0;
                for (int i = 0; i < numStates; i++) {
                    double logProbability = message[i] + logTransitionMatrix[i][j];
                    if (logProbability > maxLogProbability) {
                        maxLogProbability = logProbability;
                        maxPrevState = i;
                    }
                }
                newMessage[j] = maxLogProbability + emissionLogProbabilities[j];
                psi[t][j] = maxPrevState;
            }
            message = newMessage;
            addToHistory(message);
        }

        int lastState = mostLikelyState(message);
        int[] path = new int[timeSteps];
        path[timeSteps - 1] = lastState;
        for (int t = timeSteps - 2; t >= 0; t--) {
            path[t] = psi[t + 1][path[t + 1]];
        }
        return new MostLikelySequence(path, message[lastState]);
    }

    /**
     * Returns the sequence of intermediate forward messages (one log probability per state) for
     * each time step of the last computation. Returns null if message history is not kept.
     */
    public List<double[]> messageHistory() {
        return messageHistory;
    }

    public String messageHistoryString() {
        if (messageHistory == null) {
            throw new IllegalStateException("Message history was not recorded.");
        }

        final StringBuilder sb = new StringBuilder();
        sb.append("Message history with log probabilities\n\n");
        int i = 0;
        for (double[] message : messageHistory) {
            sb.append("Time step ").append(i).append("\n");
            i++;
            for (int state = 0; state < message.length; state++) {
                sb.append(state).append(": ").append(message[state]).append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    static double flooredLog(double probability) {
        return Math.log(Math.max(probability, PROBABILITY_FLOOR));
    }

    /**
     * Retrieves the first state of the message with maximum log probability.
     */
    private static int mostLikelyState(double[] message) {
        int result = 0;
        double maxLogProbability = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < message.length; i++) {
            if (message[i] > maxLogProbability) {
                result = i;
                maxLogProbability = message[i];
            }
        }
        return result;
    }

    private void addToHistory(double[] message) {
        if (messageHistory != null)
            messageHistory.add(message.clone());
    }
}
