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

/**
 * Posterior state probabilities given the whole observation sequence, together with the forward
 * and backward results they were computed from.
 */
public class SmoothingResult {

    private final ForwardResult forwardResult;
    private final BackwardResult backwardResult;
    private final double[][] smoothingProbabilities;

    SmoothingResult(ForwardResult forwardResult, BackwardResult backwardResult, double[][] smoothingProbabilities) {
        this.forwardResult = forwardResult;
        this.backwardResult = backwardResult;
        this.smoothingProbabilities = smoothingProbabilities;
    }

    public ForwardResult getForwardResult() {
        return forwardResult;
    }

    public BackwardResult getBackwardResult() {
        return backwardResult;
    }

    /**
     * @return a copy of the T x N matrix where entry [t][i] is the probability of state i at
     * time step t given all observations
     */
    public double[][] getSmoothingProbabilities() {
        return LogMath.copy(smoothingProbabilities);
    }

    public double[] getSmoothingProbabilities(int timeStep) {
        return smoothingProbabilities[timeStep].clone();
    }

    /**
     * @return the state with the highest posterior probability at the given time step, the
     * lowest index on ties
     */
    public int mostLikelyState(int timeStep) {
        double[] row = smoothingProbabilities[timeStep];
        int best = 0;
        for (int i = 1; i < row.length; i++) {
            if (row[i] > row[best])
                best = i;
        }
        return best;
    }
}
