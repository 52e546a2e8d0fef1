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
 * Computes the forward-backward algorithm, also known as smoothing. This algorithm computes the
 * probability of each state at each time step given the entire observation sequence.
 * <p>
 * The backward pass reuses the scaling factors of the forward pass, so the product of alpha and
 * beta only needs to be normalized per time step. Rows where this product vanishes become
 * uniform.
 */
public class ForwardBackwardAlgorithm {

    private ForwardBackwardAlgorithm() {
    }

    public static SmoothingResult compute(double[][] observations, double[][] transitionMatrix,
                                          List<EmissionParams> emissionParams, double[] initialProbs) {
        ForwardResult forwardResult = ForwardAlgorithm.compute(observations, transitionMatrix, emissionParams, initialProbs);
        BackwardResult backwardResult = BackwardAlgorithm.compute(observations, transitionMatrix, emissionParams,
                forwardResult.getScalingFactors());

        int timeSteps = observations.length;
        double[][] smoothing = new double[timeSteps][];
        for (int t = 0; t < timeSteps; t++) {
            double[] alpha = forwardResult.getAlpha(t);
            double[] beta = backwardResult.getBeta(t);
            for (int i = 0; i < alpha.length; i++) {
                alpha[i] *= beta[i];
            }
            smoothing[t] = LogMath.normalizeVector(alpha);
        }
        return new SmoothingResult(forwardResult, backwardResult, smoothing);
    }
}
