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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An HMM with N hidden states and D-dimensional Gaussian emissions. Construction validates the
 * shapes, that each transition row and the initial distribution sum to 1 and that all variances
 * are positive.
 * <p>
 * Instances are immutable and can be shared between concurrently running inferences.
 */
public final class HmmModel {

    private final int numStates;
    private final int numFeatures;
    private final double[][] transitionMatrix;
    private final List<EmissionParams> emissionParams;
    private final double[] initialProbs;

    public HmmModel(double[][] transitionMatrix, List<EmissionParams> emissionParams, double[] initialProbs) {
        if (emissionParams == null || emissionParams.isEmpty())
            throw new InvalidParameterException("At least one state is required", "emissionParams");

        this.numStates = emissionParams.size();
        this.numFeatures = emissionParams.get(0).getNumFeatures();
        HmmValidation.checkSquare(transitionMatrix, numStates);
        HmmValidation.checkLength("initialProbs", initialProbs, numStates);
        for (int i = 1; i < numStates; i++) {
            if (emissionParams.get(i).getNumFeatures() != numFeatures)
                throw new DimensionMismatchException("Emission parameters of state " + i + " do not match the number of features",
                        numFeatures, emissionParams.get(i).getNumFeatures());
        }
        HmmValidation.checkStochastic(transitionMatrix, initialProbs);

        this.transitionMatrix = LogMath.copy(transitionMatrix);
        this.emissionParams = Collections.unmodifiableList(new ArrayList<>(emissionParams));
        this.initialProbs = initialProbs.clone();
    }

    public int getNumStates() {
        return numStates;
    }

    public int getNumFeatures() {
        return numFeatures;
    }

    public double[][] getTransitionMatrix() {
        return LogMath.copy(transitionMatrix);
    }

    public List<EmissionParams> getEmissionParams() {
        return emissionParams;
    }

    public EmissionParams getEmissionParams(int state) {
        return emissionParams.get(state);
    }

    public double[] getInitialProbs() {
        return initialProbs.clone();
    }

    public ForwardResult forward(double[][] observations) {
        return ForwardAlgorithm.compute(observations, transitionMatrix, emissionParams, initialProbs);
    }

    public BackwardResult backward(double[][] observations, double[] scalingFactors) {
        return BackwardAlgorithm.compute(observations, transitionMatrix, emissionParams, scalingFactors);
    }

    public SmoothingResult smooth(double[][] observations) {
        return ForwardBackwardAlgorithm.compute(observations, transitionMatrix, emissionParams, initialProbs);
    }

    public MostLikelySequence viterbi(double[][] observations) {
        return new ViterbiAlgorithm().computeMostLikelySequence(observations, transitionMatrix, emissionParams, initialProbs);
    }

    @Override
    public String toString() {
        return "HmmModel [numStates=" + numStates + ", numFeatures=" + numFeatures + "]";
    }
}
