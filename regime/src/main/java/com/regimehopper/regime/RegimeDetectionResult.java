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
package com.regimehopper.regime;

import com.carrotsearch.hppc.IntArrayList;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of a regime detection over one price series. Time step t corresponds to the t-th
 * row of the extracted feature matrix, i.e. to price index t + window.
 */
public class RegimeDetectionResult {
    private final List<String> stateLabels;
    private final int[] stateSequence;
    private final List<String> regimes;
    private final double[][] stateProbabilities;
    private final double confidence;
    private final double logLikelihood;
    private final double pathLogProbability;
    private final int zeroScaleSteps;

    RegimeDetectionResult(List<String> stateLabels, int[] stateSequence, List<String> regimes, double[][] stateProbabilities,
                          double logLikelihood, double pathLogProbability, int zeroScaleSteps) {
        this.stateLabels = Collections.unmodifiableList(stateLabels);
        this.stateSequence = stateSequence;
        this.regimes = Collections.unmodifiableList(regimes);
        this.stateProbabilities = stateProbabilities;
        this.confidence = confidence(stateProbabilities);
        this.logLikelihood = logLikelihood;
        this.pathLogProbability = pathLogProbability;
        this.zeroScaleSteps = zeroScaleSteps;
    }

    /**
     * Mean over all time steps of the highest state probability, 0 if there are no time steps.
     */
    static double confidence(double[][] stateProbabilities) {
        if (stateProbabilities.length == 0)
            return 0;

        double sum = 0;
        for (double[] row : stateProbabilities) {
            double max = 0;
            for (double p : row) {
                max = Math.max(max, p);
            }
            sum += max;
        }
        return sum / stateProbabilities.length;
    }

    /**
     * @return the regime of the last time step
     */
    public String getCurrentRegime() {
        return regimes.get(regimes.size() - 1);
    }

    public List<String> getRegimes() {
        return regimes;
    }

    /**
     * The label of each hidden state, indexed by state.
     */
    public List<String> getStateLabels() {
        return stateLabels;
    }

    public int[] getStateSequence() {
        return stateSequence.clone();
    }

    public double[][] getStateProbabilities() {
        double[][] copy = new double[stateProbabilities.length][];
        for (int t = 0; t < copy.length; t++) {
            copy[t] = stateProbabilities[t].clone();
        }
        return copy;
    }

    public double[] getStateProbabilities(int timeStep) {
        return stateProbabilities[timeStep].clone();
    }

    public double getConfidence() {
        return confidence;
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    /**
     * @return the joint log probability of the decoded state sequence and the observations
     */
    public double getPathLogProbability() {
        return pathLogProbability;
    }

    public int getZeroScaleSteps() {
        return zeroScaleSteps;
    }

    public int getNumTimeSteps() {
        return stateSequence.length;
    }

    /**
     * @return the time steps at which the decoded state differs from the previous one
     */
    public IntArrayList getRegimeChanges() {
        IntArrayList changes = new IntArrayList();
        for (int t = 1; t < stateSequence.length; t++) {
            if (stateSequence[t] != stateSequence[t - 1])
                changes.add(t);
        }
        return changes;
    }

    @Override
    public String toString() {
        return "RegimeDetectionResult [currentRegime=" + getCurrentRegime() + ", timeSteps=" + stateSequence.length
                + ", confidence=" + confidence + ", logLikelihood=" + logLikelihood + "]";
    }
}
