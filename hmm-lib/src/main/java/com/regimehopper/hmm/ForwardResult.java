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
 * Result of the scaled forward pass.
 */
public class ForwardResult {

    private final double[][] alpha;
    private final double[] scalingFactors;
    private final double logLikelihood;
    private final int zeroScaleSteps;

    ForwardResult(double[][] alpha, double[] scalingFactors, double logLikelihood, int zeroScaleSteps) {
        this.alpha = alpha;
        this.scalingFactors = scalingFactors;
        this.logLikelihood = logLikelihood;
        this.zeroScaleSteps = zeroScaleSteps;
    }

    /**
     * @return a copy of the T x N forward matrix. Each row sums to 1 except for steps where all
     * states had zero probability, see {@link #getZeroScaleSteps()}.
     */
    public double[][] getAlpha() {
        return LogMath.copy(alpha);
    }

    public double[] getAlpha(int timeStep) {
        return alpha[timeStep].clone();
    }

    public double getAlpha(int timeStep, int state) {
        return alpha[timeStep][state];
    }

    /**
     * @return a copy of the scaling factors, one per time step. Pass them unchanged to the
     * backward pass.
     */
    public double[] getScalingFactors() {
        return scalingFactors.clone();
    }

    /**
     * The sum of log(scalingFactor) over all steps with a positive scaling factor.
     */
    public double getLogLikelihood() {
        return logLikelihood;
    }

    /**
     * Number of time steps whose scaling factor was zero. These steps are left out of the
     * log-likelihood, so a value greater than zero means the model assigns zero probability to
     * the observations and the log-likelihood is not a true likelihood.
     */
    public int getZeroScaleSteps() {
        return zeroScaleSteps;
    }

    public boolean isDegenerate() {
        return zeroScaleSteps > 0;
    }

    public int getNumTimeSteps() {
        return alpha.length;
    }

    @Override
    public String toString() {
        return "ForwardResult [timeSteps=" + alpha.length + ", logLikelihood=" + logLikelihood
                + ", zeroScaleSteps=" + zeroScaleSteps + "]";
    }
}
