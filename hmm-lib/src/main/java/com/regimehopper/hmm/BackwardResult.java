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
 * Result of the scaled backward pass.
 */
public class BackwardResult {

    private final double[][] beta;

    BackwardResult(double[][] beta) {
        this.beta = beta;
    }

    /**
     * @return a copy of the T x N backward matrix, scaled with the forward scaling factors
     */
    public double[][] getBeta() {
        return LogMath.copy(beta);
    }

    public double[] getBeta(int timeStep) {
        return beta[timeStep].clone();
    }

    public double getBeta(int timeStep, int state) {
        return beta[timeStep][state];
    }

    public int getNumTimeSteps() {
        return beta.length;
    }
}
