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

import java.util.Arrays;

/**
 * Contains the most likely state sequence computed by the Viterbi algorithm and its log
 * probability.
 */
public class MostLikelySequence {

    private final int[] path;
    private final double logProbability;

    public MostLikelySequence(int[] path, double logProbability) {
        this.path = path.clone();
        this.logProbability = logProbability;
    }

    /**
     * @return a copy of the state index for each time step
     */
    public int[] getPath() {
        return path.clone();
    }

    public int getState(int timeStep) {
        return path[timeStep];
    }

    public int size() {
        return path.length;
    }

    /**
     * Formally, this is max log p(s_1, ..., s_T, o_1, ..., o_T) w.r.t. s_1, ..., s_T, where
     * zero initial and transition probabilities are replaced by a tiny positive floor.
     */
    public double getLogProbability() {
        return logProbability;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        MostLikelySequence other = (MostLikelySequence) obj;
        return Double.compare(logProbability, other.logProbability) == 0 && Arrays.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(path) + Double.hashCode(logProbability);
    }

    @Override
    public String toString() {
        return "MostLikelySequence [path=" + Arrays.toString(path) + ", logProbability=" + logProbability + "]";
    }
}
