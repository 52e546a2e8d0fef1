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
 * Per-state emission probabilities of a single observation.
 */
class Emissions {

    private Emissions() {
    }

    static double[] probabilities(List<EmissionParams> emissionParams, double[] observation) {
        double[] result = new double[emissionParams.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = emissionParams.get(i).emissionProbability(observation);
        }
        return result;
    }

    static double[] logProbabilities(List<EmissionParams> emissionParams, double[] observation) {
        double[] result = new double[emissionParams.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = emissionParams.get(i).emissionLogProbability(observation);
        }
        return result;
    }
}
