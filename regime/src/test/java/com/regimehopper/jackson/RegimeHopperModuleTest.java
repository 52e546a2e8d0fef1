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
package com.regimehopper.jackson;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regimehopper.hmm.EmissionParams;
import com.regimehopper.hmm.HmmModel;
import com.regimehopper.hmm.MostLikelySequence;
import com.regimehopper.util.exceptions.DimensionMismatchException;
import com.regimehopper.util.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class RegimeHopperModuleTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new RegimeHopperModule());

    @Test
    public void testReadModel() throws IOException {
        HmmModel model = objectMapper.readValue(getClass().getResourceAsStream("model.json"), HmmModel.class);
        assertEquals(2, model.getNumStates());
        assertEquals(2, model.getNumFeatures());
        assertEquals(0.2, model.getTransitionMatrix()[1][0]);
        assertArrayEquals(new double[]{0.6, 0.4}, model.getInitialProbs());
        assertEquals(new EmissionParams(new double[]{-0.7, 0.3}, new double[]{2.0, 1.5}), model.getEmissionParams(1));
    }

    @Test
    public void testWriteModel() throws IOException {
        HmmModel model = objectMapper.readValue(getClass().getResourceAsStream("model.json"), HmmModel.class);
        JsonNode json = objectMapper.valueToTree(model);
        assertEquals(0.1, json.get("transition_matrix").get(0).get(1).asDouble());
        assertEquals(0.5, json.get("emission_params").get(0).get("variances").get(1).asDouble());
        assertEquals(0.4, json.get("initial_probs").get(1).asDouble());

        HmmModel copy = objectMapper.treeToValue(json, HmmModel.class);
        assertArrayEquals(model.getTransitionMatrix()[1], copy.getTransitionMatrix()[1]);
        assertEquals(model.getEmissionParams(), copy.getEmissionParams());
    }

    @Test
    public void testEmissionParams() throws IOException {
        EmissionParams params = objectMapper.readValue("{\"means\": [1.5], \"variances\": [0.25]}", EmissionParams.class);
        assertEquals(1.5, params.getMean(0));
        assertEquals(0.25, params.getVariance(0));
        assertEquals("{\"means\":[1.5],\"variances\":[0.25]}", objectMapper.writeValueAsString(params));

        assertThrows(InvalidParameterException.class, () -> objectMapper.readValue("{\"means\": [1.5], \"variances\": [0]}", EmissionParams.class));
        assertThrows(DimensionMismatchException.class, () -> objectMapper.readValue("{\"means\": [1.5, 2], \"variances\": [1]}", EmissionParams.class));
        assertThrows(JsonMappingException.class, () -> objectMapper.readValue("{\"means\": [1.5]}", EmissionParams.class));
    }

    @Test
    public void testInvalidModel() {
        String notStochastic = "{\"transition_matrix\": [[0.5, 0.1], [0.2, 0.8]], "
                + "\"emission_params\": [{\"means\": [0], \"variances\": [1]}, {\"means\": [1], \"variances\": [1]}], "
                + "\"initial_probs\": [0.5, 0.5]}";
        assertThrows(InvalidParameterException.class, () -> objectMapper.readValue(notStochastic, HmmModel.class));

        String missingEmissions = "{\"transition_matrix\": [[1]], \"initial_probs\": [1]}";
        assertThrows(JsonMappingException.class, () -> objectMapper.readValue(missingEmissions, HmmModel.class));
    }

    @Test
    public void testWriteMostLikelySequence() throws IOException {
        JsonNode json = objectMapper.valueToTree(new MostLikelySequence(new int[]{0, 1, 1}, -4.5));
        assertEquals(3, json.get("path").size());
        assertEquals(1, json.get("path").get(2).asInt());
        assertEquals(-4.5, json.get("log_probability").asDouble());
    }
}
