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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.regimehopper.hmm.EmissionParams;
import com.regimehopper.hmm.HmmModel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a model like {"transition_matrix": [[..]], "emission_params": [{"means": [..], "variances": [..]}],
 * "initial_probs": [..]}. The model is validated, i.e. an inconsistent model fails with the
 * exceptions of the {@link HmmModel} constructor.
 */
class HmmModelDeserializer extends JsonDeserializer<HmmModel> {
    @Override
    public HmmModel deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        JsonNode tree = jsonParser.readValueAsTree();
        double[][] transitionMatrix = readField(jsonParser, deserializationContext, tree, "transition_matrix", double[][].class, HmmModel.class);
        double[] initialProbs = readField(jsonParser, deserializationContext, tree, "initial_probs", double[].class, HmmModel.class);

        JsonNode emissionsNode = tree.get("emission_params");
        if (emissionsNode == null || !emissionsNode.isArray())
            return deserializationContext.reportInputMismatch(HmmModel.class, "Array field 'emission_params' is required");
        List<EmissionParams> emissionParams = new ArrayList<>(emissionsNode.size());
        for (JsonNode node : emissionsNode) {
            emissionParams.add(EmissionParamsDeserializer.fromJson(jsonParser, deserializationContext, node));
        }
        return new HmmModel(transitionMatrix, emissionParams, initialProbs);
    }

    static <T> T readField(JsonParser jsonParser, DeserializationContext deserializationContext, JsonNode tree,
                           String field, Class<T> fieldType, Class<?> targetType) throws IOException {
        JsonNode node = tree.get(field);
        if (node == null || !node.isArray())
            return deserializationContext.reportInputMismatch(targetType, "Array field '%s' is required", field);
        return jsonParser.getCodec().treeToValue(node, fieldType);
    }
}
