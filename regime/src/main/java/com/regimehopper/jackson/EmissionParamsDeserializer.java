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

import java.io.IOException;

class EmissionParamsDeserializer extends JsonDeserializer<EmissionParams> {
    @Override
    public EmissionParams deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        JsonNode tree = jsonParser.readValueAsTree();
        return fromJson(jsonParser, deserializationContext, tree);
    }

    static EmissionParams fromJson(JsonParser jsonParser, DeserializationContext deserializationContext, JsonNode node) throws IOException {
        double[] means = HmmModelDeserializer.readField(jsonParser, deserializationContext, node, "means", double[].class, EmissionParams.class);
        double[] variances = HmmModelDeserializer.readField(jsonParser, deserializationContext, node, "variances", double[].class, EmissionParams.class);
        return new EmissionParams(means, variances);
    }
}
