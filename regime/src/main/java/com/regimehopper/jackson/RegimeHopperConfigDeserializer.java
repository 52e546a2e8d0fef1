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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.regimehopper.RegimeHopperConfig;
import com.regimehopper.util.PMap;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a flat document like the config.yml. The dot in a key like "features.window" is part of
 * the key, lists like [returns, volatility] are stored as "[returns,volatility]".
 */
public class RegimeHopperConfigDeserializer extends JsonDeserializer<RegimeHopperConfig> {

    @Override
    public RegimeHopperConfig deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        jsonParser.setCodec(mapper);
        ObjectNode tree = jsonParser.readValueAsTree();
        PMap pMap = new PMap();
        Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull())
                continue;
            if (value.isObject())
                return deserializationContext.reportInputMismatch(RegimeHopperConfig.class,
                        "Nested objects are not supported, use a flat key like 'features.window' instead of '%s'", field.getKey());

            if (value.isArray()) {
                List<String> items = new ArrayList<>(value.size());
                for (JsonNode item : value) {
                    items.add(item.asText());
                }
                pMap.put(field.getKey(), items);
            } else {
                pMap.put(field.getKey(), value.asText());
            }
        }
        return new RegimeHopperConfig(pMap);
    }
}
