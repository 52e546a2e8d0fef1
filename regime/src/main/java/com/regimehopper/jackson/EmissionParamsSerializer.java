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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.regimehopper.hmm.EmissionParams;

import java.io.IOException;

class EmissionParamsSerializer extends JsonSerializer<EmissionParams> {
    @Override
    public void serialize(EmissionParams params, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeStartObject();
        writeArrayField(jsonGenerator, "means", params.getMeans());
        writeArrayField(jsonGenerator, "variances", params.getVariances());
        jsonGenerator.writeEndObject();
    }

    static void writeArrayField(JsonGenerator jsonGenerator, String name, double[] values) throws IOException {
        jsonGenerator.writeFieldName(name);
        jsonGenerator.writeArray(values, 0, values.length);
    }
}
