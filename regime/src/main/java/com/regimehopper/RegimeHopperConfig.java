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
package com.regimehopper;

import com.regimehopper.util.PMap;

import java.util.List;
import java.util.Map;

/**
 * This class represents the configuration of the regime detection, which is typically read from a
 * `config.yml` file. The key-value pairs of the file are mapped to a flat string-string map, list
 * values are stored like "[a,b]".
 */
public class RegimeHopperConfig {
    public static final String FEATURES_WINDOW = "features.window";
    public static final String FEATURES_TYPES = "features.types";
    public static final String REGIME_STATE_LABELS = "regime.state_labels";
    public static final String REGIME_SMOOTHING = "regime.smoothing";
    public static final String REGIME_THREADS = "regime.threads";

    private final PMap map;

    public RegimeHopperConfig() {
        this(new PMap());
    }

    public RegimeHopperConfig(PMap pMap) {
        this.map = pMap;
    }

    public RegimeHopperConfig put(String key, Object value) {
        map.put(key, value);
        return this;
    }

    public boolean has(String key) {
        return map.has(key);
    }

    public boolean getBool(String key, boolean _default) {
        return map.getBool(key, _default);
    }

    public int getInt(String key, int _default) {
        return map.getInt(key, _default);
    }

    public List<String> getList(String key, List<String> _default) {
        return map.getList(key, _default);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("properties:\n");
        for (Map.Entry<String, String> entry : map.toMap().entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
            sb.append("\n");
        }
        return sb.toString();
    }
}
