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
package com.regimehopper.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A properties map (String to String) with convenient accessors. Keys are stored in under_score
 * notation and can be queried in camelCase or under_score.
 */
public class PMap {
    private final Map<String, String> map;

    public PMap() {
        this(new HashMap<>(5));
    }

    public PMap(Map<String, String> map) {
        this.map = new HashMap<>(map.size());
        for (Map.Entry<String, String> entry : map.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    public PMap(PMap map) {
        this.map = new HashMap<>(map.map);
    }

    /**
     * Parses a string like "features.window=20|regime.smoothing=true".
     */
    public PMap(String propertiesString) {
        this();
        for (String s : propertiesString.split("\\|")) {
            s = s.trim();
            int index = s.indexOf("=");
            if (index < 0)
                continue;

            put(s.substring(0, index), s.substring(index + 1));
        }
    }

    public PMap put(String key, Object value) {
        if (value == null)
            throw new NullPointerException("Value cannot be null. Use remove instead.");

        if (value instanceof List) {
            List<String> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(String.valueOf(item));
            }
            value = Helper.toListString(items);
        }
        map.put(Helper.camelCaseToUnderScore(key), value.toString());
        return this;
    }

    public PMap remove(String key) {
        map.remove(Helper.camelCaseToUnderScore(key));
        return this;
    }

    public boolean has(String key) {
        return map.containsKey(Helper.camelCaseToUnderScore(key));
    }

    public int getInt(String key, int _default) {
        String str = getStringOrNull(key);
        if (str == null)
            return _default;
        try {
            return Integer.parseInt(str.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Cannot parse integer for '" + key + "': " + str, ex);
        }
    }

    public double getDouble(String key, double _default) {
        String str = getStringOrNull(key);
        if (str == null)
            return _default;
        try {
            return Double.parseDouble(str.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Cannot parse double for '" + key + "': " + str, ex);
        }
    }

    public boolean getBool(String key, boolean _default) {
        String str = getStringOrNull(key);
        return str != null ? Boolean.parseBoolean(str.trim()) : _default;
    }

    public String get(String key, String _default) {
        String str = getStringOrNull(key);
        return str != null ? str : _default;
    }

    /**
     * @return the list stored under the key, e.g. "[a,b]", or the default if the key is missing
     */
    public List<String> getList(String key, List<String> _default) {
        String str = getStringOrNull(key);
        return str != null ? Helper.parseList(str) : _default;
    }

    public String getStringOrNull(String key) {
        if (Helper.isEmpty(key)) {
            return null;
        }
        return map.get(Helper.camelCaseToUnderScore(key));
    }

    /**
     * This method copies the underlying structure into a new Map object
     */
    public Map<String, String> toMap() {
        return Collections.unmodifiableMap(new HashMap<>(map));
    }

    public PMap merge(PMap other) {
        map.putAll(other.map);
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : map.entrySet()) {
            if (sb.length() > 0)
                sb.append("|");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
        }
        return sb.toString();
    }
}
