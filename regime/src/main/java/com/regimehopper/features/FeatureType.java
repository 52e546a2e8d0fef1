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
package com.regimehopper.features;

import com.regimehopper.util.Helper;

import java.util.Locale;

/**
 * The per-period features that can be derived from a price series.
 */
public enum FeatureType {
    /**
     * simple return (p[i] - p[i-1]) / p[i-1]
     */
    RETURNS,
    /**
     * population standard deviation of the returns over a trailing window
     */
    VOLATILITY;

    /**
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FeatureType find(String name) {
        if (Helper.isEmpty(name))
            throw new IllegalArgumentException("Feature type must not be empty");
        try {
            return FeatureType.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown feature type '" + name + "', supported: returns, volatility", ex);
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
