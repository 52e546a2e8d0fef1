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
package com.regimehopper.util.exceptions;

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown if observation, mean or variance vectors disagree in length or if a matrix does not have
 * the shape implied by the number of states or features.
 */
public class DimensionMismatchException extends IllegalArgumentException implements HmmException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String message, int expected, int actual) {
        super(message + " (expected " + expected + ", got " + actual + ")");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>(2);
        details.put("expected", expected);
        details.put("actual", actual);
        return details;
    }
}
