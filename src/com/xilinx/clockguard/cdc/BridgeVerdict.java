/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of ClockGuard.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.clockguard.cdc;

import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Outcome of checking one bridge: valid, or the list of reasons it is not.
 */
public final class BridgeVerdict {

    private final Bridge bridge;

    private final List<Diagnostic> problems;

    BridgeVerdict(Bridge bridge, List<Diagnostic> problems) {
        this.bridge = bridge;
        this.problems = Collections.unmodifiableList(problems);
    }

    public Bridge getBridge() {
        return bridge;
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    public List<Diagnostic> getProblems() {
        return problems;
    }

    public JSONObject toJSON() {
        JSONObject o = new JSONObject();
        o.put("bridge", bridge.getName());
        o.put("strategy", bridge.getStrategy().getTag());
        o.put("origin", bridge.getDeclaration().getOrigin().name());
        o.put("from", bridge.getSource().getQualifiedName());
        o.put("to", bridge.getDestination().getQualifiedName());
        o.put("valid", isValid());
        JSONArray reasons = new JSONArray();
        for (Diagnostic d : problems) {
            reasons.put(d.getMessage());
        }
        o.put("problems", reasons);
        return o;
    }

    @Override
    public String toString() {
        return bridge + (isValid() ? " VALID" : " INVALID " + problems.size() + " problem(s)");
    }
}
