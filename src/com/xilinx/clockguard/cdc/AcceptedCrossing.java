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

import org.json.JSONObject;

/**
 * A crossing made safe by a verified bridge.
 */
public final class AcceptedCrossing {

    private final CrossingCandidate candidate;

    private final Bridge bridge;

    AcceptedCrossing(CrossingCandidate candidate, Bridge bridge) {
        this.candidate = candidate;
        this.bridge = bridge;
    }

    public CrossingCandidate getCandidate() {
        return candidate;
    }

    public Bridge getBridge() {
        return bridge;
    }

    public JSONObject toJSON() {
        JSONObject o = new JSONObject();
        o.put("source", candidate.getSource().getName());
        o.put("destination", candidate.getDestination().getName());
        o.put("from", candidate.getSourceDomain().getQualifiedName());
        o.put("to", candidate.getDestinationDomain().getQualifiedName());
        o.put("bridge", bridge.getName());
        o.put("strategy", bridge.getStrategy().getTag());
        return o;
    }

    @Override
    public String toString() {
        return candidate + " via " + bridge.getName();
    }
}
