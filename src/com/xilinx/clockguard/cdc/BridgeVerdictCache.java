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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.clockguard.netlist.Signal;

/**
 * Verdicts of one unit's bridges, keyed by claim so that the same claim made
 * twice is checked once, and indexed by the signals each bridge delivers to.
 */
public class BridgeVerdictCache {

    private final Map<Bridge, BridgeVerdict> verdicts = new LinkedHashMap<>();

    private final Map<Signal, List<BridgeVerdict>> byDestination = new HashMap<>();

    public BridgeVerdict get(Bridge bridge) {
        return verdicts.get(bridge);
    }

    void put(BridgeVerdict verdict) {
        Bridge b = verdict.getBridge();
        if (verdicts.putIfAbsent(b, verdict) != null) {
            return;
        }
        if (b.getFirstStage() != null) {
            index(b.getFirstStage(), verdict);
        }
        for (Signal read : b.getStorageReads()) {
            index(read, verdict);
        }
    }

    private void index(Signal s, BridgeVerdict verdict) {
        byDestination.computeIfAbsent(s, k -> new ArrayList<>()).add(verdict);
    }

    /**
     * Gets the verdicts of bridges whose first register (or storage read)
     * is the given signal.
     */
    public List<BridgeVerdict> getVerdictsFor(Signal destination) {
        List<BridgeVerdict> list = byDestination.get(destination);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }
}
