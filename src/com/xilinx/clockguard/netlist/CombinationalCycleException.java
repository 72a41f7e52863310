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

package com.xilinx.clockguard.netlist;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when the dependency graph of a unit contains a loop that no register
 * breaks. Such graphs should have been rejected by the front end.
 */
public class CombinationalCycleException extends RuntimeException {

    private static final long serialVersionUID = 2760128594306475311L;

    private final List<String> signals;

    public CombinationalCycleException(String unit, List<String> signals) {
        super("ERROR: Combinational cycle in unit '" + unit + "' through: " + String.join(", ", signals));
        this.signals = Collections.unmodifiableList(signals);
    }

    /**
     * @return Names of the signals taking part in a cycle, in declaration order.
     */
    public List<String> getSignals() {
        return signals;
    }
}
