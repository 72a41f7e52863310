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

/**
 * Declaration of a clock input: establishes a fresh domain named
 * {@link #getDomainName()} in {@link #getScope()} and tags the clock signal
 * with it.
 */
public class ClockPort {

    private final String domainName;

    private final String scope;

    private final String clockSignal;

    private final SourceLocation location;

    public ClockPort(String domainName, String scope, String clockSignal, SourceLocation location) {
        this.domainName = domainName;
        this.scope = scope;
        this.clockSignal = clockSignal;
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public String getDomainName() {
        return domainName;
    }

    public String getScope() {
        return scope;
    }

    public String getClockSignal() {
        return clockSignal;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return domainName + "@" + scope + " (" + clockSignal + ")";
    }
}
