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

import java.util.Objects;

/**
 * The clock-edge event guarding a sequential assignment. Both edges of a clock
 * belong to that clock's domain.
 */
public final class ClockEdge {

    public enum Edge {
        RISING,
        FALLING
    }

    private final String clockSignal;

    private final Edge edge;

    public ClockEdge(String clockSignal, Edge edge) {
        this.clockSignal = Objects.requireNonNull(clockSignal);
        this.edge = Objects.requireNonNull(edge);
    }

    public static ClockEdge rising(String clockSignal) {
        return new ClockEdge(clockSignal, Edge.RISING);
    }

    public static ClockEdge falling(String clockSignal) {
        return new ClockEdge(clockSignal, Edge.FALLING);
    }

    public String getClockSignal() {
        return clockSignal;
    }

    public Edge getEdge() {
        return edge;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ClockEdge)) return false;
        ClockEdge other = (ClockEdge) o;
        return clockSignal.equals(other.clockSignal) && edge == other.edge;
    }

    @Override
    public int hashCode() {
        return Objects.hash(clockSignal, edge);
    }

    @Override
    public String toString() {
        return (edge == Edge.RISING ? "posedge " : "negedge ") + clockSignal;
    }
}
