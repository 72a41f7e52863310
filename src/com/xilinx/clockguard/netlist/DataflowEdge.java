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

import org.jgrapht.graph.DefaultEdge;

/**
 * Dependency edge of a {@link DataflowGraph}: the domain of the target depends
 * on the domain of the source.
 */
public class DataflowEdge extends DefaultEdge {

    private static final long serialVersionUID = -6049521785392271874L;

    public enum Type {
        /** Operand of a combinational signal or actual of a port */
        OPERAND,
        /** Clock of a sequential signal */
        CLOCK
    }

    private final Type type;

    public DataflowEdge(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return "(" + getSource() + " -> " + getTarget() + ", " + type + ")";
    }
}
