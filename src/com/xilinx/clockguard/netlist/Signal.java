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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.xilinx.clockguard.domain.DomainRegistry;

/**
 * A node of the flattened dataflow graph: one signal of one specialized module
 * instance. Signals are created through {@link Signal#builder(String)} and
 * owned by a {@link DataflowGraph}; they are immutable once the graph is built.
 */
public class Signal {

    private final String name;

    private final String scope;

    private final SignalKind kind;

    private final int width;

    private final Expression expression;

    private final String declaredDomain;

    private final ClockEdge clockEdge;

    private final SourceLocation location;

    private final int index;

    /** Referenced signal names in order of first appearance */
    private final List<String> operands;

    Signal(Builder b, int index, SourceLocation location) {
        this.name = b.name;
        this.scope = b.scope != null ? b.scope : parentScope(b.name);
        this.kind = b.kind;
        this.width = b.width;
        this.expression = b.expression;
        this.declaredDomain = b.declaredDomain;
        this.clockEdge = b.clockEdge;
        this.location = location;
        this.index = index;
        this.operands = expression == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(expression.getReferencedSignals()));
    }

    /**
     * Gets the default scope of a hierarchical signal name: everything before
     * the last separator, e.g. "top/u_sync" for "top/u_sync/q".
     */
    public static String parentScope(String hierName) {
        int idx = hierName.lastIndexOf(DomainRegistry.SCOPE_SEPARATOR);
        return idx < 0 ? "" : hierName.substring(0, idx);
    }

    public String getName() {
        return name;
    }

    public String getScope() {
        return scope;
    }

    public SignalKind getKind() {
        return kind;
    }

    public boolean isSequential() {
        return kind == SignalKind.SEQUENTIAL;
    }

    public boolean isCombinational() {
        return kind == SignalKind.COMBINATIONAL;
    }

    public int getWidth() {
        return width;
    }

    /**
     * Gets the defining expression: the combinational function, the value
     * latched at the clock edge, or the actual connected to a port.
     * @return The expression, or null for an input.
     */
    public Expression getExpression() {
        return expression;
    }

    /**
     * @return Domain name written on the signal's declaration, or null.
     */
    public String getDeclaredDomain() {
        return declaredDomain;
    }

    /**
     * @return The clock edge guarding the assignment, or null if not sequential.
     */
    public ClockEdge getClockEdge() {
        return clockEdge;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Gets the position of this signal in the graph's declaration order.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Gets the names of the signals read by the defining expression, each once,
     * in operand declaration order.
     */
    public List<String> getOperands() {
        return operands;
    }

    /**
     * For a port, gets the name of the connected actual signal.
     * @return The actual's name, or null if this is not a port.
     */
    public String getActual() {
        return kind == SignalKind.PORT ? ((SignalRef) expression).getSignalName() : null;
    }

    @Override
    public String toString() {
        return name;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String scope;
        private SignalKind kind = SignalKind.COMBINATIONAL;
        private int width = 1;
        private Expression expression;
        private String declaredDomain;
        private ClockEdge clockEdge;
        private SourceLocation location;

        private Builder(String name) {
            this.name = name;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder kind(SignalKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder expression(Expression expression) {
            this.expression = expression;
            return this;
        }

        public Builder domain(String declaredDomain) {
            this.declaredDomain = declaredDomain;
            return this;
        }

        public Builder clock(ClockEdge clockEdge) {
            this.clockEdge = clockEdge;
            return this;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public String getName() {
            return name;
        }

        SourceLocation getLocation() {
            return location;
        }

        SignalKind getKind() {
            return kind;
        }

        int getWidth() {
            return width;
        }

        Expression getExpression() {
            return expression;
        }

        ClockEdge getClockEdge() {
            return clockEdge;
        }
    }
}
