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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;

/**
 * The flattened, fully specialized dataflow graph of one compilation unit, as
 * handed over by the front end: every signal with its defining expression and
 * guarding clock edge, the clock port declarations and the bridge
 * declarations. The graph is immutable and is never modified by the analysis.
 */
public class DataflowGraph {

    private final String name;

    private final Map<String, Signal> signals;

    private final List<ClockPort> clockPorts;

    private final List<BridgeDeclaration> bridges;

    /** For each signal, the signals whose defining expression reads it */
    private final Map<Signal, List<Signal>> readers;

    private Graph<Signal, DataflowEdge> dependencies;

    private List<Signal> topologicalOrder;

    private DataflowGraph(String name, Map<String, Signal> signals, List<ClockPort> clockPorts,
                          List<BridgeDeclaration> bridges) {
        this.name = name;
        this.signals = Collections.unmodifiableMap(signals);
        this.clockPorts = Collections.unmodifiableList(clockPorts);
        this.bridges = Collections.unmodifiableList(bridges);
        this.readers = new HashMap<>();
        for (Signal s : signals.values()) {
            for (String operand : s.getOperands()) {
                readers.computeIfAbsent(signals.get(operand), (k) -> new ArrayList<>()).add(s);
            }
        }
    }

    /**
     * @return Name of the compilation unit.
     */
    public String getName() {
        return name;
    }

    /**
     * @return All signals in declaration order.
     */
    public Collection<Signal> getSignals() {
        return signals.values();
    }

    public Signal getSignal(String signalName) {
        return signals.get(signalName);
    }

    public List<ClockPort> getClockPorts() {
        return clockPorts;
    }

    public List<BridgeDeclaration> getBridges() {
        return bridges;
    }

    /**
     * Gets the operands of a signal's defining expression as signals.
     * @param s The reading signal.
     * @return Operand signals in operand declaration order.
     */
    public List<Signal> getOperandSignals(Signal s) {
        List<Signal> operands = new ArrayList<>(s.getOperands().size());
        for (String operand : s.getOperands()) {
            operands.add(signals.get(operand));
        }
        return operands;
    }

    /**
     * Gets the signals whose defining expression reads the given signal. A
     * register's use of its clock does not count as a read.
     * @param s The signal being read.
     * @return Readers in declaration order.
     */
    public List<Signal> getReaders(Signal s) {
        List<Signal> list = readers.get(s);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    /**
     * Gets the clock signal guarding a sequential signal.
     * @return The clock signal, or null if s is not sequential.
     */
    public Signal getClockSignal(Signal s) {
        return s.getClockEdge() == null ? null : signals.get(s.getClockEdge().getClockSignal());
    }

    /**
     * Gets the dependency graph used to order domain propagation. A
     * combinational signal or port depends on its operands, a register only on
     * its clock: register feedback (e.g. a counter) is not a dependency.
     * @return The dependency graph.
     */
    public Graph<Signal, DataflowEdge> getDependencyGraph() {
        if (dependencies == null) {
            Graph<Signal, DataflowEdge> g = new DefaultDirectedGraph<>(DataflowEdge.class);
            for (Signal s : signals.values()) {
                g.addVertex(s);
            }
            for (Signal s : signals.values()) {
                if (s.isSequential()) {
                    g.addEdge(getClockSignal(s), s, new DataflowEdge(DataflowEdge.Type.CLOCK));
                } else {
                    for (Signal operand : getOperandSignals(s)) {
                        g.addEdge(operand, s, new DataflowEdge(DataflowEdge.Type.OPERAND));
                    }
                }
            }
            dependencies = g;
        }
        return dependencies;
    }

    /**
     * Gets all signals in an order where every signal comes after the signals
     * its domain depends on. Ties are broken by declaration order so the
     * result is identical from run to run.
     * @return Topologically ordered signals.
     * @throws CombinationalCycleException if an unregistered loop exists.
     */
    public List<Signal> getTopologicalOrder() {
        if (topologicalOrder == null) {
            Graph<Signal, DataflowEdge> g = getDependencyGraph();
            CycleDetector<Signal, DataflowEdge> cycleDetector = new CycleDetector<>(g);
            if (cycleDetector.detectCycles()) {
                Set<Signal> cycle = cycleDetector.findCycles();
                throw new CombinationalCycleException(name, cycle.stream()
                        .sorted(Comparator.comparingInt(Signal::getIndex))
                        .map(Signal::getName)
                        .collect(Collectors.toList()));
            }
            List<Signal> order = new ArrayList<>(signals.size());
            TopologicalOrderIterator<Signal, DataflowEdge> it =
                    new TopologicalOrderIterator<>(g, Comparator.comparingInt(Signal::getIndex));
            while (it.hasNext()) {
                order.add(it.next());
            }
            topologicalOrder = Collections.unmodifiableList(order);
        }
        return topologicalOrder;
    }

    @Override
    public String toString() {
        return name + " (" + signals.size() + " signals, " + clockPorts.size() + " clocks, "
                + bridges.size() + " bridges)";
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Assembles a {@link DataflowGraph}. Signals are numbered in the order they
     * are added; signals added without a source location are given one in a
     * synthetic file named after the unit, one line per signal.
     */
    public static class Builder {

        private final String name;

        private final List<Signal.Builder> signals = new ArrayList<>();

        private final List<ClockPort> clockPorts = new ArrayList<>();

        private final List<BridgeDeclaration> bridges = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder signal(@NotNull Signal.Builder signal) {
            signals.add(signal);
            return this;
        }

        /**
         * Adds a 1-bit clock input together with the clock port declaring its
         * domain in the input's scope.
         */
        public Builder clockInput(String signalName, String domainName) {
            signal(Signal.builder(signalName).kind(SignalKind.INPUT));
            clockPorts.add(new ClockPort(domainName, Signal.parentScope(signalName), signalName, null));
            return this;
        }

        /**
         * Adds a primary input.
         * @param domainName Domain written on the input, or null if unconstrained.
         */
        public Builder input(String signalName, int width, String domainName) {
            return signal(Signal.builder(signalName).kind(SignalKind.INPUT).width(width).domain(domainName));
        }

        public Builder combinational(String signalName, int width, Expression expression) {
            return signal(Signal.builder(signalName).kind(SignalKind.COMBINATIONAL).width(width).expression(expression));
        }

        /**
         * Adds a register updated on the rising edge of a clock.
         */
        public Builder register(String signalName, int width, String clockSignal, Expression expression) {
            return signal(Signal.builder(signalName).kind(SignalKind.SEQUENTIAL).width(width)
                    .clock(ClockEdge.rising(clockSignal)).expression(expression));
        }

        /**
         * Adds a formal port of an instantiated module bound to an actual signal.
         */
        public Builder port(String signalName, int width, String actual) {
            return signal(Signal.builder(signalName).kind(SignalKind.PORT).width(width)
                    .expression(Expression.ref(actual)));
        }

        public Builder clockPort(@NotNull ClockPort clockPort) {
            clockPorts.add(clockPort);
            return this;
        }

        public Builder bridge(@NotNull BridgeDeclaration bridge) {
            bridges.add(bridge);
            return this;
        }

        /**
         * Validates and creates the graph.
         * @throws IllegalArgumentException if a name is declared twice, a
         *         reference does not resolve, or a signal is malformed for its kind.
         */
        public DataflowGraph build() {
            Map<String, Signal> map = new LinkedHashMap<>();
            for (Signal.Builder b : signals) {
                int index = map.size();
                if (map.containsKey(b.getName())) {
                    throw new IllegalArgumentException("ERROR: Signal '" + b.getName() + "' is declared more than once in unit '" + name + "'");
                }
                if (b.getWidth() < 1) {
                    throw new IllegalArgumentException("ERROR: Signal '" + b.getName() + "' has invalid width " + b.getWidth());
                }
                checkKind(b);
                SourceLocation loc = b.getLocation() != null ? b.getLocation()
                        : new SourceLocation(name + ".hdl", index + 1, 1);
                map.put(b.getName(), new Signal(b, index, loc));
            }
            for (Signal s : map.values()) {
                for (String operand : s.getOperands()) {
                    requireSignal(map, operand, "read by signal '" + s.getName() + "'");
                }
                if (s.getClockEdge() != null) {
                    requireSignal(map, s.getClockEdge().getClockSignal(), "clocking register '" + s.getName() + "'");
                }
            }
            List<ClockPort> ports = new ArrayList<>();
            for (ClockPort p : clockPorts) {
                Signal clk = requireSignal(map, p.getClockSignal(), "declared as clock of domain '" + p.getDomainName() + "'");
                if (clk.getKind() != SignalKind.INPUT) {
                    throw new IllegalArgumentException("ERROR: Clock port '" + p.getClockSignal() + "' must be an input, found " + clk.getKind());
                }
                ports.add(p.getLocation().isUnknown()
                        ? new ClockPort(p.getDomainName(), p.getScope(), p.getClockSignal(), clk.getLocation()) : p);
            }
            for (BridgeDeclaration bridge : bridges) {
                for (String ref : bridge.getReferencedSignals()) {
                    requireSignal(map, ref, "named by bridge '" + bridge.getName() + "'");
                }
            }
            return new DataflowGraph(name, map, ports, new ArrayList<>(bridges));
        }

        private static void checkKind(Signal.Builder b) {
            String problem = null;
            switch (b.getKind()) {
                case INPUT:
                    if (b.getExpression() != null || b.getClockEdge() != null) problem = "an input has no expression or clock";
                    break;
                case SEQUENTIAL:
                    if (b.getExpression() == null || b.getClockEdge() == null) problem = "a register needs an expression and a clock edge";
                    break;
                case PORT:
                    if (!(b.getExpression() instanceof SignalRef) || b.getClockEdge() != null) problem = "a port must be bound to exactly one actual signal";
                    break;
                default:
                    if (b.getExpression() == null || b.getClockEdge() != null) problem = "a combinational signal needs an expression and no clock";
            }
            if (problem != null) {
                throw new IllegalArgumentException("ERROR: Malformed signal '" + b.getName() + "': " + problem);
            }
        }

        private Signal requireSignal(Map<String, Signal> map, String signalName, String context) {
            Signal s = map.get(signalName);
            if (s == null) {
                throw new IllegalArgumentException("ERROR: Unknown signal '" + signalName + "' " + context + " in unit '" + name + "'");
            }
            return s;
        }
    }
}
