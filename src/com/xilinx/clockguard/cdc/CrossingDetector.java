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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.domain.DomainTag;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.Signal;
import com.xilinx.clockguard.netlist.SignalKind;
import com.xilinx.clockguard.netlist.SyncStrategy;

/**
 * Finds every place where a value is consumed outside its domain, then keeps
 * as violations only those no verified bridge covers.
 */
public class CrossingDetector {

    private final DataflowGraph graph;

    private final DomainTable table;

    private final List<AcceptedCrossing> accepted = new ArrayList<>();

    public CrossingDetector(DataflowGraph graph, DomainTable table) {
        this.graph = graph;
        this.table = table;
    }

    /**
     * Lists crossing candidates in declaration order of the reading signal.
     * Operands that are unconstrained, or already in conflict, never form a
     * candidate: a conflict has been reported where it first appeared.
     */
    public List<CrossingCandidate> detect() {
        List<CrossingCandidate> candidates = new ArrayList<>();
        for (Signal s : graph.getSignals()) {
            if (s.isSequential()) {
                ClockDomain d = table.getDomain(s);
                if (d == null) continue;
                for (Signal operand : graph.getOperandSignals(s)) {
                    ClockDomain od = table.getDomain(operand);
                    if (od != null && od != d) {
                        candidates.add(new CrossingCandidate(CrossingCandidate.Kind.REGISTER_READ, operand, od, s, d));
                    }
                }
            } else if (s.isCombinational() && table.get(s).isConflict()) {
                ClockDomain baseline = null;
                for (Signal operand : graph.getOperandSignals(s)) {
                    ClockDomain od = table.getDomain(operand);
                    if (od == null) continue;
                    if (baseline == null) {
                        baseline = od;
                    } else if (od != baseline) {
                        candidates.add(new CrossingCandidate(CrossingCandidate.Kind.MIXED_EXPRESSION, operand, od, s, baseline));
                    }
                }
            }
        }
        return candidates;
    }

    /**
     * Matches candidates against verified bridges.
     * @param candidates The candidates of the unit.
     * @param verdicts   Verdicts of all bridges of the unit.
     * @return One violation per candidate left uncovered.
     */
    public List<Diagnostic> resolve(List<CrossingCandidate> candidates, BridgeVerdictCache verdicts) {
        List<Diagnostic> violations = new ArrayList<>();
        for (CrossingCandidate c : candidates) {
            Bridge cover = findCover(c, verdicts);
            if (cover != null) {
                accepted.add(new AcceptedCrossing(c, cover));
            } else {
                violations.add(c.toDiagnostic());
            }
        }
        return violations;
    }

    /**
     * @return Crossings accepted by the last call to {@link #resolve}.
     */
    public List<AcceptedCrossing> getAccepted() {
        return accepted;
    }

    private Bridge findCover(CrossingCandidate c, BridgeVerdictCache verdicts) {
        for (BridgeVerdict v : verdicts.getVerdictsFor(c.getDestination())) {
            Bridge b = v.getBridge();
            if (!v.isValid()) {
                continue;
            }
            if (b.getStrategy() == SyncStrategy.HANDSHAKE) {
                if (coversStorageRead(b, c)) {
                    return b;
                }
            } else if (c.getKind() == CrossingCandidate.Kind.REGISTER_READ
                    && b.getSource() == c.getSourceDomain() && b.getDestination() == c.getDestinationDomain()
                    && b.getFirstStage() == c.getDestination() && derivesFrom(b.getEntry(), c.getSource(), b.getSource())) {
                return b;
            }
        }
        return null;
    }

    /**
     * A verified handshake covers its storage read by a read-side register,
     * and any mix of storage and read-domain values inside a combinational
     * storage read, whose operands the verifier has already checked.
     */
    private static boolean coversStorageRead(Bridge b, CrossingCandidate c) {
        if (!b.getStorageReads().contains(c.getDestination())) {
            return false;
        }
        if (c.getKind() == CrossingCandidate.Kind.REGISTER_READ) {
            return b.getStorage() == c.getSource()
                    && b.getSource() == c.getSourceDomain() && b.getDestination() == c.getDestinationDomain();
        }
        return (b.getSource() == c.getSourceDomain() && b.getDestination() == c.getDestinationDomain())
                || (b.getDestination() == c.getSourceDomain() && b.getSource() == c.getDestinationDomain());
    }

    /**
     * Checks whether a bridge entry is the operand itself, or computed from it
     * by logic of the same domain.
     */
    private boolean derivesFrom(Signal entry, Signal operand, ClockDomain domain) {
        if (entry == null) {
            return false;
        }
        Deque<Signal> queue = new ArrayDeque<>();
        Set<Signal> seen = new HashSet<>();
        queue.add(entry);
        while (!queue.isEmpty()) {
            Signal s = queue.poll();
            if (s == operand) {
                return true;
            }
            if (!seen.add(s)) continue;
            DomainTag tag = table.get(s);
            if ((s.isCombinational() || s.getKind() == SignalKind.PORT) && tag.isDomain(domain)) {
                queue.addAll(graph.getOperandSignals(s));
            }
        }
        return false;
    }
}
