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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.domain.DomainTag;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.Expression;
import com.xilinx.clockguard.netlist.Operation;
import com.xilinx.clockguard.netlist.Operator;
import com.xilinx.clockguard.netlist.Signal;
import com.xilinx.clockguard.netlist.SignalKind;
import com.xilinx.clockguard.netlist.SyncStrategy;

/**
 * Checks that each claimed bridge really has the structure its strategy needs
 * to make a crossing safe. A bridge that fails is reported and never used to
 * accept a crossing.
 */
public class SynchronizerVerifier {

    private final DataflowGraph graph;

    private final DomainTable table;

    private final List<Bridge> bridges;

    private final Map<String, Bridge> byName = new HashMap<>();

    private final BridgeVerdictCache cache = new BridgeVerdictCache();

    private final PointerEncodingCheck encodingCheck;

    /**
     * @param graph               The unit.
     * @param table               Domains of the unit's signals.
     * @param bridges             Resolved bridges, in declaration order.
     * @param maxEnumerationWidth Widest pointer counter whose encoding is
     *                            checked exhaustively.
     */
    public SynchronizerVerifier(DataflowGraph graph, DomainTable table, List<Bridge> bridges, int maxEnumerationWidth) {
        this.graph = graph;
        this.table = table;
        this.bridges = bridges;
        for (Bridge b : bridges) {
            byName.putIfAbsent(b.getName(), b);
        }
        this.encodingCheck = new PointerEncodingCheck(graph, table, maxEnumerationWidth);
    }

    /**
     * Verifies every bridge once.
     * @return The cache holding one verdict per distinct claim.
     */
    public BridgeVerdictCache verifyAll() {
        for (Bridge b : bridges) {
            verify(b);
        }
        return cache;
    }

    public BridgeVerdict verify(Bridge b) {
        BridgeVerdict verdict = cache.get(b);
        if (verdict != null) {
            return verdict;
        }
        List<Diagnostic> problems = new ArrayList<>();
        switch (b.getStrategy()) {
            case DOUBLE_REGISTER:
                checkChain(b, problems);
                if (b.getEntry() != null && b.getEntry().getWidth() != 1) {
                    problems.add(topology(b, b.getEntry(), "'" + b.getEntry().getName() + "' is "
                            + b.getEntry().getWidth() + " bits wide; a double-register synchronizer carries a single bit"));
                }
                break;
            case GRAY_CODE_POINTER:
                checkChain(b, problems);
                if (problems.isEmpty()) {
                    for (String msg : encodingCheck.check(b.getEntry(), b.getSource())) {
                        problems.add(new Diagnostic(CdcErrorCode.E_CDC_ENCODING_INVARIANT, b.getLocation(),
                                subject(b), b.getEntry().getName(), b.getSource(), b.getDestination(),
                                "Bridge '" + b.getName() + "': " + msg));
                    }
                }
                break;
            default:
                checkHandshake(b, problems);
        }
        verdict = new BridgeVerdict(b, problems);
        cache.put(verdict);
        return verdict;
    }

    /**
     * Shape shared by the register chain strategies: enough stages, every
     * stage a register of the destination domain copying the previous one,
     * no taps on unsettled stages, and an entry of the source domain.
     */
    private void checkChain(Bridge b, List<Diagnostic> problems) {
        List<Signal> chain = b.getChain();
        if (b.getStageCount() < 2) {
            problems.add(topology(b, null, "declares " + b.getStageCount()
                    + " stage(s); at least two registers are needed for metastability to settle"));
        }
        if (chain.size() != b.getStageCount()) {
            problems.add(topology(b, b.getFirstStage(), "declares " + b.getStageCount()
                    + " stages but only " + chain.size() + " register(s) form the chain " + chain));
        }
        for (int i = 0; i < chain.size(); i++) {
            Signal stage = chain.get(i);
            if (!stage.isSequential()) {
                problems.add(topology(b, stage, "stage '" + stage.getName() + "' is not a register"));
                continue;
            }
            DomainTag tag = table.get(stage);
            if (!tag.isDomain(b.getDestination())) {
                problems.add(topology(b, stage, "stage '" + stage.getName() + "' is clocked in " + tag
                        + ", not in destination domain '" + b.getDestination().getQualifiedName() + "'"));
            }
            if (i > 0 && !stage.getExpression().isReferenceTo(chain.get(i - 1).getName())) {
                problems.add(topology(b, stage, "stage '" + stage.getName() + "' reads `" + stage.getExpression()
                        + "` instead of a plain copy of stage '" + chain.get(i - 1).getName() + "'"));
            }
            if (i < chain.size() - 1) {
                for (Signal reader : graph.getReaders(stage)) {
                    if (reader != chain.get(i + 1)) {
                        problems.add(topology(b, stage, "unsettled stage '" + stage.getName()
                                + "' is also read by '" + reader.getName() + "'"));
                    }
                }
            }
        }
        Signal first = b.getFirstStage();
        if (first == null || !first.isSequential()) {
            return;
        }
        Signal entry = b.getEntry();
        if (entry == null || !first.getExpression().isReferenceTo(entry.getName())) {
            problems.add(topology(b, first, "first stage '" + first.getName() + "' samples `" + first.getExpression()
                    + "`; logic in front of the first register can glitch across the crossing"));
            return;
        }
        DomainTag entryTag = table.get(entry);
        if (!entryTag.isDomain(b.getSource())) {
            problems.add(topology(b, entry, "entry '" + entry.getName() + "' carries " + entryTag
                    + ", not source domain '" + b.getSource().getQualifiedName() + "'"));
        }
    }

    private void checkHandshake(Bridge b, List<Diagnostic> problems) {
        Bridge write = pointerBridge(b, b.getDeclaration().getWritePointerBridge(), b.getSource(), b.getDestination(), problems);
        Bridge read = pointerBridge(b, b.getDeclaration().getReadPointerBridge(), b.getDestination(), b.getSource(), problems);

        Signal storage = b.getStorage();
        if (storage != null && !table.get(storage).isDomain(b.getSource())) {
            problems.add(topology(b, storage, "storage '" + storage.getName() + "' is written in " + table.get(storage)
                    + ", not in write domain '" + b.getSource().getQualifiedName() + "'"));
        }
        for (Signal r : b.getStorageReads()) {
            checkStorageRead(b, r, problems);
        }
        if (b.getEmptyFlag() != null && write != null) {
            checkFlag(b, b.getEmptyFlag(), write, b.getDestination(), problems);
        }
        if (b.getFullFlag() != null && read != null) {
            checkFlag(b, b.getFullFlag(), read, b.getSource(), problems);
        }
    }

    private Bridge pointerBridge(Bridge b, String name, ClockDomain from, ClockDomain to, List<Diagnostic> problems) {
        Bridge p = byName.get(name);
        if (p == null) {
            problems.add(topology(b, null, "pointer bridge '" + name + "' is not declared"));
            return null;
        }
        if (p.getStrategy() != SyncStrategy.GRAY_CODE_POINTER) {
            problems.add(topology(b, null, "pointer bridge '" + name + "' uses " + p.getStrategy()
                    + ", not " + SyncStrategy.GRAY_CODE_POINTER));
            return null;
        }
        if (p.getSource() != from || p.getDestination() != to) {
            problems.add(topology(b, p.getProtectedSignal(), "pointer bridge '" + name + "' runs "
                    + p.getSource().getQualifiedName() + " -> " + p.getDestination().getQualifiedName()
                    + ", expected " + from.getQualifiedName() + " -> " + to.getQualifiedName()));
            return null;
        }
        if (!verify(p).isValid()) {
            problems.add(topology(b, p.getProtectedSignal(), "pointer bridge '" + name + "' is not a valid synchronizer"));
            return null;
        }
        return p;
    }

    /**
     * A storage read is a register of the read domain, or read-side
     * combinational logic, that addresses the storage only with read-domain
     * values. A combinational read may use no other write-side value.
     */
    private void checkStorageRead(Bridge b, Signal read, List<Diagnostic> problems) {
        boolean registered = read.isSequential();
        if (registered ? !table.get(read).isDomain(b.getDestination()) : !read.isCombinational()) {
            problems.add(topology(b, read, "storage read '" + read.getName() + "' must be a register of read domain '"
                    + b.getDestination().getQualifiedName() + "' or combinational logic"));
            return;
        }
        List<Operation> accesses = new ArrayList<>();
        findStorageAccesses(read.getExpression(), b.getStorage(), accesses);
        if (accesses.isEmpty()) {
            problems.add(topology(b, read, "storage read '" + read.getName() + "' does not index storage '"
                    + (b.getStorage() == null ? "?" : b.getStorage().getName()) + "'"));
            return;
        }
        Set<String> checked = new LinkedHashSet<>();
        for (Operation access : accesses) {
            checked.addAll(access.getOperand(1).getReferencedSignals());
        }
        if (!registered) {
            checked.addAll(read.getExpression().getReferencedSignals());
            checked.remove(b.getStorage().getName());
        }
        for (String leaf : checked) {
            DomainTag tag = table.get(leaf);
            if (tag.isConflict() || (tag.isConstrained() && !tag.isDomain(b.getDestination()))) {
                problems.add(new Diagnostic(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ, read.getLocation(),
                        read.getName(), leaf, tag.getDomain(), b.getDestination(),
                        "Bridge '" + b.getName() + "': storage read '" + read.getName() + "' depends on '"
                        + leaf + "' of " + tag + " instead of a read-domain value"));
            }
        }
    }

    private static void findStorageAccesses(Expression e, Signal storage, List<Operation> accesses) {
        if (!(e instanceof Operation)) {
            return;
        }
        Operation op = (Operation) e;
        if (op.getOperator() == Operator.INDEX && storage != null
                && op.getOperand(0).isReferenceTo(storage.getName())) {
            accesses.add(op);
        }
        for (Expression operand : op.getOperands()) {
            findStorageAccesses(operand, storage, accesses);
        }
    }

    /**
     * A status flag of one side must be computed from the synchronized copy
     * of the other side's pointer, never from the raw pointer.
     */
    private void checkFlag(Bridge b, Signal flag, Bridge pointer, ClockDomain side, List<Diagnostic> problems) {
        Set<String> support = combinationalSupport(flag);
        Signal synced = pointer.getLastStage();
        if (synced == null || !support.contains(synced.getName())) {
            problems.add(topology(b, flag, "flag '" + flag.getName() + "' does not compare against '"
                    + (synced == null ? pointer.getName() : synced.getName())
                    + "', the synchronized output of pointer bridge '" + pointer.getName() + "'"));
        }
        DomainTag tag = table.get(flag);
        if (!tag.isDomain(side)) {
            problems.add(topology(b, flag, "flag '" + flag.getName() + "' carries " + tag + ", not domain '"
                    + side.getQualifiedName() + "'"));
        }
    }

    /**
     * Gets the signals a flag reads through combinational logic and ports.
     */
    private Set<String> combinationalSupport(Signal flag) {
        Set<String> support = new LinkedHashSet<>();
        List<Signal> queue = new ArrayList<>();
        queue.add(flag);
        while (!queue.isEmpty()) {
            Signal s = queue.remove(queue.size() - 1);
            if (s.getExpression() == null) continue;
            for (String operand : s.getExpression().getReferencedSignals()) {
                if (support.add(operand)) {
                    Signal o = graph.getSignal(operand);
                    if (o.isCombinational() || o.getKind() == SignalKind.PORT) {
                        queue.add(o);
                    }
                }
            }
        }
        return support;
    }

    private Diagnostic topology(Bridge b, Signal related, String msg) {
        return new Diagnostic(CdcErrorCode.E_CDC_BRIDGE_TOPOLOGY, b.getLocation(), subject(b),
                related == null ? null : related.getName(), b.getSource(), b.getDestination(),
                "Bridge '" + b.getName() + "': " + msg);
    }

    private static String subject(Bridge b) {
        if (b.getProtectedSignal() != null) {
            return b.getProtectedSignal().getName();
        }
        return b.getStorageReads().isEmpty() ? null : b.getStorageReads().get(0).getName();
    }
}
