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
import java.util.List;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.domain.DomainRegistry;
import com.xilinx.clockguard.netlist.BridgeDeclaration;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.Expression;
import com.xilinx.clockguard.netlist.Signal;
import com.xilinx.clockguard.netlist.SignalRef;
import com.xilinx.clockguard.netlist.SourceLocation;
import com.xilinx.clockguard.netlist.SyncStrategy;

/**
 * Binds the bridge declarations of a unit to its domains and signals. Chains
 * that are not spelled out are recovered by walking back from the protected
 * signal through plain register-to-register copies.
 */
public class BridgeResolver {

    private final DataflowGraph graph;

    private final DomainRegistry registry;

    private final DomainTable table;

    public BridgeResolver(DataflowGraph graph, DomainRegistry registry, DomainTable table) {
        this.graph = graph;
        this.registry = registry;
        this.table = table;
    }

    /**
     * Resolves every bridge declaration of the unit, in declaration order.
     * Declarations naming an unknown domain are reported and dropped.
     * @param diagnostics Receives {@link CdcErrorCode#E_CDC_UNKNOWN_DOMAIN} errors.
     * @return The resolved bridges.
     */
    public List<Bridge> resolve(List<Diagnostic> diagnostics) {
        List<Bridge> bridges = new ArrayList<>();
        for (BridgeDeclaration decl : graph.getBridges()) {
            Bridge b = resolve(decl, diagnostics);
            if (b != null) {
                bridges.add(b);
            }
        }
        return bridges;
    }

    Bridge resolve(BridgeDeclaration decl, List<Diagnostic> diagnostics) {
        ClockDomain src = lookup(decl, decl.getSourceDomain(), diagnostics);
        ClockDomain dst = lookup(decl, decl.getDestinationDomain(), diagnostics);
        if (src == null || dst == null) {
            return null;
        }
        Signal protectedSignal = signal(decl.getProtectedSignal());
        if (decl.getStrategy() == SyncStrategy.HANDSHAKE) {
            List<Signal> reads = new ArrayList<>();
            for (String r : decl.getStorageReads()) {
                reads.add(signal(r));
            }
            return new Bridge(decl, src, dst, Collections.emptyList(), null, protectedSignal,
                    signal(decl.getStorage()), reads, signal(decl.getEmptyFlag()), signal(decl.getFullFlag()));
        }

        List<Signal> chain = new ArrayList<>();
        Signal entry;
        if (!decl.getChain().isEmpty()) {
            for (String stage : decl.getChain()) {
                chain.add(signal(stage));
            }
            entry = directSource(chain.get(0));
        } else {
            entry = recoverChain(protectedSignal, decl.getStageCount(), dst, chain);
        }
        if (decl.getEntry() != null) {
            entry = signal(decl.getEntry());
        }
        return new Bridge(decl, src, dst, chain, entry, protectedSignal, null, Collections.emptyList(), null, null);
    }

    /**
     * Walks back from the last stage while the signals are registers of the
     * destination domain that copy another signal unchanged.
     * @param last       The protected signal.
     * @param stageCount Maximum number of stages to collect.
     * @param dst        Destination domain.
     * @param chain      Receives the stages found, first stage first.
     * @return The signal read by the earliest stage, or null if that stage
     *         reads more than a single signal.
     */
    private Signal recoverChain(Signal last, int stageCount, ClockDomain dst, List<Signal> chain) {
        Signal current = last;
        while (chain.size() < stageCount && current != null && current.isSequential()
                && table.get(current).isDomain(dst)) {
            chain.add(0, current);
            current = directSource(current);
        }
        if (chain.isEmpty()) {
            // Nothing matched: keep the protected signal so its shape gets reported
            chain.add(last);
            return directSource(last);
        }
        return current;
    }

    private Signal directSource(Signal stage) {
        Expression e = stage.getExpression();
        return e instanceof SignalRef ? graph.getSignal(((SignalRef) e).getSignalName()) : null;
    }

    private Signal signal(String name) {
        return name == null ? null : graph.getSignal(name);
    }

    private ClockDomain lookup(BridgeDeclaration decl, String domainName, List<Diagnostic> diagnostics) {
        ClockDomain d = registry.lookup(domainName, decl.getScope());
        if (d == null) {
            diagnostics.add(new Diagnostic(CdcErrorCode.E_CDC_UNKNOWN_DOMAIN, decl.getLocation().isUnknown()
                    ? locationOf(decl) : decl.getLocation(), decl.getProtectedSignal(), null, null, null,
                    "Bridge '" + decl.getName() + "' names domain '" + domainName
                    + "', which is not declared in scope '" + decl.getScope() + "'"));
        }
        return d;
    }

    private SourceLocation locationOf(BridgeDeclaration decl) {
        Signal s = signal(decl.getProtectedSignal());
        return s == null ? decl.getLocation() : s.getLocation();
    }
}
