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
import java.util.List;
import java.util.Map;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.domain.DomainRegistry;
import com.xilinx.clockguard.domain.DomainTag;
import com.xilinx.clockguard.domain.DuplicateDomainException;
import com.xilinx.clockguard.netlist.ClockPort;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.Signal;

/**
 * Assigns a domain tag to every signal of a unit. Clock ports are declared
 * first, then signals are labeled in topological dependency order:
 * <ul>
 * <li>an input carries its declared domain (its clock port's domain for a
 * clock), or none;</li>
 * <li>a register carries the domain of its clock, whatever its operands are;</li>
 * <li>a combinational signal carries the join of its operands' domains;</li>
 * <li>a port carries the domain of its actual, unchanged.</li>
 * </ul>
 */
public class DomainPropagation {

    private final DataflowGraph graph;

    private final DomainRegistry registry;

    /** Domain established for each clock input by its clock port */
    private final Map<Signal, ClockDomain> clockDomains = new HashMap<>();

    public DomainPropagation(DataflowGraph graph, DomainRegistry registry) {
        this.graph = graph;
        this.registry = registry;
    }

    /**
     * Declares the domains of all clock ports and labels every signal.
     * @param diagnostics Collects problems found on the way; propagation
     *                    continues past each of them.
     * @return The domain table of the unit.
     */
    public DomainTable run(List<Diagnostic> diagnostics) {
        declareClockDomains(diagnostics);
        return propagate(diagnostics);
    }

    void declareClockDomains(List<Diagnostic> diagnostics) {
        for (ClockPort port : graph.getClockPorts()) {
            Signal clk = graph.getSignal(port.getClockSignal());
            ClockDomain domain;
            try {
                domain = registry.declareDomain(port.getDomainName(), port.getScope());
            } catch (DuplicateDomainException e) {
                diagnostics.add(new Diagnostic(CdcErrorCode.E_CDC_DUPLICATE_DOMAIN, port.getLocation(),
                        clk.getName(), null, null, null,
                        "Clock domain '" + e.getDomainName() + "' is declared more than once in scope '"
                        + e.getScope() + "'"));
                // Keep the first declaration so registers on this clock are still checked
                domain = registry.lookup(port.getDomainName(), port.getScope());
            }
            ClockDomain previous = clockDomains.get(clk);
            if (previous != null && previous != domain) {
                diagnostics.add(new Diagnostic(CdcErrorCode.E_CDC_DUPLICATE_DOMAIN, port.getLocation(),
                        clk.getName(), null, previous, domain,
                        "Clock '" + clk.getName() + "' is already the clock of domain '"
                        + previous.getQualifiedName() + "'"));
                continue;
            }
            clockDomains.put(clk, domain);
        }
    }

    DomainTable propagate(List<Diagnostic> diagnostics) {
        Map<Signal, DomainTag> tags = new HashMap<>();
        for (Signal s : graph.getTopologicalOrder()) {
            DomainTag tag;
            switch (s.getKind()) {
                case INPUT:
                    tag = inputTag(s, diagnostics);
                    break;
                case SEQUENTIAL:
                    tag = registerTag(s, tags, diagnostics);
                    break;
                case PORT:
                    tag = tags.get(graph.getSignal(s.getActual()));
                    break;
                default:
                    List<DomainTag> operandTags = new ArrayList<>();
                    for (Signal operand : graph.getOperandSignals(s)) {
                        operandTags.add(tags.get(operand));
                    }
                    tag = DomainRegistry.join(operandTags);
            }
            tags.put(s, tag);
        }
        return new DomainTable(tags);
    }

    private DomainTag inputTag(Signal s, List<Diagnostic> diagnostics) {
        ClockDomain clockDomain = clockDomains.get(s);
        if (clockDomain != null) {
            return DomainTag.of(clockDomain);
        }
        if (s.getDeclaredDomain() == null) {
            return DomainTag.UNCONSTRAINED;
        }
        ClockDomain declared = resolveDeclared(s, diagnostics);
        return declared == null ? DomainTag.UNCONSTRAINED : DomainTag.of(declared);
    }

    private DomainTag registerTag(Signal s, Map<Signal, DomainTag> tags, List<Diagnostic> diagnostics) {
        Signal clk = graph.getClockSignal(s);
        DomainTag clockTag = tags.get(clk);
        if (!clockTag.isConstrained()) {
            diagnostics.add(new Diagnostic(CdcErrorCode.E_CDC_UNDECLARED_CLOCK, s.getLocation(), s.getName(),
                    clk.getName(), null, null,
                    "Register '" + s.getName() + "' is clocked by '" + clk.getName() + "', which "
                    + (clockTag.isConflict() ? "mixes the domains " + clockTag.getDomains() : "belongs to no clock domain")));
            return DomainTag.UNCONSTRAINED;
        }
        if (s.getDeclaredDomain() != null) {
            ClockDomain declared = resolveDeclared(s, diagnostics);
            if (declared != null && declared != clockTag.getDomain()) {
                diagnostics.add(new Diagnostic(CdcErrorCode.E_CDC_DECLARED_DOMAIN_MISMATCH, s.getLocation(),
                        s.getName(), clk.getName(), declared, clockTag.getDomain(),
                        "Register '" + s.getName() + "' is declared in domain '" + declared.getQualifiedName()
                        + "' but clocked by '" + clk.getName() + "' of domain '"
                        + clockTag.getDomain().getQualifiedName() + "'"));
            }
        }
        // The clock is authoritative for a register
        return clockTag;
    }

    private ClockDomain resolveDeclared(Signal s, List<Diagnostic> diagnostics) {
        ClockDomain d = registry.lookup(s.getDeclaredDomain(), s.getScope());
        if (d == null) {
            diagnostics.add(new Diagnostic(CdcErrorCode.E_CDC_UNKNOWN_DOMAIN, s.getLocation(), s.getName(), null,
                    null, null, "Signal '" + s.getName() + "' names domain '" + s.getDeclaredDomain()
                    + "', which is not declared in scope '" + s.getScope() + "'"));
        }
        return d;
    }
}
