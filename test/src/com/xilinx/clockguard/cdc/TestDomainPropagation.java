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

import static com.xilinx.clockguard.netlist.Expression.lit;
import static com.xilinx.clockguard.netlist.Expression.op;
import static com.xilinx.clockguard.netlist.Expression.ref;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.domain.DomainRegistry;
import com.xilinx.clockguard.domain.DomainTag;
import com.xilinx.clockguard.netlist.ClockEdge;
import com.xilinx.clockguard.netlist.ClockPort;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.Operator;
import com.xilinx.clockguard.netlist.Signal;
import com.xilinx.clockguard.netlist.SignalKind;
import com.xilinx.clockguard.support.DesignFixtures;

public class TestDomainPropagation {

    private List<Diagnostic> diagnostics;

    private DomainTable propagate(DataflowGraph g) {
        diagnostics = new ArrayList<>();
        return new DomainPropagation(g, new DomainRegistry()).run(diagnostics);
    }

    private List<CdcErrorCode> codes() {
        return diagnostics.stream().map(Diagnostic::getCode).collect(Collectors.toList());
    }

    @Test
    public void testRegisterTakesClockDomain() {
        DataflowGraph g = DesignFixtures.naiveCrossing();
        DomainTable table = propagate(g);
        Assertions.assertTrue(diagnostics.isEmpty());
        Assertions.assertEquals("A", table.getDomain(g.getSignal("a")).getName());
        // 'b' reads an A value but is clocked in B
        Assertions.assertEquals("B", table.getDomain(g.getSignal("b")).getName());
        Assertions.assertEquals("A", table.get("din").toString());
        Assertions.assertEquals(g.getSignals().size(), table.size());
    }

    @Test
    public void testCombinationalJoin() {
        DataflowGraph g = DesignFixtures.twoDomains("join")
                .input("cfg", 1, null)
                .combinational("k", 1, op(Operator.AND, ref("cfg"), lit(1)))
                .combinational("x", 1, op(Operator.OR, ref("k"), ref("a")))
                .register("b", 1, "clk_b", ref("din"))
                .combinational("mix", 1, op(Operator.XOR, ref("x"), ref("b")))
                .build();
        DomainTable table = propagate(g);
        Assertions.assertTrue(table.get("cfg").isUnconstrained());
        Assertions.assertTrue(table.get("k").isUnconstrained());
        Assertions.assertEquals("A", table.get("x").toString());
        DomainTag mix = table.get("mix");
        Assertions.assertTrue(mix.isConflict());
        Assertions.assertEquals(Arrays.asList("A", "B"),
                mix.getDomains().stream().map(ClockDomain::getName).collect(Collectors.toList()));
        Assertions.assertTrue(diagnostics.isEmpty());
    }

    @Test
    public void testPortCarriesActualDomain() {
        DataflowGraph g = DesignFixtures.twoDomains("ports")
                .port("u_sub/d", 1, "a")
                .register("u_sub/q", 1, "clk_a", ref("u_sub/d"))
                .port("q_out", 1, "u_sub/q")
                .combinational("mix", 1, op(Operator.AND, ref("a"), ref("clk_b")))
                .port("u_sub/m", 1, "mix")
                .build();
        DomainTable table = propagate(g);
        Assertions.assertEquals("A", table.get("u_sub/d").toString());
        Assertions.assertEquals("A", table.get("q_out").toString());
        Assertions.assertTrue(table.get("u_sub/m").isConflict());
        Assertions.assertEquals(table.get("mix"), table.get("u_sub/m"));
    }

    @Test
    public void testDuplicateDomainKeepsFirstDeclaration() {
        DataflowGraph g = DataflowGraph.builder("dup")
                .clockInput("clk0", "sys")
                .clockInput("clk1", "sys")
                .input("d", 1, null)
                .register("r0", 1, "clk0", ref("d"))
                .register("r1", 1, "clk1", ref("d"))
                .build();
        DomainTable table = propagate(g);
        Assertions.assertEquals(Arrays.asList(CdcErrorCode.E_CDC_DUPLICATE_DOMAIN), codes());
        Assertions.assertEquals("clk1", diagnostics.get(0).getSignal());
        Assertions.assertSame(table.getDomain(g.getSignal("r0")), table.getDomain(g.getSignal("r1")));
    }

    @Test
    public void testSameClockDeclaredTwice() {
        DataflowGraph g = DataflowGraph.builder("twice")
                .clockInput("clk", "A")
                .clockPort(new ClockPort("B", "", "clk", null))
                .register("r", 1, "clk", lit(0))
                .build();
        DomainTable table = propagate(g);
        Assertions.assertEquals(Arrays.asList(CdcErrorCode.E_CDC_DUPLICATE_DOMAIN), codes());
        Assertions.assertEquals("A", table.get("r").toString());
    }

    @Test
    public void testScopedDomainsAreDistinct() {
        DataflowGraph g = DataflowGraph.builder("scoped")
                .clockInput("u0/clk", "sys")
                .clockInput("u1/clk", "sys")
                .input("u0/d", 1, "sys")
                .register("u0/r", 1, "u0/clk", ref("u0/d"))
                .register("u1/r", 1, "u1/clk", ref("u0/r"))
                .build();
        DomainTable table = propagate(g);
        Assertions.assertTrue(diagnostics.isEmpty());
        ClockDomain d0 = table.getDomain(g.getSignal("u0/r"));
        ClockDomain d1 = table.getDomain(g.getSignal("u1/r"));
        Assertions.assertNotSame(d0, d1);
        Assertions.assertEquals("u0:sys", d0.getQualifiedName());
        Assertions.assertEquals("u1:sys", d1.getQualifiedName());
        Assertions.assertSame(d0, table.getDomain(g.getSignal("u0/d")));
    }

    @Test
    public void testUndeclaredClock() {
        DataflowGraph g = DataflowGraph.builder("undeclared")
                .input("clk", 1, null)
                .input("d", 1, null)
                .register("r", 1, "clk", ref("d"))
                .build();
        DomainTable table = propagate(g);
        Assertions.assertEquals(Arrays.asList(CdcErrorCode.E_CDC_UNDECLARED_CLOCK), codes());
        Assertions.assertTrue(table.get("r").isUnconstrained());
    }

    @Test
    public void testDeclaredDomainMismatch() {
        DataflowGraph g = DesignFixtures.twoDomains("mismatch")
                .signal(Signal.builder("r").kind(SignalKind.SEQUENTIAL).domain("A")
                        .clock(ClockEdge.rising("clk_b")).expression(lit(1)))
                .build();
        DomainTable table = propagate(g);
        Assertions.assertEquals(Arrays.asList(CdcErrorCode.E_CDC_DECLARED_DOMAIN_MISMATCH), codes());
        Assertions.assertEquals("B", table.get("r").toString());
    }

    @Test
    public void testUnknownDeclaredDomain() {
        DataflowGraph g = DataflowGraph.builder("unknown")
                .clockInput("clk", "A")
                .input("d", 1, "Z")
                .build();
        DomainTable table = propagate(g);
        Assertions.assertEquals(Arrays.asList(CdcErrorCode.E_CDC_UNKNOWN_DOMAIN), codes());
        Assertions.assertTrue(table.get("d").isUnconstrained());
    }

    @Test
    public void testDomainTableJSON() {
        DataflowGraph g = DesignFixtures.twoDomains("json")
                .input("cfg", 1, null)
                .combinational("mix", 1, op(Operator.AND, ref("a"), ref("clk_b")))
                .build();
        JSONObject o = propagate(g).toJSON();
        Assertions.assertEquals("A", o.getString("a"));
        Assertions.assertEquals("unconstrained", o.getString("cfg"));
        Assertions.assertEquals(2, o.getJSONArray("mix").length());
    }
}
