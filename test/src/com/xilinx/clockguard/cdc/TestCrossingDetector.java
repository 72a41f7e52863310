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
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.clockguard.domain.DomainRegistry;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.Operator;
import com.xilinx.clockguard.support.DesignFixtures;

public class TestCrossingDetector {

    private static List<CrossingCandidate> detect(DataflowGraph g) {
        DomainTable table = new DomainPropagation(g, new DomainRegistry()).run(new ArrayList<>());
        return new CrossingDetector(g, table).detect();
    }

    @Test
    public void testSameDomainHasNoCandidates() {
        DataflowGraph g = DataflowGraph.builder("same")
                .clockInput("clk", "A")
                .input("d", 8, "A")
                .register("r0", 8, "clk", ref("d"))
                .combinational("sum", 8, op(Operator.ADD, ref("r0"), ref("d")))
                .register("r1", 8, "clk", op(Operator.SELECT, ref("sum"), ref("r0"), lit(0)))
                .build();
        Assertions.assertTrue(detect(g).isEmpty());
    }

    @Test
    public void testRegisterRead() {
        DataflowGraph g = DesignFixtures.naiveCrossing();
        List<CrossingCandidate> candidates = detect(g);
        Assertions.assertEquals(1, candidates.size());
        CrossingCandidate c = candidates.get(0);
        Assertions.assertEquals(CrossingCandidate.Kind.REGISTER_READ, c.getKind());
        Assertions.assertEquals("a", c.getSource().getName());
        Assertions.assertEquals("b", c.getDestination().getName());
        Assertions.assertEquals("A", c.getSourceDomain().getName());
        Assertions.assertEquals("B", c.getDestinationDomain().getName());
        Assertions.assertEquals(g.getSignal("b").getLocation(), c.getLocation());
    }

    @Test
    public void testUnconstrainedOperandIsNotACrossing() {
        DataflowGraph g = DesignFixtures.twoDomains("unconstrained")
                .input("mode", 1, null)
                .register("b", 1, "clk_b", op(Operator.AND, ref("mode"), lit(1)))
                .build();
        Assertions.assertTrue(detect(g).isEmpty());
    }

    @Test
    public void testThreeWayConflictUsesFirstOperandAsBaseline() {
        DataflowGraph g = DesignFixtures.twoDomains("three_way")
                .clockInput("clk_c", "C")
                .register("b", 1, "clk_b", lit(0))
                .register("c", 1, "clk_c", lit(0))
                .combinational("mix", 1, op(Operator.OR, op(Operator.AND, ref("b"), ref("a")), ref("c")))
                .combinational("later", 1, op(Operator.NOT, ref("mix")))
                .build();
        List<CrossingCandidate> candidates = detect(g);
        Assertions.assertEquals(2, candidates.size());
        for (CrossingCandidate c : candidates) {
            Assertions.assertEquals(CrossingCandidate.Kind.MIXED_EXPRESSION, c.getKind());
            Assertions.assertEquals("mix", c.getDestination().getName());
            Assertions.assertEquals("B", c.getDestinationDomain().getName());
        }
        Assertions.assertEquals("a", candidates.get(0).getSource().getName());
        Assertions.assertEquals("c", candidates.get(1).getSource().getName());
    }

    @Test
    public void testResolveWithoutBridgesReportsEveryCandidate() {
        DataflowGraph g = DesignFixtures.twoDomains("two_reads")
                .register("b0", 1, "clk_b", ref("a"))
                .register("b1", 1, "clk_b", op(Operator.AND, ref("a"), ref("din")))
                .build();
        DomainTable table = new DomainPropagation(g, new DomainRegistry()).run(new ArrayList<>());
        CrossingDetector detector = new CrossingDetector(g, table);
        List<Diagnostic> violations = detector.resolve(detector.detect(), new BridgeVerdictCache());
        Assertions.assertEquals(3, violations.size());
        for (Diagnostic d : violations) {
            Assertions.assertEquals(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ, d.getCode());
        }
        Assertions.assertTrue(detector.getAccepted().isEmpty());
    }
}
