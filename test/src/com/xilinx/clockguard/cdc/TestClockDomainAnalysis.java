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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.clockguard.netlist.BridgeDeclaration;
import com.xilinx.clockguard.netlist.CombinationalCycleException;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.DataflowGraphReader;
import com.xilinx.clockguard.netlist.Operator;
import com.xilinx.clockguard.netlist.SyncStrategy;
import com.xilinx.clockguard.support.DesignFiles;
import com.xilinx.clockguard.support.DesignFixtures;
import com.xilinx.clockguard.util.ParallelismTools;

public class TestClockDomainAnalysis {

    private static AnalysisResult analyze(DataflowGraph g) {
        return new ClockDomainAnalysis(16).analyze(g);
    }

    @Test
    public void testSameDomainDesignIsClean() {
        DataflowGraph g = DataflowGraph.builder("single")
                .clockInput("clk", "A")
                .input("en", 1, "A")
                .register("cnt", 8, "clk", op(Operator.SELECT, ref("en"), op(Operator.ADD, ref("cnt"), lit(1)), ref("cnt")))
                .combinational("wrap", 1, op(Operator.EQ, ref("cnt"), lit(255)))
                .register("flag", 1, "clk", ref("wrap"))
                .build();
        AnalysisResult result = analyze(g);
        Assertions.assertTrue(result.isSuccessful(), result.getDiagnostics().toString());
        Assertions.assertEquals(1, result.getDomains().size());
        result.throwIfFailed();
    }

    @Test
    public void testNaiveCrossing() {
        AnalysisResult result = analyze(DesignFixtures.naiveCrossing());
        Assertions.assertEquals(1, result.getDiagnostics().size());
        Diagnostic d = result.getDiagnostics().get(0);
        Assertions.assertEquals(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ, d.getCode());
        Assertions.assertEquals("b", d.getSignal());
        Assertions.assertEquals("a", d.getRelatedSignal());
        Assertions.assertEquals("A", d.getSourceDomain());
        Assertions.assertEquals("B", d.getDestinationDomain());
        Assertions.assertFalse(d.getRemediation().isEmpty());
        Assertions.assertTrue(d.toString().startsWith("ERROR: [E_CDC_UNSYNCHRONIZED_READ]"));
    }

    @Test
    public void testTwoStageBridgeAccepted() {
        AnalysisResult result = analyze(DesignFixtures.doubleRegister(2, 2));
        Assertions.assertTrue(result.isSuccessful(), result.getDiagnostics().toString());
        Assertions.assertEquals(1, result.getAcceptedCrossings().size());
        AcceptedCrossing c = result.getAcceptedCrossings().get(0);
        Assertions.assertEquals("sync", c.getBridge().getName());
        Assertions.assertEquals("s1", c.getCandidate().getDestination().getName());
        Assertions.assertTrue(result.getBridgeVerdicts().get(0).isValid());
    }

    @Test
    public void testShortChainRejected() {
        AnalysisResult result = analyze(DesignFixtures.doubleRegister(1, 2));
        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertEquals(1, result.getDiagnostics(CdcErrorCode.E_CDC_BRIDGE_TOPOLOGY).size());
        Assertions.assertEquals(1, result.getDiagnostics(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ).size());
        Assertions.assertTrue(result.getAcceptedCrossings().isEmpty());
    }

    @Test
    public void testDuplicateClaimsReportedOnce() {
        DataflowGraph g = DesignFixtures.twoDomains("twice")
                .register("s1", 1, "clk_b", ref("a"))
                .bridge(BridgeDeclaration.builder("u_sync", SyncStrategy.DOUBLE_REGISTER).domains("A", "B")
                        .origin(BridgeDeclaration.Origin.INSTANCE).protects("s1").build())
                .bridge(BridgeDeclaration.builder("s1_note", SyncStrategy.DOUBLE_REGISTER).domains("A", "B")
                        .origin(BridgeDeclaration.Origin.ANNOTATION).protects("s1").build())
                .build();
        AnalysisResult result = analyze(g);
        Assertions.assertEquals(1, result.getBridgeVerdicts().size());
        Assertions.assertEquals(1, result.getDiagnostics(CdcErrorCode.E_CDC_BRIDGE_TOPOLOGY).size());
        Assertions.assertEquals(1, result.getDiagnostics(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ).size());
    }

    @Test
    public void testGrayPointerBridge() {
        AnalysisResult ok = analyze(DesignFixtures.grayPointer(5, 1, DesignFixtures.canonicalGray("p")));
        Assertions.assertTrue(ok.isSuccessful(), ok.getDiagnostics().toString());
        Assertions.assertEquals(1, ok.getAcceptedCrossings().size());

        AnalysisResult jump = analyze(DesignFixtures.grayPointer(5, 2, DesignFixtures.canonicalGray("p")));
        Assertions.assertEquals(1, jump.getDiagnostics(CdcErrorCode.E_CDC_ENCODING_INVARIANT).size());
        Assertions.assertEquals(1, jump.getDiagnostics(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ).size());
    }

    @Test
    public void testMixedDomainExpression() {
        DataflowGraph g = DesignFixtures.twoDomains("mixed")
                .register("b", 1, "clk_b", lit(1))
                .combinational("both", 1, op(Operator.AND, ref("b"), ref("a")))
                .register("out", 1, "clk_b", ref("both"))
                .build();
        AnalysisResult result = analyze(g);
        Assertions.assertEquals(1, result.getDiagnostics().size());
        Diagnostic d = result.getDiagnostics().get(0);
        Assertions.assertEquals(CdcErrorCode.E_CDC_MIXED_DOMAIN_EXPRESSION, d.getCode());
        Assertions.assertEquals("both", d.getSignal());
        Assertions.assertEquals("a", d.getRelatedSignal());
        Assertions.assertEquals("B", d.getDestinationDomain());
    }

    @Test
    public void testUnconstrainedValuesNeverCross() {
        DataflowGraph g = DesignFixtures.twoDomains("constants")
                .input("mode", 2, null)
                .combinational("cfg", 2, op(Operator.XOR, ref("mode"), lit(3)))
                .register("b", 2, "clk_b", ref("cfg"))
                .register("a2", 2, "clk_a", ref("cfg"))
                .build();
        AnalysisResult result = analyze(g);
        Assertions.assertTrue(result.isSuccessful(), result.getDiagnostics().toString());
        Assertions.assertTrue(result.getDomainTable().get("cfg").isUnconstrained());
        Assertions.assertEquals(g.getSignals().size(), result.getDomainTable().asMap().size());
    }

    @Test
    public void testScopedDomainsCross() {
        DataflowGraph g = DataflowGraph.builder("scoped")
                .clockInput("u0/clk", "sys")
                .clockInput("u1/clk", "sys")
                .input("u0/d", 1, "sys")
                .register("u0/r", 1, "u0/clk", ref("u0/d"))
                .register("u1/r", 1, "u1/clk", ref("u0/r"))
                .build();
        AnalysisResult result = analyze(g);
        Assertions.assertEquals(1, result.getDiagnostics().size());
        Assertions.assertEquals("u0:sys", result.getDiagnostics().get(0).getSourceDomain());
        Assertions.assertEquals("u1:sys", result.getDiagnostics().get(0).getDestinationDomain());
    }

    @Test
    public void testAsyncFifo() throws IOException {
        AnalysisResult fromCode = analyze(DesignFixtures.asyncFifo(false));
        Assertions.assertTrue(fromCode.isSuccessful(), fromCode.getDiagnostics().toString());
        Assertions.assertEquals(3, fromCode.getAcceptedCrossings().size());

        AnalysisResult fromFile = analyze(DataflowGraphReader.read(DesignFiles.getPath("gray_fifo.json")));
        Assertions.assertTrue(fromFile.isSuccessful(), fromFile.getDiagnostics().toString());
        Assertions.assertEquals(3, fromFile.getBridgeVerdicts().size());
    }

    @Test
    public void testAsyncFifoCombinationalRead() {
        AnalysisResult result = analyze(DesignFixtures.asyncFifo(false, false).build());
        Assertions.assertTrue(result.isSuccessful(), result.getDiagnostics().toString());
        Assertions.assertEquals(3, result.getAcceptedCrossings().size());
        Assertions.assertTrue(result.getDomainTable().get("rdata").isConflict());

        AnalysisResult unsafe = analyze(DesignFixtures.asyncFifo(true, false).build());
        Assertions.assertEquals(1, unsafe.getDiagnostics(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ).size());
        Assertions.assertTrue(unsafe.getDiagnostics(CdcErrorCode.E_CDC_MIXED_DOMAIN_EXPRESSION).isEmpty());
    }

    @Test
    public void testRedundantClaimsOnCompliantDesign() {
        DataflowGraph chain = DesignFixtures.doubleRegister(2, 2);
        DataflowGraph chainDecorated = DesignFixtures.twoDomains("double_register")
                .register("s1", 1, "clk_b", ref("a"))
                .register("s2", 1, "clk_b", ref("s1"))
                .combinational("b", 1, op(Operator.NOT, ref("s2")))
                .bridge(BridgeDeclaration.builder("sync", SyncStrategy.DOUBLE_REGISTER).domains("A", "B")
                        .protects("s2").build())
                .bridge(BridgeDeclaration.builder("u_sync", SyncStrategy.DOUBLE_REGISTER).domains("A", "B")
                        .origin(BridgeDeclaration.Origin.INSTANCE).chain("s1", "s2").build())
                .bridge(BridgeDeclaration.builder("s2_note", SyncStrategy.DOUBLE_REGISTER).domains("A", "B")
                        .origin(BridgeDeclaration.Origin.ANNOTATION).protects("s2").entry("a").build())
                .build();
        DataflowGraph fifo = DesignFixtures.asyncFifo(false);
        DataflowGraph fifoDecorated = DesignFixtures.asyncFifo(false, true)
                .bridge(BridgeDeclaration.builder("wptr_note", SyncStrategy.GRAY_CODE_POINTER).domains("W", "R")
                        .origin(BridgeDeclaration.Origin.ANNOTATION).chain("rq1_wgray", "rq2_wgray").build())
                .bridge(BridgeDeclaration.builder("u_fifo", SyncStrategy.HANDSHAKE).domains("W", "R")
                        .origin(BridgeDeclaration.Origin.INSTANCE).pointerBridges("wptr_sync", "rptr_sync")
                        .storage("mem", "rdata").flags("empty", "full").build())
                .build();

        for (DataflowGraph[] pair : new DataflowGraph[][] {{chain, chainDecorated}, {fifo, fifoDecorated}}) {
            AnalysisResult plain = analyze(pair[0]);
            AnalysisResult decorated = analyze(pair[1]);
            Assertions.assertTrue(plain.getDiagnostics().isEmpty(), plain.getDiagnostics().toString());
            Assertions.assertEquals(plain.getDiagnostics(), decorated.getDiagnostics());
            Assertions.assertEquals(plain.getAcceptedCrossings().size(), decorated.getAcceptedCrossings().size());
            Assertions.assertEquals(plain.getBridgeVerdicts().size(), decorated.getBridgeVerdicts().size());
        }
    }

    @Test
    public void testAsyncFifoUnsynchronizedStorageRead() {
        AnalysisResult result = analyze(DesignFixtures.asyncFifo(true));
        Assertions.assertFalse(result.isSuccessful());
        List<Diagnostic> reads = result.getDiagnostics(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ);
        Assertions.assertTrue(reads.stream().anyMatch(d -> "mem".equals(d.getRelatedSignal())));
        Assertions.assertTrue(reads.stream().anyMatch(d -> "raddr".equals(d.getRelatedSignal())));
    }

    @Test
    public void testUnknownBridgeDomain() {
        DataflowGraph g = DesignFixtures.twoDomains("unknown")
                .register("s1", 1, "clk_b", ref("a"))
                .register("s2", 1, "clk_b", ref("s1"))
                .bridge(BridgeDeclaration.builder("sync", SyncStrategy.DOUBLE_REGISTER)
                        .domains("A", "Q").protects("s2").build())
                .build();
        AnalysisResult result = analyze(g);
        Assertions.assertEquals(1, result.getDiagnostics(CdcErrorCode.E_CDC_UNKNOWN_DOMAIN).size());
        Assertions.assertEquals(1, result.getDiagnostics(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ).size());
        Assertions.assertTrue(result.getBridgeVerdicts().isEmpty());
    }

    @Test
    public void testDeterministic() {
        DataflowGraph g = DesignFixtures.asyncFifo(true);
        AnalysisResult first = analyze(g);
        AnalysisResult second = analyze(g);
        Assertions.assertEquals(first.getDiagnostics(), second.getDiagnostics());
        Assertions.assertEquals(first.getDomainTable().toJSON().toString(), second.getDomainTable().toJSON().toString());
        Assertions.assertEquals(first.toJSON().toString(), second.toJSON().toString());

        List<Diagnostic> sorted = new ArrayList<>(first.getDiagnostics());
        sorted.sort(null);
        Assertions.assertEquals(sorted, first.getDiagnostics());
    }

    @Test
    public void testThrowIfFailed() {
        AnalysisResult result = analyze(DesignFixtures.naiveCrossing());
        ClockDomainCrossingException e = Assertions.assertThrows(ClockDomainCrossingException.class,
                result::throwIfFailed);
        Assertions.assertEquals("naive", e.getUnit());
        Assertions.assertEquals(result.getDiagnostics(), e.getDiagnostics());
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: 1 clock domain error(s)"));
    }

    @Test
    public void testCombinationalCycle() throws IOException {
        DataflowGraph g = DataflowGraphReader.read(DesignFiles.getPath("comb_cycle.json"));
        Assertions.assertThrows(CombinationalCycleException.class, () -> analyze(g));
    }

    @Test
    public void testReportJSON() {
        JSONObject report = analyze(DesignFixtures.doubleRegister(1, 2)).toJSON();
        Assertions.assertEquals("double_register", report.getString("unit"));
        Assertions.assertFalse(report.getBoolean("successful"));
        Assertions.assertEquals(2, report.getJSONArray("diagnostics").length());
        JSONObject bridge = report.getJSONArray("bridges").getJSONObject(0);
        Assertions.assertFalse(bridge.getBoolean("valid"));
        Assertions.assertEquals("ANNOTATION", bridge.getString("origin"));
    }

    @Test
    public void testParallelMatchesSequential() {
        List<DataflowGraph> units = Arrays.asList(DesignFixtures.naiveCrossing(), DesignFixtures.doubleRegister(2, 2),
                DesignFixtures.asyncFifo(true), DesignFixtures.asyncFifo(false),
                DesignFixtures.grayPointer(6, 2, DesignFixtures.canonicalGray("p")));
        boolean saved = ParallelismTools.getParallel();
        try {
            ParallelismTools.setParallel(false);
            List<AnalysisResult> sequential = new ClockDomainAnalysis(16).analyzeAll(units);
            ParallelismTools.setParallel(true);
            List<AnalysisResult> parallel = new ClockDomainAnalysis(16).analyzeAll(units);
            Assertions.assertEquals(units.size(), parallel.size());
            for (int i = 0; i < units.size(); i++) {
                Assertions.assertEquals(units.get(i).getName(), parallel.get(i).getUnit());
                Assertions.assertEquals(sequential.get(i).toJSON().toString(), parallel.get(i).toJSON().toString());
            }
        } finally {
            ParallelismTools.setParallel(saved);
        }
    }
}
