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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.clockguard.support.DesignFiles;

public class TestDataflowGraphReader {

    @ParameterizedTest
    @ValueSource(strings = {"naive_crossing.json", "two_stage_sync.json", "gray_fifo.json", "comb_cycle.json"})
    public void testReadFixtures(String name) throws IOException {
        DataflowGraph g = DataflowGraphReader.read(DesignFiles.getPath(name));
        Assertions.assertFalse(g.getSignals().isEmpty());
        Assertions.assertFalse(g.getClockPorts().isEmpty());
    }

    @Test
    public void testReadNaiveCrossing() throws IOException {
        DataflowGraph g = DataflowGraphReader.read(DesignFiles.getPath("naive_crossing.json"));
        Assertions.assertEquals("naive_crossing", g.getName());
        Assertions.assertEquals(5, g.getSignals().size());
        Signal b = g.getSignal("b");
        Assertions.assertEquals(SignalKind.SEQUENTIAL, b.getKind());
        Assertions.assertEquals("clk_b", b.getClockEdge().getClockSignal());
        Assertions.assertEquals(ClockEdge.Edge.RISING, b.getClockEdge().getEdge());
        Assertions.assertEquals(new SourceLocation("naive_crossing.v", 11, 5), b.getLocation());
        Assertions.assertEquals("A", g.getSignal("din").getDeclaredDomain());
        Assertions.assertEquals("B", g.getClockPorts().get(1).getDomainName());
        Assertions.assertEquals(g.getSignal("clk_b").getLocation(), g.getClockPorts().get(1).getLocation());
    }

    @Test
    public void testReadBridges() throws IOException {
        DataflowGraph g = DataflowGraphReader.read(DesignFiles.getPath("gray_fifo.json"));
        Assertions.assertEquals("async_fifo", g.getName());
        Assertions.assertEquals(3, g.getBridges().size());
        BridgeDeclaration pointer = g.getBridges().get(0);
        Assertions.assertEquals(SyncStrategy.GRAY_CODE_POINTER, pointer.getStrategy());
        Assertions.assertEquals(Arrays.asList("rq1_wgray", "rq2_wgray"), pointer.getChain());
        Assertions.assertEquals("rq2_wgray", pointer.getProtectedSignal());
        Assertions.assertEquals(BridgeDeclaration.DEFAULT_STAGE_COUNT, pointer.getStageCount());
        BridgeDeclaration fifo = g.getBridges().get(2);
        Assertions.assertEquals(SyncStrategy.HANDSHAKE, fifo.getStrategy());
        Assertions.assertEquals("wptr_sync", fifo.getWritePointerBridge());
        Assertions.assertEquals(Arrays.asList("rdata"), fifo.getStorageReads());
        Operation read = (Operation) g.getSignal("rdata").getExpression();
        Assertions.assertEquals(Operator.INDEX, read.getOperator());
    }

    @Test
    public void testUnitNameDefaultsToFileName(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("my_unit.json");
        Files.write(file, "{\"signals\":[{\"name\":\"x\",\"kind\":\"input\"}]}".getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals("my_unit", DataflowGraphReader.read(file).getName());
    }

    @Test
    public void testMalformedSignal() {
        DataflowGraphFormatException e = Assertions.assertThrows(DataflowGraphFormatException.class,
                () -> DataflowGraphReader.read(DesignFiles.getPath("malformed.json")));
        Assertions.assertTrue(e.getMessage().startsWith("ERROR:"));
    }

    @Test
    public void testInvalidJSON() {
        Assertions.assertThrows(DataflowGraphFormatException.class, () -> DataflowGraphReader.read("{", "broken"));
    }

    @Test
    public void testUnknownStrategy() {
        String json = "{\"signals\":[{\"name\":\"clk\",\"kind\":\"input\"},"
                + "{\"name\":\"q\",\"kind\":\"sequential\",\"clock\":\"clk\",\"expr\":0}],"
                + "\"bridges\":[{\"name\":\"s\",\"strategy\":\"triple-flop\",\"from\":\"A\",\"to\":\"B\",\"protects\":\"q\"}]}";
        DataflowGraphFormatException e = Assertions.assertThrows(DataflowGraphFormatException.class,
                () -> DataflowGraphReader.read(json, "u"));
        Assertions.assertTrue(e.getMessage().contains("triple-flop"));
    }

    @Test
    public void testExpressionForms() {
        Assertions.assertEquals(Expression.ref("a"), DataflowGraphReader.readExpression("a"));
        Assertions.assertEquals(Expression.lit(3), DataflowGraphReader.readExpression(3));
        Assertions.assertEquals(Expression.op(Operator.NOT, Expression.ref("a")),
                DataflowGraphReader.readExpression(new JSONObject("{\"op\":\"not\",\"args\":[{\"ref\":\"a\"}]}")));
    }
}
