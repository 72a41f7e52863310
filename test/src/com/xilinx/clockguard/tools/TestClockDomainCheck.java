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


package com.xilinx.clockguard.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.xilinx.clockguard.support.DesignFiles;

public class TestClockDomainCheck {

    @Test
    public void testNaiveCrossingFails() {
        Assertions.assertEquals(ClockDomainCheck.EXIT_DIAGNOSTICS,
                ClockDomainCheck.run(new String[] {"--design", DesignFiles.getString("naive_crossing.json")}));
    }

    @Test
    public void testSynchronizedDesignPasses() {
        Assertions.assertEquals(ClockDomainCheck.EXIT_OK,
                ClockDomainCheck.run(new String[] {DesignFiles.getString("two_stage_sync.json"),
                        DesignFiles.getString("gray_fifo.json")}));
    }

    @Test
    public void testMalformedInput() {
        Assertions.assertEquals(ClockDomainCheck.EXIT_BAD_INPUT,
                ClockDomainCheck.run(new String[] {"-d", DesignFiles.getString("malformed.json")}));
        Assertions.assertEquals(ClockDomainCheck.EXIT_BAD_INPUT,
                ClockDomainCheck.run(new String[] {"-d", DesignFiles.getString("comb_cycle.json")}));
    }

    @Test
    public void testMissingDesign(@TempDir Path dir) {
        Assertions.assertEquals(ClockDomainCheck.EXIT_BAD_INPUT, ClockDomainCheck.run(new String[0]));
        Assertions.assertEquals(ClockDomainCheck.EXIT_BAD_INPUT,
                ClockDomainCheck.run(new String[] {"-d", dir.resolve("absent.json").toString()}));
        Assertions.assertEquals(ClockDomainCheck.EXIT_BAD_INPUT, ClockDomainCheck.run(new String[] {"--no-such-option"}));
    }

    @Test
    public void testHelp() {
        Assertions.assertEquals(ClockDomainCheck.EXIT_OK, ClockDomainCheck.run(new String[] {"-h"}));
    }

    @Test
    public void testWritesDomainsAndReport(@TempDir Path dir) throws IOException {
        Path domains = dir.resolve("domains");
        Path report = dir.resolve("report.json");
        int status = ClockDomainCheck.run(new String[] {"-d", DesignFiles.getString("naive_crossing.json"),
                "-o", domains.toString(), "-r", report.toString()});
        Assertions.assertEquals(ClockDomainCheck.EXIT_DIAGNOSTICS, status);

        Path domainsFile = dir.resolve("domains.json");
        Assertions.assertTrue(Files.exists(domainsFile));
        JSONObject tables = new JSONObject(new String(Files.readAllBytes(domainsFile), StandardCharsets.UTF_8));
        Assertions.assertTrue(tables.has("naive_crossing"));

        JSONArray results = new JSONArray(new String(Files.readAllBytes(report), StandardCharsets.UTF_8));
        Assertions.assertEquals(1, results.length());
        JSONObject result = results.getJSONObject(0);
        Assertions.assertFalse(result.getBoolean("successful"));
        JSONObject diag = result.getJSONArray("diagnostics").getJSONObject(0);
        Assertions.assertEquals("E_CDC_UNSYNCHRONIZED_READ", diag.getString("code"));
    }
}
