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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import com.xilinx.clockguard.domain.DomainRegistry;
import com.xilinx.clockguard.netlist.CombinationalCycleException;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.util.ParallelismTools;
import com.xilinx.clockguard.util.Params;

/**
 * Clock-domain crossing check of elaborated compilation units. For each unit:
 * domains are declared and propagated, bridge claims are verified, and every
 * crossing not covered by a valid bridge is reported. Units are independent
 * and may be analyzed in parallel.
 */
public class ClockDomainAnalysis {

    private final int maxEnumerationWidth;

    public ClockDomainAnalysis() {
        this(Params.CG_MAX_ENUMERATION_WIDTH);
    }

    /**
     * @param maxEnumerationWidth Widest pointer counter whose encoding is
     *                            checked by trying every value.
     */
    public ClockDomainAnalysis(int maxEnumerationWidth) {
        this.maxEnumerationWidth = maxEnumerationWidth;
    }

    /**
     * Analyzes one unit. The graph is not modified.
     * @param graph The elaborated unit.
     * @return Domains, verdicts and diagnostics of the unit.
     * @throws CombinationalCycleException if the unit has combinational feedback.
     */
    public AnalysisResult analyze(DataflowGraph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        DomainRegistry registry = new DomainRegistry();
        DomainTable table = new DomainPropagation(graph, registry).run(diagnostics);

        List<Bridge> bridges = new BridgeResolver(graph, registry, table).resolve(diagnostics);
        SynchronizerVerifier verifier = new SynchronizerVerifier(graph, table, bridges, maxEnumerationWidth);
        BridgeVerdictCache cache = verifier.verifyAll();
        Set<BridgeVerdict> verdicts = new LinkedHashSet<>();
        for (Bridge b : bridges) {
            verdicts.add(cache.get(b));
        }
        for (BridgeVerdict v : verdicts) {
            diagnostics.addAll(v.getProblems());
        }

        CrossingDetector detector = new CrossingDetector(graph, table);
        diagnostics.addAll(detector.resolve(detector.detect(), cache));

        List<Diagnostic> sorted = diagnostics.stream().sorted().distinct().collect(Collectors.toList());
        return new AnalysisResult(graph.getName(), registry.getDomains(), table, sorted,
                detector.getAccepted(), new ArrayList<>(verdicts));
    }

    /**
     * Analyzes several units, in parallel unless CG_PARALLEL=0.
     * @param units The units to check.
     * @return One result per unit, in the order of the units.
     */
    public List<AnalysisResult> analyzeAll(List<DataflowGraph> units) {
        List<Callable<AnalysisResult>> tasks = new ArrayList<>(units.size());
        for (DataflowGraph unit : units) {
            tasks.add(() -> analyze(unit));
        }
        return ParallelismTools.invokeAll(tasks);
    }
}
