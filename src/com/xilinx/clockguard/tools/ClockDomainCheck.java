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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.json.JSONArray;
import org.json.JSONObject;

import com.xilinx.clockguard.cdc.AnalysisResult;
import com.xilinx.clockguard.cdc.ClockDomainAnalysis;
import com.xilinx.clockguard.cdc.Diagnostic;
import com.xilinx.clockguard.netlist.CombinationalCycleException;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.DataflowGraphFormatException;
import com.xilinx.clockguard.netlist.DataflowGraphReader;
import com.xilinx.clockguard.util.MessageGenerator;
import com.xilinx.clockguard.util.Params;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

/**
 * Checks the clock-domain crossings of one or more elaborated units, each
 * given as a JSON dataflow graph.
 */
public class ClockDomainCheck {

    public static final int EXIT_OK = 0;

    public static final int EXIT_DIAGNOSTICS = 1;

    public static final int EXIT_BAD_INPUT = 2;

    private static final List<String> DESIGN_OPTS = Arrays.asList("d", "design");
    private static final List<String> DOMAINS_OPTS = Arrays.asList("o", "domains");
    private static final List<String> REPORT_OPTS = Arrays.asList("r", "report");
    private static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    private static void printHelp(OptionParser p) {
        MessageGenerator.printHeader(ClockDomainCheck.class.getSimpleName());
        System.out.println(
                "Infers the clock domain of every signal of each unit, verifies the declared \n"
                + "synchronizers and reports every unsafe clock-domain crossing. Exits with 0 if \n"
                + "no errors are found, 1 if there are errors and 2 if an input is malformed.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }

    /**
     * Runs the check without exiting the JVM.
     * @param args Command line arguments.
     * @return The exit status.
     */
    public static int run(String[] args) {
        OptionParser p = new OptionParser();
        OptionSpec<String> designOpt = p.acceptsAll(DESIGN_OPTS, "Dataflow graph JSON file of a unit (repeatable)")
                .withRequiredArg().describedAs("design.json");
        OptionSpec<String> domainsOpt = p.acceptsAll(DOMAINS_OPTS, "Write the inferred domain of every signal to this file")
                .withRequiredArg().describedAs("domains.json");
        OptionSpec<String> reportOpt = p.acceptsAll(REPORT_OPTS, "Write diagnostics and bridge verdicts to this file")
                .withRequiredArg().describedAs("report.json");
        p.acceptsAll(VERBOSE_OPTS, "Print timing and the inferred domains");
        p.acceptsAll(HELP_OPTS, "Print this help message").forHelp();

        OptionSet options;
        try {
            options = p.parse(args);
        } catch (OptionException e) {
            MessageGenerator.briefError(e.getMessage());
            printHelp(p);
            return EXIT_BAD_INPUT;
        }
        List<String> designFiles = new ArrayList<>(options.valuesOf(designOpt));
        for (Object extra : options.nonOptionArguments()) {
            designFiles.add(extra.toString());
        }
        if (options.has(HELP_OPTS.get(0)) || designFiles.isEmpty()) {
            printHelp(p);
            return designFiles.isEmpty() && !options.has(HELP_OPTS.get(0)) ? EXIT_BAD_INPUT : EXIT_OK;
        }
        boolean verbose = options.has(VERBOSE_OPTS.get(0)) || Params.CG_VERBOSE;

        long start = System.nanoTime();
        List<DataflowGraph> units = new ArrayList<>();
        for (String fileName : designFiles) {
            try {
                units.add(DataflowGraphReader.read(Paths.get(fileName)));
            } catch (IOException | DataflowGraphFormatException e) {
                MessageGenerator.briefError("Couldn't read design '" + fileName + "': " + e.getMessage());
                return EXIT_BAD_INPUT;
            }
        }
        if (verbose) {
            System.out.printf("%-40s %10.3fs%n", "Read " + units.size() + " unit(s)", (System.nanoTime() - start) * 1e-9);
        }

        start = System.nanoTime();
        List<AnalysisResult> results;
        try {
            results = new ClockDomainAnalysis().analyzeAll(units);
        } catch (CombinationalCycleException e) {
            MessageGenerator.briefError(e.getMessage());
            return EXIT_BAD_INPUT;
        }
        if (verbose) {
            System.out.printf("%-40s %10.3fs%n", "Clock domain analysis", (System.nanoTime() - start) * 1e-9);
        }

        int errors = 0;
        for (AnalysisResult result : results) {
            for (Diagnostic d : result.getDiagnostics()) {
                System.err.println(d);
            }
            errors += result.getDiagnostics().size();
            if (verbose) {
                System.out.print(result.getDomainTable());
            }
            System.out.println(result.getUnit() + ": " + result.getDiagnostics().size() + " error(s), "
                    + result.getAcceptedCrossings().size() + " synchronized crossing(s), "
                    + result.getBridgeVerdicts().size() + " bridge(s)");
        }

        try {
            if (options.has(domainsOpt)) {
                JSONObject domains = new JSONObject();
                for (AnalysisResult result : results) {
                    domains.put(result.getUnit(), result.getDomainTable().toJSON());
                }
                writeJSON(options.valueOf(domainsOpt), domains.toString(2));
            }
            if (options.has(reportOpt)) {
                JSONArray report = new JSONArray();
                for (AnalysisResult result : results) {
                    report.put(result.toJSON());
                }
                writeJSON(options.valueOf(reportOpt), report.toString(2));
            }
        } catch (IOException e) {
            MessageGenerator.briefError("Couldn't write output: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }
        return errors == 0 ? EXIT_OK : EXIT_DIAGNOSTICS;
    }

    private static void writeJSON(String fileName, String json) throws IOException {
        String name = FilenameUtils.getExtension(fileName).isEmpty() ? fileName + ".json" : fileName;
        FileUtils.writeStringToFile(new File(name), json, StandardCharsets.UTF_8);
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }
}
