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
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads a compilation unit's dataflow graph from the JSON hand-off format of
 * the front end:
 *
 * <pre>
 * {
 *   "unit": "top",
 *   "clocks":  [ {"domain": "a", "signal": "top/clk_a"} ],
 *   "signals": [ {"name": "top/q", "kind": "SEQUENTIAL", "width": 1,
 *                 "clock": "top/clk_a", "expr": {"op": "NOT", "args": ["top/q"]},
 *                 "loc": {"file": "top.hdl", "line": 3, "column": 5}} ],
 *   "bridges": [ {"name": "s0", "strategy": "double-register", "from": "a", "to": "b",
 *                 "chain": ["top/s1", "top/s2"], "entry": "top/q"} ]
 * }
 * </pre>
 *
 * In expressions, a bare string is a signal reference and a bare number a
 * literal; otherwise objects with "ref", "lit" or "op"/"args" are used.
 */
public class DataflowGraphReader {

    public static DataflowGraph read(Path path) throws IOException {
        String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return read(json, FilenameUtils.getBaseName(path.toString()));
    }

    public static DataflowGraph read(InputStream in, String defaultUnitName) throws IOException {
        return read(IOUtils.toString(in, StandardCharsets.UTF_8), defaultUnitName);
    }

    /**
     * Parses a unit from JSON text.
     * @param json            The serialized graph.
     * @param defaultUnitName Unit name to use if the document has no "unit" entry.
     * @return The graph.
     * @throws DataflowGraphFormatException if the document is malformed.
     */
    public static DataflowGraph read(String json, String defaultUnitName) {
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new DataflowGraphFormatException("ERROR: Unit '" + defaultUnitName + "' is not valid JSON: " + e.getMessage(), e);
        }
        return fromJSON(root, defaultUnitName);
    }

    public static DataflowGraph fromJSON(JSONObject root, String defaultUnitName) {
        String unit = root.optString("unit", defaultUnitName);
        DataflowGraph.Builder builder = DataflowGraph.builder(unit);
        String element = "unit '" + unit + "'";
        try {
            JSONArray signals = root.optJSONArray("signals");
            if (signals != null) {
                for (int i = 0; i < signals.length(); i++) {
                    element = "signal #" + i + " of unit '" + unit + "'";
                    builder.signal(readSignal(signals.getJSONObject(i)));
                }
            }
            JSONArray clocks = root.optJSONArray("clocks");
            if (clocks != null) {
                for (int i = 0; i < clocks.length(); i++) {
                    element = "clock #" + i + " of unit '" + unit + "'";
                    JSONObject c = clocks.getJSONObject(i);
                    String signal = c.getString("signal");
                    builder.clockPort(new ClockPort(c.getString("domain"),
                            c.optString("scope", Signal.parentScope(signal)), signal, readLocation(c)));
                }
            }
            JSONArray bridges = root.optJSONArray("bridges");
            if (bridges != null) {
                for (int i = 0; i < bridges.length(); i++) {
                    element = "bridge #" + i + " of unit '" + unit + "'";
                    builder.bridge(readBridge(bridges.getJSONObject(i)));
                }
            }
            element = "unit '" + unit + "'";
            return builder.build();
        } catch (JSONException | IllegalArgumentException e) {
            throw new DataflowGraphFormatException("ERROR: Malformed " + element + ": " + e.getMessage(), e);
        }
    }

    private static Signal.Builder readSignal(JSONObject s) {
        Signal.Builder b = Signal.builder(s.getString("name"))
                .kind(readEnum(SignalKind.class, s.optString("kind", SignalKind.COMBINATIONAL.name())))
                .width(s.optInt("width", 1))
                .location(readLocation(s));
        if (s.has("scope")) {
            b.scope(s.getString("scope"));
        }
        if (s.has("domain")) {
            b.domain(s.getString("domain"));
        }
        if (s.has("expr")) {
            b.expression(readExpression(s.get("expr")));
        }
        if (s.has("clock")) {
            Object clk = s.get("clock");
            if (clk instanceof JSONObject) {
                JSONObject c = (JSONObject) clk;
                b.clock(new ClockEdge(c.getString("signal"),
                        readEnum(ClockEdge.Edge.class, c.optString("edge", ClockEdge.Edge.RISING.name()))));
            } else {
                b.clock(ClockEdge.rising(clk.toString()));
            }
        }
        return b;
    }

    static Expression readExpression(Object o) {
        if (o instanceof String) {
            return Expression.ref((String) o);
        }
        if (o instanceof Number) {
            return Expression.lit(((Number) o).longValue());
        }
        if (!(o instanceof JSONObject)) {
            throw new IllegalArgumentException("unexpected expression element " + o);
        }
        JSONObject e = (JSONObject) o;
        if (e.has("ref")) {
            return Expression.ref(e.getString("ref"));
        }
        if (e.has("lit")) {
            return Expression.lit(e.getLong("lit"));
        }
        Operator op = readEnum(Operator.class, e.getString("op"));
        JSONArray args = e.getJSONArray("args");
        List<Expression> operands = new ArrayList<>(args.length());
        for (int i = 0; i < args.length(); i++) {
            operands.add(readExpression(args.get(i)));
        }
        return new Operation(op, operands);
    }

    private static BridgeDeclaration readBridge(JSONObject j) {
        String strategyTag = j.getString("strategy");
        SyncStrategy strategy = SyncStrategy.fromTag(strategyTag);
        if (strategy == null) {
            throw new IllegalArgumentException("unknown synchronization strategy '" + strategyTag + "'");
        }
        BridgeDeclaration.Builder b = BridgeDeclaration.builder(j.getString("name"), strategy)
                .stages(j.optInt("stages", BridgeDeclaration.DEFAULT_STAGE_COUNT))
                .domains(j.getString("from"), j.getString("to"))
                .scope(j.optString("scope", ""))
                .origin(readEnum(BridgeDeclaration.Origin.class, j.optString("origin", BridgeDeclaration.Origin.ANNOTATION.name())))
                .location(readLocation(j));
        if (j.has("protects")) b.protects(j.getString("protects"));
        if (j.has("chain")) b.chain(readStrings(j.getJSONArray("chain")));
        if (j.has("entry")) b.entry(j.getString("entry"));
        if (j.has("writePointer") || j.has("readPointer")) {
            b.pointerBridges(j.optString("writePointer", null), j.optString("readPointer", null));
        }
        if (j.has("storage")) {
            JSONArray reads = j.optJSONArray("storageReads");
            b.storage(j.getString("storage"), reads == null ? new ArrayList<>() : readStrings(reads));
        }
        if (j.has("emptyFlag") || j.has("fullFlag")) {
            b.flags(j.optString("emptyFlag", null), j.optString("fullFlag", null));
        }
        return b.build();
    }

    private static List<String> readStrings(JSONArray a) {
        List<String> list = new ArrayList<>(a.length());
        for (int i = 0; i < a.length(); i++) {
            list.add(a.getString(i));
        }
        return list;
    }

    private static SourceLocation readLocation(JSONObject o) {
        JSONObject loc = o.optJSONObject("loc");
        if (loc == null) {
            return null;
        }
        return new SourceLocation(loc.getString("file"), loc.optInt("line", 0), loc.optInt("column", 0));
    }

    private static <E extends Enum<E>> E readEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("'" + value + "' is not a valid " + type.getSimpleName());
        }
    }
}
