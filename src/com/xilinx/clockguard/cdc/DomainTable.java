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

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.domain.DomainTag;
import com.xilinx.clockguard.netlist.Signal;

/**
 * The inferred domain of every signal of a unit. This is a side table: the
 * dataflow graph itself is not modified.
 */
public class DomainTable {

    private final Map<Signal, DomainTag> tags;

    private final Map<String, Signal> byName;

    DomainTable(Map<Signal, DomainTag> tags) {
        Map<Signal, DomainTag> ordered = new LinkedHashMap<>();
        tags.keySet().stream().sorted(Comparator.comparingInt(Signal::getIndex))
                .forEach((s) -> ordered.put(s, tags.get(s)));
        this.tags = Collections.unmodifiableMap(ordered);
        this.byName = new LinkedHashMap<>();
        for (Signal s : ordered.keySet()) {
            byName.put(s.getName(), s);
        }
    }

    /**
     * @return The tag of the signal, {@link DomainTag#UNCONSTRAINED} if unknown.
     */
    public DomainTag get(Signal s) {
        DomainTag tag = tags.get(s);
        return tag == null ? DomainTag.UNCONSTRAINED : tag;
    }

    public DomainTag get(String signalName) {
        Signal s = byName.get(signalName);
        return s == null ? DomainTag.UNCONSTRAINED : get(s);
    }

    /**
     * @return The single domain of the signal, or null if it is unconstrained
     *         or in conflict.
     */
    public ClockDomain getDomain(Signal s) {
        return get(s).getDomain();
    }

    /**
     * @return All entries in declaration order.
     */
    public Map<Signal, DomainTag> asMap() {
        return tags;
    }

    public int size() {
        return tags.size();
    }

    /**
     * Serializes the table for downstream stages: signal name to the qualified
     * domain name, "unconstrained", or the list of conflicting domains.
     */
    public JSONObject toJSON() {
        JSONObject o = new JSONObject();
        for (Map.Entry<Signal, DomainTag> e : tags.entrySet()) {
            DomainTag tag = e.getValue();
            switch (tag.getKind()) {
                case CONSTRAINED:
                    o.put(e.getKey().getName(), tag.getDomain().getQualifiedName());
                    break;
                case UNCONSTRAINED:
                    o.put(e.getKey().getName(), "unconstrained");
                    break;
                default:
                    JSONArray conflict = new JSONArray();
                    for (ClockDomain d : tag.getDomains()) {
                        conflict.put(d.getQualifiedName());
                    }
                    o.put(e.getKey().getName(), conflict);
            }
        }
        return o;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Signal, DomainTag> e : tags.entrySet()) {
            sb.append(e.getKey().getName()).append(" : ").append(e.getValue()).append("\n");
        }
        return sb.toString();
    }
}
