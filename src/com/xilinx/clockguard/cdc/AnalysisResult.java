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
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

import com.xilinx.clockguard.domain.ClockDomain;

/**
 * Everything the analysis of one unit produces: the domain of every signal,
 * the verdict of every bridge, the crossings accepted and the errors found.
 */
public class AnalysisResult {

    private final String unit;

    private final List<ClockDomain> domains;

    private final DomainTable domainTable;

    private final List<Diagnostic> diagnostics;

    private final List<AcceptedCrossing> accepted;

    private final List<BridgeVerdict> verdicts;

    AnalysisResult(String unit, List<ClockDomain> domains, DomainTable domainTable, List<Diagnostic> diagnostics,
                   List<AcceptedCrossing> accepted, List<BridgeVerdict> verdicts) {
        this.unit = unit;
        this.domains = Collections.unmodifiableList(domains);
        this.domainTable = domainTable;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.accepted = Collections.unmodifiableList(accepted);
        this.verdicts = Collections.unmodifiableList(verdicts);
    }

    public String getUnit() {
        return unit;
    }

    /**
     * @return Domains declared by the unit's clock ports, in declaration order.
     */
    public List<ClockDomain> getDomains() {
        return domains;
    }

    public DomainTable getDomainTable() {
        return domainTable;
    }

    /**
     * @return All errors, sorted by location, then code, then signal.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getDiagnostics(CdcErrorCode code) {
        List<Diagnostic> list = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.getCode() == code) {
                list.add(d);
            }
        }
        return list;
    }

    public List<AcceptedCrossing> getAcceptedCrossings() {
        return accepted;
    }

    /**
     * @return One verdict per distinct bridge claim, in declaration order.
     */
    public List<BridgeVerdict> getBridgeVerdicts() {
        return verdicts;
    }

    public boolean isSuccessful() {
        return diagnostics.isEmpty();
    }

    /**
     * @throws ClockDomainCrossingException if any error was found.
     */
    public void throwIfFailed() {
        if (!isSuccessful()) {
            throw new ClockDomainCrossingException(unit, diagnostics);
        }
    }

    public JSONObject toJSON() {
        JSONObject o = new JSONObject();
        o.put("unit", unit);
        o.put("successful", isSuccessful());
        JSONArray doms = new JSONArray();
        for (ClockDomain d : domains) {
            doms.put(d.getQualifiedName());
        }
        o.put("domains", doms);
        JSONArray diags = new JSONArray();
        for (Diagnostic d : diagnostics) {
            diags.put(d.toJSON());
        }
        o.put("diagnostics", diags);
        JSONArray bridges = new JSONArray();
        for (BridgeVerdict v : verdicts) {
            bridges.put(v.toJSON());
        }
        o.put("bridges", bridges);
        JSONArray crossings = new JSONArray();
        for (AcceptedCrossing c : accepted) {
            crossings.put(c.toJSON());
        }
        o.put("acceptedCrossings", crossings);
        return o;
    }

    @Override
    public String toString() {
        return unit + ": " + (isSuccessful() ? "no clock domain errors" : diagnostics.size() + " error(s)");
    }
}
