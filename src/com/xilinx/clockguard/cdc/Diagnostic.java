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

import java.util.Comparator;
import java.util.Objects;

import org.json.JSONObject;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.netlist.SourceLocation;

/**
 * A located, user-facing error of the clock-domain analysis.
 */
public final class Diagnostic implements Comparable<Diagnostic> {

    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    private static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::getLocation)
            .thenComparing(Diagnostic::getCode)
            .thenComparing(Diagnostic::getSignal, NULLS_LAST)
            .thenComparing(Diagnostic::getRelatedSignal, NULLS_LAST)
            .thenComparing(Diagnostic::getMessage);

    private final CdcErrorCode code;

    private final SourceLocation location;

    private final String signal;

    private final String relatedSignal;

    private final String sourceDomain;

    private final String destinationDomain;

    private final String message;

    private final String remediation;

    /**
     * @param code              Error code.
     * @param location          Where the problem is, typically the reading assignment.
     * @param signal            The offending signal (the reader or the claimed bridge output).
     * @param relatedSignal     The other signal involved (e.g. the source read), or null.
     * @param sourceDomain      Domain the value comes from, or null.
     * @param destinationDomain Domain the value is consumed in, or null.
     * @param message           Human readable explanation.
     */
    public Diagnostic(CdcErrorCode code, SourceLocation location, String signal, String relatedSignal,
                      ClockDomain sourceDomain, ClockDomain destinationDomain, String message) {
        this.code = Objects.requireNonNull(code);
        this.location = location == null ? SourceLocation.UNKNOWN : location;
        this.signal = signal;
        this.relatedSignal = relatedSignal;
        this.sourceDomain = sourceDomain == null ? null : sourceDomain.getQualifiedName();
        this.destinationDomain = destinationDomain == null ? null : destinationDomain.getQualifiedName();
        this.message = Objects.requireNonNull(message);
        this.remediation = code.getRemediation();
    }

    public CdcErrorCode getCode() {
        return code;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getSignal() {
        return signal;
    }

    public String getRelatedSignal() {
        return relatedSignal;
    }

    /**
     * @return Qualified name of the domain the value comes from, or null.
     */
    public String getSourceDomain() {
        return sourceDomain;
    }

    /**
     * @return Qualified name of the domain the value is consumed in, or null.
     */
    public String getDestinationDomain() {
        return destinationDomain;
    }

    public String getMessage() {
        return message;
    }

    public String getRemediation() {
        return remediation;
    }

    public JSONObject toJSON() {
        JSONObject o = new JSONObject();
        o.put("code", code.name());
        o.put("location", location.toString());
        o.put("signal", signal == null ? JSONObject.NULL : signal);
        o.put("relatedSignal", relatedSignal == null ? JSONObject.NULL : relatedSignal);
        o.put("sourceDomain", sourceDomain == null ? JSONObject.NULL : sourceDomain);
        o.put("destinationDomain", destinationDomain == null ? JSONObject.NULL : destinationDomain);
        o.put("message", message);
        o.put("remediation", remediation);
        return o;
    }

    @Override
    public int compareTo(Diagnostic o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic other = (Diagnostic) o;
        return code == other.code && location.equals(other.location) && Objects.equals(signal, other.signal)
                && Objects.equals(relatedSignal, other.relatedSignal)
                && Objects.equals(sourceDomain, other.sourceDomain)
                && Objects.equals(destinationDomain, other.destinationDomain)
                && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, location, signal, relatedSignal, sourceDomain, destinationDomain, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ERROR: [");
        sb.append(code.name()).append("] ").append(location).append(": ").append(message);
        if (sourceDomain != null || destinationDomain != null) {
            sb.append(" (").append(sourceDomain == null ? "?" : sourceDomain)
              .append(" -> ").append(destinationDomain == null ? "?" : destinationDomain).append(")");
        }
        sb.append("\n    Suggestion: ").append(remediation);
        return sb.toString();
    }
}
