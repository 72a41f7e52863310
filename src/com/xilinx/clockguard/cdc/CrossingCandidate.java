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

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.netlist.Signal;
import com.xilinx.clockguard.netlist.SourceLocation;

/**
 * A point where a value of one domain is consumed in another: a violation
 * until a verified bridge is found that covers it.
 */
public final class CrossingCandidate {

    public enum Kind {
        /** A register reads an operand of another domain */
        REGISTER_READ,
        /** A combinational expression joins operands of different domains */
        MIXED_EXPRESSION
    }

    private final Kind kind;

    private final Signal source;

    private final ClockDomain sourceDomain;

    private final Signal destination;

    private final ClockDomain destinationDomain;

    public CrossingCandidate(Kind kind, Signal source, ClockDomain sourceDomain, Signal destination,
                             ClockDomain destinationDomain) {
        this.kind = kind;
        this.source = source;
        this.sourceDomain = sourceDomain;
        this.destination = destination;
        this.destinationDomain = destinationDomain;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return The operand being read across domains.
     */
    public Signal getSource() {
        return source;
    }

    public ClockDomain getSourceDomain() {
        return sourceDomain;
    }

    /**
     * @return The signal whose defining expression reads the source.
     */
    public Signal getDestination() {
        return destination;
    }

    public ClockDomain getDestinationDomain() {
        return destinationDomain;
    }

    /**
     * @return Location of the assignment where the crossing happens.
     */
    public SourceLocation getLocation() {
        return destination.getLocation();
    }

    Diagnostic toDiagnostic() {
        if (kind == Kind.REGISTER_READ) {
            return new Diagnostic(CdcErrorCode.E_CDC_UNSYNCHRONIZED_READ, getLocation(), destination.getName(),
                    source.getName(), sourceDomain, destinationDomain,
                    "Register '" + destination.getName() + "' of domain '" + destinationDomain.getQualifiedName()
                    + "' reads '" + source.getName() + "' of domain '" + sourceDomain.getQualifiedName()
                    + "' without a verified synchronizer");
        }
        return new Diagnostic(CdcErrorCode.E_CDC_MIXED_DOMAIN_EXPRESSION, getLocation(), destination.getName(),
                source.getName(), sourceDomain, destinationDomain,
                "Expression of '" + destination.getName() + "' combines '" + source.getName() + "' of domain '"
                + sourceDomain.getQualifiedName() + "' with operands of domain '"
                + destinationDomain.getQualifiedName() + "'");
    }

    @Override
    public String toString() {
        return source + " (" + sourceDomain + ") -> " + destination + " (" + destinationDomain + ")";
    }
}
