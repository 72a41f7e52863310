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

/**
 * Stable error codes of clock-domain diagnostics. Every code is fatal: a unit
 * with any diagnostic fails compilation.
 */
public enum CdcErrorCode {

    /** A register reads a signal of another domain without a verified bridge */
    E_CDC_UNSYNCHRONIZED_READ("route the signal through a two-stage synchronizer clocked by the destination domain"),
    /** A combinational expression mixes operands of different domains */
    E_CDC_MIXED_DOMAIN_EXPRESSION("synchronize every operand into one domain before combining them"),
    /** A claimed synchronizer does not have the register structure it claims */
    E_CDC_BRIDGE_TOPOLOGY("build the synchronizer as a direct chain of destination-clocked registers with no logic or taps between stages"),
    /** A claimed encoded-pointer bridge does not carry a one-bit-per-step encoding */
    E_CDC_ENCODING_INVARIANT("encode the pointer before crossing (e.g. p ^ (p >> 1)) and advance it by one per clock"),
    /** The same domain name is declared twice in one module's clock ports */
    E_CDC_DUPLICATE_DOMAIN("give each clock port of a module a distinct domain name"),
    /** A declaration names a domain that is not visible in its scope */
    E_CDC_UNKNOWN_DOMAIN("declare the domain on a clock port of this module or an enclosing one"),
    /** A register is clocked by a signal that carries no clock domain */
    E_CDC_UNDECLARED_CLOCK("clock registers from a declared clock port"),
    /** A register's declared domain disagrees with the domain of its clock */
    E_CDC_DECLARED_DOMAIN_MISMATCH("clock the register from its declared domain or correct the declaration");

    private final String remediation;

    CdcErrorCode(String remediation) {
        this.remediation = remediation;
    }

    /**
     * @return The suggested fix printed with diagnostics of this code.
     */
    public String getRemediation() {
        return remediation;
    }
}
