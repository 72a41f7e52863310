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

/**
 * Operators of the flattened expression language handed over by the front end.
 */
public enum Operator {
    NOT(1, "~"),
    AND(2, "&"),
    OR(2, "|"),
    XOR(2, "^"),
    ADD(2, "+"),
    SUB(2, "-"),
    SHL(2, "<<"),
    SHR(2, ">>"),
    EQ(2, "=="),
    NE(2, "!="),
    LT(2, "<"),
    /** Multiplexer: condition, value if true, value if false */
    SELECT(3, "?:"),
    /** Word read from a storage array: storage, address */
    INDEX(2, "[]");

    private final int arity;

    private final String symbol;

    Operator(int arity, String symbol) {
        this.arity = arity;
        this.symbol = symbol;
    }

    public int getArity() {
        return arity;
    }

    public String getSymbol() {
        return symbol;
    }
}
