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

import java.util.Set;

/**
 * A compile-time constant. Literals carry no domain.
 */
public final class Literal extends Expression {

    private final long value;

    public Literal(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    protected void collectReferences(Set<String> refs) {
        // none
    }

    @Override
    public long evaluate(ValueResolver resolver, int width) {
        return value & mask(width);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Literal && ((Literal) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
