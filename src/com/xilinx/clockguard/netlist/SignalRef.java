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

import java.util.Objects;
import java.util.Set;

/**
 * A read of another signal's current value.
 */
public final class SignalRef extends Expression {

    private final String signalName;

    public SignalRef(String signalName) {
        this.signalName = Objects.requireNonNull(signalName);
    }

    public String getSignalName() {
        return signalName;
    }

    @Override
    protected void collectReferences(Set<String> refs) {
        refs.add(signalName);
    }

    @Override
    public long evaluate(ValueResolver resolver, int width) {
        return resolver.valueOf(signalName) & mask(width);
    }

    @Override
    public boolean isReferenceTo(String name) {
        return signalName.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SignalRef && ((SignalRef) o).signalName.equals(signalName);
    }

    @Override
    public int hashCode() {
        return signalName.hashCode();
    }

    @Override
    public String toString() {
        return signalName;
    }
}
