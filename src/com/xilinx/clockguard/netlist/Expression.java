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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable defining expression of a signal. Expressions are trees of
 * {@link SignalRef}, {@link Literal} and {@link Operation} nodes.
 */
public abstract class Expression {

    /**
     * Supplies values of referenced signals during evaluation.
     */
    @FunctionalInterface
    public interface ValueResolver {
        /**
         * @param signalName Referenced signal.
         * @return The current value of the signal.
         * @throws UnsupportedOperationException if the signal has no known value.
         */
        long valueOf(String signalName);
    }

    /**
     * Gets the names of all signals referenced by this expression, each once,
     * in order of first appearance (left to right, depth first).
     * @return Ordered set of signal names.
     */
    public Set<String> getReferencedSignals() {
        Set<String> refs = new LinkedHashSet<>();
        collectReferences(refs);
        return refs;
    }

    protected abstract void collectReferences(Set<String> refs);

    /**
     * Evaluates the expression as an unsigned bit vector.
     * @param resolver Values of referenced signals.
     * @param width    Result width in bits; intermediate results are truncated to it.
     * @return The value, masked to width bits.
     * @throws UnsupportedOperationException if a sub-expression cannot be evaluated.
     */
    public abstract long evaluate(ValueResolver resolver, int width);

    public static long mask(int width) {
        return width >= 64 ? -1L : (1L << width) - 1;
    }

    /**
     * Checks whether this expression is exactly a reference to the given signal,
     * with no logic around it.
     */
    public boolean isReferenceTo(String signalName) {
        return false;
    }

    public static SignalRef ref(String signalName) {
        return new SignalRef(signalName);
    }

    public static Literal lit(long value) {
        return new Literal(value);
    }

    public static Operation op(Operator operator, Expression... operands) {
        List<Expression> list = new ArrayList<>(operands.length);
        for (Expression e : operands) {
            list.add(e);
        }
        return new Operation(operator, list);
    }
}
