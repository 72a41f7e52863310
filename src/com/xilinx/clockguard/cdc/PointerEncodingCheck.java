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
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.domain.DomainTag;
import com.xilinx.clockguard.netlist.DataflowGraph;
import com.xilinx.clockguard.netlist.Expression;
import com.xilinx.clockguard.netlist.Literal;
import com.xilinx.clockguard.netlist.Operation;
import com.xilinx.clockguard.netlist.Operator;
import com.xilinx.clockguard.netlist.Signal;
import com.xilinx.clockguard.netlist.SignalKind;
import com.xilinx.clockguard.netlist.SignalRef;

/**
 * Checks that the value entering a gray-code pointer bridge is a single-bit
 * step encoding of one source-domain counter that moves by at most one per
 * clock. Combinational logic of the source domain is inlined, so the encoding
 * is judged from the design's own expressions.
 */
class PointerEncodingCheck {

    private final DataflowGraph graph;

    private final DomainTable table;

    private final int maxEnumerationWidth;

    PointerEncodingCheck(DataflowGraph graph, DomainTable table, int maxEnumerationWidth) {
        this.graph = graph;
        this.table = table;
        this.maxEnumerationWidth = maxEnumerationWidth;
    }

    /**
     * @return Why the encoding is unsafe; empty if it is safe.
     */
    List<String> check(Signal entry, ClockDomain src) {
        List<String> problems = new ArrayList<>();
        if (entry.getKind() == SignalKind.INPUT) {
            problems.add("Pointer '" + entry.getName() + "' is a primary input; its encoding cannot be checked");
            return problems;
        }
        Expression encoding = inline(entry.getExpression(), src);

        Signal counter = null;
        for (String leaf : encoding.getReferencedSignals()) {
            Signal s = graph.getSignal(leaf);
            if (s.isSequential() && table.get(s).isDomain(src) && counter == null) {
                counter = s;
            } else {
                problems.add("Pointer '" + entry.getName() + "' depends on '" + leaf
                        + "', which is not the single counter it encodes");
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }
        if (counter == null) {
            problems.add("Pointer '" + entry.getName() + "' is a constant, not an encoded counter");
            return problems;
        }
        if (counter == entry || encoding.isReferenceTo(counter.getName())) {
            problems.add("Counter '" + counter.getName() + "' crosses unencoded; all of its bits may change at once");
            return problems;
        }

        Set<Long> loads = new TreeSet<>();
        Set<Long> steps = classifySteps(inline(counter.getExpression(), src), counter, loads);
        if (steps == null) {
            problems.add("Counter '" + counter.getName() + "' is updated by `" + counter.getExpression()
                    + "`, which is neither a hold nor a step of one");
            return problems;
        }
        for (long step : steps) {
            if (Math.abs(step) > 1) {
                problems.add("Counter '" + counter.getName() + "' can advance by " + step
                        + " in one clock, so the encoded pointer changes more than one bit");
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }

        if (counter.getWidth() <= maxEnumerationWidth) {
            enumerate(entry, counter, encoding, steps, problems);
            enumerateLoads(entry, counter, encoding, loads, problems);
        } else {
            if (!isCanonicalGray(encoding, counter)) {
                problems.add("Counter '" + counter.getName() + "' is " + counter.getWidth()
                        + " bits wide, above the enumeration limit of " + maxEnumerationWidth + ", and '"
                        + entry.getName() + "' is not of the form p ^ (p >> 1)");
            }
            for (long k : loads) {
                problems.add("Counter '" + counter.getName() + "' can be loaded with " + k
                        + ", a jump the encoded pointer cannot make one bit at a time");
            }
        }
        return problems;
    }

    /**
     * A load jumps from any value straight to a constant; the pointer must
     * still change at most one bit, whatever value it jumps from.
     */
    private void enumerateLoads(Signal entry, Signal counter, Expression encoding, Set<Long> loads,
                                List<String> problems) {
        long size = 1L << counter.getWidth();
        long mask = Expression.mask(counter.getWidth());
        try {
            for (long k : loads) {
                long b = valueAt(encoding, counter, k & mask, entry.getWidth());
                for (long n = 0; n < size; n++) {
                    long a = valueAt(encoding, counter, n, entry.getWidth());
                    if (GrayCode.hammingDistance(a, b) > 1) {
                        problems.add("Pointer '" + entry.getName() + "' changes " + GrayCode.hammingDistance(a, b)
                                + " bit(s) when counter '" + counter.getName() + "' is loaded with " + (k & mask)
                                + " from " + n + " (0x" + Long.toHexString(a) + " -> 0x" + Long.toHexString(b) + ")");
                        break;
                    }
                }
            }
        } catch (UnsupportedOperationException e) {
            problems.add("Encoding of pointer '" + entry.getName() + "' cannot be evaluated: " + e.getMessage());
        }
    }

    private void enumerate(Signal entry, Signal counter, Expression encoding, Set<Long> steps, List<String> problems) {
        long size = 1L << counter.getWidth();
        long mask = Expression.mask(counter.getWidth());
        try {
            for (long step : steps) {
                if (step == 0) continue;
                for (long n = 0; n < size; n++) {
                    long m = (n + step) & mask;
                    long a = valueAt(encoding, counter, n, entry.getWidth());
                    long b = valueAt(encoding, counter, m, entry.getWidth());
                    if (!GrayCode.isSingleBitStep(a, b)) {
                        problems.add("Pointer '" + entry.getName() + "' changes " + GrayCode.hammingDistance(a, b)
                                + " bit(s) when counter '" + counter.getName() + "' steps from " + n + " to " + m
                                + " (0x" + Long.toHexString(a) + " -> 0x" + Long.toHexString(b) + ")");
                        break;
                    }
                }
            }
        } catch (UnsupportedOperationException e) {
            problems.add("Encoding of pointer '" + entry.getName() + "' cannot be evaluated: " + e.getMessage());
        }
    }

    private static long valueAt(Expression encoding, Signal counter, long n, int width) {
        return encoding.evaluate((name) -> {
            if (!name.equals(counter.getName())) {
                throw new UnsupportedOperationException("'" + name + "' has no value");
            }
            return n;
        }, width);
    }

    /**
     * Classifies the next-state function of a counter into the set of signed
     * steps it can take. Constant loads, resets included, are collected apart.
     * @param loads Receives the constants the counter can be loaded with.
     * @return The steps, or null if the update is not a hold, a constant step
     *         or a load.
     */
    static Set<Long> classifySteps(Expression next, Signal counter, Set<Long> loads) {
        Set<Long> steps = new TreeSet<>();
        return collectSteps(next, counter, steps, loads) ? steps : null;
    }

    private static boolean collectSteps(Expression e, Signal counter, Set<Long> steps, Set<Long> loads) {
        if (e.isReferenceTo(counter.getName())) {
            steps.add(0L);
            return true;
        }
        if (e instanceof Literal) {
            loads.add(((Literal) e).getValue());
            return true;
        }
        if (!(e instanceof Operation)) {
            return false;
        }
        Operation op = (Operation) e;
        switch (op.getOperator()) {
            case SELECT:
                return collectSteps(op.getOperand(1), counter, steps, loads)
                        && collectSteps(op.getOperand(2), counter, steps, loads);
            case ADD:
                if (op.getOperand(0).isReferenceTo(counter.getName()) && op.getOperand(1) instanceof Literal) {
                    steps.add(signedStep(((Literal) op.getOperand(1)).getValue(), counter.getWidth()));
                    return true;
                }
                if (op.getOperand(1).isReferenceTo(counter.getName()) && op.getOperand(0) instanceof Literal) {
                    steps.add(signedStep(((Literal) op.getOperand(0)).getValue(), counter.getWidth()));
                    return true;
                }
                return false;
            case SUB:
                if (op.getOperand(0).isReferenceTo(counter.getName()) && op.getOperand(1) instanceof Literal) {
                    steps.add(signedStep(-((Literal) op.getOperand(1)).getValue(), counter.getWidth()));
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    /**
     * Normalizes a step modulo the counter width, e.g. +15 on 4 bits is -1.
     */
    private static long signedStep(long step, int width) {
        if (width >= 63) return step;
        long m = step & Expression.mask(width);
        return m > (1L << (width - 1)) ? m - (1L << width) : m;
    }

    private static boolean isCanonicalGray(Expression e, Signal counter) {
        if (!(e instanceof Operation) || ((Operation) e).getOperator() != Operator.XOR) {
            return false;
        }
        Operation xor = (Operation) e;
        return isHalfOf(xor.getOperand(1), xor.getOperand(0), counter)
                || isHalfOf(xor.getOperand(0), xor.getOperand(1), counter);
    }

    private static boolean isHalfOf(Expression shifted, Expression value, Signal counter) {
        if (!(shifted instanceof Operation) || ((Operation) shifted).getOperator() != Operator.SHR) {
            return false;
        }
        Operation shr = (Operation) shifted;
        Set<String> leaves = value.getReferencedSignals();
        return shr.getOperand(0).equals(value)
                && shr.getOperand(1) instanceof Literal && ((Literal) shr.getOperand(1)).getValue() == 1
                && leaves.size() == 1 && leaves.contains(counter.getName());
    }

    /**
     * Substitutes combinational signals and ports of the source domain (and
     * constants) by their defining expressions.
     */
    Expression inline(Expression e, ClockDomain src) {
        if (e instanceof SignalRef) {
            Signal s = graph.getSignal(((SignalRef) e).getSignalName());
            DomainTag tag = table.get(s);
            if ((s.isCombinational() || s.getKind() == SignalKind.PORT)
                    && (tag.isDomain(src) || tag.isUnconstrained())) {
                return inline(s.getExpression(), src);
            }
            return e;
        }
        if (e instanceof Operation) {
            Operation op = (Operation) e;
            List<Expression> operands = new ArrayList<>();
            for (Expression operand : op.getOperands()) {
                operands.add(inline(operand, src));
            }
            return new Operation(op.getOperator(), operands);
        }
        return e;
    }
}
