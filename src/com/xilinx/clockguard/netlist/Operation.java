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
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * An operator applied to sub-expressions.
 */
public final class Operation extends Expression {

    private final Operator operator;

    private final List<Expression> operands;

    public Operation(Operator operator, List<Expression> operands) {
        if (operands.size() != operator.getArity()) {
            throw new IllegalArgumentException("ERROR: Operator " + operator + " expects "
                    + operator.getArity() + " operand(s), got " + operands.size());
        }
        this.operator = operator;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expression> getOperands() {
        return operands;
    }

    public Expression getOperand(int i) {
        return operands.get(i);
    }

    @Override
    protected void collectReferences(Set<String> refs) {
        for (Expression e : operands) {
            e.collectReferences(refs);
        }
    }

    @Override
    public long evaluate(ValueResolver resolver, int width) {
        long mask = mask(width);
        switch (operator) {
            case NOT:
                return ~operands.get(0).evaluate(resolver, width) & mask;
            case SELECT:
                // Only the chosen branch is evaluated
                return operands.get(0).evaluate(resolver, 64) != 0
                        ? operands.get(1).evaluate(resolver, width)
                        : operands.get(2).evaluate(resolver, width);
            case INDEX:
                throw new UnsupportedOperationException("Storage reads have no compile-time value: " + this);
            default:
                break;
        }
        long a = operands.get(0).evaluate(resolver, width);
        long b = operands.get(1).evaluate(resolver, width);
        switch (operator) {
            case AND:
                return a & b;
            case OR:
                return a | b;
            case XOR:
                return a ^ b;
            case ADD:
                return (a + b) & mask;
            case SUB:
                return (a - b) & mask;
            case SHL:
                return b >= 64 ? 0 : (a << b) & mask;
            case SHR:
                return b >= 64 ? 0 : a >>> b;
            case EQ:
                return a == b ? 1 : 0;
            case NE:
                return a != b ? 1 : 0;
            case LT:
                return Long.compareUnsigned(a, b) < 0 ? 1 : 0;
            default:
                throw new UnsupportedOperationException("Unhandled operator " + operator);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operation)) return false;
        Operation other = (Operation) o;
        return operator == other.operator && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return 31 * operator.hashCode() + operands.hashCode();
    }

    @Override
    public String toString() {
        switch (operator) {
            case NOT:
                return "~" + operands.get(0);
            case SELECT:
                return "(" + operands.get(0) + " ? " + operands.get(1) + " : " + operands.get(2) + ")";
            case INDEX:
                return operands.get(0) + "[" + operands.get(1) + "]";
            default:
                return "(" + operands.get(0) + " " + operator.getSymbol() + " " + operands.get(1) + ")";
        }
    }
}
