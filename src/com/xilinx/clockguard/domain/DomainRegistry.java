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

package com.xilinx.clockguard.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * Owns the set of clock domains declared in one compilation unit. A registry
 * is created at the start of an analysis and discarded with it; it is never
 * shared between units.
 */
public class DomainRegistry {

    /** Separator between the instance names of a hierarchical scope */
    public static final char SCOPE_SEPARATOR = '/';

    /** Declared domains, keyed by scope then by name */
    private final Map<String, Map<String, ClockDomain>> scopes = new HashMap<>();

    private final List<ClockDomain> domains = new ArrayList<>();

    /**
     * Declares a fresh clock domain.
     * @param name  Name of the domain as written on the clock port.
     * @param scope Module scope (instance path) of the port list declaring it.
     * @return A new domain, distinct from every other domain of this registry.
     * @throws DuplicateDomainException if the name is already declared in scope.
     */
    public ClockDomain declareDomain(@NotNull String name, @NotNull String scope) {
        Map<String, ClockDomain> names = scopes.computeIfAbsent(scope, (s) -> new HashMap<>());
        if (names.containsKey(name)) {
            throw new DuplicateDomainException(name, scope);
        }
        ClockDomain domain = new ClockDomain(name, scope, domains.size());
        names.put(name, domain);
        domains.add(domain);
        return domain;
    }

    /**
     * Resolves a domain name as seen from a scope: the scope itself is searched
     * first, then each enclosing scope outwards up to the top of the unit.
     * @param name  The domain name.
     * @param scope The scope the reference appears in.
     * @return The visible domain, or null if none is declared.
     */
    public ClockDomain lookup(@NotNull String name, @NotNull String scope) {
        String current = scope;
        while (true) {
            Map<String, ClockDomain> names = scopes.get(current);
            if (names != null && names.containsKey(name)) {
                return names.get(name);
            }
            if (current.isEmpty()) {
                return null;
            }
            int idx = current.lastIndexOf(SCOPE_SEPARATOR);
            current = idx < 0 ? "" : current.substring(0, idx);
        }
    }

    /**
     * Gets all declared domains in declaration order.
     * @return Unmodifiable list of domains.
     */
    public List<ClockDomain> getDomains() {
        return Collections.unmodifiableList(domains);
    }

    /**
     * Compares two domains. There is no notion of compatible or derived
     * domains: two domains are either the same object or they differ.
     */
    public static boolean equal(ClockDomain a, ClockDomain b) {
        return a == b;
    }

    /**
     * Joins the domain tags of the operands of an expression.
     * @param tags Operand tags in operand declaration order.
     * @return {@link DomainTag#UNCONSTRAINED} if no tag is constrained, the
     *         shared domain if all constrained tags agree, otherwise a conflict
     *         listing the distinct domains in the order they were first seen.
     */
    public static DomainTag join(Collection<DomainTag> tags) {
        List<ClockDomain> seen = new ArrayList<>();
        boolean conflictInput = false;
        for (DomainTag tag : tags) {
            if (tag.isConflict()) {
                conflictInput = true;
            }
            for (ClockDomain d : tag.getDomains()) {
                if (!containsIdentical(seen, d)) {
                    seen.add(d);
                }
            }
        }
        if (seen.isEmpty()) {
            return DomainTag.UNCONSTRAINED;
        }
        if (seen.size() == 1 && !conflictInput) {
            return DomainTag.of(seen.get(0));
        }
        return DomainTag.conflict(seen);
    }

    private static boolean containsIdentical(List<ClockDomain> list, ClockDomain domain) {
        for (ClockDomain d : list) {
            if (d == domain) return true;
        }
        return false;
    }
}
