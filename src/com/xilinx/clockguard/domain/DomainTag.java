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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The domain annotation carried by a signal after propagation: either
 * unconstrained (no temporal association, e.g. a literal), constrained to
 * exactly one {@link ClockDomain}, or a conflict between two or more domains.
 */
public final class DomainTag {

    public enum Kind {
        UNCONSTRAINED,
        CONSTRAINED,
        CONFLICT
    }

    public static final DomainTag UNCONSTRAINED = new DomainTag(Kind.UNCONSTRAINED, Collections.emptyList());

    private final Kind kind;

    private final List<ClockDomain> domains;

    private DomainTag(Kind kind, List<ClockDomain> domains) {
        this.kind = kind;
        this.domains = domains;
    }

    public static DomainTag of(ClockDomain domain) {
        return new DomainTag(Kind.CONSTRAINED, Collections.singletonList(Objects.requireNonNull(domain)));
    }

    /**
     * Creates a conflict marker.
     * @param domains The distinct domains in the order they were first seen;
     *                must hold at least two.
     * @return A new conflict tag.
     */
    public static DomainTag conflict(List<ClockDomain> domains) {
        if (domains.size() < 2) {
            throw new IllegalArgumentException("ERROR: A domain conflict needs at least two domains, got " + domains);
        }
        return new DomainTag(Kind.CONFLICT, Collections.unmodifiableList(new ArrayList<>(domains)));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isUnconstrained() {
        return kind == Kind.UNCONSTRAINED;
    }

    public boolean isConstrained() {
        return kind == Kind.CONSTRAINED;
    }

    public boolean isConflict() {
        return kind == Kind.CONFLICT;
    }

    /**
     * Gets the single domain of a constrained tag.
     * @return The domain, or null if this tag is not constrained.
     */
    public ClockDomain getDomain() {
        return kind == Kind.CONSTRAINED ? domains.get(0) : null;
    }

    /**
     * Gets the domains involved in this tag: none for unconstrained, one for
     * constrained, all conflicting domains (first seen first) for a conflict.
     * @return An unmodifiable list of domains.
     */
    public List<ClockDomain> getDomains() {
        return domains;
    }

    /**
     * Checks whether this tag is constrained to exactly the given domain.
     * @param domain The domain to compare with.
     * @return True if constrained and the domains are identical.
     */
    public boolean isDomain(ClockDomain domain) {
        return kind == Kind.CONSTRAINED && domains.get(0) == domain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainTag)) return false;
        DomainTag other = (DomainTag) o;
        if (kind != other.kind || domains.size() != other.domains.size()) return false;
        for (int i = 0; i < domains.size(); i++) {
            if (domains.get(i) != other.domains.get(i)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = kind.hashCode();
        for (ClockDomain d : domains) {
            result = 31 * result + System.identityHashCode(d);
        }
        return result;
    }

    @Override
    public String toString() {
        switch (kind) {
            case UNCONSTRAINED:
                return "<unconstrained>";
            case CONSTRAINED:
                return domains.get(0).getQualifiedName();
            default:
                return "<conflict " + domains.stream().map(ClockDomain::getQualifiedName)
                        .collect(Collectors.joining(", ")) + ">";
        }
    }
}
