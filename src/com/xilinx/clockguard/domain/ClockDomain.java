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

/**
 * A distinct timing regime, one per declared clock port. Two ClockDomain
 * objects are the same domain only if they are the same object: the name is
 * for humans, the identity is structural. Instances are created exclusively by
 * {@link DomainRegistry#declareDomain(String, String)}.
 */
public final class ClockDomain {

    private final String name;

    private final String scope;

    private final int id;

    ClockDomain(String name, String scope, int id) {
        this.name = name;
        this.scope = scope;
        this.id = id;
    }

    /**
     * Gets the name given to this domain at its declaration.
     * @return The declared domain name.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets the module scope (instance path) the domain was declared in.
     * @return The declaring scope, empty for the top of the unit.
     */
    public String getScope() {
        return scope;
    }

    /**
     * Gets the serial number of this domain within its registry. Serials are
     * assigned in declaration order and are unique per compilation unit.
     * @return The serial id.
     */
    public int getId() {
        return id;
    }

    /**
     * Gets a name that distinguishes equally named domains of different scopes.
     * @return The scope-qualified name, e.g. "top/u_rx:clk".
     */
    public String getQualifiedName() {
        return scope.isEmpty() ? name : scope + ":" + name;
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
