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
 * Thrown when a domain name is declared twice within the clock ports of the
 * same module scope.
 */
public class DuplicateDomainException extends RuntimeException {

    private static final long serialVersionUID = -3121840977655310912L;

    private final String domainName;

    private final String scope;

    public DuplicateDomainException(String domainName, String scope) {
        super("ERROR: Clock domain '" + domainName + "' is declared more than once in scope '" + scope + "'");
        this.domainName = domainName;
        this.scope = scope;
    }

    public String getDomainName() {
        return domainName;
    }

    public String getScope() {
        return scope;
    }
}
