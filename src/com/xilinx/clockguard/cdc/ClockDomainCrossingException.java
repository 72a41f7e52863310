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

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a unit has clock-domain errors and the caller asked for the
 * analysis to stop the build.
 */
public class ClockDomainCrossingException extends RuntimeException {

    private static final long serialVersionUID = -2264172085196352340L;

    private final String unit;

    private final List<Diagnostic> diagnostics;

    public ClockDomainCrossingException(String unit, List<Diagnostic> diagnostics) {
        super(buildMessage(unit, diagnostics));
        this.unit = unit;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    private static String buildMessage(String unit, List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder("ERROR: ");
        sb.append(diagnostics.size()).append(" clock domain error(s) in unit '").append(unit).append("'");
        for (Diagnostic d : diagnostics) {
            sb.append("\n").append(d);
        }
        return sb.toString();
    }

    public String getUnit() {
        return unit;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
