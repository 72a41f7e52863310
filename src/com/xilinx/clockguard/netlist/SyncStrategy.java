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

/**
 * Synchronization strategies a bridge may claim.
 */
public enum SyncStrategy {
    /** Single bit through a chain of registers clocked by the destination */
    DOUBLE_REGISTER("double-register"),
    /** Counter encoded so one bit changes per step, then register-synchronized */
    GRAY_CODE_POINTER("gray-code-pointer"),
    /** Dual-clock buffer: encoded pointers synchronized in both directions */
    HANDSHAKE("handshake");

    private final String tag;

    SyncStrategy(String tag) {
        this.tag = tag;
    }

    /**
     * @return The tag used in annotations, e.g. "double-register".
     */
    public String getTag() {
        return tag;
    }

    /**
     * Looks up a strategy by its annotation tag or enum name, ignoring case.
     * @param tag Tag such as "gray-code-pointer" or "GRAY_CODE_POINTER".
     * @return The strategy, or null if the tag is not recognized.
     */
    public static SyncStrategy fromTag(String tag) {
        for (SyncStrategy s : values()) {
            if (s.tag.equalsIgnoreCase(tag) || s.name().equalsIgnoreCase(tag)) {
                return s;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return tag;
    }
}
