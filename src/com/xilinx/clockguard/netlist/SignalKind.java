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

public enum SignalKind {
    /** Primary input of the compilation unit, possibly a clock */
    INPUT,
    /** Pure function of other signals */
    COMBINATIONAL,
    /** Register: assignment guarded by a clock edge */
    SEQUENTIAL,
    /** Formal port of an instantiated module, bound to one actual signal */
    PORT;
}
