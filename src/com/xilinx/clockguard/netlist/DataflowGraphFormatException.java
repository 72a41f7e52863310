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
 * Thrown when a serialized dataflow graph cannot be read.
 */
public class DataflowGraphFormatException extends RuntimeException {

    private static final long serialVersionUID = 8154470091126320365L;

    public DataflowGraphFormatException(String message) {
        super(message);
    }

    public DataflowGraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
