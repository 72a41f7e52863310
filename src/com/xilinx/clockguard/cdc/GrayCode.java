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

/**
 * Reflected binary (Gray) code helpers.
 */
public class GrayCode {

    public static long encode(long n) {
        return n ^ (n >>> 1);
    }

    public static long decode(long g) {
        long n = g;
        for (long shift = g >>> 1; shift != 0; shift >>>= 1) {
            n ^= shift;
        }
        return n;
    }

    public static int hammingDistance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    /**
     * Checks that two consecutive encoded values differ in exactly one bit,
     * so a sampler can only ever see the old or the new value.
     */
    public static boolean isSingleBitStep(long a, long b) {
        return hammingDistance(a, b) == 1;
    }
}
