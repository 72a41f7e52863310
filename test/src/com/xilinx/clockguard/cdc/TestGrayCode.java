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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestGrayCode {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 8, 12})
    public void testConsecutiveCodesDifferInOneBit(int width) {
        long size = 1L << width;
        for (long n = 0; n < size; n++) {
            long next = (n + 1) % size;
            Assertions.assertTrue(GrayCode.isSingleBitStep(GrayCode.encode(n), GrayCode.encode(next)),
                    "step " + n + " -> " + next);
        }
    }

    @Test
    public void testDecodeInvertsEncode() {
        for (long n = 0; n < 1024; n++) {
            Assertions.assertEquals(n, GrayCode.decode(GrayCode.encode(n)));
        }
        Assertions.assertEquals(Long.MAX_VALUE, GrayCode.decode(GrayCode.encode(Long.MAX_VALUE)));
    }

    @Test
    public void testHammingDistance() {
        Assertions.assertEquals(0, GrayCode.hammingDistance(5, 5));
        Assertions.assertEquals(4, GrayCode.hammingDistance(0b0111, 0b1000));
        Assertions.assertFalse(GrayCode.isSingleBitStep(7, 8));
    }
}
