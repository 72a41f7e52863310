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


package com.xilinx.clockguard.util;

/**
 * Console message helpers shared by the command line tools.
 */
public class MessageGenerator {

    private static final int HEADER_WIDTH = 72;

    /**
     * Prints a banner with the given title centered in it.
     */
    public static void printHeader(String s) {
        String bar = makeRepeated('=', HEADER_WIDTH + 6);
        double whiteSpace = (HEADER_WIDTH - s.length()) / 2.0;
        System.out.println(bar);
        System.out.println("== " + makeWhiteSpace((int) whiteSpace) + s + makeWhiteSpace((int) (whiteSpace + 0.5)) + " ==");
        System.out.println(bar);
    }

    /**
     * Prints an error line to standard error.
     */
    public static void briefError(String msg) {
        System.err.println(msg.startsWith("ERROR:") ? msg : "ERROR: " + msg);
    }

    public static String makeWhiteSpace(int length) {
        return makeRepeated(' ', length);
    }

    private static String makeRepeated(char c, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
