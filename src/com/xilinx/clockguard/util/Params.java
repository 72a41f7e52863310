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
 * Centralized access to global ClockGuard settings. Each setting is read from
 * an environment variable or, failing that, from a JVM property of the same
 * name.
 */
public class Params {

    public static final String CG_MAX_ENUMERATION_WIDTH_NAME = "CG_MAX_ENUMERATION_WIDTH";

    public static final String CG_PARALLEL_NAME = "CG_PARALLEL";

    public static final String CG_VERBOSE_NAME = "CG_VERBOSE";

    public static final int CG_DEFAULT_MAX_ENUMERATION_WIDTH = 16;

    /**
     * Widest pointer counter, in bits, whose encoding is checked by trying
     * every value. Wider counters must use the canonical p ^ (p >> 1) form.
     */
    public static int CG_MAX_ENUMERATION_WIDTH = getParamOrDefaultIntSetting(CG_MAX_ENUMERATION_WIDTH_NAME,
            CG_DEFAULT_MAX_ENUMERATION_WIDTH);

    /**
     * Set CG_PARALLEL=0 to analyze units one after another on the calling thread.
     */
    public static boolean CG_PARALLEL = getParamValue(CG_PARALLEL_NAME) == null || isParamSet(CG_PARALLEL_NAME);

    /**
     * Prints per-unit timing and the inferred domains.
     */
    public static boolean CG_VERBOSE = isParamSet(CG_VERBOSE_NAME);

    /**
     * Checks if the named parameter is set via an environment variable or by a
     * JVM parameter of the same name.
     * @param key Name of the parameter.
     * @return True if the parameter is set, as defined by {@link #isSet(String)}.
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * @param value An environment variable or JVM parameter value.
     * @return False if the value is null, empty, "0" or "false" (any case);
     *         true otherwise.
     */
    public static boolean isSet(String value) {
        return !(value == null || value.isEmpty() || value.equals("0") || value.equalsIgnoreCase("false"));
    }

    /**
     * @param key Name of the parameter.
     * @return The environment variable's value, else the JVM property's, else null.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        return value != null ? value : System.getProperty(key);
    }

    /**
     * Gets an integer parameter. A value that does not parse produces a
     * warning and is treated as unset.
     * @param key Name of the parameter.
     * @return The value, or null if none was set.
     */
    public static Integer getParamIntValue(String key) {
        String value = getParamValue(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            System.err.println("WARNING: Couldn't interpret the value '" + value
                    + "' of parameter '" + key + "' as an integer, using its default.");
        }
        return null;
    }

    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer value = getParamIntValue(key);
        return value == null ? defaultValue : value;
    }
}
