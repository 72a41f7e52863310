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

import java.util.Objects;

/**
 * Position of a construct in the HDL source, as reported by the front end.
 * Locations order by file, then line, then column; {@link #UNKNOWN} sorts
 * after every real location.
 */
public final class SourceLocation implements Comparable<SourceLocation> {

    public static final SourceLocation UNKNOWN = new SourceLocation(null, 0, 0);

    private final String file;

    private final int line;

    private final int column;

    public SourceLocation(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isUnknown() {
        return file == null;
    }

    @Override
    public int compareTo(SourceLocation o) {
        if (isUnknown() || o.isUnknown()) {
            return Boolean.compare(isUnknown(), o.isUnknown());
        }
        int c = file.compareTo(o.file);
        if (c != 0) return c;
        c = Integer.compare(line, o.line);
        if (c != 0) return c;
        return Integer.compare(column, o.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation other = (SourceLocation) o;
        return line == other.line && column == other.column && Objects.equals(file, other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return isUnknown() ? "<unknown>" : file + ":" + line + ":" + column;
    }
}
