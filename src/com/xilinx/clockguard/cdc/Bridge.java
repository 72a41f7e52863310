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
import java.util.Objects;

import com.xilinx.clockguard.domain.ClockDomain;
import com.xilinx.clockguard.netlist.BridgeDeclaration;
import com.xilinx.clockguard.netlist.Signal;
import com.xilinx.clockguard.netlist.SourceLocation;
import com.xilinx.clockguard.netlist.SyncStrategy;

/**
 * A synchronizer claim with its domains and signals resolved against a unit.
 * Two bridges are equal when they make the same claim, regardless of their
 * names or of whether they come from an instance or an annotation.
 */
public final class Bridge {

    private final BridgeDeclaration declaration;

    private final ClockDomain source;

    private final ClockDomain destination;

    private final List<Signal> chain;

    private final Signal entry;

    private final Signal protectedSignal;

    private final Signal storage;

    private final List<Signal> storageReads;

    private final Signal emptyFlag;

    private final Signal fullFlag;

    Bridge(BridgeDeclaration declaration, ClockDomain source, ClockDomain destination, List<Signal> chain,
           Signal entry, Signal protectedSignal, Signal storage, List<Signal> storageReads, Signal emptyFlag,
           Signal fullFlag) {
        this.declaration = declaration;
        this.source = source;
        this.destination = destination;
        this.chain = Collections.unmodifiableList(chain);
        this.entry = entry;
        this.protectedSignal = protectedSignal;
        this.storage = storage;
        this.storageReads = Collections.unmodifiableList(storageReads);
        this.emptyFlag = emptyFlag;
        this.fullFlag = fullFlag;
    }

    public BridgeDeclaration getDeclaration() {
        return declaration;
    }

    public String getName() {
        return declaration.getName();
    }

    public SyncStrategy getStrategy() {
        return declaration.getStrategy();
    }

    public int getStageCount() {
        return declaration.getStageCount();
    }

    public ClockDomain getSource() {
        return source;
    }

    public ClockDomain getDestination() {
        return destination;
    }

    /**
     * @return Registers of the chain, first stage first. Empty for a handshake.
     */
    public List<Signal> getChain() {
        return chain;
    }

    public Signal getFirstStage() {
        return chain.isEmpty() ? null : chain.get(0);
    }

    public Signal getLastStage() {
        return chain.isEmpty() ? null : chain.get(chain.size() - 1);
    }

    /**
     * @return The source-domain signal read by the first stage, or null if the
     *         first stage does not read a signal directly.
     */
    public Signal getEntry() {
        return entry;
    }

    public Signal getProtectedSignal() {
        return protectedSignal;
    }

    public Signal getStorage() {
        return storage;
    }

    public List<Signal> getStorageReads() {
        return storageReads;
    }

    public Signal getEmptyFlag() {
        return emptyFlag;
    }

    public Signal getFullFlag() {
        return fullFlag;
    }

    /**
     * @return Where the claim was written, falling back to the protected signal.
     */
    public SourceLocation getLocation() {
        if (!declaration.getLocation().isUnknown()) {
            return declaration.getLocation();
        }
        if (protectedSignal != null) {
            return protectedSignal.getLocation();
        }
        return storageReads.isEmpty() ? SourceLocation.UNKNOWN : storageReads.get(0).getLocation();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bridge)) return false;
        Bridge other = (Bridge) o;
        return getStrategy() == other.getStrategy()
                && getStageCount() == other.getStageCount()
                && source == other.source
                && destination == other.destination
                && chain.equals(other.chain)
                && entry == other.entry
                && protectedSignal == other.protectedSignal
                && storage == other.storage
                && storageReads.equals(other.storageReads)
                && emptyFlag == other.emptyFlag
                && fullFlag == other.fullFlag
                && Objects.equals(declaration.getWritePointerBridge(), other.declaration.getWritePointerBridge())
                && Objects.equals(declaration.getReadPointerBridge(), other.declaration.getReadPointerBridge());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getStrategy(), getStageCount(), source == null ? 0 : source.getId(),
                destination == null ? 0 : destination.getId(), chain, entry, protectedSignal, storage, storageReads);
    }

    @Override
    public String toString() {
        return getName() + " [" + getStrategy() + " " + source + " -> " + destination + "]";
    }
}
