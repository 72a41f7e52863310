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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A synchronizer claim as written by the design author, either by
 * instantiating a recognized synchronizer module or by annotating a signal.
 * This is plain data; the claim is checked by the synchronizer verifier.
 */
public class BridgeDeclaration {

    public enum Origin {
        /** Instantiation of a recognized synchronizer abstraction */
        INSTANCE,
        /** Explicit crossing annotation on a signal */
        ANNOTATION
    }

    public static final int DEFAULT_STAGE_COUNT = 2;

    private final String name;
    private final SyncStrategy strategy;
    private final int stageCount;
    private final String sourceDomain;
    private final String destinationDomain;
    private final String scope;
    private final Origin origin;
    private final String protectedSignal;
    private final List<String> chain;
    private final String entry;
    private final String writePointerBridge;
    private final String readPointerBridge;
    private final String storage;
    private final List<String> storageReads;
    private final String emptyFlag;
    private final String fullFlag;
    private final SourceLocation location;

    private BridgeDeclaration(Builder b) {
        this.name = b.name;
        this.strategy = b.strategy;
        this.stageCount = b.stageCount;
        this.sourceDomain = b.sourceDomain;
        this.destinationDomain = b.destinationDomain;
        this.scope = b.scope;
        this.origin = b.origin;
        this.protectedSignal = b.protectedSignal;
        this.chain = Collections.unmodifiableList(new ArrayList<>(b.chain));
        this.entry = b.entry;
        this.writePointerBridge = b.writePointerBridge;
        this.readPointerBridge = b.readPointerBridge;
        this.storage = b.storage;
        this.storageReads = Collections.unmodifiableList(new ArrayList<>(b.storageReads));
        this.emptyFlag = b.emptyFlag;
        this.fullFlag = b.fullFlag;
        this.location = b.location;
    }

    public String getName() {
        return name;
    }

    public SyncStrategy getStrategy() {
        return strategy;
    }

    /**
     * @return Number of register stages the author claims.
     */
    public int getStageCount() {
        return stageCount;
    }

    public String getSourceDomain() {
        return sourceDomain;
    }

    public String getDestinationDomain() {
        return destinationDomain;
    }

    /**
     * @return Scope in which the domain names of this claim are resolved.
     */
    public String getScope() {
        return scope;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * @return The synchronized output signal, i.e. the last stage of the chain.
     */
    public String getProtectedSignal() {
        return protectedSignal;
    }

    /**
     * @return The register chain in order, or an empty list if it must be
     *         recovered from the protected signal.
     */
    public List<String> getChain() {
        return chain;
    }

    /**
     * @return The source-domain signal read by the first stage, or null if it
     *         must be recovered from the chain.
     */
    public String getEntry() {
        return entry;
    }

    public String getWritePointerBridge() {
        return writePointerBridge;
    }

    public String getReadPointerBridge() {
        return readPointerBridge;
    }

    public String getStorage() {
        return storage;
    }

    public List<String> getStorageReads() {
        return storageReads;
    }

    public String getEmptyFlag() {
        return emptyFlag;
    }

    public String getFullFlag() {
        return fullFlag;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Gets every signal name this declaration mentions.
     */
    public List<String> getReferencedSignals() {
        List<String> refs = new ArrayList<>();
        if (protectedSignal != null) refs.add(protectedSignal);
        refs.addAll(chain);
        if (entry != null) refs.add(entry);
        if (storage != null) refs.add(storage);
        refs.addAll(storageReads);
        if (emptyFlag != null) refs.add(emptyFlag);
        if (fullFlag != null) refs.add(fullFlag);
        return refs;
    }

    @Override
    public String toString() {
        return name + " [" + strategy + " " + sourceDomain + " -> " + destinationDomain + "]";
    }

    public static Builder builder(String name, SyncStrategy strategy) {
        return new Builder(name, strategy);
    }

    public static class Builder {
        private final String name;
        private final SyncStrategy strategy;
        private int stageCount = DEFAULT_STAGE_COUNT;
        private String sourceDomain;
        private String destinationDomain;
        private String scope = "";
        private Origin origin = Origin.ANNOTATION;
        private String protectedSignal;
        private List<String> chain = new ArrayList<>();
        private String entry;
        private String writePointerBridge;
        private String readPointerBridge;
        private String storage;
        private List<String> storageReads = new ArrayList<>();
        private String emptyFlag;
        private String fullFlag;
        private SourceLocation location = SourceLocation.UNKNOWN;

        private Builder(String name, SyncStrategy strategy) {
            this.name = name;
            this.strategy = strategy;
        }

        public Builder stages(int stageCount) {
            this.stageCount = stageCount;
            return this;
        }

        public Builder domains(String sourceDomain, String destinationDomain) {
            this.sourceDomain = sourceDomain;
            this.destinationDomain = destinationDomain;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder origin(Origin origin) {
            this.origin = origin;
            return this;
        }

        public Builder protects(String protectedSignal) {
            this.protectedSignal = protectedSignal;
            return this;
        }

        public Builder chain(String... stages) {
            this.chain = new ArrayList<>(Arrays.asList(stages));
            return this;
        }

        public Builder chain(List<String> stages) {
            this.chain = new ArrayList<>(stages);
            return this;
        }

        public Builder entry(String entry) {
            this.entry = entry;
            return this;
        }

        public Builder pointerBridges(String writePointerBridge, String readPointerBridge) {
            this.writePointerBridge = writePointerBridge;
            this.readPointerBridge = readPointerBridge;
            return this;
        }

        public Builder storage(String storage, String... storageReads) {
            this.storage = storage;
            this.storageReads = new ArrayList<>(Arrays.asList(storageReads));
            return this;
        }

        public Builder storage(String storage, List<String> storageReads) {
            this.storage = storage;
            this.storageReads = new ArrayList<>(storageReads);
            return this;
        }

        public Builder flags(String emptyFlag, String fullFlag) {
            this.emptyFlag = emptyFlag;
            this.fullFlag = fullFlag;
            return this;
        }

        public Builder location(SourceLocation location) {
            this.location = location == null ? SourceLocation.UNKNOWN : location;
            return this;
        }

        public BridgeDeclaration build() {
            if (name == null || strategy == null) {
                throw new IllegalArgumentException("ERROR: A bridge declaration needs a name and a strategy");
            }
            if (sourceDomain == null || destinationDomain == null) {
                throw new IllegalArgumentException("ERROR: Bridge '" + name + "' must name its source and destination domains");
            }
            if (strategy != SyncStrategy.HANDSHAKE && protectedSignal == null && chain.isEmpty()) {
                throw new IllegalArgumentException("ERROR: Bridge '" + name + "' must name the signal it protects or its register chain");
            }
            if (strategy == SyncStrategy.HANDSHAKE && (writePointerBridge == null || readPointerBridge == null)) {
                throw new IllegalArgumentException("ERROR: Handshake bridge '" + name + "' must name its write and read pointer bridges");
            }
            if (strategy == SyncStrategy.HANDSHAKE && (storage == null || storageReads.isEmpty())) {
                throw new IllegalArgumentException("ERROR: Handshake bridge '" + name + "' must name its storage and at least one storage read");
            }
            if (protectedSignal == null && !chain.isEmpty()) {
                protectedSignal = chain.get(chain.size() - 1);
            }
            return new BridgeDeclaration(this);
        }
    }
}
