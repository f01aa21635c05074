/*
 * EngineConfig.java
 *
 * This source file is part of the Quarry open source project
 *
 * Copyright 2024-2026 the Quarry project authors
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
 */

package io.quarry.engine;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.quarry.annotation.API;
import io.quarry.util.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Properties;

/**
 * Immutable configuration used to open a {@link StorageEngine}.
 *
 * <p>
 * The recognized properties are:
 * </p>
 * <ul>
 *     <li>{@value #ENGINE_PROPERTY}: the name of the engine, {@code memory} (default) or {@code foundationdb}</li>
 *     <li>{@value #CLUSTER_FILE_PROPERTY}: the FoundationDB cluster file; the client default if unset</li>
 *     <li>{@value #API_VERSION_PROPERTY}: the FoundationDB API version</li>
 *     <li>{@value #KEY_PREFIX_PROPERTY}: the tuple element under which all FoundationDB keys are placed</li>
 * </ul>
 */
@API(API.Status.UNSTABLE)
public final class EngineConfig {
    public static final String ENGINE_PROPERTY = "quarry.engine";
    public static final String CLUSTER_FILE_PROPERTY = "quarry.fdb.cluster-file";
    public static final String API_VERSION_PROPERTY = "quarry.fdb.api-version";
    public static final String KEY_PREFIX_PROPERTY = "quarry.fdb.key-prefix";

    public static final String DEFAULT_ENGINE = "memory";
    public static final int DEFAULT_API_VERSION = 710;
    public static final String DEFAULT_KEY_PREFIX = "quarry";

    @Nonnull
    private final String engineName;
    @Nullable
    private final String clusterFile;
    private final int apiVersion;
    @Nonnull
    private final String keyPrefix;

    private EngineConfig(@Nonnull Builder builder) {
        this.engineName = builder.engineName;
        this.clusterFile = builder.clusterFile;
        this.apiVersion = builder.apiVersion;
        this.keyPrefix = builder.keyPrefix;
    }

    @Nonnull
    public String getEngineName() {
        return engineName;
    }

    @Nullable
    public String getClusterFile() {
        return clusterFile;
    }

    public int getApiVersion() {
        return apiVersion;
    }

    @Nonnull
    public String getKeyPrefix() {
        return keyPrefix;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder()
                .setEngineName(engineName)
                .setClusterFile(clusterFile)
                .setApiVersion(apiVersion)
                .setKeyPrefix(keyPrefix);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public static EngineConfig defaults() {
        return newBuilder().build();
    }

    /**
     * Read a configuration from properties. Missing properties keep their defaults.
     * @param properties the properties to read
     * @return the configuration
     * @throws StorageException if a property cannot be parsed
     */
    @Nonnull
    public static EngineConfig fromProperties(@Nonnull Properties properties) {
        final Builder builder = newBuilder();
        final String engine = properties.getProperty(ENGINE_PROPERTY);
        if (!Strings.isNullOrEmpty(engine)) {
            builder.setEngineName(engine.trim());
        }
        builder.setClusterFile(Strings.emptyToNull(properties.getProperty(CLUSTER_FILE_PROPERTY)));
        final String apiVersion = properties.getProperty(API_VERSION_PROPERTY);
        if (!Strings.isNullOrEmpty(apiVersion)) {
            try {
                builder.setApiVersion(Integer.parseInt(apiVersion.trim()));
            } catch (NumberFormatException e) {
                throw new StorageException("invalid engine property", e)
                        .addLogInfo(LogMessageKeys.PROPERTY, API_VERSION_PROPERTY)
                        .addLogInfo(LogMessageKeys.VALUE, apiVersion);
            }
        }
        final String keyPrefix = properties.getProperty(KEY_PREFIX_PROPERTY);
        if (!Strings.isNullOrEmpty(keyPrefix)) {
            builder.setKeyPrefix(keyPrefix);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
               "engine=" + engineName +
               ", clusterFile=" + clusterFile +
               ", apiVersion=" + apiVersion +
               ", keyPrefix=" + keyPrefix +
               '}';
    }

    /**
     * Builder for {@link EngineConfig}.
     */
    public static final class Builder {
        @Nonnull
        private String engineName = DEFAULT_ENGINE;
        @Nullable
        private String clusterFile;
        private int apiVersion = DEFAULT_API_VERSION;
        @Nonnull
        private String keyPrefix = DEFAULT_KEY_PREFIX;

        private Builder() {
        }

        @Nonnull
        public Builder setEngineName(@Nonnull String engineName) {
            this.engineName = engineName;
            return this;
        }

        @Nonnull
        public Builder setClusterFile(@Nullable String clusterFile) {
            this.clusterFile = clusterFile;
            return this;
        }

        @Nonnull
        public Builder setApiVersion(int apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        @Nonnull
        public Builder setKeyPrefix(@Nonnull String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        @Nonnull
        public EngineConfig build() {
            Preconditions.checkArgument(!engineName.isEmpty(), "engine name must not be empty");
            Preconditions.checkArgument(!keyPrefix.isEmpty(), "key prefix must not be empty");
            return new EngineConfig(this);
        }
    }
}
