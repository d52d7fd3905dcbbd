/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.statevault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for a state root.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dstatevault.stateDir=/path})</li>
 *   <li>Environment variables (e.g., {@code STATEVAULT_STATE_DIR})</li>
 *   <li>Properties file ({@code statevault.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>stateDir</td><td>statevault.stateDir</td><td>STATEVAULT_STATE_DIR</td><td>~/.statevault/state</td></tr>
 *   <tr><td>syncEnabled</td><td>statevault.syncEnabled</td><td>STATEVAULT_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>reserveMb</td><td>statevault.reserveMb</td><td>STATEVAULT_RESERVE_MB</td><td>64</td></tr>
 *   <tr><td>maxPayloadSizeMb</td><td>statevault.maxPayloadSizeMb</td><td>STATEVAULT_MAX_PAYLOAD_SIZE_MB</td><td>64</td></tr>
 *   <tr><td>keyFile</td><td>statevault.keyFile</td><td>STATEVAULT_KEY_FILE</td><td>&lt;stateDir&gt;/statevault.key</td></tr>
 * </table>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * StateVaultConfig config = StateVaultConfig.builder()
 *     .stateDir(Path.of("/var/lib/agent/state"))
 *     .reserveMb(128)
 *     .build();
 *
 * PersistenceCoordinator coordinator = new PersistenceCoordinator(config);
 * </pre>
 */
public final class StateVaultConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StateVaultConfig.class);

    private static final String PROPERTIES_FILE = "statevault.properties";

    // Property keys
    private static final String PROP_STATE_DIR = "statevault.stateDir";
    private static final String PROP_SYNC_ENABLED = "statevault.syncEnabled";
    private static final String PROP_RESERVE_MB = "statevault.reserveMb";
    private static final String PROP_MAX_PAYLOAD_SIZE_MB = "statevault.maxPayloadSizeMb";
    private static final String PROP_KEY_FILE = "statevault.keyFile";

    // Environment variable keys
    private static final String ENV_STATE_DIR = "STATEVAULT_STATE_DIR";
    private static final String ENV_SYNC_ENABLED = "STATEVAULT_SYNC_ENABLED";
    private static final String ENV_RESERVE_MB = "STATEVAULT_RESERVE_MB";
    private static final String ENV_MAX_PAYLOAD_SIZE_MB = "STATEVAULT_MAX_PAYLOAD_SIZE_MB";
    private static final String ENV_KEY_FILE = "STATEVAULT_KEY_FILE";

    // Defaults
    private static final Path DEFAULT_STATE_DIR = Path.of(System.getProperty("user.home"), ".statevault", "state");
    private static final String DEFAULT_KEY_FILE_NAME = "statevault.key";
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_RESERVE_MB = 64;
    private static final int DEFAULT_MAX_PAYLOAD_SIZE_MB = 64;

    private static final long MB = 1024L * 1024L;

    private final Path stateDir;
    private final Path keyFile;
    private final boolean syncEnabled;
    private final long reserveBytes;
    private final int maxPayloadSizeMb;

    private StateVaultConfig(Builder builder) {
        this.stateDir = builder.stateDir;
        this.keyFile = builder.keyFile;
        this.syncEnabled = builder.syncEnabled;
        this.reserveBytes = builder.reserveBytes;
        this.maxPayloadSizeMb = builder.maxPayloadSizeMb;
    }

    /** Root directory holding every component's generation chain. */
    public Path stateDir() {
        return stateDir;
    }

    /** File holding the installation's signing key. */
    public Path keyFile() {
        return keyFile;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Bytes that must stay free on the state volume after a checkpoint. */
    public long reserveBytes() {
        return reserveBytes;
    }

    /** Maximum payload size in MB per component blob. */
    public int maxPayloadSizeMb() {
        return maxPayloadSizeMb;
    }

    /** Maximum payload size in bytes. */
    public int maxPayloadSizeBytes() {
        return (int) Math.min(Integer.MAX_VALUE, maxPayloadSizeMb * MB);
    }

    @Override
    public String toString() {
        return "StateVaultConfig{" +
                "stateDir=" + stateDir +
                ", keyFile=" + keyFile +
                ", syncEnabled=" + syncEnabled +
                ", reserveBytes=" + reserveBytes +
                ", maxPayloadSizeMb=" + maxPayloadSizeMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code StateVaultConfig.builder().build()}.
     */
    public static StateVaultConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link StateVaultConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path stateDir;
        private Path keyFile;
        private Boolean syncEnabled;
        private Long reserveBytes;
        private Integer maxPayloadSizeMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the state directory. */
        public Builder stateDir(Path stateDir) {
            this.stateDir = stateDir;
            return this;
        }

        /** Sets the state directory from a string path. */
        public Builder stateDir(String stateDir) {
            this.stateDir = Path.of(stateDir);
            return this;
        }

        /** Sets the signing key file (default: statevault.key inside the state directory). */
        public Builder keyFile(Path keyFile) {
            this.keyFile = keyFile;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the free-space reserve in MB (default: 64). */
        public Builder reserveMb(int reserveMb) {
            this.reserveBytes = reserveMb * MB;
            return this;
        }

        /** Sets the free-space reserve in bytes. */
        public Builder reserveBytes(long reserveBytes) {
            this.reserveBytes = reserveBytes;
            return this;
        }

        /** Sets maximum payload size in MB (default: 64). */
        public Builder maxPayloadSizeMb(int maxPayloadSizeMb) {
            this.maxPayloadSizeMb = maxPayloadSizeMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public StateVaultConfig build() {
            if (stateDir == null) {
                stateDir = resolvePath(PROP_STATE_DIR, ENV_STATE_DIR, DEFAULT_STATE_DIR);
            }
            if (keyFile == null) {
                keyFile = resolvePath(PROP_KEY_FILE, ENV_KEY_FILE, stateDir.resolve(DEFAULT_KEY_FILE_NAME));
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (reserveBytes == null) {
                reserveBytes = resolveInt(PROP_RESERVE_MB, ENV_RESERVE_MB, DEFAULT_RESERVE_MB) * MB;
            }
            if (maxPayloadSizeMb == null) {
                maxPayloadSizeMb = resolveInt(PROP_MAX_PAYLOAD_SIZE_MB, ENV_MAX_PAYLOAD_SIZE_MB, DEFAULT_MAX_PAYLOAD_SIZE_MB);
            }
            if (reserveBytes < 0) {
                throw new IllegalArgumentException("reserveBytes must be >= 0: " + reserveBytes);
            }
            if (maxPayloadSizeMb <= 0) {
                throw new IllegalArgumentException("maxPayloadSizeMb must be > 0: " + maxPayloadSizeMb);
            }

            return new StateVaultConfig(this);
        }

        private String resolveRaw(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        }

        private Path resolvePath(String sysProp, String envVar, Path defaultValue) {
            String value = resolveRaw(sysProp, envVar);
            return value != null ? Path.of(value) : defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolveRaw(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolveRaw(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value for {}: '{}', using default {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = StateVaultConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read classpath {}: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
