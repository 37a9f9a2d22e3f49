// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.voteledger.config.VoteLedgerConfig;

/**
 * Builds a {@link VoteLedgerConfig} from layered properties. Later layers override earlier ones:
 * <ol>
 *   <li>{@value #DEFAULTS_RESOURCE} on the classpath</li>
 *   <li>an optional external properties file</li>
 *   <li>properties prefixed with {@value #OVERRIDE_PREFIX}, usually the JVM system properties</li>
 * </ol>
 */
public final class VoteLedgerConfigLoader {
    private static final Logger log = LogManager.getLogger(VoteLedgerConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "vote-ledger.properties";
    public static final String OVERRIDE_PREFIX = "voteledger.";

    private static final JavaPropsMapper MAPPER = JavaPropsMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private VoteLedgerConfigLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Loads the defaults overridden by the JVM system properties.
     *
     * @return the configuration
     */
    @NonNull
    public static VoteLedgerConfig load() {
        return load(null, System.getProperties());
    }

    /**
     * @param externalFile an optional properties file overriding the defaults
     * @param overrides    properties whose {@value #OVERRIDE_PREFIX}-prefixed entries override everything else
     * @return the configuration
     * @throws IllegalStateException if a layer cannot be read or the merged properties are not a valid configuration
     */
    @NonNull
    public static VoteLedgerConfig load(@Nullable final Path externalFile, @NonNull final Properties overrides) {
        requireNonNull(overrides, "overrides must not be null");
        final Properties merged = new Properties();
        try (final InputStream in =
                VoteLedgerConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing " + DEFAULTS_RESOURCE + " on the classpath");
            }
            merged.load(in);
            if (externalFile != null) {
                try (final Reader reader = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
                    merged.load(reader);
                }
                log.info("Loaded vote ledger configuration overrides from {}", externalFile);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read vote ledger configuration", e);
        }
        for (final String name : overrides.stringPropertyNames()) {
            if (name.startsWith(OVERRIDE_PREFIX)) {
                merged.setProperty(name.substring(OVERRIDE_PREFIX.length()), overrides.getProperty(name));
            }
        }
        try {
            final VoteLedgerConfig config = MAPPER.readPropertiesAs(merged, VoteLedgerConfig.class);
            log.info(
                    "Vote ledger configured with storage {} (fsync {}), nullifier scope {}, ceremony timeout {}",
                    config.storage().directory(),
                    config.storage().fsync(),
                    config.nullifiers().scopePolicy(),
                    config.ceremony().timeout());
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Invalid vote ledger configuration: " + e.getMessage(), e);
        }
    }
}
