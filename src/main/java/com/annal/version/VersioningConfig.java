package com.annal.version;

import com.annal.store.Document;
import com.annal.store.TransactionOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings of a {@link HistoricalCollection}.
 * <p>
 * Recognized properties:
 * <pre>
 *   annal.num-deltas-before-snapshot     checkpoint interval (default 5)
 *   annal.internal-metadata-keyname      header field name
 *   annal.transaction.max-attempts       attempts per write transaction (default 5)
 *   annal.transaction.commit-timeout-ms  majority commit wait (default 1000)
 * </pre>
 */
public record VersioningConfig(int numDeltasBeforeSnapshot,
                               String internalMetadataKeyname,
                               TransactionOptions transactionOptions) {

    public static final int DEFAULT_NUM_DELTAS_BEFORE_SNAPSHOT = 5;
    public static final String DEFAULT_INTERNAL_METADATA_KEYNAME = "__HISTORICAL_COLLECTION_INTERNAL_METADATA";

    static final String NUM_DELTAS_KEY = "annal.num-deltas-before-snapshot";
    static final String METADATA_KEYNAME_KEY = "annal.internal-metadata-keyname";
    static final String MAX_ATTEMPTS_KEY = "annal.transaction.max-attempts";
    static final String COMMIT_TIMEOUT_KEY = "annal.transaction.commit-timeout-ms";

    public VersioningConfig {
        if (numDeltasBeforeSnapshot < 1) {
            throw new ConfigurationException("num-deltas-before-snapshot must be >= 1, got " + numDeltasBeforeSnapshot);
        }
        if (internalMetadataKeyname == null || internalMetadataKeyname.isBlank()
                || Document.ID_FIELD.equals(internalMetadataKeyname) || internalMetadataKeyname.contains(".")) {
            throw new ConfigurationException("invalid internal metadata keyname '" + internalMetadataKeyname + "'");
        }
        if (transactionOptions == null) {
            throw new ConfigurationException("transaction options are required");
        }
    }

    public static VersioningConfig defaults() {
        return new VersioningConfig(DEFAULT_NUM_DELTAS_BEFORE_SNAPSHOT, DEFAULT_INTERNAL_METADATA_KEYNAME,
                TransactionOptions.defaults());
    }

    public VersioningConfig withNumDeltasBeforeSnapshot(int value) {
        return new VersioningConfig(value, internalMetadataKeyname, transactionOptions);
    }

    public VersioningConfig withInternalMetadataKeyname(String value) {
        return new VersioningConfig(numDeltasBeforeSnapshot, value, transactionOptions);
    }

    public VersioningConfig withTransactionOptions(TransactionOptions value) {
        return new VersioningConfig(numDeltasBeforeSnapshot, internalMetadataKeyname, value);
    }

    /** Reads settings, falling back to the defaults for absent keys. */
    public static VersioningConfig fromProperties(Properties props) {
        VersioningConfig defaults = defaults();
        TransactionOptions tx = defaults.transactionOptions();
        try {
            int interval = intProperty(props, NUM_DELTAS_KEY, defaults.numDeltasBeforeSnapshot());
            String keyname = props.getProperty(METADATA_KEYNAME_KEY, defaults.internalMetadataKeyname()).trim();
            int attempts = intProperty(props, MAX_ATTEMPTS_KEY, tx.maxAttempts());
            long timeoutMs = intProperty(props, COMMIT_TIMEOUT_KEY, (int) tx.writeConcern().timeout().toMillis());
            return new VersioningConfig(interval, keyname,
                    tx.withMaxAttempts(attempts).withCommitTimeout(Duration.ofMillis(timeoutMs)));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid versioning configuration: " + e.getMessage(), e);
        }
    }

    public static VersioningConfig load(Path file) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("unable to read " + file, e);
        }
        return fromProperties(props);
    }

    /** Loads a properties resource; a missing resource yields the defaults. */
    public static VersioningConfig fromClasspath(String resource) {
        Properties props = new Properties();
        try (InputStream in = VersioningConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            props.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("unable to read classpath resource " + resource, e);
        }
        return fromProperties(props);
    }

    private static int intProperty(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }
}
