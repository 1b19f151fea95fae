package com.annal.version;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class VersioningConfigTest {
    @Test
    public void testDefaults() {
        VersioningConfig config = VersioningConfig.defaults();
        assertEquals(5, config.numDeltasBeforeSnapshot());
        assertEquals("__HISTORICAL_COLLECTION_INTERNAL_METADATA", config.internalMetadataKeyname());
        assertEquals(5, config.transactionOptions().maxAttempts());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("annal.num-deltas-before-snapshot", "3");
        props.setProperty("annal.internal-metadata-keyname", " _hist ");
        props.setProperty("annal.transaction.max-attempts", "2");
        props.setProperty("annal.transaction.commit-timeout-ms", "250");

        VersioningConfig config = VersioningConfig.fromProperties(props);

        assertEquals(3, config.numDeltasBeforeSnapshot());
        assertEquals("_hist", config.internalMetadataKeyname());
        assertEquals(2, config.transactionOptions().maxAttempts());
        assertEquals(Duration.ofMillis(250), config.transactionOptions().writeConcern().timeout());
    }

    @Test
    public void testInvalidValuesAreRejected() {
        Properties notANumber = new Properties();
        notANumber.setProperty("annal.num-deltas-before-snapshot", "often");
        assertThrows(ConfigurationException.class, () -> VersioningConfig.fromProperties(notANumber));

        Properties zeroAttempts = new Properties();
        zeroAttempts.setProperty("annal.transaction.max-attempts", "0");
        assertThrows(ConfigurationException.class, () -> VersioningConfig.fromProperties(zeroAttempts));

        assertThrows(ConfigurationException.class, () -> VersioningConfig.defaults().withNumDeltasBeforeSnapshot(0));
        assertThrows(ConfigurationException.class, () -> VersioningConfig.defaults().withInternalMetadataKeyname("_id"));
        assertThrows(ConfigurationException.class, () -> VersioningConfig.defaults().withInternalMetadataKeyname("a.b"));
    }

    @Test
    public void testLoadFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("versioning.properties");
        Files.writeString(file, "annal.num-deltas-before-snapshot=9\n");
        VersioningConfig config = VersioningConfig.load(file);
        assertEquals(9, config.numDeltasBeforeSnapshot());
        assertEquals(VersioningConfig.DEFAULT_INTERNAL_METADATA_KEYNAME, config.internalMetadataKeyname());

        assertThrows(ConfigurationException.class, () -> VersioningConfig.load(tempDir.resolve("missing.properties")));
    }

    @Test
    public void testClasspathResource() {
        assertEquals(VersioningConfig.defaults(), VersioningConfig.fromClasspath("annal.properties"));
        assertEquals(VersioningConfig.defaults(), VersioningConfig.fromClasspath("no-such-file.properties"));
    }
}
