package com.travelagent.poi;

import com.travelagent.poi.clustering.PoiClustering;
import com.travelagent.poi.dedupe.DedupeKeyGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PoiClusteringConfigTest {

    private static Properties defaults () {
        Properties properties = new Properties();
        properties.setProperty("density-clustering-enabled", "true");
        properties.setProperty("cluster-selection-epsilon-km", "0.5");
        properties.setProperty("dedupe-precision", "7");
        properties.setProperty("duplicate-distance-m", "150");
        return properties;
    }

    private static PoiClusteringConfig config (Properties properties, Map<String, String> env, Properties system) {
        return new PoiClusteringConfig(properties, env, system);
    }

    @Test
    public void testClasspathDefaults () {
        PoiClusteringConfig config = PoiClusteringConfig.load();
        assertTrue(config.densityClusteringEnabled());
        assertEquals(PoiClustering.DEFAULT_CLUSTER_SELECTION_EPSILON_KM, config.clusterSelectionEpsilonKm(), 0);
        assertEquals(DedupeKeyGenerator.DEFAULT_PRECISION, config.dedupePrecision());
        assertEquals(150, config.duplicateDistanceMeters(), 0);
    }

    @Test
    public void testEnvironmentAndSystemOverrides () {
        Map<String, String> env = new HashMap<>();
        env.put("POI_DEDUPE_PRECISION", "8");
        env.put("POI_DUPLICATE_DISTANCE_M", "100");
        env.put("HOME", "/root");
        Properties system = new Properties();
        system.setProperty("poi.dedupe.precision", "6");
        system.setProperty("poi.density.clustering.enabled", "no");

        PoiClusteringConfig config = config(defaults(), env, system);
        // System properties win over environment variables, which win over the file.
        assertEquals(6, config.dedupePrecision());
        assertEquals(100, config.duplicateDistanceMeters(), 0);
        assertFalse(config.densityClusteringEnabled());
    }

    @Test
    public void testAllErrorsReportedTogether () {
        Properties properties = new Properties();
        properties.setProperty("density-clustering-enabled", "maybe");
        properties.setProperty("dedupe-precision", "13");
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> config(properties, Collections.emptyMap(), new Properties()));
        assertTrue(e.getMessage().contains("density-clustering-enabled"));
        assertTrue(e.getMessage().contains("dedupe-precision"));
        assertTrue(e.getMessage().contains("duplicate-distance-m"));
        assertTrue(e.getMessage().contains("cluster-selection-epsilon-km"));
    }

    @Test
    public void testNegativeEpsilonRejected () {
        Properties properties = defaults();
        properties.setProperty("cluster-selection-epsilon-km", "-0.1");
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> config(properties, Collections.emptyMap(), new Properties()));
        assertEquals("Missing or invalid configuration properties: cluster-selection-epsilon-km", e.getMessage());
    }

    @Test
    public void testUnparseableNumber () {
        Properties properties = defaults();
        properties.setProperty("duplicate-distance-m", "far");
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> config(properties, Collections.emptyMap(), new Properties()));
        assertEquals("Missing or invalid configuration properties: duplicate-distance-m", e.getMessage());
    }

    @Test
    public void testFromFile (@TempDir Path directory) throws Exception {
        File file = directory.resolve("poi.properties").toFile();
        try (Writer writer = new FileWriter(file)) {
            // Only one key, the others come from the classpath defaults.
            writer.write("dedupe-precision=5\n");
        }
        PoiClusteringConfig config = PoiClusteringConfig.fromFile(file.getPath());
        assertEquals(5, config.dedupePrecision());
        assertEquals(150, config.duplicateDistanceMeters(), 0);
        assertThrows(ConfigurationException.class,
                () -> PoiClusteringConfig.fromFile(directory.resolve("missing.properties").toString()));
    }

    @Test
    public void testComponentsConsumeConfig () {
        Properties properties = defaults();
        properties.setProperty("density-clustering-enabled", "false");
        properties.setProperty("dedupe-precision", "5");
        PoiClusteringConfig config = config(properties, Collections.emptyMap(), new Properties());
        assertEquals(5, new DedupeKeyGenerator(config).getPrecision());
        assertTrue(new PoiClustering(config).clusterByDensity(TestPois.daNang(), 3, 2).isEmpty());
    }

}
