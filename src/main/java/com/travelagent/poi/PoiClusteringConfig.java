package com.travelagent.poi;

import com.travelagent.poi.clustering.PoiClustering;
import com.travelagent.poi.dedupe.DedupeKeyGenerator;
import com.travelagent.poi.dedupe.DuplicateMatcher;
import com.travelagent.poi.dedupe.Geohash;

import java.util.Map;
import java.util.Properties;

/**
 * Configuration of the clustering and deduplication components. Defaults come from poi-clustering.properties on the
 * classpath and may be overridden by a properties file, environment variables or system properties.
 */
public class PoiClusteringConfig extends ConfigBase implements
        PoiClustering.Config,
        DedupeKeyGenerator.Config,
        DuplicateMatcher.Config {

    public static final String DEFAULTS_RESOURCE = "poi-clustering.properties";

    private final boolean densityClusteringEnabled;
    private final double clusterSelectionEpsilonKm;
    private final int dedupePrecision;
    private final double duplicateDistanceMeters;

    PoiClusteringConfig (Properties properties, Map<String, String> environment, Properties systemProperties) {
        super(properties, environment, systemProperties);
        densityClusteringEnabled = boolProp("density-clustering-enabled");
        clusterSelectionEpsilonKm = doubleProp("cluster-selection-epsilon-km");
        dedupePrecision = intProp("dedupe-precision");
        duplicateDistanceMeters = doubleProp("duplicate-distance-m");
        if (!keysWithErrors.contains("cluster-selection-epsilon-km")
                && !(Double.isFinite(clusterSelectionEpsilonKm) && clusterSelectionEpsilonKm >= 0)) {
            invalid("cluster-selection-epsilon-km", clusterSelectionEpsilonKm, "must be a non-negative number");
        }
        if (!keysWithErrors.contains("dedupe-precision")
                && (dedupePrecision < 1 || dedupePrecision > Geohash.MAX_PRECISION)) {
            invalid("dedupe-precision", dedupePrecision, "must be between 1 and 12");
        }
        if (!keysWithErrors.contains("duplicate-distance-m")
                && !(Double.isFinite(duplicateDistanceMeters) && duplicateDistanceMeters >= 0)) {
            invalid("duplicate-distance-m", duplicateDistanceMeters, "must be a non-negative number");
        }
        throwIfErrors();
    }

    /** Configuration from the given properties with environment and system property overrides applied. */
    public static PoiClusteringConfig fromProperties (Properties properties) {
        return new PoiClusteringConfig(properties, System.getenv(), System.getProperties());
    }

    /** The defaults shipped on the classpath, with environment and system property overrides. */
    public static PoiClusteringConfig load () {
        return fromProperties(propsFromResource(DEFAULTS_RESOURCE));
    }

    /** The defaults overlaid with the given properties file, then environment and system property overrides. */
    public static PoiClusteringConfig fromFile (String filename) {
        return fromProperties(propsFromFile(filename, propsFromResource(DEFAULTS_RESOURCE)));
    }

    @Override
    public boolean densityClusteringEnabled () {
        return densityClusteringEnabled;
    }

    @Override
    public double clusterSelectionEpsilonKm () {
        return clusterSelectionEpsilonKm;
    }

    @Override
    public int dedupePrecision () {
        return dedupePrecision;
    }

    @Override
    public double duplicateDistanceMeters () {
        return duplicateDistanceMeters;
    }

}
