package com.travelagent.poi.main;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.travelagent.poi.PoiClusteringConfig;
import com.travelagent.poi.clustering.ClusteringAlgorithm;
import com.travelagent.poi.clustering.ClusteringParameters;
import com.travelagent.poi.clustering.PoiClustering;
import com.travelagent.poi.common.JsonUtilities;
import com.travelagent.poi.dedupe.DedupeKeyGenerator;
import com.travelagent.poi.dedupe.DuplicateMatcher;
import com.travelagent.poi.dedupe.PoiDeduplicator;
import com.travelagent.poi.model.ClusterAssignment;
import com.travelagent.poi.model.PoiRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON array of POIs from a file, clusters them and prints the resulting assignment as JSON on stdout.
 * Useful for trying out radii and cluster sizes against real search results.
 */
public class PoiClusteringMain {

    private static final Logger LOG = LoggerFactory.getLogger(PoiClusteringMain.class);

    static class Arguments {
        @Parameter(names = "--input", description = "JSON file holding an array of POIs", required = true)
        String input;

        @Parameter(names = "--algorithm", description = "proximity, hdbscan, dbscan or kmeans")
        String algorithm = "proximity";

        @Parameter(names = "--radius-km", description = "Link radius for proximity clustering")
        double radiusKm = 2.0;

        @Parameter(names = "--target-clusters", description = "Merge down to at most this many clusters (k for kmeans)")
        Integer targetClusters;

        @Parameter(names = "--min-cluster-size", description = "Smallest dense cluster for hdbscan and dbscan")
        int minClusterSize = 3;

        @Parameter(names = "--min-samples", description = "Neighborhood size defining core points in hdbscan")
        int minSamples = 2;

        @Parameter(names = "--eps-km", description = "Neighborhood radius for dbscan")
        double epsKm = 2.0;

        @Parameter(names = "--keep-noise", description = "Report outliers separately instead of joining them to clusters")
        boolean keepNoise = false;

        @Parameter(names = "--dedupe", description = "Assign dedupe keys and drop duplicates before clustering")
        boolean dedupe = false;

        @Parameter(names = "--config", description = "Properties file overriding the default configuration")
        String config;

        @Parameter(names = { "--help", "-h" }, help = true)
        boolean help;

        ClusteringParameters toClusteringParameters () {
            ClusteringParameters params = new ClusteringParameters();
            params.radiusKm = radiusKm;
            params.maxClusters = targetClusters;
            params.minClusterSize = minClusterSize;
            params.minSamples = minSamples;
            params.epsKm = epsKm;
            params.assignNoiseToNearest = !keepNoise;
            return params;
        }
    }

    public static void main (String[] args) {
        Arguments arguments = new Arguments();
        JCommander commander = JCommander.newBuilder().addObject(arguments).programName("poi-clustering").build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            commander.usage();
            System.exit(1);
        }
        if (arguments.help) {
            commander.usage();
            return;
        }
        long startTime = System.currentTimeMillis();
        System.out.println(JsonUtilities.objectToJsonString(run(arguments)));
        LOG.info("Total run time: {} sec", (System.currentTimeMillis() - startTime) / 1000D);
    }

    static ClusterAssignment run (Arguments arguments) {
        ClusteringAlgorithm algorithm = ClusteringAlgorithm.fromName(arguments.algorithm);
        PoiClusteringConfig config = arguments.config == null
                ? PoiClusteringConfig.load()
                : PoiClusteringConfig.fromFile(arguments.config);
        List<PoiRecord> pois = readPois(arguments.input);
        LOG.info("Read {} POIs from {}.", pois.size(), arguments.input);
        if (arguments.dedupe) {
            DedupeKeyGenerator keyGenerator = new DedupeKeyGenerator(config);
            PoiDeduplicator deduplicator = new PoiDeduplicator(keyGenerator, new DuplicateMatcher(keyGenerator, config));
            List<PoiRecord> identified = new ArrayList<>(pois.size());
            for (PoiRecord poi : pois) {
                identified.add(deduplicator.withIdentity(poi));
            }
            pois = deduplicator.deduplicate(identified);
        }
        return new PoiClustering(config).cluster(algorithm, pois, arguments.toClusteringParameters());
    }

    static List<PoiRecord> readPois (String path) {
        try {
            return JsonUtilities.objectMapper.readValue(new File(path), new TypeReference<List<PoiRecord>>() { });
        } catch (IOException e) {
            throw new RuntimeException("Could not read POIs from " + path, e);
        }
    }

}
