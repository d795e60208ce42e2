package com.finanzas.ops.taxonomy.config;

import lombok.Data;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the taxonomy tooling.
 * <p>
 * Groups settings for:
 * <ul>
 *     <li>Store access (region, endpoint, table names)</li>
 *     <li>Report and backup locations</li>
 *     <li>Diff sampling limits</li>
 *     <li>Referencing-record migration throttling</li>
 * </ul>
 * Read-only commands may rely on the documented defaults; mutating commands must go through
 * the {@code require*} accessors, which refuse to fall back silently.
 */
@Data
public class TaxonomyOpsProperties {

    public static final String ENV_REGION = "AWS_REGION";
    public static final String ENV_ENDPOINT = "DYNAMODB_ENDPOINT";
    public static final String ENV_TAXONOMY_TABLE = "TAXONOMY_TABLE";
    public static final String ENV_ALLOCATIONS_TABLE = "ALLOCATIONS_TABLE";
    public static final String ENV_PROJECT_RUBROS_TABLE = "PROJECT_RUBROS_TABLE";
    public static final String ENV_REPORT_DIR = "TAXONOMY_REPORT_DIR";

    public static final String DEFAULT_REGION = "us-east-2";
    public static final String DEFAULT_TAXONOMY_TABLE = "finz_rubros_taxonomia";
    public static final String DEFAULT_ALLOCATIONS_TABLE = "allocations";
    public static final String DEFAULT_PROJECT_RUBROS_TABLE = "project_rubros";

    private final Store store = new Store();
    private final Reports reports = new Reports();
    private final Diff diff = new Diff();
    private final Migration migration = new Migration();

    /**
     * Build properties from environment variables. Unset variables stay {@code null} so that
     * callers can tell an explicit value from a default.
     */
    public static TaxonomyOpsProperties fromEnvironment(Map<String, String> env) {
        TaxonomyOpsProperties properties = new TaxonomyOpsProperties();
        properties.getStore().setRegion(blankToNull(env.get(ENV_REGION)));
        properties.getStore().setEndpoint(blankToNull(env.get(ENV_ENDPOINT)));
        properties.getStore().setTaxonomyTable(blankToNull(env.get(ENV_TAXONOMY_TABLE)));
        properties.getStore().setAllocationsTable(blankToNull(env.get(ENV_ALLOCATIONS_TABLE)));
        properties.getStore().setProjectRubrosTable(blankToNull(env.get(ENV_PROJECT_RUBROS_TABLE)));
        String reportDir = blankToNull(env.get(ENV_REPORT_DIR));
        if (reportDir != null) {
            properties.getReports().setDirectory(Paths.get(reportDir));
        }
        return properties;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Store access configuration.
     */
    @Data
    public static class Store {
        private String region;
        /** Endpoint override, e.g. DynamoDB Local */
        private String endpoint;
        private String taxonomyTable;
        private String allocationsTable;
        private String projectRubrosTable;
        private String partitionKey = "pk";
        private String sortKey = "sk";
        private int scanPageSize = 1000;

        public String regionOrDefault() {
            return region != null ? region : DEFAULT_REGION;
        }

        public String taxonomyTableOrDefault() {
            return taxonomyTable != null ? taxonomyTable : DEFAULT_TAXONOMY_TABLE;
        }

        public String allocationsTableOrDefault() {
            return allocationsTable != null ? allocationsTable : DEFAULT_ALLOCATIONS_TABLE;
        }

        public String projectRubrosTableOrDefault() {
            return projectRubrosTable != null ? projectRubrosTable : DEFAULT_PROJECT_RUBROS_TABLE;
        }

        public String requireRegion(String purpose) {
            return require(region, ENV_REGION, purpose);
        }

        public String requireTaxonomyTable(String purpose) {
            return require(taxonomyTable, ENV_TAXONOMY_TABLE, purpose);
        }

        public String requireAllocationsTable(String purpose) {
            return require(allocationsTable, ENV_ALLOCATIONS_TABLE, purpose);
        }

        public String requireProjectRubrosTable(String purpose) {
            return require(projectRubrosTable, ENV_PROJECT_RUBROS_TABLE, purpose);
        }

        private static String require(String value, String variable, String purpose) {
            if (value == null || value.isBlank()) {
                throw new MissingConfigurationException(variable, purpose);
            }
            return value;
        }
    }

    /**
     * Local report and backup locations.
     */
    @Data
    public static class Reports {
        private Path directory = Paths.get("tmp");
        private String diffReportFile = "taxonomy_report_full.json";

        public Path diffReportPath() {
            return directory.resolve(diffReportFile);
        }

        public Path backupDirectory() {
            return directory.resolve("backups");
        }
    }

    /**
     * Diff sampling limits.
     */
    @Data
    public static class Diff {
        /** Store rows compared per canonical id */
        private int sampleRowsPerId = 3;
        /** Frontend entries and table rows copied into the report for triage */
        private int reportSampleSize = 5;
    }

    /**
     * Referencing-record migration throttling.
     */
    @Data
    public static class Migration {
        private int batchSize = 50;
        private Duration batchPause = Duration.ofSeconds(1);
        private String primaryField = "rubro_id";
        private String canonicalField = "canonical_rubro_id";
        private String provenanceField = "legacy_rubro_token";
    }
}
