package battetl.transform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the transform engine and its upload surface
 *
 * Maps directly to properties in application.properties:
 * - battetl.transform.timezone
 * - battetl.transform.cv-voltage-threshold-mv
 * - battetl.transform.cell-thermocouple-index
 * - battetl.transform.unnamed-column-regex
 * - battetl.transform.test-data-hook-class
 * - battetl.transform.cycle-stats-hook-class
 * - battetl.csv.delimiter
 * - battetl.csv.charset
 * - battetl.api.allowed-extensions
 */
@Configuration
@ConfigurationProperties(prefix = "battetl")
@Data
public class BattEtlConfig {

    // ========================================
    // TRANSFORM SETTINGS (battetl.transform.*)
    // ========================================

    private Transform transform = new Transform();

    @Data
    public static class Transform {
        /** IANA zone used to localize naive cycler timestamps */
        private String timezone = CyclerColumns.DEFAULT_TIME_ZONE;

        /** Voltage at or above which a charge row counts as constant voltage */
        private Double cvVoltageThresholdMv = 4195.0;

        /** Thermocouple channel attached to the cell, used for max temperature stats */
        private Integer cellThermocoupleIndex;

        /** Columns whose name matches this regex are index artifacts and get dropped */
        private String unnamedColumnRegex = "(?i)^\\s*$|.*unnamed.*";

        /** Optional TableTransformer class applied after test data normalization */
        private String testDataHookClass;

        /** Optional TableTransformer class applied after cycle stats normalization */
        private String cycleStatsHookClass;
    }

    // ========================================
    // CSV SETTINGS (battetl.csv.*)
    // ========================================

    private Csv csv = new Csv();

    @Data
    public static class Csv {
        private char delimiter = ',';

        private String charset = "UTF-8";
    }

    // ========================================
    // API UPLOAD SETTINGS (battetl.api.*)
    // ========================================

    private Api api = new Api();

    @Data
    public static class Api {
        /** Comma-separated list of accepted upload extensions */
        private String allowedExtensions = "csv,txt";

        public String[] getAllowedExtensionsArray() {
            if (allowedExtensions == null || allowedExtensions.trim().isEmpty()) {
                return new String[0];
            }
            return allowedExtensions.split(",\\s*");
        }
    }
}
