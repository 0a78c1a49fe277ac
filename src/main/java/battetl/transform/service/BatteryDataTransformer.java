package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.CycleStatisticsResult;
import battetl.transform.model.CyclerMake;
import battetl.transform.model.DataKind;
import battetl.transform.model.DataTable;
import battetl.transform.model.FormatDetection;
import battetl.transform.model.ScheduleSteps;
import battetl.transform.model.UnstructuredFileDescriptor;
import battetl.transform.transformer.TableTransformer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Transforms one test's raw cycler tables to the canonical schema.
 *
 * An instance holds the last transformed test data and cycle stats of a
 * single run. It is not thread-safe; create one per run through
 * {@link BatteryDataTransformerFactory}.
 */
@Slf4j
public class BatteryDataTransformer {

    private static final int MAX_CYCLE = 65535;
    private static final int MAX_STEP = 255;

    private final FormatDetectorService formatDetectorService;
    private final ColumnNormalizerService columnNormalizerService;
    private final DateTimeHarmonizerService dateTimeHarmonizerService;
    private final CycleStatisticsService cycleStatisticsService;
    private final String timezone;
    private final Pattern unnamedColumnPattern;
    private final TableTransformer testDataHook;
    private final TableTransformer cycleStatsHook;

    @Getter
    private DataTable testData = new DataTable();

    @Getter
    private DataTable cycleStats = new DataTable();

    @Getter
    private FormatDetection lastDetection = FormatDetection.NONE;

    public BatteryDataTransformer(FormatDetectorService formatDetectorService,
                                  ColumnNormalizerService columnNormalizerService,
                                  DateTimeHarmonizerService dateTimeHarmonizerService,
                                  CycleStatisticsService cycleStatisticsService,
                                  String timezone,
                                  String unnamedColumnRegex,
                                  TableTransformer testDataHook,
                                  TableTransformer cycleStatsHook) {
        this.formatDetectorService = formatDetectorService;
        this.columnNormalizerService = columnNormalizerService;
        this.dateTimeHarmonizerService = dateTimeHarmonizerService;
        this.cycleStatisticsService = cycleStatisticsService;
        this.timezone = timezone != null ? timezone : CyclerColumns.DEFAULT_TIME_ZONE;
        this.unnamedColumnPattern = Pattern.compile(unnamedColumnRegex);
        this.testDataHook = testDataHook;
        this.cycleStatsHook = cycleStatsHook;
    }

    public DataTable transformTestData(DataTable raw) {
        return transformTestData(raw, null);
    }

    /**
     * Transform raw test data to the canonical schema.
     *
     * When no known cycler layout matches and a descriptor is given, the
     * descriptor's column mapping and scaling factors are applied instead.
     * Without a descriptor an unrecognized table passes through unrenamed.
     *
     * @param raw        table as read from the cycler file; not modified
     * @param descriptor mapping for files of unknown layout, or null
     * @return the transformed table, also kept as {@link #getTestData()}
     * @throws TransformValidationException when the descriptor lacks required roles or columns
     */
    public DataTable transformTestData(DataTable raw, UnstructuredFileDescriptor descriptor) {
        log.info("Transform test data");

        DataTable table = prepare(raw);
        FormatDetection detection = detect(table);

        if (detection.is(CyclerMake.ARBIN, DataKind.TEST_DATA)) {
            table = transformArbinTestData(table);
        } else if (detection.is(CyclerMake.MACCOR, DataKind.TEST_DATA)) {
            table = transformMaccorTestData(table);
        } else if (!detection.isDetected() && descriptor != null) {
            table = transformUnstructuredTestData(table, descriptor);
        } else {
            log.warn("Test data layout not recognized (make: {}, kind: {}), passing columns through unchanged",
                    detection.getMake(), detection.getKind());
        }

        testData = applyHook(testDataHook, table);
        return testData;
    }

    /**
     * Transform raw cycle stats to the canonical schema. An unrecognized table
     * passes through unrenamed.
     *
     * @param raw table as read from the cycler file; not modified
     * @return the transformed table, also kept as {@link #getCycleStats()}
     */
    public DataTable transformCycleStats(DataTable raw) {
        log.info("Transform cycle stats");

        DataTable table = prepare(raw);
        FormatDetection detection = detect(table);

        if (detection.is(CyclerMake.ARBIN, DataKind.CYCLE_STATS)) {
            table = transformArbinCycleStats(table);
        } else if (detection.is(CyclerMake.MACCOR, DataKind.CYCLE_STATS)) {
            table = transformMaccorCycleStats(table);
        } else {
            log.warn("Cycle stats layout not recognized (make: {}, kind: {}), passing columns through unchanged",
                    detection.getMake(), detection.getKind());
        }

        cycleStats = applyHook(cycleStatsHook, table);
        return cycleStats;
    }

    /**
     * Calculate per-cycle statistics from the transformed test data.
     *
     * The calculated columns are joined onto previously transformed cycle
     * stats when there are any. Afterwards {@link #getTestData()} holds the
     * test data with harmonized capacity columns and capacity-reset corrections.
     *
     * @param steps             schedule step classification
     * @param cvThresholdMv     constant-voltage threshold, or null to skip CC/CV
     * @param thermocoupleIndex cell thermocouple channel, or null
     * @return the cycle statistics, also kept as {@link #getCycleStats()}
     * @throws TransformValidationException when there is no transformed test data
     */
    public DataTable calcCycleStats(ScheduleSteps steps, Double cvThresholdMv, Integer thermocoupleIndex) {
        CycleStatisticsResult result = cycleStatisticsService.calculate(
                testData, steps, cvThresholdMv, thermocoupleIndex, cycleStats);

        testData = result.getCorrectedTestData();
        cycleStats = result.getCycleStats();
        return cycleStats;
    }

    // ========================================
    // VENDOR PIPELINES
    // ========================================

    private DataTable transformArbinTestData(DataTable table) {
        columnNormalizerService.rename(table, CyclerColumns.ARBIN_TEST_DATA_MAPPING);
        columnNormalizerService.convertToMilli(table);
        convertDatetimeUnixtime(table);
        narrowTypes(table);
        sortTestData(table);
        return table;
    }

    private DataTable transformArbinCycleStats(DataTable table) {
        columnNormalizerService.rename(table, CyclerColumns.ARBIN_CYCLE_STATS_MAPPING);
        columnNormalizerService.convertToMilli(table);
        narrowTypes(table);
        sortCycleStats(table);
        return table;
    }

    private DataTable transformMaccorTestData(DataTable table) {
        columnNormalizerService.rename(table, CyclerColumns.MACCOR_TEST_DATA_MAPPING);
        columnNormalizerService.convertToMilli(table);
        convertTimedeltaIfText(table, CyclerColumns.TEST_TIME_S);
        convertTimedeltaIfText(table, CyclerColumns.STEP_TIME_S);
        convertDatetimeUnixtime(table);
        narrowTypes(table);
        sortTestData(table);
        return table;
    }

    private DataTable transformMaccorCycleStats(DataTable table) {
        columnNormalizerService.rename(table, CyclerColumns.MACCOR_CYCLE_STATS_MAPPING);
        columnNormalizerService.convertToMilli(table);
        narrowTypes(table);
        convertTimedeltaIfText(table, CyclerColumns.TEST_TIME_S);
        sortCycleStats(table);
        return table;
    }

    private DataTable transformUnstructuredTestData(DataTable table, UnstructuredFileDescriptor descriptor) {
        log.info("Transform unstructured test data with descriptor roles {}", descriptor.getColumns().keySet());
        validateDescriptor(table, descriptor);

        for (Map.Entry<String, UnstructuredFileDescriptor.ColumnSpec> entry : descriptor.getColumns().entrySet()) {
            String role = entry.getKey();
            String source = entry.getValue().getColumnName();
            if (!source.equals(role) && !table.renameColumn(source, role)) {
                throw new TransformValidationException(
                        String.format("Cannot map column '%s' to '%s': name already present", source, role));
            }
        }

        convertTimedeltaIfText(table, CyclerColumns.TEST_TIME_S);

        for (Map.Entry<String, UnstructuredFileDescriptor.ColumnSpec> entry : descriptor.getColumns().entrySet()) {
            String role = entry.getKey();
            double factor = entry.getValue().getScalingFactor();
            if (!CyclerColumns.RECORDED_DATETIME.equals(role) && factor != 1.0) {
                log.info("Scaling {} by {}", role, factor);
                table.setColumn(role, row -> scale(row.get(role), factor, role));
            }
        }

        convertDatetimeUnixtime(table);
        narrowTypes(table);
        sortTestData(table);
        return table;
    }

    // ========================================
    // SHARED STEPS
    // ========================================

    private DataTable prepare(DataTable raw) {
        DataTable table = raw.copy();

        List<String> unnamed = new ArrayList<>();
        for (String column : table.getColumns()) {
            if (unnamedColumnPattern.matcher(column).matches()) {
                unnamed.add(column);
            }
        }
        if (!unnamed.isEmpty()) {
            log.info("Drop unnamed columns {}", unnamed);
            table.dropColumns(unnamed);
        }

        int dropped = table.dropEmptyRows();
        if (dropped > 0) {
            log.info("Dropped {} empty rows", dropped);
        }
        return table;
    }

    private FormatDetection detect(DataTable table) {
        lastDetection = formatDetectorService.detect(table.getColumns());
        log.info("Cycler make: {}. Data type: {}", lastDetection.getMake(), lastDetection.getKind());
        return lastDetection;
    }

    private void convertDatetimeUnixtime(DataTable table) {
        if (!table.hasColumn(CyclerColumns.RECORDED_DATETIME)) {
            log.warn("No {} column, {} will not be added", CyclerColumns.RECORDED_DATETIME, CyclerColumns.UNIXTIME_S);
            return;
        }
        dateTimeHarmonizerService.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, timezone);
        dateTimeHarmonizerService.addUnixTime(table, CyclerColumns.RECORDED_DATETIME);
    }

    private void convertTimedeltaIfText(DataTable table, String column) {
        if (!table.hasColumn(column)) {
            return;
        }
        Object first = firstValue(table, column);
        if (dateTimeHarmonizerService.isTimedeltaText(first)) {
            dateTimeHarmonizerService.convertTimedeltaToSeconds(table, column);
        }
    }

    /**
     * Store {@code cycle} and {@code step} as Integer. Values outside the
     * unsigned 16-bit and 8-bit ranges are kept and logged.
     */
    private void narrowTypes(DataTable table) {
        if (table.hasColumn(CyclerColumns.CYCLE)) {
            log.info("Convert column `{}` to uint16", CyclerColumns.CYCLE);
            narrow(table, CyclerColumns.CYCLE, MAX_CYCLE);
        }
        if (table.hasColumn(CyclerColumns.STEP)) {
            log.info("Convert column `{}` to uint8", CyclerColumns.STEP);
            narrow(table, CyclerColumns.STEP, MAX_STEP);
        }
    }

    private static void narrow(DataTable table, String column, int max) {
        int[] outOfRange = {0};
        table.setColumn(column, row -> {
            Object value = row.get(column);
            double number = DataTable.toDouble(value);
            if (Double.isNaN(number)) {
                return value;
            }
            if (number < 0 || number > max) {
                outOfRange[0]++;
            }
            return (int) number;
        });
        if (outOfRange[0] > 0) {
            log.warn("{} values of column {} are outside 0..{}", outOfRange[0], column, max);
        }
    }

    /**
     * Chronological order: by {@code unixtime_s}, or by {@code test_time_s}
     * when there is no datetime, then by step. Without either time column the
     * file order is kept.
     */
    private static void sortTestData(DataTable table) {
        String timeColumn = table.hasColumn(CyclerColumns.UNIXTIME_S) ? CyclerColumns.UNIXTIME_S
                : table.hasColumn(CyclerColumns.TEST_TIME_S) ? CyclerColumns.TEST_TIME_S
                : null;
        if (timeColumn == null) {
            log.warn("No {} or {} column, keeping file order", CyclerColumns.UNIXTIME_S, CyclerColumns.TEST_TIME_S);
            return;
        }
        log.info("Sort data by [{}, {}]", timeColumn, CyclerColumns.STEP);
        table.sort(numericOrder(timeColumn).thenComparing(numericOrder(CyclerColumns.STEP)));
    }

    private static void sortCycleStats(DataTable table) {
        log.info("Sort data by [{}]", CyclerColumns.CYCLE);
        table.sort(numericOrder(CyclerColumns.CYCLE));
    }

    /**
     * Ascending numeric order with missing values last.
     */
    private static Comparator<Map<String, Object>> numericOrder(String column) {
        return (left, right) -> {
            double a = DataTable.toDouble(left.get(column));
            double b = DataTable.toDouble(right.get(column));
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return Boolean.compare(Double.isNaN(a), Double.isNaN(b));
            }
            return Double.compare(a, b);
        };
    }

    private static DataTable applyHook(TableTransformer hook, DataTable table) {
        if (hook == null || !hook.requiresTransformation()) {
            return table;
        }
        log.info("Apply user defined transform {}", hook.getClass().getName());
        DataTable transformed = hook.transform(table);
        if (transformed == null) {
            throw new TransformValidationException(
                    "User defined transform " + hook.getClass().getName() + " returned no table");
        }
        return transformed;
    }

    private static void validateDescriptor(DataTable table, UnstructuredFileDescriptor descriptor) {
        for (String role : CyclerColumns.UNSTRUCTURED_REQUIRED_ROLES) {
            if (!descriptor.hasRole(role)) {
                throw new TransformValidationException("Descriptor does not contain required key: " + role);
            }
        }
        boolean hasTime = CyclerColumns.UNSTRUCTURED_TIME_ROLES.stream().anyMatch(descriptor::hasRole);
        if (!hasTime) {
            throw new TransformValidationException(
                    "Descriptor needs one of " + CyclerColumns.UNSTRUCTURED_TIME_ROLES);
        }
        for (Map.Entry<String, UnstructuredFileDescriptor.ColumnSpec> entry : descriptor.getColumns().entrySet()) {
            UnstructuredFileDescriptor.ColumnSpec spec = entry.getValue();
            if (spec == null || spec.getColumnName() == null || spec.getColumnName().trim().isEmpty()) {
                throw new TransformValidationException("Descriptor role " + entry.getKey() + " names no column");
            }
            if (!table.hasColumn(spec.getColumnName())) {
                throw new TransformValidationException("Can not find column " + spec.getColumnName());
            }
        }
    }

    private static Double scale(Object value, double factor, String role) {
        if (DataTable.isBlank(value)) {
            return null;
        }
        double number = DataTable.toDouble(value);
        if (Double.isNaN(number)) {
            throw new TransformValidationException(
                    String.format("Column %s holds non-numeric value '%s'", role, value));
        }
        return number * factor;
    }

    private static Object firstValue(DataTable table, String column) {
        for (Map<String, Object> row : table.getRows()) {
            Object value = row.get(column);
            if (!DataTable.isBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
