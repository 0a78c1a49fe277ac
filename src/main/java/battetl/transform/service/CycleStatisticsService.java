package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.CycleStatisticsResult;
import battetl.transform.model.DataTable;
import battetl.transform.model.ScheduleSteps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-cycle charge and discharge statistics computed from normalized test data.
 *
 * For every cycle the charge rows (steps in {@code chg}) and discharge rows
 * (steps in {@code dsg}) are aggregated step by step in the order the steps
 * first appear. Elapsed time and capacity accumulate across the phase's steps,
 * so rest steps between them contribute nothing. When a cycler resets its
 * capacity counter at the start of every step, the step's readings are offset
 * by the capacity already accumulated; the corrected readings are returned with
 * the statistics.
 *
 * The input table is never modified.
 */
@Service
@Slf4j
public class CycleStatisticsService {

    private static final List<String> ID_COLUMNS = List.of(CyclerColumns.CYCLE);

    private final CapacityHarmonizerService capacityHarmonizerService;

    public CycleStatisticsService(CapacityHarmonizerService capacityHarmonizerService) {
        this.capacityHarmonizerService = capacityHarmonizerService;
    }

    /**
     * Compute cycle statistics.
     *
     * @param testData          normalized test data with {@code cycle}, {@code step}, {@code voltage_mv}
     *                          and a time column ({@code step_time_s} or {@code test_time_s})
     * @param steps             schedule step classification
     * @param cvThresholdMv     voltage at or above which a charge row counts as constant voltage;
     *                          null skips the CC/CV split
     * @param thermocoupleIndex thermocouple channel attached to the cell; null skips max temperatures
     * @param reportedStats     cycle stats reported by the cycler, or null. When present the
     *                          calculated columns are left-joined onto it by cycle
     * @return statistics plus a corrected copy of the test data
     * @throws TransformValidationException when a required column is absent
     */
    public CycleStatisticsResult calculate(DataTable testData, ScheduleSteps steps, Double cvThresholdMv,
                                           Integer thermocoupleIndex, DataTable reportedStats) {
        log.debug("Calculating cycle statistics with cv voltage threshold {} mV", cvThresholdMv);

        if (testData == null || testData.isEmpty()) {
            throw new TransformValidationException("Cannot calculate cycle statistics without test data");
        }
        for (String required : List.of(CyclerColumns.CYCLE, CyclerColumns.STEP)) {
            if (!testData.hasColumn(required)) {
                throw new TransformValidationException("Can not find column " + required);
            }
        }
        if (!testData.hasColumn(CyclerColumns.STEP_TIME_S) && !testData.hasColumn(CyclerColumns.TEST_TIME_S)) {
            throw new TransformValidationException(
                    "Test data needs " + CyclerColumns.STEP_TIME_S + " or " + CyclerColumns.TEST_TIME_S);
        }
        if (cvThresholdMv == null) {
            log.warn("No cv voltage threshold given, CC/CV statistics will be omitted");
        }

        DataTable corrected = capacityHarmonizerService.harmonize(testData.copy(), steps);
        String thermocoupleColumn = thermocoupleColumn(corrected, thermocoupleIndex);

        DataTable calculated = new DataTable(ID_COLUMNS);
        Map<Double, DataTable> cycles = corrected.groupBy(CycleStatisticsService::cycleNumber);
        int grouped = cycles.values().stream().mapToInt(DataTable::size).sum();
        if (grouped < corrected.size()) {
            log.warn("{} rows have no cycle number and are ignored", corrected.size() - grouped);
        }

        for (DataTable cycleData : cycles.values()) {
            Object cycle = cycleData.getValue(0, CyclerColumns.CYCLE);

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put(CyclerColumns.CYCLE, cycle);
            stats.putAll(chargeStats(cycleData, steps, cvThresholdMv, thermocoupleColumn, cycle));
            stats.putAll(dischargeStats(cycleData, steps, thermocoupleColumn, cycle));
            stats.put(CyclerColumns.CALC_COULOMBIC_EFFICIENCY, coulombicEfficiency(stats, cycle));

            calculated.addRow(stats);
        }
        log.info("Calculated statistics for {} cycles", calculated.size());

        DataTable cycleStats = reportedStats == null || reportedStats.isEmpty()
                ? calculated
                : joinOnCycle(reportedStats, calculated);
        return new CycleStatisticsResult(cycleStats, corrected);
    }

    private Map<String, Object> chargeStats(DataTable cycleData, ScheduleSteps steps, Double cvThresholdMv,
                                            String thermocoupleColumn, Object cycle) {
        Map<String, Object> stats = new LinkedHashMap<>();

        DataTable chargeData = cycleData.filter(row -> steps.isCharge(CapacityHarmonizerService.stepOf(row)));
        if (chargeData.size() < 2) {
            log.info("No charge data for cycle {}", cycle);
            return stats;
        }

        PhaseTable phase = PhaseTable.build(chargeData, CyclerColumns.CHARGE_CAPACITY_MAH,
                CyclerColumns.CHARGE_ENERGY_MWH, cvThresholdMv, cycle);

        stats.put(CyclerColumns.CALC_CHARGE_CAPACITY_MAH, phase.finalCapacity());
        stats.put(CyclerColumns.CALC_CHARGE_ENERGY_MWH, phase.finalEnergy());
        stats.put(CyclerColumns.CALC_CHARGE_TIME_S, phase.finalElapsed());

        if (cvThresholdMv != null) {
            stats.put(CyclerColumns.CALC_CC_CHARGE_TIME_S, phase.ccTime);
            stats.put(CyclerColumns.CALC_CV_CHARGE_TIME_S, phase.cvTime);
            stats.put(CyclerColumns.CALC_CC_CAPACITY_MAH, phase.ccCapacity);
            stats.put(CyclerColumns.CALC_CV_CAPACITY_MAH, phase.cvCapacity);
        }

        double fifty = phase.timeToFraction(0.5);
        double eighty = phase.timeToFraction(0.8);
        if (Double.isNaN(fifty) || Double.isNaN(eighty)) {
            log.warn("Incomplete charge data for cycle {}", cycle);
        }
        stats.put(CyclerColumns.CALC_FIFTY_PERCENT_CHARGE_TIME_S, fifty);
        stats.put(CyclerColumns.CALC_EIGHTY_PERCENT_CHARGE_TIME_S, eighty);

        putMaxTemperature(stats, CyclerColumns.CALC_MAX_CHARGE_TEMP_C, chargeData, thermocoupleColumn);
        return stats;
    }

    private Map<String, Object> dischargeStats(DataTable cycleData, ScheduleSteps steps,
                                               String thermocoupleColumn, Object cycle) {
        Map<String, Object> stats = new LinkedHashMap<>();

        DataTable dischargeData = cycleData.filter(row -> steps.isDischarge(CapacityHarmonizerService.stepOf(row)));
        if (dischargeData.size() < 2) {
            log.info("No discharge data for cycle {}", cycle);
            return stats;
        }

        PhaseTable phase = PhaseTable.build(dischargeData, CyclerColumns.DISCHARGE_CAPACITY_MAH,
                CyclerColumns.DISCHARGE_ENERGY_MWH, null, cycle);

        stats.put(CyclerColumns.CALC_DISCHARGE_CAPACITY_MAH, phase.finalCapacity());
        stats.put(CyclerColumns.CALC_DISCHARGE_ENERGY_MWH, phase.finalEnergy());
        stats.put(CyclerColumns.CALC_DISCHARGE_TIME_S, phase.finalElapsed());

        putMaxTemperature(stats, CyclerColumns.CALC_MAX_DISCHARGE_TEMP_C, dischargeData, thermocoupleColumn);
        return stats;
    }

    private static double coulombicEfficiency(Map<String, Object> stats, Object cycle) {
        double charge = DataTable.toDouble(stats.get(CyclerColumns.CALC_CHARGE_CAPACITY_MAH));
        double discharge = DataTable.toDouble(stats.get(CyclerColumns.CALC_DISCHARGE_CAPACITY_MAH));

        if (Double.isNaN(charge) || Double.isNaN(discharge) || charge == 0) {
            log.info("Unable to calculate coulombic efficiency for cycle {}", cycle);
            return Double.NaN;
        }
        return discharge / charge;
    }

    private static String thermocoupleColumn(DataTable table, Integer thermocoupleIndex) {
        if (thermocoupleIndex == null) {
            return null;
        }
        String column = String.format(CyclerColumns.THERMOCOUPLE_TEMPLATE, thermocoupleIndex);
        if (!table.hasColumn(column)) {
            log.warn("Column {} not found, max temperatures will be omitted", column);
            return null;
        }
        return column;
    }

    private static void putMaxTemperature(Map<String, Object> stats, String key, DataTable phaseData,
                                          String thermocoupleColumn) {
        if (thermocoupleColumn == null) {
            return;
        }
        double max = Double.NaN;
        for (Map<String, Object> row : phaseData.getRows()) {
            double temperature = DataTable.toDouble(row.get(thermocoupleColumn));
            if (!Double.isNaN(temperature) && (Double.isNaN(max) || temperature > max)) {
                max = temperature;
            }
        }
        stats.put(key, max);
    }

    /**
     * Left join of calculated columns onto reported stats. Calculated columns
     * already present from an earlier run are replaced.
     */
    private static DataTable joinOnCycle(DataTable reported, DataTable calculated) {
        if (!reported.hasColumn(CyclerColumns.CYCLE)) {
            log.warn("Reported cycle stats have no {} column, returning calculated statistics only",
                    CyclerColumns.CYCLE);
            return calculated;
        }
        DataTable joined = reported.copy();
        joined.dropColumns(CyclerColumns.CALCULATED_COLUMNS);

        Map<Long, Map<String, Object>> byCycle = new HashMap<>();
        for (Map<String, Object> row : calculated.getRows()) {
            byCycle.put(cycleKey(row), row);
        }

        for (String column : calculated.getColumns()) {
            if (CyclerColumns.CYCLE.equals(column)) {
                continue;
            }
            joined.setColumn(column, row -> {
                Map<String, Object> match = byCycle.get(cycleKey(row));
                return match != null ? match.get(column) : null;
            });
        }
        log.debug("Joined calculated statistics onto {} reported cycles", joined.size());
        return joined;
    }

    private static Double cycleNumber(Map<String, Object> row) {
        double cycle = DataTable.toDouble(row.get(CyclerColumns.CYCLE));
        return Double.isNaN(cycle) ? null : cycle;
    }

    private static Long cycleKey(Map<String, Object> row) {
        double cycle = DataTable.toDouble(row.get(CyclerColumns.CYCLE));
        return Double.isNaN(cycle) ? null : (long) cycle;
    }

    /**
     * Step-by-step accumulation of one phase of a cycle: elapsed time,
     * cumulative capacity and energy for each row, plus the CC/CV split.
     */
    private static final class PhaseTable {

        private final List<double[]> rows = new ArrayList<>();
        private double ccTime;
        private double cvTime;
        private double ccCapacity;
        private double cvCapacity;

        private static final int ELAPSED = 0;
        private static final int CAPACITY = 1;
        private static final int ENERGY = 2;

        static PhaseTable build(DataTable phaseData, String capacityColumn, String energyColumn,
                                Double cvThresholdMv, Object cycle) {
            PhaseTable phase = new PhaseTable();
            boolean hasEnergy = phaseData.hasColumn(energyColumn);

            double elapsedBase = 0;
            double cumulativeCapacity = 0;
            double cumulativeEnergy = 0;
            boolean firstStep = true;

            for (Map.Entry<Integer, List<Map<String, Object>>> entry : groupBySteps(phaseData).entrySet()) {
                List<Map<String, Object>> stepRows = entry.getValue();

                double firstCapacity = zeroIfMissing(stepRows.get(0).get(capacityColumn));
                if (!firstStep && firstCapacity < cumulativeCapacity) {
                    log.debug("Capacity reset detected in cycle {} step {}, offsetting by {} mAh",
                            cycle, entry.getKey(), cumulativeCapacity);
                    offset(stepRows, capacityColumn, cumulativeCapacity);
                    if (hasEnergy) {
                        offset(stepRows, energyColumn, cumulativeEnergy);
                    }
                    firstCapacity = zeroIfMissing(stepRows.get(0).get(capacityColumn));
                }
                double firstEnergy = hasEnergy ? zeroIfMissing(stepRows.get(0).get(energyColumn)) : 0;
                double firstTestTime = DataTable.toDouble(stepRows.get(0).get(CyclerColumns.TEST_TIME_S));

                double capacityBase = cumulativeCapacity;
                double energyBase = cumulativeEnergy;
                // the phase starts at 0 even when its first step began before this cycle
                double stepOrigin = firstStep ? stepTime(stepRows.get(0), firstTestTime, 0) : 0;
                double previousStepTime = stepOrigin;
                double previousCapacity = cumulativeCapacity;

                for (Map<String, Object> row : stepRows) {
                    double stepTime = stepTime(row, firstTestTime, previousStepTime);
                    double capacity = accumulate(row.get(capacityColumn), capacityBase, firstCapacity,
                            previousCapacity);
                    double energy = hasEnergy
                            ? accumulate(row.get(energyColumn), energyBase, firstEnergy, cumulativeEnergy)
                            : Double.NaN;

                    if (cvThresholdMv != null) {
                        double voltage = DataTable.toDouble(row.get(CyclerColumns.VOLTAGE_MV));
                        if (voltage < cvThresholdMv) {
                            phase.ccTime += stepTime - previousStepTime;
                            phase.ccCapacity += capacity - previousCapacity;
                        } else {
                            phase.cvTime += stepTime - previousStepTime;
                            phase.cvCapacity += capacity - previousCapacity;
                        }
                    }

                    phase.rows.add(new double[]{elapsedBase + stepTime - stepOrigin, capacity, energy});
                    previousStepTime = stepTime;
                    previousCapacity = capacity;
                    cumulativeCapacity = capacity;
                    if (hasEnergy) {
                        cumulativeEnergy = energy;
                    }
                }

                elapsedBase += previousStepTime - stepOrigin;
                firstStep = false;
            }
            return phase;
        }

        double finalElapsed() {
            return last()[ELAPSED];
        }

        double finalCapacity() {
            return last()[CAPACITY];
        }

        double finalEnergy() {
            return last()[ENERGY];
        }

        /**
         * Time from the phase start to the first row whose cumulative capacity
         * exceeds the given fraction of the final capacity, or NaN.
         */
        double timeToFraction(double fraction) {
            double target = finalCapacity() * fraction;
            double start = rows.get(0)[ELAPSED];
            for (double[] row : rows) {
                if (row[CAPACITY] > target) {
                    return row[ELAPSED] - start;
                }
            }
            return Double.NaN;
        }

        private double[] last() {
            return rows.get(rows.size() - 1);
        }

        private static Map<Integer, List<Map<String, Object>>> groupBySteps(DataTable phaseData) {
            Map<Integer, List<Map<String, Object>>> groups = new LinkedHashMap<>();
            for (Map<String, Object> row : phaseData.getRows()) {
                groups.computeIfAbsent(CapacityHarmonizerService.stepOf(row), step -> new ArrayList<>()).add(row);
            }
            return groups;
        }

        /**
         * Time since the start of the step. {@code step_time_s} when present,
         * otherwise derived from {@code test_time_s}. A missing reading keeps
         * the previous one.
         */
        private static double stepTime(Map<String, Object> row, double firstTestTime, double previous) {
            double stepTime = DataTable.toDouble(row.get(CyclerColumns.STEP_TIME_S));
            if (Double.isNaN(stepTime)) {
                stepTime = DataTable.toDouble(row.get(CyclerColumns.TEST_TIME_S)) - firstTestTime;
            }
            return Double.isNaN(stepTime) ? previous : stepTime;
        }

        private static void offset(List<Map<String, Object>> stepRows, String column, double amount) {
            for (Map<String, Object> row : stepRows) {
                double value = DataTable.toDouble(row.get(column));
                if (!Double.isNaN(value)) {
                    row.put(column, value + amount);
                }
            }
        }

        /**
         * Cumulative value of a reading: the phase total before this step plus
         * the change since the step's first reading. A missing reading keeps
         * the previous cumulative value.
         */
        private static double accumulate(Object reading, double base, double first, double previous) {
            double value = DataTable.toDouble(reading);
            return Double.isNaN(value) ? previous : base + value - first;
        }

        private static double zeroIfMissing(Object value) {
            double number = DataTable.toDouble(value);
            return Double.isNaN(number) ? 0 : number;
        }
    }
}
