package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.DataTable;
import battetl.transform.model.ScheduleSteps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Derives vendor-neutral charge/discharge capacity and energy columns.
 *
 * Maccor reports a single capacity (and energy) reading that counts up during
 * both charge and discharge steps; Arbin reports separate charge and discharge
 * counters. Both become {@code charge_capacity_mah}, {@code discharge_capacity_mah},
 * {@code charge_energy_mwh} and {@code discharge_energy_mwh}, each holding the
 * vendor reading only on rows of the matching schedule steps and null elsewhere.
 * The vendor columns are kept.
 */
@Service
@Slf4j
public class CapacityHarmonizerService {

    /**
     * Add the harmonized capacity/energy columns to the table in place.
     *
     * @param table normalized test data with a {@code step} column
     * @param steps schedule step classification
     * @return the same table
     */
    public DataTable harmonize(DataTable table, ScheduleSteps steps) {
        if (table.hasColumn(CyclerColumns.MACCOR_CAPACITY_MAH)) {
            mask(table, steps, CyclerColumns.MACCOR_CAPACITY_MAH, CyclerColumns.MACCOR_CAPACITY_MAH,
                    CyclerColumns.CHARGE_CAPACITY_MAH, CyclerColumns.DISCHARGE_CAPACITY_MAH);

            if (table.hasColumn(CyclerColumns.MACCOR_ENERGY_MWH)) {
                mask(table, steps, CyclerColumns.MACCOR_ENERGY_MWH, CyclerColumns.MACCOR_ENERGY_MWH,
                        CyclerColumns.CHARGE_ENERGY_MWH, CyclerColumns.DISCHARGE_ENERGY_MWH);
                log.debug("Harmonized Maccor capacity and energy for {} rows", table.size());
            } else {
                log.debug("Harmonized Maccor capacity for {} rows, no energy column present", table.size());
            }
            return table;
        }

        if (table.hasColumn(CyclerColumns.ARBIN_CHARGE_CAPACITY_MAH)
                || table.hasColumn(CyclerColumns.ARBIN_DISCHARGE_CAPACITY_MAH)) {
            mask(table, steps, CyclerColumns.ARBIN_CHARGE_CAPACITY_MAH, CyclerColumns.ARBIN_DISCHARGE_CAPACITY_MAH,
                    CyclerColumns.CHARGE_CAPACITY_MAH, CyclerColumns.DISCHARGE_CAPACITY_MAH);

            if (table.hasColumn(CyclerColumns.ARBIN_CHARGE_ENERGY_MWH)
                    || table.hasColumn(CyclerColumns.ARBIN_DISCHARGE_ENERGY_MWH)) {
                mask(table, steps, CyclerColumns.ARBIN_CHARGE_ENERGY_MWH, CyclerColumns.ARBIN_DISCHARGE_ENERGY_MWH,
                        CyclerColumns.CHARGE_ENERGY_MWH, CyclerColumns.DISCHARGE_ENERGY_MWH);
            }
            log.debug("Harmonized Arbin capacity and energy for {} rows", table.size());
            return table;
        }

        log.warn("No capacity columns were found to harmonize");
        return table;
    }

    private static void mask(DataTable table, ScheduleSteps steps,
                             String chargeSource, String dischargeSource,
                             String chargeTarget, String dischargeTarget) {
        List<Integer> chargeSteps = steps.getChg();
        List<Integer> dischargeSteps = steps.getDsg();

        table.setColumn(chargeTarget, row -> inSteps(row, chargeSteps) ? numeric(row.get(chargeSource)) : null);
        table.setColumn(dischargeTarget, row -> inSteps(row, dischargeSteps) ? numeric(row.get(dischargeSource)) : null);
    }

    static boolean inSteps(Map<String, Object> row, List<Integer> steps) {
        Integer step = stepOf(row);
        return step != null && steps != null && steps.contains(step);
    }

    static Integer stepOf(Map<String, Object> row) {
        double step = DataTable.toDouble(row.get(CyclerColumns.STEP));
        return Double.isNaN(step) ? null : (int) step;
    }

    private static Double numeric(Object value) {
        double number = DataTable.toDouble(value);
        return Double.isNaN(number) ? null : number;
    }
}
