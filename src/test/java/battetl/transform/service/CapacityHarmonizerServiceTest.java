package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.DataTable;
import battetl.transform.model.ScheduleSteps;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CapacityHarmonizerServiceTest {

    private static final ScheduleSteps STEPS = ScheduleSteps.of(List.of(2), List.of(4), List.of(1, 3));

    private final CapacityHarmonizerService harmonizer = new CapacityHarmonizerService();

    @Test
    void testHarmonize_MaccorSingleCounter_SplitByStep() {
        // Given
        DataTable table = DataTable.of(
                List.of(CyclerColumns.STEP, CyclerColumns.MACCOR_CAPACITY_MAH, CyclerColumns.MACCOR_ENERGY_MWH),
                List.of(
                        Arrays.asList(1, 0.0, 0.0),
                        Arrays.asList(2, 500.0, 1850.0),
                        Arrays.asList(3, 0.0, 0.0),
                        Arrays.asList(4, 400.0, 1480.0),
                        Arrays.asList(5, 9.0, 9.0)));

        // When
        DataTable result = harmonizer.harmonize(table, STEPS);

        // Then
        assertSame(table, result);
        assertThat(table.getColumnValues(CyclerColumns.CHARGE_CAPACITY_MAH))
                .containsExactly(null, 500.0, null, null, null);
        assertThat(table.getColumnValues(CyclerColumns.DISCHARGE_CAPACITY_MAH))
                .containsExactly(null, null, null, 400.0, null);
        assertThat(table.getColumnValues(CyclerColumns.CHARGE_ENERGY_MWH))
                .containsExactly(null, 1850.0, null, null, null);
        assertThat(table.getColumnValues(CyclerColumns.DISCHARGE_ENERGY_MWH))
                .containsExactly(null, null, null, 1480.0, null);
        assertTrue(table.hasColumn(CyclerColumns.MACCOR_CAPACITY_MAH));
    }

    @Test
    void testHarmonize_MaccorWithoutEnergy_OnlyCapacityAdded() {
        DataTable table = DataTable.of(
                List.of(CyclerColumns.STEP, CyclerColumns.MACCOR_CAPACITY_MAH),
                List.of(Arrays.asList(2L, 10.0)));

        harmonizer.harmonize(table, STEPS);

        assertEquals(10.0, table.getValue(0, CyclerColumns.CHARGE_CAPACITY_MAH));
        assertFalse(table.hasColumn(CyclerColumns.CHARGE_ENERGY_MWH));
    }

    @Test
    void testHarmonize_ArbinSeparateCounters() {
        // Given
        DataTable table = DataTable.of(
                List.of(CyclerColumns.STEP,
                        CyclerColumns.ARBIN_CHARGE_CAPACITY_MAH, CyclerColumns.ARBIN_DISCHARGE_CAPACITY_MAH,
                        CyclerColumns.ARBIN_CHARGE_ENERGY_MWH, CyclerColumns.ARBIN_DISCHARGE_ENERGY_MWH),
                List.of(
                        Arrays.asList(2, 700.0, 0.0, 2600.0, 0.0),
                        Arrays.asList(4, 700.0, 650.0, 2600.0, 2300.0)));

        // When
        harmonizer.harmonize(table, STEPS);

        // Then
        assertThat(table.getColumnValues(CyclerColumns.CHARGE_CAPACITY_MAH)).containsExactly(700.0, null);
        assertThat(table.getColumnValues(CyclerColumns.DISCHARGE_CAPACITY_MAH)).containsExactly(null, 650.0);
        assertThat(table.getColumnValues(CyclerColumns.CHARGE_ENERGY_MWH)).containsExactly(2600.0, null);
        assertThat(table.getColumnValues(CyclerColumns.DISCHARGE_ENERGY_MWH)).containsExactly(null, 2300.0);
    }

    @Test
    void testHarmonize_NoCapacityColumns_TableUnchanged() {
        DataTable table = DataTable.of(List.of(CyclerColumns.STEP, CyclerColumns.VOLTAGE_MV),
                List.of(Arrays.asList(2, 4000.0)));

        harmonizer.harmonize(table, STEPS);

        assertThat(table.getColumns()).containsExactly(CyclerColumns.STEP, CyclerColumns.VOLTAGE_MV);
    }

    @Test
    void testStepOf_ReadsNumericText() {
        Map<String, Object> row = new HashMap<>();
        row.put(CyclerColumns.STEP, "4");

        assertEquals(4, CapacityHarmonizerService.stepOf(row));
        assertTrue(CapacityHarmonizerService.inSteps(row, List.of(4)));

        row.put(CyclerColumns.STEP, null);
        assertNull(CapacityHarmonizerService.stepOf(row));
        assertFalse(CapacityHarmonizerService.inSteps(row, List.of(4)));
    }
}
