package battetl.transform.service;

import battetl.transform.model.CyclerMake;
import battetl.transform.model.DataKind;
import battetl.transform.model.FormatDetection;
import battetl.transform.util.CyclerTestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FormatDetectorService.
 * Each signature is checked at the smallest matching subset and one name short of it.
 */
class FormatDetectorServiceTest {

    private final FormatDetectorService detector = new FormatDetectorService();

    static Stream<Arguments> halfSignatures() {
        return Stream.of(
                Arguments.of("arbin test data", CyclerMake.ARBIN, DataKind.TEST_DATA,
                        List.of("ACR (Ohm)", "dQ/dV (Ah/V)", "Internal Resistance (Ohm)", "dV/dQ (V/Ah)")),
                Arguments.of("arbin cycle stats", CyclerMake.ARBIN, DataKind.CYCLE_STATS,
                        List.of("Charge Time (s)", "mAh/g", "Coulombic Efficiency (%)")),
                Arguments.of("maccor test data", CyclerMake.MACCOR, DataKind.TEST_DATA,
                        List.of("EV Temp", "Temp 1", "Cyc#", "StepTime(s)", "DPt Time")),
                Arguments.of("maccor type2", CyclerMake.MACCOR, DataKind.TEST_DATA,
                        List.of("Rec", "Cycle P", "Cycle C", "Capacity")),
                Arguments.of("maccor customer1", CyclerMake.MACCOR, DataKind.TEST_DATA,
                        List.of("Watt-hr", "Volt 1", "ManufacturerAccess (0x00)", "AtRate (0x02)",
                                "AtRateTimeToEmpty (0x04)", "Temperature (0x06)", "Voltage (0x08)",
                                "BatteryStatus (0x0A)", "Current (0x0C)", "RemainingCapacity (0x10)",
                                "FullChargeCapacity (0x12)", "AverageCurrent (0x14)",
                                "AverageTimeToEmpty (0x16)", "AverageTimeToFull (0x18)")),
                Arguments.of("maccor cycle stats", CyclerMake.MACCOR, DataKind.CYCLE_STATS,
                        List.of("T1_End", "T1_Max", "T1_Start", "T1_Min")),
                Arguments.of("maccor cycle stats customer1", CyclerMake.MACCOR, DataKind.CYCLE_STATS,
                        List.of("Cycle", "AH-IN", "AH-OUT", "T1_Start")));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("halfSignatures")
    void testDetect_HalfOfSignature_Matches(String name, CyclerMake make, DataKind kind, List<String> columns) {
        FormatDetection detection = detector.detect(columns);

        assertEquals(make, detection.getMake());
        assertEquals(kind, detection.getKind());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("halfSignatures")
    void testDetect_OneShortOfHalf_NoMatch(String name, CyclerMake make, DataKind kind, List<String> columns) {
        List<String> shortOne = new ArrayList<>(columns.subList(0, columns.size() - 1));

        FormatDetection detection = detector.detect(shortOne);

        assertFalse(detection.isDetected());
        assertSame(FormatDetection.NONE, detection);
    }

    @Test
    void testDetect_NameNormalization_IgnoresCaseSpacesAndUnderscores() {
        List<String> columns = List.of(" charge_time(S) ", "MAH/G", "coulombic efficiency(%)");

        FormatDetection detection = detector.detect(columns);

        assertTrue(detection.is(CyclerMake.ARBIN, DataKind.CYCLE_STATS));
    }

    @Test
    void testDetect_FirstSignatureInOrderWins() {
        // Given: enough names for both Arbin test data and Arbin cycle stats
        List<String> columns = new ArrayList<>(List.of(
                "ACR (Ohm)", "dQ/dV (Ah/V)", "Internal Resistance (Ohm)", "dV/dQ (V/Ah)"));
        columns.addAll(List.of("Charge Time (s)", "mAh/g", "Coulombic Efficiency (%)"));

        // When
        FormatDetection detection = detector.detect(columns);

        // Then
        assertTrue(detection.is(CyclerMake.ARBIN, DataKind.TEST_DATA));
    }

    @Test
    void testDetect_FullVendorHeaders() {
        assertTrue(detector.detect(CyclerTestDataFactory.MACCOR_TEST_DATA_HEADER)
                .is(CyclerMake.MACCOR, DataKind.TEST_DATA));
        assertTrue(detector.detect(CyclerTestDataFactory.MACCOR_CYCLE_STATS_HEADER)
                .is(CyclerMake.MACCOR, DataKind.CYCLE_STATS));
        assertTrue(detector.detect(CyclerTestDataFactory.ARBIN_TEST_DATA_HEADER)
                .is(CyclerMake.ARBIN, DataKind.TEST_DATA));
        assertTrue(detector.detect(CyclerTestDataFactory.ARBIN_CYCLE_STATS_HEADER)
                .is(CyclerMake.ARBIN, DataKind.CYCLE_STATS));
    }

    @Test
    void testDetect_UnknownColumns_ReturnsNone() {
        FormatDetection detection = detector.detect(List.of("time", "volt", "curr"));

        assertThat(detection.getMake()).isNull();
        assertThat(detection.getKind()).isNull();
    }

    @Test
    void testDetect_EmptyColumns_ReturnsNone() {
        assertFalse(detector.detect(List.of()).isDetected());
    }

    @Test
    void testNormalizeName() {
        assertEquals("chargecapacity(ah)", FormatDetectorService.normalizeName(" Charge_Capacity (Ah) "));
    }
}
