package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.DataTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DateTimeHarmonizerServiceTest {

    private static final String LA = "America/Los_Angeles";

    private final DateTimeHarmonizerService harmonizer = new DateTimeHarmonizerService();

    private static DataTable datetimes(Object... values) {
        return DataTable.of(List.of(CyclerColumns.RECORDED_DATETIME),
                Arrays.stream(values).map(value -> Arrays.asList(value)).toList());
    }

    @Test
    void testConvertDatetime_MaccorLayout_LocalToUtc() {
        // Given: March 14 2023 is daylight time in Los Angeles (UTC-7)
        DataTable table = datetimes("3/14/2023 8:00:00", "3/14/2023 13:05:09");

        // When
        harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, LA);

        // Then
        assertEquals(Instant.parse("2023-03-14T15:00:00Z"), table.getValue(0, CyclerColumns.RECORDED_DATETIME));
        assertEquals(Instant.parse("2023-03-14T20:05:09Z"), table.getValue(1, CyclerColumns.RECORDED_DATETIME));
    }

    @Test
    void testConvertDatetime_FractionalSeconds() {
        DataTable table = datetimes("1/5/2023 9:15:30.250");

        harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "UTC");

        assertEquals(Instant.parse("2023-01-05T09:15:30.250Z"), table.getValue(0, CyclerColumns.RECORDED_DATETIME));
    }

    @Test
    void testConvertDatetime_TabPrefixedLayout() {
        DataTable table = datetimes("\t1/5/2023 9:15:30.5");

        harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "UTC");

        assertEquals(Instant.parse("2023-01-05T09:15:30.500Z"), table.getValue(0, CyclerColumns.RECORDED_DATETIME));
    }

    @Test
    void testConvertDatetime_TwelveHourClock() {
        DataTable table = datetimes("1/5/2023 1:15:30 PM", "1/5/2023 12:00:00 am");

        harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "UTC");

        assertEquals(Instant.parse("2023-01-05T13:15:30Z"), table.getValue(0, CyclerColumns.RECORDED_DATETIME));
        assertEquals(Instant.parse("2023-01-05T00:00:00Z"), table.getValue(1, CyclerColumns.RECORDED_DATETIME));
    }

    @Test
    void testConvertDatetime_IsoTextWithOffset_KeepsOffset() {
        DataTable table = datetimes("2023-01-05T09:15:30+02:00", "2023-01-05 09:15:30");

        harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, LA);

        assertEquals(Instant.parse("2023-01-05T07:15:30Z"), table.getValue(0, CyclerColumns.RECORDED_DATETIME));
        // naive value uses the zone: PST is UTC-8 in January
        assertEquals(Instant.parse("2023-01-05T17:15:30Z"), table.getValue(1, CyclerColumns.RECORDED_DATETIME));
    }

    @Test
    void testConvertDatetime_NullStaysMissing() {
        DataTable table = datetimes("3/14/2023 8:00:00", null);

        harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "UTC");

        assertNull(table.getValue(1, CyclerColumns.RECORDED_DATETIME));
    }

    @Test
    void testConvertDatetime_NotATimestamp_Throws() {
        DataTable table = datetimes("yesterday");

        assertThrows(TransformValidationException.class,
                () -> harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "UTC"));
    }

    @Test
    void testConvertDatetime_UnknownZone_Throws() {
        DataTable table = datetimes("3/14/2023 8:00:00");

        assertThrows(TransformValidationException.class,
                () -> harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "Mars/Olympus_Mons"));
    }

    @Test
    void testConvertDatetime_MissingColumn_Throws() {
        DataTable table = new DataTable(List.of("cycle"));

        TransformValidationException exception = assertThrows(TransformValidationException.class,
                () -> harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "UTC"));

        assertThat(exception.getMessage()).contains(CyclerColumns.RECORDED_DATETIME);
    }

    @Test
    void testAddUnixTime_TruncatesToWholeSeconds() {
        // Given
        DataTable table = datetimes("1/5/2023 9:15:30.999", null);
        harmonizer.convertDatetime(table, CyclerColumns.RECORDED_DATETIME, "UTC");

        // When
        harmonizer.addUnixTime(table, CyclerColumns.RECORDED_DATETIME);

        // Then
        long expected = Instant.parse("2023-01-05T09:15:30Z").getEpochSecond();
        assertEquals(expected, table.getValue(0, CyclerColumns.UNIXTIME_S));
        assertNull(table.getValue(1, CyclerColumns.UNIXTIME_S));
    }

    @Test
    void testAddUnixTime_BeforeEpoch_FloorsTowardEarlierSecond() {
        DataTable table = datetimes(Instant.parse("1969-12-31T23:59:59.500Z"));

        harmonizer.addUnixTime(table, CyclerColumns.RECORDED_DATETIME);

        assertEquals(-1L, table.getValue(0, CyclerColumns.UNIXTIME_S));
    }

    @ParameterizedTest
    @CsvSource({
            "1d 15:07:52.77, 140872.77",
            "0d 00:00:01.5, 1.5",
            "3d 00:00:00, 259200.0",
            "10:00:00, 36000.0",
            "PT1M30S, 90.0",
            "12.3456, 12.346"
    })
    void testConvertTimedeltaToSeconds(String text, double expected) {
        DataTable table = DataTable.of(List.of(CyclerColumns.TEST_TIME_S), List.of(List.of(text)));

        harmonizer.convertTimedeltaToSeconds(table, CyclerColumns.TEST_TIME_S);

        assertEquals(expected, (Double) table.getValue(0, CyclerColumns.TEST_TIME_S), 1e-9);
    }

    @Test
    void testConvertTimedeltaToSeconds_NotADuration_Throws() {
        DataTable table = DataTable.of(List.of(CyclerColumns.TEST_TIME_S), List.of(List.of("soon")));

        assertThrows(TransformValidationException.class,
                () -> harmonizer.convertTimedeltaToSeconds(table, CyclerColumns.TEST_TIME_S));
    }

    @Test
    void testConvertTimedeltaToSeconds_MissingColumn_Throws() {
        assertThrows(TransformValidationException.class,
                () -> harmonizer.convertTimedeltaToSeconds(new DataTable(), CyclerColumns.STEP_TIME_S));
    }

    @Test
    void testIsTimedeltaText() {
        assertTrue(harmonizer.isTimedeltaText("1d 15:07:52.77"));
        assertTrue(harmonizer.isTimedeltaText(" 0d 00:01:00 "));
        assertFalse(harmonizer.isTimedeltaText("15:07:52"));
        assertFalse(harmonizer.isTimedeltaText(12.5));
        assertFalse(harmonizer.isTimedeltaText(null));
    }
}
