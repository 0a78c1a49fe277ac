package battetl.transform.controller;

import battetl.transform.util.CyclerTestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class TransformControllerTest {

    private static final String FIVE_STEP_SCHEDULE = "{\"chg\":[2,3],\"dsg\":[5],\"rst\":[1,4]}";

    @Autowired
    private MockMvc mockMvc;

    @Test
    public void testTransformTestData_MaccorExport() throws Exception {
        MockMultipartFile file = CyclerTestDataFactory.csvFile(
                "file", "maccor.csv", CyclerTestDataFactory.maccorTestData(1));

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file)
                .param("timezone", "UTC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycler_make").value("maccor"))
                .andExpect(jsonPath("$.data_kind").value("test_data"))
                .andExpect(jsonPath("$.file_name").value("maccor.csv"))
                .andExpect(jsonPath("$.columns", hasItems("cycle", "step", "voltage_mv", "unixtime_s")))
                .andExpect(jsonPath("$.rows[0].recorded_datetime").value("2023-03-14T08:00:00Z"))
                .andExpect(jsonPath("$.rows[0].voltage_mv").value(3600.0));
    }

    @Test
    public void testTransformTestData_UnstructuredWithDescriptor() throws Exception {
        MockMultipartFile file = CyclerTestDataFactory.csvFile(
                "file", "bench.csv", CyclerTestDataFactory.unstructuredTestData());
        String descriptor = "{"
                + "\"test_time_s\":{\"column_name\":\"time\",\"scaling_factor\":1},"
                + "\"voltage_mv\":{\"column_name\":\"volt\",\"scaling_factor\":1000},"
                + "\"current_ma\":{\"column_name\":\"curr\",\"scaling_factor\":1000},"
                + "\"cycle\":{\"column_name\":\"cyc\"},"
                + "\"step\":{\"column_name\":\"stp\"}"
                + "}";

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file)
                .param("descriptor", descriptor))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycler_make").isEmpty())
                .andExpect(jsonPath("$.row_count").value(3))
                .andExpect(jsonPath("$.rows[1].voltage_mv").value(3800.0))
                .andExpect(jsonPath("$.rows[1].current_ma").value(500.0));
    }

    @Test
    public void testTransformTestData_DescriptorMissingVoltage_BadRequest() throws Exception {
        MockMultipartFile file = CyclerTestDataFactory.csvFile(
                "file", "bench.csv", CyclerTestDataFactory.unstructuredTestData());
        String descriptor = "{\"test_time_s\":{\"column_name\":\"time\"},\"current_ma\":{\"column_name\":\"curr\"}}";

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file)
                .param("descriptor", descriptor))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));
    }

    @Test
    public void testTransformTestData_MalformedDescriptor_BadRequest() throws Exception {
        MockMultipartFile file = CyclerTestDataFactory.csvFile(
                "file", "bench.csv", CyclerTestDataFactory.unstructuredTestData());

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file)
                .param("descriptor", "{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testTransformTestData_EmptyFile_BadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]);

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));
    }

    @Test
    public void testTransformTestData_WrongExtension_BadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "export.xlsx", "application/octet-stream",
                "a,b\n1,2".getBytes());

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testTransformTestData_UnknownTimezone_BadRequest() throws Exception {
        MockMultipartFile file = CyclerTestDataFactory.csvFile(
                "file", "maccor.csv", CyclerTestDataFactory.maccorTestData(1));

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file)
                .param("timezone", "Mars/Olympus_Mons"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testCorrelationIdEchoedAndReportedInErrors() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]);

        mockMvc.perform(multipart("/api/v1/transform/test-data")
                .file(file)
                .header("X-Correlation-ID", "run-7"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-Correlation-ID", "run-7"))
                .andExpect(jsonPath("$.correlation_id").value("run-7"));
    }

    @Test
    public void testCalculateCycleStats_JoinedOntoReportedStats() throws Exception {
        MockMultipartFile testData = CyclerTestDataFactory.csvFile(
                "testData", "maccor.csv", CyclerTestDataFactory.maccorTestData(4));
        MockMultipartFile cycleStats = CyclerTestDataFactory.csvFile(
                "cycleStats", "maccor_stats.csv", CyclerTestDataFactory.maccorCycleStats(4));

        mockMvc.perform(multipart("/api/v1/transform/cycle-stats")
                .file(testData)
                .file(cycleStats)
                .param("steps", FIVE_STEP_SCHEDULE)
                .param("cellThermocoupleIndex", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycler_make").value("maccor"))
                .andExpect(jsonPath("$.data_kind").value("cycle_stats"))
                .andExpect(jsonPath("$.row_count").value(4))
                .andExpect(jsonPath("$.columns", hasItems(
                        "reported_charge_capacity_mah", "calculated_charge_capacity_mah",
                        "calculated_cc_charge_time_s", "calculated_max_charge_temp_c")))
                .andExpect(jsonPath("$.rows[1].calculated_max_charge_temp_c").value(30.0));
    }

    @Test
    public void testCalculateCycleStats_NaNWrittenAsNull() throws Exception {
        // Given: no discharge steps, so coulombic efficiency cannot be calculated
        MockMultipartFile testData = CyclerTestDataFactory.csvFile(
                "testData", "maccor.csv", CyclerTestDataFactory.maccorTestData(2));

        mockMvc.perform(multipart("/api/v1/transform/cycle-stats")
                .file(testData)
                .param("steps", "{\"chg\":[2,3],\"dsg\":[],\"rst\":[1,4,5]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data_kind").value("test_data"))
                .andExpect(jsonPath("$.columns", hasItem("calculated_coulombic_efficiency")))
                .andExpect(jsonPath("$.rows[0].calculated_coulombic_efficiency").isEmpty());
    }

    @Test
    public void testCalculateCycleStats_InvalidSteps_BadRequest() throws Exception {
        MockMultipartFile testData = CyclerTestDataFactory.csvFile(
                "testData", "maccor.csv", CyclerTestDataFactory.maccorTestData(1));

        mockMvc.perform(multipart("/api/v1/transform/cycle-stats")
                .file(testData)
                .param("steps", "[2,3]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));
    }
}
