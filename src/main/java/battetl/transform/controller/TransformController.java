package battetl.transform.controller;

import battetl.transform.config.BattEtlConfig;
import battetl.transform.dto.ErrorResponseDto;
import battetl.transform.dto.TransformResponseDto;
import battetl.transform.model.DataTable;
import battetl.transform.model.FormatDetection;
import battetl.transform.model.ScheduleSteps;
import battetl.transform.model.UnstructuredFileDescriptor;
import battetl.transform.service.BatteryDataTransformer;
import battetl.transform.service.BatteryDataTransformerFactory;
import battetl.transform.service.CsvTableReaderService;
import battetl.transform.util.FileValidationUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Upload endpoints that run the transform engine on delimited cycler exports.
 */
@RestController
@RequestMapping("/api/v1/transform")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Transform", description = "Cycler data normalization and cycle statistics")
public class TransformController {

    private static final Logger logger = LoggerFactory.getLogger(TransformController.class);

    @Autowired
    private BatteryDataTransformerFactory transformerFactory;

    @Autowired
    private CsvTableReaderService csvTableReaderService;

    @Autowired
    private BattEtlConfig config;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * Normalize one test data file.
     */
    @PostMapping(value = "/test-data", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Normalize test data",
        description = "Detect the cycler layout of a test data export and return it in the canonical schema. "
                + "Files of unknown layout need a descriptor mapping canonical roles to their columns."
    )
    @ApiResponse(responseCode = "200", description = "Test data normalized")
    @ApiResponse(responseCode = "400", description = "Invalid file or descriptor")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> transformTestData(
            @Parameter(description = "Test data export", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Unstructured file descriptor as JSON, e.g. "
                    + "{\"voltage_mv\":{\"column_name\":\"volt\",\"scaling_factor\":1000}, ...}")
            @RequestParam(value = "descriptor", required = false) String descriptorJson,
            @Parameter(description = "IANA zone for naive timestamps, defaults to the configured zone")
            @RequestParam(value = "timezone", required = false) String timezone) {

        logger.info("Transforming test data file: {}", file.getOriginalFilename());

        try {
            FileValidationUtil.validateFile(file, "Test data", config.getApi().getAllowedExtensionsArray());
            UnstructuredFileDescriptor descriptor = descriptorJson == null || descriptorJson.trim().isEmpty()
                    ? null
                    : readJson(descriptorJson, UnstructuredFileDescriptor.class, "descriptor");

            BatteryDataTransformer transformer = transformerFactory.create(timezone);
            DataTable testData = transformer.transformTestData(csvTableReaderService.readTable(file), descriptor);

            logger.info("Test data transformed: {} rows, make {}",
                    testData.size(), transformer.getLastDetection().getMake());
            return ResponseEntity.ok(TransformResponseDto.of(
                    file.getOriginalFilename(), transformer.getLastDetection(), testData));

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to transform test data: {}", file.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to process file: " + e.getMessage()));
        }
    }

    /**
     * Calculate cycle statistics for a test.
     */
    @PostMapping(value = "/cycle-stats", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Calculate cycle statistics",
        description = "Normalize a test data export and calculate per-cycle charge/discharge statistics. "
                + "When the cycler's own cycle stats export is supplied, the calculated columns are joined onto it."
    )
    @ApiResponse(responseCode = "200", description = "Cycle statistics calculated")
    @ApiResponse(responseCode = "400", description = "Invalid files, steps or parameters")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> calculateCycleStats(
            @Parameter(description = "Test data export", required = true)
            @RequestParam("testData") MultipartFile testDataFile,
            @Parameter(description = "Cycle stats export reported by the cycler")
            @RequestParam(value = "cycleStats", required = false) MultipartFile cycleStatsFile,
            @Parameter(description = "Schedule steps as JSON, e.g. {\"chg\":[2,3],\"dsg\":[5],\"rst\":[1,4]}",
                    required = true)
            @RequestParam("steps") String stepsJson,
            @Parameter(description = "Constant-voltage threshold in mV, defaults to the configured threshold")
            @RequestParam(value = "cvVoltageThresholdMv", required = false) Double cvVoltageThresholdMv,
            @Parameter(description = "Thermocouple channel attached to the cell")
            @RequestParam(value = "cellThermocoupleIndex", required = false) Integer cellThermocoupleIndex,
            @Parameter(description = "IANA zone for naive timestamps, defaults to the configured zone")
            @RequestParam(value = "timezone", required = false) String timezone) {

        logger.info("Calculating cycle stats for file: {}", testDataFile.getOriginalFilename());

        try {
            String[] extensions = config.getApi().getAllowedExtensionsArray();
            FileValidationUtil.validateFile(testDataFile, "Test data", extensions);
            if (FileValidationUtil.isPresent(cycleStatsFile)) {
                FileValidationUtil.validateFileExtension(cycleStatsFile, "Cycle stats", extensions);
            }
            ScheduleSteps steps = readJson(stepsJson, ScheduleSteps.class, "steps");

            Double threshold = cvVoltageThresholdMv != null
                    ? cvVoltageThresholdMv
                    : config.getTransform().getCvVoltageThresholdMv();
            Integer thermocoupleIndex = cellThermocoupleIndex != null
                    ? cellThermocoupleIndex
                    : config.getTransform().getCellThermocoupleIndex();

            BatteryDataTransformer transformer = transformerFactory.create(timezone);
            FormatDetection detection = FormatDetection.NONE;
            if (FileValidationUtil.isPresent(cycleStatsFile)) {
                transformer.transformCycleStats(csvTableReaderService.readTable(cycleStatsFile));
                detection = transformer.getLastDetection();
            }
            transformer.transformTestData(csvTableReaderService.readTable(testDataFile));
            if (!detection.isDetected()) {
                detection = transformer.getLastDetection();
            }

            DataTable cycleStats = transformer.calcCycleStats(steps, threshold, thermocoupleIndex);

            logger.info("Cycle stats calculated for {} cycles", cycleStats.size());
            return ResponseEntity.ok(TransformResponseDto.of(
                    testDataFile.getOriginalFilename(), detection, cycleStats));

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Failed to calculate cycle stats: {}", testDataFile.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Failed to process file: " + e.getMessage()));
        }
    }

    private <T> T readJson(String json, Class<T> type, String label) {
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new IllegalArgumentException("Missing " + label);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid " + label + " JSON: " + e.getOriginalMessage(), e);
        }
    }
}
