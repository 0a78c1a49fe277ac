package battetl.transform.service;

import battetl.transform.config.BattEtlConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates a {@link BatteryDataTransformer} per run, wired with the shared
 * engine services, the configured timezone and the configured hooks.
 */
@Service
@Slf4j
public class BatteryDataTransformerFactory {

    private final FormatDetectorService formatDetectorService;
    private final ColumnNormalizerService columnNormalizerService;
    private final DateTimeHarmonizerService dateTimeHarmonizerService;
    private final CycleStatisticsService cycleStatisticsService;
    private final TableTransformerFactory tableTransformerFactory;
    private final BattEtlConfig config;

    public BatteryDataTransformerFactory(FormatDetectorService formatDetectorService,
                                         ColumnNormalizerService columnNormalizerService,
                                         DateTimeHarmonizerService dateTimeHarmonizerService,
                                         CycleStatisticsService cycleStatisticsService,
                                         TableTransformerFactory tableTransformerFactory,
                                         BattEtlConfig config) {
        this.formatDetectorService = formatDetectorService;
        this.columnNormalizerService = columnNormalizerService;
        this.dateTimeHarmonizerService = dateTimeHarmonizerService;
        this.cycleStatisticsService = cycleStatisticsService;
        this.tableTransformerFactory = tableTransformerFactory;
        this.config = config;
    }

    public BatteryDataTransformer create() {
        return create(config.getTransform().getTimezone());
    }

    /**
     * @param timezone IANA zone for naive timestamps; null means the configured default
     */
    public BatteryDataTransformer create(String timezone) {
        BattEtlConfig.Transform settings = config.getTransform();
        String zone = timezone != null && !timezone.trim().isEmpty() ? timezone.trim() : settings.getTimezone();
        log.debug("Creating transformer with timezone {}", zone);

        return new BatteryDataTransformer(
                formatDetectorService,
                columnNormalizerService,
                dateTimeHarmonizerService,
                cycleStatisticsService,
                zone,
                settings.getUnnamedColumnRegex(),
                tableTransformerFactory.getTransformer(settings.getTestDataHookClass()),
                tableTransformerFactory.getTransformer(settings.getCycleStatsHookClass()));
    }
}
