package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses cycler timestamps into UTC instants and elapsed-time text into seconds.
 */
@Service
@Slf4j
public class DateTimeHarmonizerService {

    /**
     * Literal layouts written by the supported cyclers, in the order they are tried.
     */
    private static final List<NamedFormat> KNOWN_FORMATS = List.of(
            new NamedFormat("\\tM/d/yyyy H:mm:ss.f", new DateTimeFormatterBuilder()
                    .appendLiteral('\t')
                    .appendPattern("M/d/uuuu H:mm:ss")
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .toFormatter(Locale.US)),
            new NamedFormat("M/d/yyyy H:mm:ss.f", new DateTimeFormatterBuilder()
                    .appendPattern("M/d/uuuu H:mm:ss")
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .toFormatter(Locale.US)),
            new NamedFormat("M/d/yyyy h:mm:ss a", new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("M/d/uuuu h:mm:ss a")
                    .toFormatter(Locale.US)),
            new NamedFormat("M/d/yyyy H:mm:ss", new DateTimeFormatterBuilder()
                    .appendPattern("M/d/uuuu H:mm:ss")
                    .toFormatter(Locale.US)));

    private static final DateTimeFormatter GENERIC_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendPattern("HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd()
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd()
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalStart().appendLiteral('[').appendZoneRegionId().appendLiteral(']').optionalEnd()
            .toFormatter(Locale.US);

    private static final Pattern TIMEDELTA_TEXT = Pattern.compile(
            "\\d+d \\d+:\\d+:\\d+(\\.\\d+)?", Pattern.CASE_INSENSITIVE);

    private static final Pattern TIMEDELTA_PARTS = Pattern.compile(
            "^(-)?(?:(\\d+)\\s*(?:d|days?)\\s*,?\\s*)?(\\d+):(\\d+):(\\d+(?:\\.\\d+)?)$", Pattern.CASE_INSENSITIVE);

    /**
     * Replace a timestamp column with UTC instants.
     *
     * Text is parsed with the first known cycler layout that reads every value
     * of the column, falling back to ISO-8601 parsing per value. Naive
     * timestamps are taken to be local to {@code timezone}.
     *
     * @param table    table to convert in place
     * @param column   timestamp column
     * @param timezone IANA zone name, e.g. America/Los_Angeles
     * @return the same table
     * @throws TransformValidationException when the column is absent, the zone is unknown,
     *                                      or a value is not a timestamp
     */
    public DataTable convertDatetime(DataTable table, String column, String timezone) {
        log.info("Convert {} to UTC with timezone {}", column, timezone);

        if (!table.hasColumn(column)) {
            throw new TransformValidationException("Can not find column " + column);
        }

        ZoneId zone;
        try {
            zone = ZoneId.of(timezone != null ? timezone : CyclerColumns.DEFAULT_TIME_ZONE);
        } catch (DateTimeException e) {
            throw new TransformValidationException("Unknown time zone " + timezone, e);
        }

        DateTimeFormatter format = findColumnFormat(table, column);
        if (format == null) {
            log.debug("No known datetime layout fits column {}, parsing values individually", column);
        }

        table.setColumn(column, row -> toInstant(row.get(column), format, zone, column));
        return table;
    }

    /**
     * Add {@code unixtime_s} as whole seconds since the epoch, truncated toward
     * the earlier second.
     */
    public DataTable addUnixTime(DataTable table, String datetimeColumn) {
        log.info("Add {} from {}", CyclerColumns.UNIXTIME_S, datetimeColumn);

        if (!table.hasColumn(datetimeColumn)) {
            throw new TransformValidationException("Can not find column " + datetimeColumn);
        }
        table.setColumn(CyclerColumns.UNIXTIME_S, row -> {
            Object value = row.get(datetimeColumn);
            return value instanceof Instant ? ((Instant) value).getEpochSecond() : null;
        });
        return table;
    }

    /**
     * Replace elapsed-time text such as {@code 1d 15:07:52.77} with seconds,
     * rounded to three decimals.
     *
     * @throws TransformValidationException when the column is absent or a value is not a duration
     */
    public DataTable convertTimedeltaToSeconds(DataTable table, String column) {
        log.info("Convert {} to seconds", column);

        if (!table.hasColumn(column)) {
            throw new TransformValidationException("Can not find column " + column);
        }
        table.setColumn(column, row -> toSeconds(row.get(column), column));
        return table;
    }

    /**
     * Whether a value looks like {@code <days>d <h>:<m>:<s>[.fraction]}.
     */
    public boolean isTimedeltaText(Object value) {
        return value != null && TIMEDELTA_TEXT.matcher(value.toString().trim()).matches();
    }

    private DateTimeFormatter findColumnFormat(DataTable table, String column) {
        for (NamedFormat candidate : KNOWN_FORMATS) {
            if (parsesAll(table, column, candidate.formatter)) {
                log.debug("Found datetime format \"{}\" for column {}", candidate.name, column);
                return candidate.formatter;
            }
        }
        return null;
    }

    private static boolean parsesAll(DataTable table, String column, DateTimeFormatter formatter) {
        boolean sawText = false;
        for (Map<String, Object> row : table.getRows()) {
            Object value = row.get(column);
            if (!(value instanceof String) || ((String) value).trim().isEmpty()) {
                continue;
            }
            sawText = true;
            try {
                formatter.parse((String) value);
            } catch (DateTimeParseException e) {
                return false;
            }
        }
        return sawText;
    }

    private static Instant toInstant(Object value, DateTimeFormatter format, ZoneId zone, String column) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone).toInstant();
        }

        String text = value.toString();
        if (text.trim().isEmpty()) {
            return null;
        }
        if (format != null) {
            return LocalDateTime.parse(text, format).atZone(zone).toInstant();
        }
        return parseGeneric(text, zone, column);
    }

    private static Instant parseGeneric(String text, ZoneId zone, String column) {
        for (NamedFormat candidate : KNOWN_FORMATS) {
            try {
                return LocalDateTime.parse(text, candidate.formatter).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                log.trace("Value '{}' does not fit layout {}", text, candidate.name);
            }
        }

        String trimmed = text.trim();
        try {
            TemporalAccessor parsed = GENERIC_FORMAT.parse(trimmed);
            LocalDateTime local = LocalDateTime.of(
                    parsed.query(TemporalQueries.localDate()),
                    parsed.query(TemporalQueries.localTime()));
            ZoneId explicit = parsed.query(TemporalQueries.zone());
            return local.atZone(explicit != null ? explicit : zone).toInstant();
        } catch (DateTimeException e) {
            log.trace("Value '{}' is not an ISO-8601 date-time", trimmed);
        }

        try {
            return LocalDate.parse(trimmed).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new TransformValidationException(
                    String.format("Column %s holds value '%s' that is not a timestamp", column, text), e);
        }
    }

    private static Double toSeconds(Object value, String column) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return round3(BigDecimal.valueOf(((Number) value).doubleValue()));
        }

        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }

        Matcher matcher = TIMEDELTA_PARTS.matcher(text);
        if (matcher.matches()) {
            long days = matcher.group(2) != null ? Long.parseLong(matcher.group(2)) : 0;
            long whole = days * 86400 + Long.parseLong(matcher.group(3)) * 3600 + Long.parseLong(matcher.group(4)) * 60;
            BigDecimal seconds = BigDecimal.valueOf(whole).add(new BigDecimal(matcher.group(5)));
            return round3(matcher.group(1) != null ? seconds.negate() : seconds);
        }

        try {
            Duration duration = Duration.parse(text);
            return round3(BigDecimal.valueOf(duration.getSeconds()).add(BigDecimal.valueOf(duration.getNano(), 9)));
        } catch (DateTimeParseException e) {
            log.trace("Value '{}' is not an ISO-8601 duration", text);
        }

        try {
            return round3(new BigDecimal(text.replace(",", "")));
        } catch (NumberFormatException e) {
            throw new TransformValidationException(
                    String.format("Column %s holds value '%s' that is not a duration", column, value), e);
        }
    }

    private static double round3(BigDecimal seconds) {
        return seconds.setScale(3, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static final class NamedFormat {
        private final String name;
        private final DateTimeFormatter formatter;

        private NamedFormat(String name, DateTimeFormatter formatter) {
            this.name = name;
            this.formatter = formatter;
        }
    }
}
