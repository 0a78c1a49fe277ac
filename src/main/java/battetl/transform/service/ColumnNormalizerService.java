package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames vendor column names to the canonical schema and rescales base
 * units (V, A, Ah, Wh, Ohm) to milli units.
 */
@Service
@Slf4j
public class ColumnNormalizerService {

    private static final Pattern ARBIN_THERMOCOUPLE = Pattern.compile(CyclerColumns.ARBIN_THERMOCOUPLE_REGEX);
    private static final Pattern MACCOR_THERMOCOUPLE = Pattern.compile(CyclerColumns.MACCOR_THERMOCOUPLE_REGEX);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Rename columns using a vendor mapping table.
     *
     * Every column name is lower-cased and whitespace-normalized first, so
     * columns the mapping does not know pass through in that normalized form.
     * Thermocouple channels ({@code Aux_Temperature_N (C)} on Arbin,
     * {@code Temp N} on Maccor) become {@code thermocouple_N_c} before the
     * mapping is applied.
     *
     * @param table   table to rename in place
     * @param mapping vendor column name -> canonical column name
     * @return the same table
     */
    public DataTable rename(DataTable table, Map<String, String> mapping) {
        log.info("Rename column names to canonical format");
        log.debug("Columns before renaming: {}", table.getColumns());

        Map<String, String> mappingTable = new HashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            mappingTable.put(normalizeName(entry.getKey()), entry.getValue());
        }

        for (String column : new ArrayList<>(table.getColumns())) {
            String normalized = normalizeName(column);
            String thermocouple = thermocoupleName(normalized);
            String target = thermocouple != null ? thermocouple : mappingTable.getOrDefault(normalized, normalized);

            if (!target.equals(column) && !table.renameColumn(column, target)) {
                log.warn("Cannot rename column '{}' to '{}': name already present, keeping original", column, target);
            }
        }

        log.debug("Columns after renaming: {}", table.getColumns());
        return table;
    }

    /**
     * Convert every column listed in the unit conversion table to its milli
     * unit and rename it. Thousands separators are stripped before parsing.
     *
     * Running this twice is a no-op the second time: converted names never
     * appear as conversion sources.
     *
     * @param table table to convert in place
     * @return the same table
     * @throws TransformValidationException when a value cannot be read as a number
     */
    public DataTable convertToMilli(DataTable table) {
        log.info("Convert data to milli units");

        for (String column : new ArrayList<>(table.getColumns())) {
            String target = CyclerColumns.TO_MILLI.get(column);
            if (target == null) {
                continue;
            }

            log.info("Converting {} -> {} (x1000)", column, target);
            table.setColumn(column, row -> toMilli(row.get(column), column));

            if (table.hasColumn(target)) {
                log.warn("Column {} already present, replacing it with converted {}", target, column);
                table.dropColumn(target);
            }
            table.renameColumn(column, target);
        }

        return table;
    }

    /**
     * Lower-case, trim and collapse inner whitespace.
     */
    public static String normalizeName(String name) {
        return WHITESPACE.matcher(name.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    private static String thermocoupleName(String normalized) {
        for (Pattern pattern : List.of(ARBIN_THERMOCOUPLE, MACCOR_THERMOCOUPLE)) {
            Matcher matcher = pattern.matcher(normalized);
            if (matcher.find()) {
                return String.format(CyclerColumns.THERMOCOUPLE_TEMPLATE, matcher.group(1));
            }
        }
        return null;
    }

    private static Double toMilli(Object value, String column) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() * 1e3;
        }
        String text = value.toString().replace(",", "").trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text) * 1e3;
        } catch (NumberFormatException e) {
            throw new TransformValidationException(
                    String.format("Column %s holds non-numeric value '%s'", column, value), e);
        }
    }
}
