package battetl.transform.service;

import battetl.transform.config.BattEtlConfig;
import battetl.transform.model.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads delimited cycler exports into a raw {@link DataTable}.
 *
 * Features:
 * - Header line becomes the column names; blank names become {@code Unnamed: <index>}
 * - Repeated header names get {@code .1}, {@code .2}, ... suffixes
 * - Quoted fields with embedded delimiters and doubled quotes
 * - Per-value type inference: blank -> null, integer -> Long, decimal -> Double, else String
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class CsvTableReaderService {

    private static final Logger logger = LoggerFactory.getLogger(CsvTableReaderService.class);

    private static final Pattern INTEGER = Pattern.compile("^[-+]?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?$");

    private final BattEtlConfig config;

    public CsvTableReaderService(BattEtlConfig config) {
        this.config = config;
    }

    /**
     * Read an uploaded file with the configured delimiter and charset.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file has no header
     */
    public DataTable readTable(MultipartFile file) throws IOException {
        logger.debug("Reading table from file: {}", file.getOriginalFilename());
        try (InputStream inputStream = file.getInputStream()) {
            DataTable table = readTable(inputStream, config.getCsv().getDelimiter(),
                    Charset.forName(config.getCsv().getCharset()));
            logger.info("Read {} rows and {} columns from {}",
                    table.size(), table.getColumns().size(), file.getOriginalFilename());
            return table;
        }
    }

    /**
     * Read a delimited stream. The stream is not closed.
     *
     * @throws IOException              if the stream cannot be read
     * @throws IllegalArgumentException if the stream is empty or has no header
     */
    public DataTable readTable(InputStream inputStream, char delimiter, Charset charset) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, charset));

        String headerLine = reader.readLine();
        if (headerLine == null || headerLine.trim().isEmpty()) {
            throw new IllegalArgumentException("File is empty or has no header");
        }
        if (headerLine.charAt(0) == '\uFEFF') {
            headerLine = headerLine.substring(1);
        }

        List<String> columns = uniqueColumnNames(parseRow(headerLine, delimiter));

        List<List<Object>> values = new ArrayList<>();
        String line;
        long lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            List<String> fields = parseRow(line, delimiter);
            if (fields.size() > columns.size()) {
                logger.debug("Line {} has {} fields for {} columns, extra fields ignored",
                        lineNumber, fields.size(), columns.size());
            }
            List<Object> row = new ArrayList<>(fields.size());
            for (String field : fields) {
                row.add(inferType(field));
            }
            values.add(row);
        }

        return DataTable.of(columns, values);
    }

    /**
     * Parse one delimited row, handling quoted fields and doubled quotes.
     * Surrounding spaces are removed; tabs are kept unless they are the delimiter.
     *
     * Examples with ',':
     *   "1,2.5,CC Chg" -> ["1", "2.5", "CC Chg"]
     *   "1,\"3,500.2\",x" -> ["1", "3,500.2", "x"]
     */
    public List<String> parseRow(String line, char delimiter) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                values.add(stripSpaces(currentValue));
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }

        values.add(stripSpaces(currentValue));
        return values;
    }

    /**
     * Blank names become {@code Unnamed: <index>}; repeats get a numeric suffix.
     */
    List<String> uniqueColumnNames(List<String> header) {
        List<String> columns = new ArrayList<>(header.size());
        Set<String> seen = new HashSet<>();
        Map<String, Integer> repeats = new HashMap<>();

        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).trim();
            if (name.isEmpty()) {
                name = "Unnamed: " + i;
            }
            String unique = name;
            while (seen.contains(unique)) {
                int count = repeats.merge(name, 1, Integer::sum);
                unique = name + "." + count;
            }
            seen.add(unique);
            columns.add(unique);
        }
        return columns;
    }

    static Object inferType(String field) {
        String text = field.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return Double.parseDouble(text);
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        return field;
    }

    private static String stripSpaces(StringBuilder value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == ' ') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == ' ') {
            end--;
        }
        return value.substring(start, end);
    }
}
