package battetl.transform.dto;

import battetl.transform.model.DataTable;
import battetl.transform.model.FormatDetection;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A transformed table as returned over HTTP.
 *
 * NaN and infinite numbers are written as null; instants as ISO-8601 text.
 */
@Data
@NoArgsConstructor
public class TransformResponseDto {

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("cycler_make")
    private String cyclerMake;

    @JsonProperty("data_kind")
    private String dataKind;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("columns")
    private List<String> columns;

    @JsonProperty("rows")
    private List<Map<String, Object>> rows;

    public static TransformResponseDto of(String fileName, FormatDetection detection, DataTable table) {
        TransformResponseDto dto = new TransformResponseDto();
        dto.setFileName(fileName);
        dto.setCyclerMake(detection.getMake() != null ? detection.getMake().getValue() : null);
        dto.setDataKind(detection.getKind() != null ? detection.getKind().getValue() : null);
        dto.setRowCount(table.size());
        dto.setColumns(new ArrayList<>(table.getColumns()));

        List<Map<String, Object>> rows = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (String column : table.getColumns()) {
                out.put(column, toJsonValue(row.get(column)));
            }
            rows.add(out);
        }
        dto.setRows(rows);
        return dto;
    }

    private static Object toJsonValue(Object value) {
        if (value instanceof Double && (((Double) value).isNaN() || ((Double) value).isInfinite())) {
            return null;
        }
        if (value instanceof Instant) {
            return value.toString();
        }
        return value;
    }
}
