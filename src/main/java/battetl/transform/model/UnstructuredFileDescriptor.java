package battetl.transform.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller supplied description of a file that matches no known cycler layout.
 *
 * Maps a canonical column role (for example {@code voltage_mv}) to the source
 * column holding it and the factor that scales the source values into the
 * canonical unit.
 *
 * JSON form:
 * <pre>
 * {
 *   "voltage_mv": {"column_name": "volt", "scaling_factor": 1000},
 *   "current_ma": {"column_name": "curr", "scaling_factor": 1},
 *   "test_time_s": {"column_name": "time", "scaling_factor": 1}
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
public class UnstructuredFileDescriptor {

    private final Map<String, ColumnSpec> columns = new LinkedHashMap<>();

    @JsonAnySetter
    public void put(String role, ColumnSpec spec) {
        columns.put(role, spec);
    }

    @JsonAnyGetter
    public Map<String, ColumnSpec> getColumns() {
        return columns;
    }

    public UnstructuredFileDescriptor with(String role, String columnName, double scalingFactor) {
        columns.put(role, new ColumnSpec(columnName, scalingFactor));
        return this;
    }

    public boolean hasRole(String role) {
        return columns.containsKey(role);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColumnSpec {

        @JsonProperty("column_name")
        private String columnName;

        @JsonProperty("scaling_factor")
        private double scalingFactor = 1.0;
    }
}
