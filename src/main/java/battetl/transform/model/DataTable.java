package battetl.transform.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory tabular dataset with named columns and ordered rows.
 *
 * Each row is a column name -> value map. Values are Long, Integer, Double,
 * String, Instant or null. A null value is the missing marker and reads as
 * {@code Double.NaN} through the numeric accessors.
 *
 * Filtered views returned by {@link #filter(Predicate)} share their row maps
 * with the source table, so {@link #setValue(int, String, Object)} on a view is
 * visible in the source. Use {@link #copy()} to detach.
 */
public class DataTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public DataTable() {
        this(new ArrayList<>(), new ArrayList<>());
    }

    public DataTable(List<String> columns) {
        this(new ArrayList<>(columns), new ArrayList<>());
    }

    private DataTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Build a table from a header and positional row values.
     * Missing trailing values are stored as null.
     */
    public static DataTable of(List<String> columns, List<? extends List<?>> values) {
        DataTable table = new DataTable(columns);
        for (List<?> rowValues : values) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < rowValues.size() ? rowValues.get(i) : null);
            }
            table.rows.add(row);
        }
        return table;
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public Map<String, Object> getRow(int index) {
        return rows.get(index);
    }

    public void addRow(Map<String, Object> values) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!columns.contains(entry.getKey())) {
                columns.add(entry.getKey());
                for (Map<String, Object> existing : rows) {
                    existing.put(entry.getKey(), null);
                }
            }
        }
        for (String column : columns) {
            row.put(column, values.get(column));
        }
        rows.add(row);
    }

    public Object getValue(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    public void setValue(int rowIndex, String column, Object value) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        rows.get(rowIndex).put(column, value);
    }

    /**
     * Numeric read of a cell. Strings are parsed after stripping thousands
     * separators; null, blanks and unparsable text read as NaN.
     */
    public double getDouble(int rowIndex, String column) {
        return toDouble(rows.get(rowIndex).get(column));
    }

    public List<Object> getColumnValues(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Distinct values of a column in first-encounter order.
     */
    public Set<Object> distinct(String column) {
        Set<Object> values = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Rename a column in place, keeping its position.
     *
     * @return false when the source is absent or the target name is already taken
     */
    public boolean renameColumn(String from, String to) {
        int index = columns.indexOf(from);
        if (index < 0 || from.equals(to) || columns.contains(to)) {
            return false;
        }
        columns.set(index, to);
        for (Map<String, Object> row : rows) {
            row.put(to, row.remove(from));
        }
        return true;
    }

    public void dropColumn(String column) {
        if (columns.remove(column)) {
            for (Map<String, Object> row : rows) {
                row.remove(column);
            }
        }
    }

    public void dropColumns(Collection<String> toDrop) {
        for (String column : toDrop) {
            dropColumn(column);
        }
    }

    /**
     * Add a column (or overwrite an existing one) computed from each row.
     */
    public void setColumn(String column, Function<Map<String, Object>, Object> valueFn) {
        List<Object> computed = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            computed.add(valueFn.apply(row));
        }
        if (!columns.contains(column)) {
            columns.add(column);
        }
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).put(column, computed.get(i));
        }
    }

    /**
     * Rows matching the predicate. The returned table shares row maps with this one.
     */
    public DataTable filter(Predicate<Map<String, Object>> predicate) {
        List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (predicate.test(row)) {
                matching.add(row);
            }
        }
        return new DataTable(new ArrayList<>(columns), matching);
    }

    /**
     * Split rows into groups by key in one pass, groups in first-encounter
     * order. Rows whose key is null are left out. The groups share row maps
     * with this table.
     */
    public <K> Map<K, DataTable> groupBy(Function<Map<String, Object>, K> keyFn) {
        Map<K, DataTable> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            K key = keyFn.apply(row);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new DataTable(new ArrayList<>(columns), new ArrayList<>()))
                        .rows.add(row);
            }
        }
        return groups;
    }

    /**
     * Drop rows whose values are all null or blank.
     *
     * @return number of rows removed
     */
    public int dropEmptyRows() {
        int before = rows.size();
        rows.removeIf(row -> row.values().stream().allMatch(DataTable::isBlank));
        return before - rows.size();
    }

    /**
     * Stable in-place sort.
     */
    public void sort(Comparator<Map<String, Object>> comparator) {
        rows.sort(comparator);
    }

    /**
     * Deep copy of the column list and row maps. Cell values are immutable and shared.
     */
    public DataTable copy() {
        List<Map<String, Object>> copiedRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copiedRows.add(new LinkedHashMap<>(row));
        }
        return new DataTable(new ArrayList<>(columns), copiedRows);
    }

    public static double toDouble(Object value) {
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = value.toString().replace(",", "").trim();
        if (text.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        return value instanceof String && ((String) value).trim().isEmpty();
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
