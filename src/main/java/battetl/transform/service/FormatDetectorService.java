package battetl.transform.service;

import battetl.transform.config.CyclerColumns;
import battetl.transform.model.CyclerMake;
import battetl.transform.model.DataKind;
import battetl.transform.model.FormatDetection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which cycler make and data kind a set of column names belongs to.
 *
 * Column names are compared after lower-casing and removing spaces and
 * underscores. A signature matches when at least half of its names are
 * present. Signatures are checked in a fixed order and the first match wins:
 * <ol>
 *   <li>Arbin test data</li>
 *   <li>Arbin cycle stats</li>
 *   <li>Maccor test data</li>
 *   <li>Maccor test data (type 2 export)</li>
 *   <li>Maccor test data (customer 1 export)</li>
 *   <li>Maccor cycle stats</li>
 *   <li>Maccor cycle stats (customer 1 export)</li>
 * </ol>
 * The Maccor layouts share many names, so this order is a contract.
 */
@Service
@Slf4j
public class FormatDetectorService {

    private static final List<Signature> SIGNATURES = List.of(
            new Signature("arbin test data", CyclerMake.ARBIN, DataKind.TEST_DATA,
                    CyclerColumns.ARBIN_TEST_DATA_SIGNATURE),
            new Signature("arbin cycle stats", CyclerMake.ARBIN, DataKind.CYCLE_STATS,
                    CyclerColumns.ARBIN_CYCLE_STATS_SIGNATURE),
            new Signature("maccor test data", CyclerMake.MACCOR, DataKind.TEST_DATA,
                    CyclerColumns.MACCOR_TEST_DATA_SIGNATURE),
            new Signature("maccor test data type2", CyclerMake.MACCOR, DataKind.TEST_DATA,
                    CyclerColumns.MACCOR_TEST_DATA_TYPE2_SIGNATURE),
            new Signature("maccor test data customer1", CyclerMake.MACCOR, DataKind.TEST_DATA,
                    CyclerColumns.MACCOR_TEST_DATA_CUSTOMER1_SIGNATURE),
            new Signature("maccor cycle stats", CyclerMake.MACCOR, DataKind.CYCLE_STATS,
                    CyclerColumns.MACCOR_CYCLE_STATS_SIGNATURE),
            new Signature("maccor cycle stats customer1", CyclerMake.MACCOR, DataKind.CYCLE_STATS,
                    CyclerColumns.MACCOR_CYCLE_STATS_CUSTOMER1_SIGNATURE));

    /**
     * Detect the cycler make and data kind of a column set.
     *
     * @param columnNames column names as they appear in the file
     * @return the first matching (make, kind), or {@link FormatDetection#NONE}
     */
    public FormatDetection detect(Collection<String> columnNames) {
        Set<String> columns = normalize(columnNames);

        for (Signature signature : SIGNATURES) {
            Set<String> overlap = new HashSet<>(signature.columns);
            overlap.retainAll(columns);

            // at least half of the signature, compared without rounding
            if (2 * overlap.size() >= signature.columns.size()) {
                log.info("Detected {} ({}/{} signature columns present)",
                        signature.name, overlap.size(), signature.columns.size());
                return new FormatDetection(signature.make, signature.kind);
            }
            log.debug("No match for {}: {}/{} signature columns present",
                    signature.name, overlap.size(), signature.columns.size());
        }

        log.info("Column set matches no known cycler format");
        return FormatDetection.NONE;
    }

    /**
     * Lower-case, trim and remove spaces and underscores.
     */
    public static String normalizeName(String name) {
        return name.toLowerCase(Locale.ROOT).trim().replace(" ", "").replace("_", "");
    }

    static Set<String> normalize(Collection<String> names) {
        Set<String> normalized = new HashSet<>();
        for (String name : names) {
            if (name != null) {
                normalized.add(normalizeName(name));
            }
        }
        return normalized;
    }

    private static final class Signature {
        private final String name;
        private final CyclerMake make;
        private final DataKind kind;
        private final Set<String> columns;

        private Signature(String name, CyclerMake make, DataKind kind, Set<String> columns) {
            this.name = name;
            this.make = make;
            this.kind = kind;
            this.columns = normalize(columns);
        }
    }
}
