package battetl.transform.model;

import lombok.Value;

/**
 * Output of a cycle statistics run: one row per cycle, plus the test data
 * with harmonized capacity columns and any capacity-reset corrections applied.
 */
@Value
public class CycleStatisticsResult {

    DataTable cycleStats;
    DataTable correctedTestData;
}
