package battetl.transform.config;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column name tables for the supported cycler file layouts.
 *
 * Signature sets drive format detection, mapping tables drive renaming to the
 * canonical schema, and {@link #TO_MILLI} drives unit rescaling. Mapping keys
 * are matched case-insensitively after trimming.
 */
public final class CyclerColumns {

    private CyclerColumns() {
    }

    public static final String DEFAULT_TIME_ZONE = "America/Los_Angeles";

    public static final String THERMOCOUPLE_TEMPLATE = "thermocouple_%s_c";
    public static final String ARBIN_THERMOCOUPLE_REGEX = "aux_temperature_(\\d+)\\s*\\(c\\)";
    public static final String MACCOR_THERMOCOUPLE_REGEX = "temp\\s*(\\d+)";

    // Canonical names
    public static final String CYCLE = "cycle";
    public static final String STEP = "step";
    public static final String TEST_TIME_S = "test_time_s";
    public static final String STEP_TIME_S = "step_time_s";
    public static final String CURRENT_MA = "current_ma";
    public static final String VOLTAGE_MV = "voltage_mv";
    public static final String RECORDED_DATETIME = "recorded_datetime";
    public static final String UNIXTIME_S = "unixtime_s";

    public static final String MACCOR_CAPACITY_MAH = "maccor_capacity_mah";
    public static final String MACCOR_ENERGY_MWH = "maccor_energy_mwh";
    public static final String ARBIN_CHARGE_CAPACITY_MAH = "arbin_charge_capacity_mah";
    public static final String ARBIN_DISCHARGE_CAPACITY_MAH = "arbin_discharge_capacity_mah";
    public static final String ARBIN_CHARGE_ENERGY_MWH = "arbin_charge_energy_mwh";
    public static final String ARBIN_DISCHARGE_ENERGY_MWH = "arbin_discharge_energy_mwh";

    public static final String CHARGE_CAPACITY_MAH = "charge_capacity_mah";
    public static final String DISCHARGE_CAPACITY_MAH = "discharge_capacity_mah";
    public static final String CHARGE_ENERGY_MWH = "charge_energy_mwh";
    public static final String DISCHARGE_ENERGY_MWH = "discharge_energy_mwh";

    // Calculated cycle statistics
    public static final String CALC_CHARGE_CAPACITY_MAH = "calculated_charge_capacity_mah";
    public static final String CALC_CHARGE_ENERGY_MWH = "calculated_charge_energy_mwh";
    public static final String CALC_CHARGE_TIME_S = "calculated_charge_time_s";
    public static final String CALC_CC_CHARGE_TIME_S = "calculated_cc_charge_time_s";
    public static final String CALC_CV_CHARGE_TIME_S = "calculated_cv_charge_time_s";
    public static final String CALC_CC_CAPACITY_MAH = "calculated_cc_capacity_mah";
    public static final String CALC_CV_CAPACITY_MAH = "calculated_cv_capacity_mah";
    public static final String CALC_FIFTY_PERCENT_CHARGE_TIME_S = "calculated_fifty_percent_charge_time_s";
    public static final String CALC_EIGHTY_PERCENT_CHARGE_TIME_S = "calculated_eighty_percent_charge_time_s";
    public static final String CALC_MAX_CHARGE_TEMP_C = "calculated_max_charge_temp_c";
    public static final String CALC_DISCHARGE_CAPACITY_MAH = "calculated_discharge_capacity_mah";
    public static final String CALC_DISCHARGE_ENERGY_MWH = "calculated_discharge_energy_mwh";
    public static final String CALC_DISCHARGE_TIME_S = "calculated_discharge_time_s";
    public static final String CALC_MAX_DISCHARGE_TEMP_C = "calculated_max_discharge_temp_c";
    public static final String CALC_COULOMBIC_EFFICIENCY = "calculated_coulombic_efficiency";

    public static final List<String> CALCULATED_COLUMNS = List.of(
            CALC_CHARGE_CAPACITY_MAH,
            CALC_CHARGE_ENERGY_MWH,
            CALC_CHARGE_TIME_S,
            CALC_CC_CHARGE_TIME_S,
            CALC_CV_CHARGE_TIME_S,
            CALC_CC_CAPACITY_MAH,
            CALC_CV_CAPACITY_MAH,
            CALC_FIFTY_PERCENT_CHARGE_TIME_S,
            CALC_EIGHTY_PERCENT_CHARGE_TIME_S,
            CALC_MAX_CHARGE_TEMP_C,
            CALC_DISCHARGE_CAPACITY_MAH,
            CALC_DISCHARGE_ENERGY_MWH,
            CALC_DISCHARGE_TIME_S,
            CALC_MAX_DISCHARGE_TEMP_C,
            CALC_COULOMBIC_EFFICIENCY);

    // ========================================
    // DETECTION SIGNATURES
    // ========================================

    public static final Set<String> ARBIN_TEST_DATA_SIGNATURE = setOf(
            "Date Time",
            "ACR (Ohm)",
            "dQ/dV (Ah/V)",
            "Internal Resistance (Ohm)",
            "dV/dQ (V/Ah)",
            "dV/dt (V/s)",
            "Data Point");

    public static final Set<String> ARBIN_CYCLE_STATS_SIGNATURE = setOf(
            "Charge Time (s)",
            "Date_Time",
            "mAh/g",
            "Coulombic Efficiency (%)",
            "V_Max_On_Cycle (V)",
            "Discharge Time (s)");

    public static final Set<String> MACCOR_TEST_DATA_SIGNATURE = setOf(
            "Cyc#",
            "StepTime(s)",
            "DPt Time",
            "Current(A)",
            "Capacity(Ah)",
            "Step",
            "EV Temp",
            "Voltage(V)",
            "TestTime(s)",
            "Temp 1");

    public static final Set<String> MACCOR_TEST_DATA_TYPE2_SIGNATURE = setOf(
            "Rec",
            "Cycle P",
            "Cycle C",
            "Capacity",
            "Energy",
            "MD",
            "ES",
            "DPT Time");

    public static final Set<String> MACCOR_TEST_DATA_CUSTOMER1_SIGNATURE = setOf(
            "Cyc#",
            "Step",
            "TestTime(s)",
            "StepTime(s)",
            "Capacity(Ah)",
            "Watt-hr",
            "Current(A)",
            "Voltage(V)",
            "ES",
            "DPt Time",
            "Volt 1",
            "ManufacturerAccess (0x00)",
            "AtRate (0x02)",
            "AtRateTimeToEmpty (0x04)",
            "Temperature (0x06)",
            "Voltage (0x08)",
            "BatteryStatus (0x0A)",
            "Current (0x0C)",
            "RemainingCapacity (0x10)",
            "FullChargeCapacity (0x12)",
            "AverageCurrent (0x14)",
            "AverageTimeToEmpty (0x16)",
            "AverageTimeToFull (0x18)",
            "RelativeStateOfCharge (0x2C)",
            "ChargingVoltage (0x30)",
            "ChargingCurrent (0x32)",
            "DesignCapacity (0x3C)");

    public static final Set<String> MACCOR_CYCLE_STATS_SIGNATURE = setOf(
            "T1_End",
            "T1_Max",
            "T1_Start",
            "T1_Min",
            "Cycle",
            "Date",
            "AH-OUT",
            "AH-IN");

    public static final Set<String> MACCOR_CYCLE_STATS_CUSTOMER1_SIGNATURE = setOf(
            "Cycle",
            "AH-IN",
            "AH-OUT",
            "T1_Start",
            "T1_End",
            "T1_Min",
            "T1_Max",
            "Date");

    // ========================================
    // UNIT CONVERSION (base unit -> milli unit)
    // ========================================

    public static final Map<String, String> TO_MILLI = mapOf(
            // Test data
            "voltage_v", "voltage_mv",
            "current_a", "current_ma",
            "voltage", "voltage_mv",
            "current", "current_ma",
            "charge_capacity_ah", "charge_capacity_mah",
            "discharge_capacity_ah", "discharge_capacity_mah",
            "charge_energy_wh", "charge_energy_mwh",
            "discharge_energy_wh", "discharge_energy_mwh",
            "power_w", "power_mw",
            "impedance_ohm", "impedance_mohm",
            "capacity_ah", "capacity_mah",
            // Arbin test data
            "arbin_charge_capacity_ah", "arbin_charge_capacity_mah",
            "arbin_discharge_capacity_ah", "arbin_discharge_capacity_mah",
            "arbin_charge_energy_wh", "arbin_charge_energy_mwh",
            "arbin_discharge_energy_wh", "arbin_discharge_energy_mwh",
            // Maccor test data
            "maccor_capacity_ah", "maccor_capacity_mah",
            "maccor_energy_wh", "maccor_energy_mwh",
            "capacity", "maccor_capacity_mah",
            "energy", "maccor_energy_mwh",
            // Cycle stats
            "reported_charge_capacity_ah", "reported_charge_capacity_mah",
            "reported_discharge_capacity_ah", "reported_discharge_capacity_mah",
            "reported_charge_energy_wh", "reported_charge_energy_mwh",
            "reported_discharge_energy_wh", "reported_discharge_energy_mwh");

    // ========================================
    // RENAME TABLES
    // ========================================

    public static final Map<String, String> ARBIN_TEST_DATA_MAPPING = mapOf(
            "Date_Time", "recorded_datetime",
            "Date Time", "recorded_datetime",
            "Internal Resistance (Ohm)", "impedance_ohm",
            "Data Point", "data_point",
            "Test Time (s)", "test_time_s",
            "Test Time(s)", "test_time_s",
            "Test_Time(s)", "test_time_s",
            "Step Time (s)", "step_time_s",
            "Step_Time(s)", "step_time_s",
            "Step Time(s)", "step_time_s",
            "Cycle Index", "cycle",
            "Cycle_Index", "cycle",
            "Step Index", "step",
            "Step_Index", "step",
            "TC_Counter1", "tc_counter1",
            "Voltage (V)", "voltage_v",
            "Voltage(V)", "voltage_v",
            "Current (A)", "current_a",
            "Current(A)", "current_a",
            "Charge Capacity (Ah)", "arbin_charge_capacity_ah",
            "Charge Capacity(Ah)", "arbin_charge_capacity_ah",
            "Charge_Capacity(Ah)", "arbin_charge_capacity_ah",
            "Discharge Capacity (Ah)", "arbin_discharge_capacity_ah",
            "Discharge Capacity(Ah)", "arbin_discharge_capacity_ah",
            "Discharge_Capacity(Ah)", "arbin_discharge_capacity_ah",
            "Charge Energy (Wh)", "arbin_charge_energy_wh",
            "Charge_Energy (Wh)", "arbin_charge_energy_wh",
            "Charge_Energy(Wh)", "arbin_charge_energy_wh",
            "Discharge Energy (Wh)", "arbin_discharge_energy_wh",
            "Discharge Energy(Wh)", "arbin_discharge_energy_wh",
            "Discharge_Energy(Wh)", "arbin_discharge_energy_wh",
            "Power (W)", "power_w");

    public static final Map<String, String> ARBIN_CYCLE_STATS_MAPPING = mapOf(
            "Date_Time", "recorded_datetime",
            "Test Time (s)", "test_time_s",
            "Test Time(s)", "test_time_s",
            "Step Time (s)", "step_time_s",
            "Step Time(s)", "step_time_s",
            "Cycle Index", "cycle",
            "Step Index", "step",
            "TC_Counter1", "tc_counter1",
            "Voltage(V)", "voltage_v",
            "Voltage (V)", "voltage_v",
            "Current (A)", "current_a",
            "Current(A)", "current_a",
            "Charge Capacity (Ah)", "reported_charge_capacity_ah",
            "Charge Capacity(Ah)", "reported_charge_capacity_ah",
            "Discharge Capacity (Ah)", "reported_discharge_capacity_ah",
            "Discharge Capacity(Ah)", "reported_discharge_capacity_ah",
            "Charge Time (s)", "reported_charge_time_s",
            "Charge Time(s)", "reported_charge_time_s",
            "Discharge Time (s)", "reported_discharge_time_s",
            "Coulombic Efficiency (%)", "reported_coulombic_efficiency",
            "Charge Energy (Wh)", "reported_charge_energy_wh",
            "Charge_Energy(Wh)", "reported_charge_energy_wh",
            "Discharge Energy (Wh)", "reported_discharge_energy_wh",
            "Discharge Energy(Wh)", "reported_discharge_energy_wh");

    public static final Map<String, String> MACCOR_TEST_DATA_MAPPING = mapOf(
            "Cyc#", "cycle",
            "Cycle P", "cycle",
            "Step", "step",
            "TestTime(s)", "test_time_s",
            "Test Time", "test_time_s",
            "StepTime(s)", "step_time_s",
            "Step Time", "step_time_s",
            "Capacity(Ah)", "maccor_capacity_ah",
            "Watt-hr", "maccor_energy_wh",
            "Current(A)", "current_a",
            "Voltage(V)", "voltage_v",
            "DPt Time", "recorded_datetime",
            "EV Temp", "ev_temp_c");

    public static final Map<String, String> MACCOR_CYCLE_STATS_MAPPING = mapOf(
            "Cycle", "cycle",
            "Test Time", "test_time_s",
            "Current", "maccor_min_current_ma",
            "Voltage", "maccor_min_voltage_mv",
            "AH-IN", "reported_charge_capacity_ah",
            "AH-OUT", "reported_discharge_capacity_ah",
            "WH-IN", "reported_charge_energy_wh",
            "WH-OUT", "reported_discharge_energy_wh",
            "T1_Start", "maccor_charge_thermocouple_start_c",
            "T1_End", "maccor_charge_thermocouple_end_c",
            "T1_Min", "maccor_charge_thermocouple_min_c",
            "T1_Max", "maccor_charge_thermocouple_max_c",
            "T1_Start.1", "maccor_discharge_thermocouple_start_c",
            "T1_End.1", "maccor_discharge_thermocouple_end_c",
            "T1_Min.1", "maccor_discharge_thermocouple_min_c",
            "T1_Max.1", "maccor_discharge_thermocouple_max_c",
            "ACR", "acr_ohm");

    // ========================================
    // UNSTRUCTURED FILES
    // ========================================

    public static final Set<String> UNSTRUCTURED_REQUIRED_ROLES = setOf(VOLTAGE_MV, CURRENT_MA);
    public static final Set<String> UNSTRUCTURED_TIME_ROLES = setOf(TEST_TIME_S, RECORDED_DATETIME);

    private static Set<String> setOf(String... values) {
        return java.util.Collections.unmodifiableSet(new LinkedHashSet<>(List.of(values)));
    }

    private static Map<String, String> mapOf(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return java.util.Collections.unmodifiableMap(map);
    }
}
