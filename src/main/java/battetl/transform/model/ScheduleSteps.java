package battetl.transform.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Step classification taken from a cycler schedule or procedure file.
 * Step numbers are 1-based. Steps in none of the lists are "other".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSteps {

    @JsonProperty("chg")
    private List<Integer> chg = new ArrayList<>();

    @JsonProperty("dsg")
    private List<Integer> dsg = new ArrayList<>();

    @JsonProperty("rst")
    private List<Integer> rst = new ArrayList<>();

    public static ScheduleSteps of(List<Integer> chg, List<Integer> dsg, List<Integer> rst) {
        return new ScheduleSteps(new ArrayList<>(chg), new ArrayList<>(dsg), new ArrayList<>(rst));
    }

    public boolean isCharge(Integer step) {
        return step != null && chg != null && chg.contains(step);
    }

    public boolean isDischarge(Integer step) {
        return step != null && dsg != null && dsg.contains(step);
    }
}
