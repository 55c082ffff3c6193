package cz.drbacon.pades.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import cz.drbacon.pades.tsp.TimestampVerificationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Results for the signatures that carry a timestamp. Signatures without one are not counted.
 */
public final class TimestampValidationSummary {

    @JsonProperty("total_timestamps")
    private final int totalTimestamps;

    @JsonProperty("valid_timestamps")
    private final int validTimestamps;

    @JsonProperty("all_timestamps_valid")
    private final boolean allTimestampsValid;

    @JsonProperty("timestamps")
    private final List<TimestampVerificationResult> timestamps;

    public TimestampValidationSummary(List<TimestampVerificationResult> timestamps) {
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        int valid = 0;
        for (TimestampVerificationResult timestamp : timestamps) {
            if (timestamp.isValid()) {
                valid++;
            }
        }
        this.totalTimestamps = timestamps.size();
        this.validTimestamps = valid;
        this.allTimestampsValid = valid == totalTimestamps;
    }

    public int getTotalTimestamps() {
        return totalTimestamps;
    }

    public int getValidTimestamps() {
        return validTimestamps;
    }

    public boolean isAllTimestampsValid() {
        return allTimestampsValid;
    }

    public List<TimestampVerificationResult> getTimestamps() {
        return timestamps;
    }
}
