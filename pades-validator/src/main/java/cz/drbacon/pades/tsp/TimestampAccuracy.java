package cz.drbacon.pades.tsp;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.bouncycastle.tsp.GenTimeAccuracy;

/**
 * Accuracy of a token's genTime; absent parts are zero.
 */
public final class TimestampAccuracy {

    @JsonProperty("seconds")
    private final int seconds;

    @JsonProperty("millis")
    private final int millis;

    @JsonProperty("micros")
    private final int micros;

    public TimestampAccuracy(int seconds, int millis, int micros) {
        this.seconds = seconds;
        this.millis = millis;
        this.micros = micros;
    }

    static TimestampAccuracy from(GenTimeAccuracy accuracy) {
        if (accuracy == null) {
            return null;
        }
        return new TimestampAccuracy(accuracy.getSeconds(), accuracy.getMillis(), accuracy.getMicros());
    }

    public int getSeconds() {
        return seconds;
    }

    public int getMillis() {
        return millis;
    }

    public int getMicros() {
        return micros;
    }

    @Override
    public String toString() {
        return seconds + "s " + millis + "ms " + micros + "us";
    }
}
