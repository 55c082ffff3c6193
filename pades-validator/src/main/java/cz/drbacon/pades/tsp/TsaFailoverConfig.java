package cz.drbacon.pades.tsp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Primary TSA plus ordered fallbacks. Servers are tried in order, at most {@code maxFailoverAttempts} of them.
 */
public final class TsaFailoverConfig {

    private final TsaConfig primary;
    private final List<TsaConfig> fallbacks;
    private final int maxFailoverAttempts;

    public TsaFailoverConfig(TsaConfig primary, List<TsaConfig> fallbacks) {
        this(primary, fallbacks, 1 + (fallbacks == null ? 0 : fallbacks.size()));
    }

    public TsaFailoverConfig(TsaConfig primary, List<TsaConfig> fallbacks, int maxFailoverAttempts) {
        this.primary = Objects.requireNonNull(primary, "primary TSA config");
        this.fallbacks = fallbacks == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(fallbacks));
        if (maxFailoverAttempts < 1) {
            throw new IllegalArgumentException("maxFailoverAttempts must be at least 1, got " + maxFailoverAttempts);
        }
        this.maxFailoverAttempts = maxFailoverAttempts;
    }

    public static TsaFailoverConfig single(TsaConfig primary) {
        return new TsaFailoverConfig(primary, Collections.emptyList());
    }

    public TsaConfig getPrimary() {
        return primary;
    }

    public List<TsaConfig> getFallbacks() {
        return fallbacks;
    }

    public int getMaxFailoverAttempts() {
        return maxFailoverAttempts;
    }

    /**
     * Servers in the order they will be attempted, already cut to {@code maxFailoverAttempts}.
     */
    public List<TsaConfig> attemptOrder() {
        List<TsaConfig> order = new ArrayList<>();
        order.add(primary);
        order.addAll(fallbacks);
        return order.subList(0, Math.min(order.size(), maxFailoverAttempts));
    }
}
