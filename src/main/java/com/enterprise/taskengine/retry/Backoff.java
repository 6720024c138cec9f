package com.enterprise.taskengine.retry;

import java.util.Objects;

/**
 * Backoff setting of a task: off, on, or on with a multiplier.
 * <p>
 * A factor of zero turns backoff off. Any other factor turns it on, and the
 * multiplier is the factor truncated to an integer with a floor of one, so
 * degenerate factors such as -1 or 0.1 behave like plain {@code enabled()}.
 */
public final class Backoff {
    
    private static final Backoff DISABLED = new Backoff(false, 0.0);
    private static final Backoff ENABLED = new Backoff(true, 1.0);
    
    private final boolean enabled;
    private final double factor;
    
    private Backoff(boolean enabled, double factor) {
        this.enabled = enabled;
        this.factor = factor;
    }
    
    public static Backoff disabled() {
        return DISABLED;
    }
    
    public static Backoff enabled() {
        return ENABLED;
    }
    
    public static Backoff factor(double factor) {
        return factor == 0.0 ? DISABLED : new Backoff(true, factor);
    }
    
    public static Backoff of(boolean enabled) {
        return enabled ? ENABLED : DISABLED;
    }
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public double getFactor() {
        return factor;
    }
    
    /**
     * Integer multiplier applied to {@code 2^attempt}
     */
    public int multiplier() {
        return (int) Math.max(1.0, factor);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Backoff backoff = (Backoff) o;
        return enabled == backoff.enabled && Double.compare(backoff.factor, factor) == 0;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(enabled, factor);
    }
    
    @Override
    public String toString() {
        return enabled ? "Backoff{factor=" + factor + "}" : "Backoff{disabled}";
    }
}
