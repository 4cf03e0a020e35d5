package info.isaksson.erland.javatoseq.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable whole-program index from a method's qualified signature to the sites that call it.
 */
public final class CallerIndex {

    public static final CallerIndex EMPTY = new CallerIndex(Map.of());

    private final Map<String, Set<CallSite>> callers;

    private CallerIndex(Map<String, Set<CallSite>> callers) {
        this.callers = callers;
    }

    public Set<CallSite> callersOf(String symbol) {
        if (symbol == null) return Set.of();
        return callers.getOrDefault(symbol, Set.of());
    }

    public boolean hasCallers(String symbol) {
        return !callersOf(symbol).isEmpty();
    }

    /** Number of distinct called symbols. */
    public int size() {
        return callers.size();
    }

    public Set<String> symbols() {
        return callers.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Set<CallSite>> callers = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(String symbol, CallSite site) {
            if (symbol == null || symbol.isBlank() || site == null) return this;
            callers.computeIfAbsent(symbol, k -> new LinkedHashSet<>()).add(site);
            return this;
        }

        public CallerIndex build() {
            Map<String, Set<CallSite>> copy = new LinkedHashMap<>();
            callers.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
            return new CallerIndex(Collections.unmodifiableMap(copy));
        }
    }
}
