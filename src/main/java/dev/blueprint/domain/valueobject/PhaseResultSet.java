package dev.blueprint.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.enums.UnitStatus;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All envelopes of one phase keyed by unit name. Order carries no meaning.
 * Built incrementally through a {@link Builder} and frozen when the phase completes.
 */
public final class PhaseResultSet {

    private final Phase phase;
    private final Map<String, UnitResult> results;

    private PhaseResultSet(Phase phase, Map<String, UnitResult> results) {
        this.phase = phase;
        this.results = Collections.unmodifiableMap(new TreeMap<>(results));
    }

    public static PhaseResultSet empty(Phase phase) {
        return new PhaseResultSet(phase, Map.of());
    }

    public static Builder builder(Phase phase) {
        return new Builder(phase);
    }

    @JsonProperty("phase")
    public Phase phase() {
        return phase;
    }

    @JsonProperty("results")
    public Map<String, UnitResult> results() {
        return results;
    }

    public Optional<UnitResult> get(String unitName) {
        return Optional.ofNullable(results.get(unitName));
    }

    @JsonIgnore
    public Set<String> unitNames() {
        return results.keySet();
    }

    public int size() {
        return results.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return results.isEmpty();
    }

    public long count(UnitStatus status) {
        return results.values().stream().filter(r -> r.status() == status).count();
    }

    @Override
    public String toString() {
        return "PhaseResultSet[" + phase + ", " + results.keySet() + "]";
    }

    /**
     * Thread-safe accumulator used while the phase is running. Rejects insertions after
     * {@link #freeze()} and duplicate unit names.
     */
    public static final class Builder {
        private final Phase phase;
        private final Map<String, UnitResult> results = new ConcurrentHashMap<>();
        private volatile boolean frozen;

        private Builder(Phase phase) {
            this.phase = phase;
        }

        public synchronized Builder record(UnitResult result) {
            if (frozen)
                throw new IllegalStateException("Phase " + phase + " already completed; late result from "
                        + result.unitName());
            if (results.putIfAbsent(result.unitName(), result) != null)
                throw new IllegalStateException("Duplicate result for unit " + result.unitName() + " in " + phase);
            return this;
        }

        public boolean contains(String unitName) {
            return results.containsKey(unitName);
        }

        public synchronized PhaseResultSet freeze() {
            frozen = true;
            return new PhaseResultSet(phase, results);
        }
    }
}
