package dev.blueprint.domain.payload;

import dev.blueprint.domain.valueobject.UnitResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only, default-returning view over a unit's payload. A missing result or one that
 * did not complete reads as an empty payload, so callers never branch on status.
 */
public final class PayloadView {

    private static final PayloadView ABSENT = new PayloadView(Map.of());

    private final Map<String, Object> payload;

    private PayloadView(Map<String, Object> payload) {
        this.payload = payload;
    }

    public static PayloadView of(Optional<UnitResult> result) {
        return result.filter(UnitResult::isCompleted)
                .map(r -> new PayloadView(r.payload()))
                .orElse(ABSENT);
    }

    public static PayloadView of(UnitResult result) {
        return of(Optional.ofNullable(result));
    }

    public boolean isPresent() {
        return this != ABSENT;
    }

    public String text(String key) {
        Object value = payload.get(key);
        return value instanceof String s ? s : "";
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(String key) {
        Object value = payload.get(key);
        return value instanceof List<?> l ? (List<Object>) l : List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        Object value = payload.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    public OptionalDouble number(String key) {
        Object value = payload.get(key);
        return value instanceof Number n ? OptionalDouble.of(n.doubleValue()) : OptionalDouble.empty();
    }

    /**
     * Numeric entries of the map stored under {@code key}; non-numeric entries are skipped.
     */
    public Map<String, Double> numbers(String key) {
        Map<String, Double> numbers = new LinkedHashMap<>();
        map(key).forEach((k, v) -> {
            if (v instanceof Number n && !Double.isNaN(n.doubleValue())) numbers.put(k, n.doubleValue());
        });
        return numbers;
    }
}
