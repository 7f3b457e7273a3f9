package dev.blueprint.support;

import dev.blueprint.domain.enums.FailureKind;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.domain.valueobject.UnitResult;
import dev.blueprint.unit.PipelineUnit;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scriptable unit for pipeline tests. Records every input it receives.
 */
public final class StubUnit implements PipelineUnit {

    private final String name;
    private final Phase phase;
    private final Function<UnitInput, UnitResult> behavior;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<UnitInput> inputs = new CopyOnWriteArrayList<>();

    private StubUnit(String name, Phase phase, Function<UnitInput, UnitResult> behavior) {
        this.name = name;
        this.phase = phase;
        this.behavior = behavior;
    }

    public static StubUnit of(String name, Phase phase, Function<UnitInput, UnitResult> behavior) {
        return new StubUnit(name, phase, behavior);
    }

    public static StubUnit completing(String name, Phase phase, Map<String, Object> payload) {
        return new StubUnit(name, phase,
                input -> UnitResult.completed(name, input.executionId(), payload, Duration.ofMillis(1)));
    }

    public static StubUnit failing(String name, Phase phase, String error) {
        return new StubUnit(name, phase,
                input -> UnitResult.failed(name, input.executionId(), FailureKind.EXECUTION, error, Duration.ofMillis(1)));
    }

    public static StubUnit throwing(String name, Phase phase, RuntimeException error) {
        return new StubUnit(name, phase, input -> {
            throw error;
        });
    }

    public static StubUnit sleeping(String name, Phase phase, Duration sleep) {
        return new StubUnit(name, phase, input -> {
            try {
                Thread.sleep(sleep.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return UnitResult.cancelled(name, input.executionId(), "Interrupted", Duration.ZERO);
            }
            return UnitResult.completed(name, input.executionId(), Map.of("slept_ms", sleep.toMillis()), sleep);
        });
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Phase getPhase() {
        return phase;
    }

    @Override
    public UnitResult execute(UnitInput input) {
        invocations.incrementAndGet();
        inputs.add(input);
        return behavior.apply(input);
    }

    public int invocations() {
        return invocations.get();
    }

    public List<UnitInput> inputs() {
        return List.copyOf(inputs);
    }

    public UnitInput lastInput() {
        return inputs.get(inputs.size() - 1);
    }
}
