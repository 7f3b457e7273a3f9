package dev.blueprint.domain.valueobject;

import dev.blueprint.domain.enums.Phase;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Payload handed to a unit: the run's context, the original request and the frozen
 * result sets of every earlier phase (empty for phase 1).
 */
public record UnitInput(ExecutionContext context, PipelineRequest request, Map<Phase, PhaseResultSet> upstream) {

    public UnitInput {
        if (context == null) throw new IllegalArgumentException("context required");
        if (request == null) throw new IllegalArgumentException("request required");
        upstream = upstream == null || upstream.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(upstream));
    }

    public static UnitInput forAnalysis(ExecutionContext context, PipelineRequest request) {
        return new UnitInput(context, request, Map.of());
    }

    public static UnitInput forSynthesis(ExecutionContext context, PipelineRequest request,
                                         PhaseResultSet analysis) {
        return new UnitInput(context, request, Map.of(Phase.ANALYSIS, analysis));
    }

    public static UnitInput forValidation(ExecutionContext context, PipelineRequest request,
                                          PhaseResultSet analysis, PhaseResultSet synthesis) {
        return new UnitInput(context, request, Map.of(Phase.ANALYSIS, analysis, Phase.SYNTHESIS, synthesis));
    }

    public String executionId() {
        return context.executionId();
    }

    public PhaseResultSet upstream(Phase phase) {
        return upstream.getOrDefault(phase, PhaseResultSet.empty(phase));
    }

    public Optional<UnitResult> upstreamResult(Phase phase, String unitName) {
        return upstream(phase).get(unitName);
    }
}
