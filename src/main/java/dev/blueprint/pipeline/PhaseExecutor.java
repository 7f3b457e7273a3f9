package dev.blueprint.pipeline;

import dev.blueprint.config.UnitProperties;
import dev.blueprint.domain.enums.FailureKind;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.enums.UnitStatus;
import dev.blueprint.domain.valueobject.PhaseResultSet;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.domain.valueobject.UnitResult;
import dev.blueprint.exception.UnitNotRegisteredException;
import dev.blueprint.unit.PipelineUnit;
import dev.blueprint.unit.UnitRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the units of one phase concurrently and collects exactly one envelope per requested name.
 *
 * <pre>
 *  1. Resolve every name (unresolvable → synthetic registration failure, never scheduled)
 *  2. Fan out one task per unit; a semaphore caps how many run at once, the rest queue
 *  3. Each task: acquire permit → start unit timeout → invoke with retry → release permit
 *  4. Await all slots, bounded by the phase timeout
 *  5. Still-running slots after the phase timeout are interrupted and reported as cancelled
 *  6. Freeze the result set
 * </pre>
 *
 * <p>Every fault (exception, timeout, rejection, interruption) is converted into an envelope at
 * the task boundary, so one unit can never abort its siblings or the phase.
 */
@Component
public class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final UnitRegistry registry;
    private final UnitProperties unitProperties;
    private final ExecutorService unitExecutor;
    private final MeterRegistry meterRegistry;

    public PhaseExecutor(UnitRegistry registry,
                         UnitProperties unitProperties,
                         @Qualifier("unitExecutorService") ExecutorService unitExecutor,
                         MeterRegistry meterRegistry) {
        this.registry = registry;
        this.unitProperties = unitProperties;
        this.unitExecutor = unitExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Executes {@code unitNames} against a shared input and blocks until every slot is final.
     *
     * @param maxParallelUnits upper bound on concurrently running units, at least 1
     * @param phaseTimeout     wall-clock cap for the whole phase; null or non-positive means none
     */
    public PhaseResultSet execute(Phase phase, List<String> unitNames, UnitInput input,
                                  int maxParallelUnits, Duration phaseTimeout) {
        String executionId = input.executionId();
        PhaseResultSet.Builder builder = PhaseResultSet.builder(phase);
        Semaphore permits = new Semaphore(Math.max(1, maxParallelUnits), true);

        Set<String> names = new LinkedHashSet<>(unitNames);
        if (names.size() != unitNames.size())
            log.warn("Phase {} received duplicate unit names {}; each runs once", phase, unitNames);

        List<Slot> slots = new ArrayList<>();
        for (String name : names) {
            PipelineUnit unit;
            try {
                unit = registry.resolve(name);
            } catch (UnitNotRegisteredException e) {
                log.error("Phase {}: {}", phase, e.getMessage());
                builder.record(UnitResult.notRegistered(name, executionId));
                continue;
            } catch (RuntimeException e) {
                log.error("Phase {}: unit {} could not be instantiated: {}", phase, name, e.getMessage());
                builder.record(UnitResult.failed(name, executionId, FailureKind.REGISTRATION,
                        "Unit could not be instantiated: " + e.getMessage(), Duration.ZERO));
                continue;
            }
            slots.add(schedule(phase, name, unit, input, permits));
        }

        log.info("Phase {}: scheduled {} units (max {} concurrent) for execution {}",
                phase, slots.size(), maxParallelUnits, executionId);

        awaitAll(phase, slots, phaseTimeout, executionId);

        for (Slot slot : slots) {
            UnitResult result = slot.outcome().join();
            builder.record(result);
            recordMetrics(phase, result);
        }

        PhaseResultSet resultSet = builder.freeze();
        log.info("Phase {} finished for execution {}: {}/{} units completed",
                phase, executionId, resultSet.count(UnitStatus.COMPLETED), resultSet.size());
        return resultSet;
    }

    // ── Internal ───────────────────────────────────────────────────

    /**
     * One scheduled unit. {@code outcome} never completes exceptionally.
     */
    private record Slot(String name, CompletableFuture<UnitResult> outcome, Future<?> handle, Instant scheduledAt) {}

    private Slot schedule(Phase phase, String name, PipelineUnit unit, UnitInput input, Semaphore permits) {
        String executionId = input.executionId();
        Duration unitTimeout = unitProperties.timeoutFor(name);
        Instant scheduledAt = Instant.now();
        CompletableFuture<UnitResult> running = new CompletableFuture<>();

        final Future<?> handle;
        try {
            handle = unitExecutor.submit(() -> runUnit(running, name, unit, input, permits, unitTimeout));
        } catch (RejectedExecutionException e) {
            log.error("Phase {}: executor rejected unit {}: {}", phase, name, e.getMessage());
            UnitResult rejected = UnitResult.failed(name, executionId, FailureKind.EXECUTION,
                    "Unit could not be scheduled: " + e.getMessage(), Duration.ZERO);
            return new Slot(name, CompletableFuture.completedFuture(rejected), null, scheduledAt);
        }

        CompletableFuture<UnitResult> outcome = running.handle((result, error) -> {
            if (error == null) return result;
            handle.cancel(true);
            Duration elapsed = Duration.between(scheduledAt, Instant.now());
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                log.warn("Unit {} timed out after {}s", name, unitTimeout.toSeconds());
                return UnitResult.failed(name, executionId, FailureKind.TIMEOUT,
                        "Unit timed out after " + unitTimeout.toMillis() + "ms", elapsed);
            }
            if (cause instanceof CancellationException) {
                return UnitResult.cancelled(name, executionId, "Cancelled: " + cause.getMessage(), elapsed);
            }
            log.warn("Unit {} violated its contract and threw {}", name, cause.toString());
            return UnitResult.failed(name, executionId, FailureKind.EXECUTION,
                    "Unit raised " + cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsed);
        });
        return new Slot(name, outcome, handle, scheduledAt);
    }

    private void runUnit(CompletableFuture<UnitResult> running, String name, PipelineUnit unit,
                         UnitInput input, Semaphore permits, Duration unitTimeout) {
        MDC.put("unit", name);
        boolean acquired = false;
        try {
            permits.acquire();
            acquired = true;
            // The unit's clock starts once it holds a permit, not while it waits in the queue
            if (unitTimeout != null && !unitTimeout.isZero() && !unitTimeout.isNegative())
                running.orTimeout(unitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            running.complete(invokeWithRetry(name, unit, input));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.completeExceptionally(new CancellationException("interrupted before " + name + " could start"));
        } catch (Throwable t) {
            running.completeExceptionally(t);
        } finally {
            if (acquired) permits.release();
            MDC.remove("unit");
        }
    }

    private UnitResult invokeWithRetry(String name, PipelineUnit unit, UnitInput input) {
        int retries = unitProperties.retryCountFor(name);
        if (retries == 0) return invokeOnce(name, unit, input);

        AtomicInteger attempts = new AtomicInteger();
        RetryConfig config = RetryConfig.<UnitResult>custom()
                .maxAttempts(retries + 1)
                .waitDuration(unitProperties.retryDelay())
                .retryOnResult(PhaseExecutor::isRetryable)
                .build();
        Retry retry = Retry.of(input.executionId() + ":" + name, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying unit {} (attempt {}/{})", name, event.getNumberOfRetryAttempts() + 1, retries + 1));

        UnitResult result = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            return invokeOnce(name, unit, input);
        }).get();
        return attempts.get() > 1 ? result.withMetadata(UnitResult.ATTEMPTS, attempts.get()) : result;
    }

    private UnitResult invokeOnce(String name, PipelineUnit unit, UnitInput input) {
        log.debug("Running unit {} for execution {}", name, input.executionId());
        try {
            UnitResult result = unit.execute(input);
            if (result == null)
                return UnitResult.failed(name, input.executionId(), FailureKind.EXECUTION,
                        "Unit returned no result", Duration.ZERO);
            return result;
        } catch (RuntimeException e) {
            log.warn("Unit {} threw past its boundary: {}", name, e.toString());
            return UnitResult.failed(name, input.executionId(), FailureKind.EXECUTION,
                    "Unit raised " + e.getClass().getSimpleName() + ": " + e.getMessage(), Duration.ZERO);
        }
    }

    private static boolean isRetryable(UnitResult result) {
        return result.status() == UnitStatus.FAILED
                && result.failureKind().map(kind -> kind == FailureKind.EXECUTION).orElse(false);
    }

    private void awaitAll(Phase phase, List<Slot> slots, Duration phaseTimeout, String executionId) {
        if (slots.isEmpty()) return;
        CompletableFuture<Void> all = CompletableFuture.allOf(
                slots.stream().map(Slot::outcome).toArray(CompletableFuture[]::new));
        try {
            if (phaseTimeout == null || phaseTimeout.isZero() || phaseTimeout.isNegative()) {
                all.get();
            } else {
                all.get(phaseTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            log.warn("Phase {} timed out after {}ms for execution {}; cancelling running units",
                    phase, phaseTimeout.toMillis(), executionId);
            cancelUnfinished(slots, executionId, "phase " + phase.wireName() + " timed out after "
                    + phaseTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Phase {} interrupted for execution {}; cancelling running units", phase, executionId);
            cancelUnfinished(slots, executionId, "phase " + phase.wireName() + " interrupted");
        } catch (ExecutionException e) {
            log.error("Phase {} slot completed exceptionally: {}", phase, e.getMessage(), e);
            cancelUnfinished(slots, executionId, "phase " + phase.wireName() + " aborted");
        }
    }

    private void cancelUnfinished(List<Slot> slots, String executionId, String reason) {
        for (Slot slot : slots) {
            if (slot.outcome().isDone()) continue;
            Duration elapsed = Duration.between(slot.scheduledAt(), Instant.now());
            slot.outcome().complete(UnitResult.cancelled(slot.name(), executionId, "Cancelled: " + reason, elapsed));
            if (slot.handle() != null) slot.handle().cancel(true);
        }
    }

    private void recordMetrics(Phase phase, UnitResult result) {
        if (result.elapsedSeconds() == null) return;
        Timer.builder("blueprint.unit.duration")
                .description("Time spent in one unit invocation")
                .tag("unit", result.unitName())
                .tag("phase", phase.wireName())
                .tag("status", result.status().wireName())
                .register(meterRegistry)
                .record(Duration.ofMillis(Math.round(result.elapsedSeconds() * 1000)));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
