package dev.blueprint.unit;

import dev.blueprint.domain.enums.FailureKind;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.enums.UnitStatus;
import dev.blueprint.domain.valueobject.ExecutionContext;
import dev.blueprint.domain.valueobject.PipelineRequest;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.domain.valueobject.UnitResult;
import dev.blueprint.exception.PipelineConfigurationException;
import dev.blueprint.exception.UnitNotRegisteredException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnitRegistryTest {

    private UnitRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new UnitRegistry();
    }

    private static UnitInput input() {
        PipelineRequest request = new PipelineRequest("/tmp", "exec-r", null, null, null, true, 1);
        return UnitInput.forAnalysis(ExecutionContext.start("exec-r"), request);
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Should build the unit lazily and reuse the instance")
        void lazySingleton() {
            AtomicInteger built = new AtomicInteger();
            registry.register("stub", () -> {
                built.incrementAndGet();
                return new NotImplementedUnit("stub", Phase.ANALYSIS);
            });

            assertThat(built.get()).isZero();
            PipelineUnit first = registry.resolve("stub");
            PipelineUnit second = registry.resolve("stub");

            assertThat(first).isSameAs(second);
            assertThat(built.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should refuse a second registration under the same name")
        void duplicateName() {
            registry.register("stub", () -> new NotImplementedUnit("stub", Phase.ANALYSIS));

            assertThatThrownBy(() -> registry.register("stub", () -> new NotImplementedUnit("stub", Phase.ANALYSIS)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already registered");
        }

        @Test
        @DisplayName("Should require a name and a factory")
        void requiresNameAndFactory() {
            assertThatThrownBy(() -> registry.register(" ", () -> null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register("x", null)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should list registered names in sorted order")
        void registeredNames() {
            registry.register("zeta", () -> new NotImplementedUnit("zeta", Phase.ANALYSIS));
            registry.register("alpha", () -> new NotImplementedUnit("alpha", Phase.ANALYSIS));

            assertThat(registry.registeredNames()).containsExactly("alpha", "zeta");
            assertThat(registry.isRegistered("alpha")).isTrue();
            assertThat(registry.isRegistered(null)).isFalse();
            assertThat(registry.isEmpty()).isFalse();
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Should throw a dedicated exception for unknown names")
        void unknownName() {
            assertThatThrownBy(() -> registry.resolve("ghost"))
                    .isInstanceOf(UnitNotRegisteredException.class)
                    .hasMessage("Unit not registered: ghost");
        }

        @Test
        @DisplayName("Should treat a factory returning null as misconfiguration")
        void nullFactoryResult() {
            registry.register("empty", () -> null);

            assertThatThrownBy(() -> registry.resolve("empty"))
                    .isInstanceOf(PipelineConfigurationException.class)
                    .hasMessageContaining("returned null");
        }
    }

    @Nested
    @DisplayName("Unit contract")
    class Contract {

        @Test
        @DisplayName("Should make a placeholder fail with not implemented")
        void notImplemented() {
            UnitResult result = new NotImplementedUnit("later", Phase.SYNTHESIS).execute(input());

            assertThat(result.status()).isEqualTo(UnitStatus.FAILED);
            assertThat(result.errorMessage()).isEqualTo(NotImplementedUnit.MESSAGE);
            assertThat(result.failureKind()).contains(FailureKind.NOT_IMPLEMENTED);
            assertThat(result.executionId()).isEqualTo("exec-r");
        }

        @Test
        @DisplayName("Should wrap a successful body in a completed envelope")
        void abstractUnitSuccess() {
            UnitResult result = new EchoUnit(false).execute(input());

            assertThat(result.isCompleted()).isTrue();
            assertThat(result.payload()).containsEntry("echo", "exec-r");
            assertThat(result.unitName()).isEqualTo("echo");
        }

        @Test
        @DisplayName("Should report an interrupted body as cancelled and keep the interrupt flag")
        void abstractUnitInterrupted() {
            UnitResult result = new EchoUnit(true).execute(input());

            assertThat(result.status()).isEqualTo(UnitStatus.CANCELLED);
            assertThat(Thread.interrupted()).isTrue();
        }
    }

    private static final class EchoUnit extends AbstractPipelineUnit {
        private final boolean interrupt;

        EchoUnit(boolean interrupt) {
            this.interrupt = interrupt;
        }

        @Override
        public String getName() {
            return "echo";
        }

        @Override
        public Phase getPhase() {
            return Phase.ANALYSIS;
        }

        @Override
        protected Map<String, Object> analyze(UnitInput input) throws InterruptedException {
            if (interrupt) throw new InterruptedException("stop");
            return Map.of("echo", input.executionId());
        }
    }
}
