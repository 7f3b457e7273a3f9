package dev.blueprint.config;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.unit.NotImplementedUnit;
import dev.blueprint.unit.PipelineUnit;
import dev.blueprint.unit.UnitRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the process-wide registry from every {@link PipelineUnit} bean, then fills
 * configured placeholder slots with {@link NotImplementedUnit}.
 */
@Configuration
public class UnitRegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(UnitRegistryConfig.class);

    @Bean
    public UnitRegistry unitRegistry(List<PipelineUnit> units, UnitProperties unitProperties,
                                     PipelineProperties pipelineProperties) {
        UnitRegistry registry = new UnitRegistry();
        units.forEach(unit -> registry.register(unit.getName(), () -> unit));

        for (String placeholder : unitProperties.placeholders()) {
            if (registry.isRegistered(placeholder)) {
                log.warn("Placeholder {} ignored: a real implementation is registered", placeholder);
                continue;
            }
            Phase phase = phaseOf(placeholder, pipelineProperties);
            registry.register(placeholder, () -> new NotImplementedUnit(placeholder, phase));
        }
        log.info("Unit registry ready: {}", registry.registeredNames());
        return registry;
    }

    private static Phase phaseOf(String unitName, PipelineProperties properties) {
        if (unitName.equals(properties.synthesisUnit())) return Phase.SYNTHESIS;
        if (unitName.equals(properties.validationUnit())) return Phase.VALIDATION;
        return Phase.ANALYSIS;
    }
}
