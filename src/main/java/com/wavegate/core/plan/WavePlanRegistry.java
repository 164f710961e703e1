package com.wavegate.core.plan;

import com.wavegate.core.config.WavegateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue of all {@link WavePlan} beans, looked up by name.
 */
@Component
public class WavePlanRegistry {

    private static final Logger log = LoggerFactory.getLogger(WavePlanRegistry.class);

    private final Map<String, WavePlan> plans = new LinkedHashMap<>();
    private final String defaultPlan;

    @Autowired
    public WavePlanRegistry(ObjectProvider<WavePlan> plans, WavegateProperties properties) {
        this(plans.orderedStream().toList(), properties.getDefaultPlan());
    }

    public WavePlanRegistry(List<WavePlan> plans, String defaultPlan) {
        for (WavePlan plan : plans) {
            if (this.plans.putIfAbsent(plan.name(), plan) != null) {
                throw new IllegalStateException("Duplicate wave plan name: " + plan.name());
            }
            log.info("Registered wave plan {}", plan);
        }
        this.defaultPlan = defaultPlan;
    }

    /**
     * Resolves a plan by name; {@code null} or blank selects the default plan.
     *
     * @throws UnknownPlanException if no such plan is registered
     */
    public WavePlan resolve(String name) {
        String effective = (name == null || name.isBlank()) ? defaultPlan : name;
        if (effective == null) {
            throw new UnknownPlanException("<default>");
        }
        return find(effective).orElseThrow(() -> new UnknownPlanException(effective));
    }

    public Optional<WavePlan> find(String name) {
        return Optional.ofNullable(plans.get(name));
    }

    public Collection<WavePlan> all() {
        return plans.values();
    }
}
