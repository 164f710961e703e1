package com.wavegate.dispatch.api;

import com.wavegate.core.plan.WavePlan;
import com.wavegate.core.plan.WavePlanRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only catalogue of registered wave plans.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private final WavePlanRegistry registry;

    public PlanController(WavePlanRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /api/v1/plans: Names, waves and task names of every plan.
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listPlans() {
        return ResponseEntity.ok(registry.all().stream().map(PlanController::describe).toList());
    }

    static Map<String, Object> describe(WavePlan plan) {
        var body = new LinkedHashMap<String, Object>();
        body.put("name", plan.name());
        body.put("description", plan.description());
        body.put("waves", plan.waves().stream()
                .map(w -> Map.of("wave", w.number(), "tasks", w.taskNames()))
                .toList());
        body.put("final_task", WavePlan.FINAL_TASK);
        body.put("total_checkpoints", plan.totalCheckpoints());
        return body;
    }
}
