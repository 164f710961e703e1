package com.wavegate.core.plan;

import com.wavegate.core.model.SessionMode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in three-wave character development plan.
 * <ul>
 *   <li>Wave 1 (foundation): personality, backstory_motivation</li>
 *   <li>Wave 2 (expression): voice_dialogue, physical_description, story_arc</li>
 *   <li>Wave 3 (social): relationships</li>
 * </ul>
 * followed by final consolidation into a character profile.
 * <p>
 * The executors are deterministic local stand-ins: they derive their output from the start
 * input ({@code name}, {@code role}, {@code personality}), the session mode and the visible
 * context, and make no external calls.
 */
@Configuration("characterDevelopmentPlanConfiguration")
@ConditionalOnProperty(name = "wavegate.demo-plan.enabled", havingValue = "true", matchIfMissing = true)
public class CharacterDevelopmentPlan {

    public static final String NAME = "character-development";

    @Bean
    public WavePlan characterDevelopmentPlan() {
        return plan();
    }

    public static WavePlan plan() {
        return WavePlan.builder(NAME)
                .description("Develops a story character in three waves of specialised tasks")
                .wave(new TaskSpec("personality", CharacterDevelopmentPlan::personality),
                      new TaskSpec("backstory_motivation", CharacterDevelopmentPlan::backstory))
                .wave(new TaskSpec("voice_dialogue", CharacterDevelopmentPlan::voice),
                      new TaskSpec("physical_description", CharacterDevelopmentPlan::physical),
                      new TaskSpec("story_arc", CharacterDevelopmentPlan::storyArc))
                .wave(new TaskSpec("relationships", CharacterDevelopmentPlan::relationships))
                .consolidation(CharacterDevelopmentPlan::consolidate)
                .build();
    }

    // ── Wave 1 ────────────────────────────────────────────────────────────

    static TaskResult personality(TaskInput input) {
        String name = characterName(input);
        List<String> traits = limit(List.of(
                text(input, "personality", "curious"), "stubborn", "loyal", "guarded", "witty"), input.mode());
        var out = structured(input);
        out.put("core_traits", traits);
        out.put("fears", limit(List.of("abandonment", "irrelevance", "losing control"), input.mode()));
        out.put("secrets", List.of(name + " hides how much the past still hurts"));
        out.put("emotional_baseline", "composed with a restless undercurrent");
        out.put("triggers", List.of("being dismissed", "broken promises"));
        return result(out, name + " is " + String.join(", ", traits) + ".", input);
    }

    static TaskResult backstory(TaskInput input) {
        String name = characterName(input);
        var out = structured(input);
        out.put("timeline", List.of(
                Map.of("age", 8, "event", name + " loses a mentor"),
                Map.of("age", 19, "event", name + " leaves home to become a " + role(input))));
        out.put("formative_experiences", List.of(
                Map.of("experience", "an early betrayal", "impact", "trusts slowly")));
        out.put("goals", Map.of("surface", "prove themselves as a " + role(input),
                                "deep", "be understood"));
        out.put("internal_conflicts", List.of(
                Map.of("conflict", "duty versus desire", "description", "torn between promises and wants")));
        return result(out, name + " grew up in the shadow of an early loss.", input);
    }

    // ── Wave 2 ────────────────────────────────────────────────────────────

    static TaskResult voice(TaskInput input) {
        String name = characterName(input);
        List<String> traits = contextList(input, "personality", "core_traits");
        var out = structured(input);
        out.put("speech_pattern", traits.isEmpty() ? "measured" : "measured, " + traits.get(0));
        out.put("verbal_tics", List.of("answers questions with questions"));
        out.put("vocabulary", input.mode() == SessionMode.DEEP ? "rich and precise" : "plain");
        out.put("sample_dialogue", Map.of(
                "confident", "I know exactly what I'm doing.",
                "vulnerable", "I never wanted it to end like this.",
                "stressed", "Not now. Just not now.",
                "sarcastic", "Oh, wonderful. Another plan."));
        return result(out, name + " speaks in a " + out.get("speech_pattern") + " voice.", input);
    }

    static TaskResult physical(TaskInput input) {
        String name = characterName(input);
        var out = structured(input);
        out.put("mannerisms", List.of("taps fingers when thinking"));
        out.put("body_language", "closed until trust is earned");
        out.put("movement_style", "economical");
        out.put("physical_quirks", List.of(text(input, "appearance", "a faded scar on the left hand")));
        return result(out, name + " moves economically and rarely wastes a gesture.", input);
    }

    static TaskResult storyArc(TaskInput input) {
        String name = characterName(input);
        Object goals = input.context().getOrDefault("backstory_motivation", Map.of()).get("goals");
        var out = structured(input);
        out.put("role", role(input));
        out.put("arc_type", "positive change");
        out.put("transformation_beats", List.of(
                Map.of("act", 1, "beat", "refuses help"),
                Map.of("act", 2, "beat", "is forced to rely on others"),
                Map.of("act", 3, "beat", "chooses connection over control")));
        out.put("scene_presence", List.of("opening", "midpoint", "climax"));
        out.put("driven_by", goals != null ? goals : Map.of());
        return result(out, name + " learns to trust across three acts.", input);
    }

    // ── Wave 3 ────────────────────────────────────────────────────────────

    static TaskResult relationships(TaskInput input) {
        String name = characterName(input);
        var relationships = new ArrayList<Map<String, Object>>();
        relationships.add(Map.of("character", "the mentor", "type", "mentor",
                "dynamic", "unresolved grief", "evolution", "acceptance"));
        if (input.context().containsKey("story_arc")) {
            relationships.add(Map.of("character", "the rival", "type", "rival",
                    "dynamic", "mirror of " + name + "'s flaws", "evolution", "grudging respect"));
        }
        var out = structured(input);
        out.put("relationships", relationships);
        return result(out, name + " has " + relationships.size() + " defining relationships.", input);
    }

    // ── Consolidation ─────────────────────────────────────────────────────

    static TaskResult consolidate(TaskInput input) {
        String name = characterName(input);
        var profile = new LinkedHashMap<String, Object>();
        profile.put("name", name);
        profile.put("role", role(input));
        profile.put("mode", input.mode().wireName());
        profile.put("sections", new ArrayList<>(input.context().keySet()));
        input.context().forEach(profile::put);
        if (input.isRegeneration()) {
            profile.put("revision_notes", input.feedback());
        }
        String narrative = "Character profile of " + name + " combining "
                + input.context().size() + " sections.";
        return result(profile, narrative, input);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static LinkedHashMap<String, Object> structured(TaskInput input) {
        var out = new LinkedHashMap<String, Object>();
        if (input.isRegeneration()) {
            out.put("revision_notes", input.feedback());
        }
        return out;
    }

    private static TaskResult result(Map<String, Object> structured, String narrative, TaskInput input) {
        String text = input.isRegeneration() ? narrative + " (revised: " + input.feedback() + ")" : narrative;
        double cost = switch (input.mode()) {
            case FAST -> 1;
            case BALANCED -> 2;
            case DEEP -> 4;
        };
        return new TaskResult(structured, text, cost);
    }

    private static String characterName(TaskInput input) {
        return text(input, "name", "The protagonist");
    }

    private static String role(TaskInput input) {
        return text(input, "role", "wanderer");
    }

    private static String text(TaskInput input, String key, String fallback) {
        Object value = input.input().get(key);
        return value instanceof String s && !s.isBlank() ? s : fallback;
    }

    @SuppressWarnings("unchecked")
    private static List<String> contextList(TaskInput input, String task, String key) {
        Object value = input.context().getOrDefault(task, Map.of()).get(key);
        return value instanceof List<?> list ? (List<String>) list : List.of();
    }

    private static List<String> limit(List<String> values, SessionMode mode) {
        int n = switch (mode) {
            case FAST -> 1;
            case BALANCED -> 3;
            case DEEP -> values.size();
        };
        return values.subList(0, Math.min(n, values.size()));
    }
}
