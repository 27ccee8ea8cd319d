package com.bko.ensemble.orchestration.service;

import static com.bko.ensemble.orchestration.ModeConstants.*;

import com.bko.ensemble.orchestration.model.ModeConfig;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders mode prompts. A custom prompt from {@link ModeConfig} replaces the built-in template but is rendered
 * with the same placeholders.
 */
@Service
public class ModePromptService {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    public String routingPrompt(ModeConfig config, List<String> targetNames) {
        return render(pick(config.routingPrompt(), ROUTING_PROMPT), Map.of("models", String.join("\n", targetNames)));
    }

    public String synthesisPrompt(ModeConfig config, String responses) {
        return render(pick(config.synthesisPrompt(), SYNTHESIS_PROMPT), Map.of("responses", responses));
    }

    public String critiquePrompt(ModeConfig config, String response) {
        return render(pick(config.critiquePrompt(), CRITIQUE_PROMPT), Map.of("response", response));
    }

    public String revisionPrompt(String originalResponse, String critiques) {
        return render(REVISION_PROMPT, Map.of("original_response", originalResponse, "critiques", critiques));
    }

    public String votingPrompt(ModeConfig config, String question, String candidates) {
        return render(pick(config.votingPrompt(), VOTING_PROMPT), Map.of("question", question, "candidates", candidates));
    }

    public String judgingPrompt(ModeConfig config, String question, String responseA, String responseB) {
        return render(pick(config.votingPrompt(), TOURNAMENT_JUDGING_PROMPT),
                Map.of("question", question, "response_a", responseA, "response_b", responseB));
    }

    public String consensusPrompt(ModeConfig config, String question, String responses) {
        return render(pick(config.consensusPrompt(), CONSENSUS_PROMPT),
                Map.of("question", question, "responses", responses));
    }

    public String debateOpeningPrompt(ModeConfig config, String position, String question) {
        return render(pick(config.debatePrompt(), DEBATE_OPENING_PROMPT),
                Map.of("position", position, "question", question));
    }

    public String debateRebuttalPrompt(ModeConfig config, String position, String question, String arguments) {
        return render(pick(config.debatePrompt(), DEBATE_REBUTTAL_PROMPT),
                Map.of("position", position, "question", question, "arguments", arguments));
    }

    public String debateSummaryPrompt(String question, String debate) {
        return render(DEBATE_SUMMARY_PROMPT, Map.of("question", question, "debate", debate));
    }

    public String councilOpeningPrompt(ModeConfig config, String role, String question) {
        return render(pick(config.councilPrompt(), COUNCIL_OPENING_PROMPT), Map.of("role", role, "question", question));
    }

    public String councilDiscussionPrompt(ModeConfig config, String role, String question, String perspectives) {
        return render(pick(config.councilPrompt(), COUNCIL_DISCUSSION_PROMPT),
                Map.of("role", role, "question", question, "perspectives", perspectives));
    }

    public String councilSynthesisPrompt(String question, String discussion) {
        return render(COUNCIL_SYNTHESIS_PROMPT, Map.of("question", question, "discussion", discussion));
    }

    public String councilRoleAssignmentPrompt(String question, List<String> members) {
        return render(COUNCIL_ROLE_ASSIGNMENT_PROMPT, Map.of(
                "question", question,
                "count", String.valueOf(members.size()),
                "members", bulletList(members)));
    }

    public String decompositionPrompt(ModeConfig config, String question, List<String> workers) {
        return render(pick(config.decompositionPrompt(), HIERARCHICAL_DECOMPOSITION_PROMPT), Map.of(
                "question", question,
                "count", String.valueOf(workers.size()),
                "workers", bulletList(workers)));
    }

    public String workerPrompt(ModeConfig config, String task, String context) {
        return render(pick(config.hierarchicalWorkerPrompt(), HIERARCHICAL_WORKER_PROMPT),
                Map.of("task", task, "context", context));
    }

    public String hierarchicalSynthesisPrompt(String question, String results) {
        return render(HIERARCHICAL_SYNTHESIS_PROMPT, Map.of("question", question, "results", results));
    }

    public String explainerInitialPrompt(String level, String question) {
        return render(EXPLAINER_INITIAL_PROMPT,
                Map.of("level", level, "question", question, "level_guidelines", audienceGuidelines(level)));
    }

    public String explainerSimplifyPrompt(String level, String question, String previousExplanation) {
        return render(EXPLAINER_SIMPLIFY_PROMPT, Map.of(
                "level", level,
                "question", question,
                "previous_explanation", previousExplanation,
                "level_guidelines", audienceGuidelines(level)));
    }

    public String audienceGuidelines(String level) {
        return AUDIENCE_GUIDELINES.getOrDefault(level.toLowerCase(Locale.ROOT), GENERIC_AUDIENCE_GUIDELINES);
    }

    public String confidenceResponsePrompt(ModeConfig config, String question) {
        return render(pick(config.confidencePrompt(), CONFIDENCE_RESPONSE_PROMPT), Map.of("question", question));
    }

    public String confidenceSynthesisPrompt(ModeConfig config, String responses) {
        return render(pick(config.synthesisPrompt(), CONFIDENCE_SYNTHESIS_PROMPT), Map.of("responses", responses));
    }

    /**
     * Single-pass substitution, so placeholder-like text inside a value is never expanded. Unknown placeholders
     * are left as is.
     */
    String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder(template.length());
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(rendered);
        return rendered.toString().strip();
    }

    private String pick(@Nullable String custom, String template) {
        return StringUtils.hasText(custom) ? custom : template;
    }

    private String bulletList(List<String> items) {
        StringBuilder builder = new StringBuilder();
        for (String item : items) {
            if (!builder.isEmpty()) {
                builder.append('\n');
            }
            builder.append("- ").append(item);
        }
        return builder.toString();
    }
}
