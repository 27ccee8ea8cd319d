package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.*;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.ModeConfig;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.model.StreamResult;
import com.bko.ensemble.orchestration.runner.GatherResult;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.JsonProcessingService;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.CouncilState;
import com.bko.ensemble.orchestration.state.CouncilState.CouncilStatement;
import com.bko.ensemble.orchestration.support.ModelNames;
import com.bko.ensemble.orchestration.support.TranscriptEntry;
import com.bko.ensemble.orchestration.support.TranscriptFormatter;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Council members discuss the question from distinct roles over an opening round and several discussion rounds.
 * The synthesizer does not sit on the council; it only writes the final recommendation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CouncilMode implements ModeSpec<CouncilState> {

    private static final TypeReference<Map<String, Object>> ROLE_MAP = new TypeReference<>() {
    };

    private final ModePromptService promptService;
    private final JsonProcessingService jsonProcessingService;
    private final EnsembleProperties properties;

    @Override
    public ConversationMode mode() {
        return ConversationMode.COUNCIL;
    }

    @Override
    public int minInstances() {
        return 2;
    }

    @Override
    public boolean validate(ModeContext ctx) {
        return !members(ctx).isEmpty();
    }

    @Override
    public CouncilState initialize(ModeContext ctx) {
        ModeConfig config = ctx.config();
        Integer configured = config.debateRounds();
        int totalRounds = configured != null ? configured : properties.getModes().getCouncilRounds();
        boolean autoAssign = Boolean.TRUE.equals(config.councilAutoAssignRoles());
        ModelInstance synthesizer = synthesizer(ctx);
        return new CouncilState(autoAssign ? CouncilState.Phase.ASSIGNING : CouncilState.Phase.OPENING, 0,
                totalRounds, autoAssign ? Map.of() : assignRoles(members(ctx), config.councilRoles()),
                List.of(), List.of(), synthesizer.modelId(), synthesizer.id(), null, null, null);
    }

    @Override
    public CouncilState execute(ModeContext ctx, RunnerHelpers<CouncilState> helpers) {
        ModeConfig config = ctx.config();
        String question = ctx.userContent();
        List<ModelInstance> members = members(ctx);
        ModelInstance synthesizer = synthesizer(ctx);

        if (helpers.state().phase() == CouncilState.Phase.ASSIGNING) {
            helpers.setState(autoAssignRoles(helpers, synthesizer, members, config, question));
        }
        Map<String, String> roles = helpers.state().roles();
        log.info("Council roles: {}", roles);

        GatherResult opening = helpers.gather(members, instance -> List.of(
                InputItem.system(promptService.councilOpeningPrompt(config, roles.get(instance.id()), question)),
                InputItem.user(COUNCIL_OPENING_INSTRUCTION)),
                (call, result, index) -> recordStatement(helpers, call.instance(), result, 0));
        if (opening.successCount() == 0) {
            log.warn("No council member produced an opening perspective.");
            return helpers.state().withPhase(CouncilState.Phase.DONE);
        }

        Function<TranscriptEntry, String> roleLabel = entry -> roles.get(entry.instanceId());
        int totalRounds = helpers.state().totalRounds();
        for (int round = 1; round <= totalRounds; round++) {
            int current = round;
            helpers.setState(helpers.state().startRound(CouncilState.Phase.DISCUSSING, round));
            String perspectives = TranscriptFormatter.formatRound(helpers.state().statements(), round - 1, roleLabel);
            helpers.gather(members, instance -> List.of(
                    InputItem.system(promptService.councilDiscussionPrompt(config, roles.get(instance.id()), question,
                            perspectives)),
                    InputItem.user(COUNCIL_DISCUSSION_INSTRUCTION)),
                    (call, result, index) -> recordStatement(helpers, call.instance(), result, current));
        }

        helpers.setState(helpers.state().withPhase(CouncilState.Phase.SYNTHESIZING)
                .withCurrentRoundStatements(List.of()));
        String discussion = TranscriptFormatter.formatRounds(helpers.state().statements(),
                round -> round == 0 ? "Opening Perspectives" : "Discussion Round " + round, roleLabel);
        StreamResult synthesis = helpers.callSingle(synthesizer, List.of(
                InputItem.system(promptService.councilSynthesisPrompt(question, discussion)),
                InputItem.user(COUNCIL_SYNTHESIS_INSTRUCTION)));
        if (synthesis == null) {
            log.warn("Council synthesis failed; using the fallback text.");
        }
        return helpers.state()
                .withPhase(CouncilState.Phase.DONE)
                .withSynthesis(synthesis != null ? synthesis.content() : COUNCIL_SYNTHESIS_FALLBACK)
                .withSynthesisUsage(synthesis != null ? synthesis.usage() : null);
    }

    @Override
    public List<ModeResult> finalize(CouncilState state, ModeContext ctx) {
        if (state.synthesis() == null) {
            return ModeResults.empty(ctx.instances());
        }
        MessageUsage total = UsageAggregator.aggregate(state.statements(), state.synthesisUsage(),
                state.roleAssignmentUsage());
        ModeMetadata metadata = new ModeMetadata(mode(), ResultKind.SYNTHESIS,
                ModelNames.shortName(state.synthesizerModel()), state, total);
        return ModeResults.at(ctx.instances(), state.synthesizerInstanceId(),
                new ModeResult(state.synthesis(), state.synthesisUsage(), metadata));
    }

    private CouncilState autoAssignRoles(RunnerHelpers<CouncilState> helpers, ModelInstance synthesizer,
                                         List<ModelInstance> members, ModeConfig config, String question) {
        List<String> names = members.stream().map(ModelInstance::displayName).toList();
        StreamResult assignment = helpers.callSingle(synthesizer, List.of(
                InputItem.system(promptService.councilRoleAssignmentPrompt(question, names)),
                InputItem.user(COUNCIL_ROLE_INSTRUCTION)));
        Map<String, String> roles = assignment != null
                ? parseAssignedRoles(jsonProcessingService.parseJsonResponse("council roles", assignment.content(),
                        ROLE_MAP), members)
                : null;
        if (roles == null) {
            log.warn("Role auto-assignment unusable; falling back to configured or default roles.");
            roles = assignRoles(members, config.councilRoles());
        }
        return helpers.state()
                .withPhase(CouncilState.Phase.OPENING)
                .withRoles(roles)
                .withRoleAssignmentUsage(assignment != null ? assignment.usage() : null);
    }

    /**
     * Configured role by instance id, then by model id, otherwise the default roles in member order.
     */
    static Map<String, String> assignRoles(List<ModelInstance> members, @Nullable Map<String, String> configured) {
        Map<String, String> roles = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            ModelInstance member = members.get(i);
            String role = configured != null ? configured.get(member.id()) : null;
            if (!StringUtils.hasText(role) && configured != null) {
                role = configured.get(member.modelId());
            }
            if (!StringUtils.hasText(role)) {
                role = DEFAULT_COUNCIL_ROLES.get(i % DEFAULT_COUNCIL_ROLES.size());
            }
            roles.put(member.id(), role);
        }
        return roles;
    }

    /**
     * Maps the coordinator's JSON back onto members. Returns {@code null} unless every member got a textual role.
     */
    @Nullable
    static Map<String, String> parseAssignedRoles(@Nullable Map<String, Object> parsed, List<ModelInstance> members) {
        if (parsed == null) {
            return null;
        }
        Map<String, String> roles = new LinkedHashMap<>();
        for (ModelInstance member : members) {
            String shortName = ModelNames.shortName(member.modelId());
            Object role = firstPresent(parsed, member.id(), member.modelId(), shortName, member.displayName());
            if (role == null) {
                role = parsed.entrySet().stream()
                        .filter(entry -> entry.getKey().contains(shortName) || shortName.contains(entry.getKey()))
                        .map(Map.Entry::getValue)
                        .findFirst()
                        .orElse(null);
            }
            if (role instanceof String text && StringUtils.hasText(text)) {
                roles.put(member.id(), text);
            }
        }
        return roles.size() == members.size() ? roles : null;
    }

    @Nullable
    private static Object firstPresent(Map<String, Object> parsed, String... keys) {
        for (String key : keys) {
            Object value = parsed.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private void recordStatement(RunnerHelpers<CouncilState> helpers, ModelInstance instance,
                                 @Nullable StreamResult result, int round) {
        if (result == null) {
            return;
        }
        helpers.updateState(state -> state.withStatement(new CouncilStatement(instance.id(), instance.displayName(),
                state.roles().get(instance.id()), result.content(), round, result.usage())));
    }

    private List<ModelInstance> members(ModeContext ctx) {
        return SynthesizedMode.responders(ctx.instances(), synthesizer(ctx));
    }

    private ModelInstance synthesizer(ModeContext ctx) {
        ModeConfig config = ctx.config();
        return ModelNames.findSpecialInstance(ctx.instances(), config.synthesizerInstanceId(), config.synthesizerModel())
                .orElseThrow(() -> new IllegalStateException("Synthesizer instance not found"));
    }
}
