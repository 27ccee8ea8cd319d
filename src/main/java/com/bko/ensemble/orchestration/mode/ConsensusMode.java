package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.CONSENSUS_INSTRUCTION;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.GatherResult;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.CandidateResponse;
import com.bko.ensemble.orchestration.state.ConsensusState;
import com.bko.ensemble.orchestration.state.ConsensusState.ConsensusRound;
import com.bko.ensemble.orchestration.support.TextSimilarity;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Instances revise their answers after seeing everyone else's until their token-set similarity reaches the
 * threshold or the round limit is hit. The most central final answer is returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConsensusMode implements ModeSpec<ConsensusState> {

    private final ModePromptService promptService;
    private final EnsembleProperties properties;

    @Override
    public ConversationMode mode() {
        return ConversationMode.CONSENSUS;
    }

    @Override
    public int minInstances() {
        return 2;
    }

    @Override
    public ConsensusState initialize(ModeContext ctx) {
        Integer maxRounds = ctx.config().maxConsensusRounds();
        Double threshold = ctx.config().consensusThreshold();
        return new ConsensusState(ConsensusState.Phase.RESPONDING, 0,
                maxRounds != null ? maxRounds : properties.getModes().getMaxConsensusRounds(),
                threshold != null ? threshold : properties.getModes().getConsensusThreshold(),
                List.of(), List.of(), null, false, null);
    }

    @Override
    public ConsensusState execute(ModeContext ctx, RunnerHelpers<ConsensusState> helpers) {
        GatherResult initial = helpers.gather(helpers.instances(),
                instance -> helpers.buildConversationInput(instance.modelId(), ctx.userContent()),
                (call, result, index) -> {
                    if (result != null) {
                        helpers.updateState(state -> state.withRoundResponse(CandidateResponse.from(call.instance(), result)));
                    }
                });
        List<CandidateResponse> current = helpers.state().currentRoundResponses();
        helpers.setState(helpers.state()
                .withRound(new ConsensusRound(0, current, false, null))
                .withCurrentRoundResponses(List.of()));

        if (initial.successCount() < 2) {
            log.warn("Only {} initial response(s); skipping revision rounds.", initial.successCount());
            return helpers.state()
                    .withPhase(ConsensusState.Phase.DONE)
                    .withRepresentative(current.isEmpty() ? null : current.get(0));
        }

        int maxRounds = helpers.state().maxRounds();
        double threshold = helpers.state().threshold();
        boolean reached = false;
        double score = TextSimilarity.roundScore(contents(current));
        for (int round = 1; round < maxRounds && !reached; round++) {
            int revisionRound = round;
            helpers.setState(helpers.state()
                    .withPhase(ConsensusState.Phase.REVISING)
                    .withCurrentRound(round)
                    .withCurrentRoundResponses(List.of()));
            List<InputItem> revisionInput = List.of(
                    InputItem.system(promptService.consensusPrompt(ctx.config(), ctx.userContent(),
                            formatResponses(current))),
                    InputItem.user(CONSENSUS_INSTRUCTION));
            helpers.gather(helpers.instances(), instance -> revisionInput, (call, result, index) -> {
                if (result != null) {
                    helpers.updateState(state -> state.currentRound() == revisionRound
                            ? state.withRoundResponse(CandidateResponse.from(call.instance(), result))
                            : state);
                }
            });

            List<CandidateResponse> revised = helpers.state().currentRoundResponses();
            if (revised.isEmpty()) {
                log.warn("Every revision failed in round {}; carrying the previous responses forward.", round);
            } else {
                current = revised;
            }
            score = TextSimilarity.roundScore(contents(current));
            reached = score >= threshold;
            log.info("Consensus round {} scored {} (threshold {}).", round, String.format("%.3f", score), threshold);
            helpers.setState(helpers.state()
                    .withRound(new ConsensusRound(round, revised, reached, score))
                    .withPhase(reached ? ConsensusState.Phase.DONE : ConsensusState.Phase.REVISING)
                    .withFinalScore(reached ? score : null));
        }

        int representative = TextSimilarity.representativeIndex(contents(current));
        return helpers.state()
                .withPhase(ConsensusState.Phase.DONE)
                .withCurrentRoundResponses(List.of())
                .withConsensusReached(reached)
                .withFinalScore(score)
                .withRepresentative(current.get(representative));
    }

    @Override
    public List<ModeResult> finalize(ConsensusState state, ModeContext ctx) {
        CandidateResponse representative = state.representative();
        if (representative == null) {
            return ModeResults.empty(ctx.instances());
        }
        MessageUsage total = MessageUsage.ZERO;
        for (ConsensusRound round : state.rounds()) {
            total = total.plus(UsageAggregator.aggregate(round.responses()));
        }
        return ModeResults.at(ctx.instances(), representative.instanceId(), new ModeResult(representative.content(),
                representative.usage(), ModeMetadata.of(mode(), ResultKind.SELECTION, state, total)));
    }

    static String formatResponses(List<CandidateResponse> responses) {
        return responses.stream()
                .map(response -> "--- " + response.model() + " ---\n" + response.content())
                .collect(Collectors.joining("\n\n"));
    }

    private static List<String> contents(List<CandidateResponse> responses) {
        return responses.stream().map(CandidateResponse::content).toList();
    }
}
