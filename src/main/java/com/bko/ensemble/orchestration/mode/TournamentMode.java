package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.JUDGE_INSTRUCTION;

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
import com.bko.ensemble.orchestration.runner.InstanceCall;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.CandidateResponse;
import com.bko.ensemble.orchestration.state.TournamentState;
import com.bko.ensemble.orchestration.state.TournamentState.TournamentMatch;
import com.bko.ensemble.orchestration.support.ModelNames;
import com.bko.ensemble.orchestration.support.TournamentBracket;
import com.bko.ensemble.orchestration.support.TournamentBracket.Pairing;
import com.bko.ensemble.orchestration.support.TournamentBracket.RoundPairing;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Every instance answers, then answers meet in single-elimination matches decided by a judge until one remains.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TournamentMode implements ModeSpec<TournamentState> {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^A-Z0-9]+");

    private final ModePromptService promptService;

    @Override
    public ConversationMode mode() {
        return ConversationMode.TOURNAMENT;
    }

    @Override
    public int minInstances() {
        return 4;
    }

    @Override
    public TournamentState initialize(ModeContext ctx) {
        List<String> field = ctx.instances().stream().map(ModelInstance::id).toList();
        return new TournamentState(TournamentState.Phase.GENERATING, List.of(field), 0,
                TournamentBracket.roundCount(field.size()), List.of(), List.of(), List.of(), null, null);
    }

    @Override
    public TournamentState execute(ModeContext ctx, RunnerHelpers<TournamentState> helpers) {
        List<ModelInstance> instances = helpers.instances();
        GatherResult generated = helpers.gather(instances,
                instance -> helpers.buildConversationInput(instance.modelId(), ctx.userContent()),
                (call, result, index) -> {
                    if (result != null) {
                        helpers.updateState(state -> state.withInitialResponse(CandidateResponse.from(call.instance(), result)));
                    }
                });

        Map<String, CandidateResponse> responses = new LinkedHashMap<>();
        for (int i = 0; i < instances.size(); i++) {
            StreamResult result = generated.resultAt(i);
            if (result != null) {
                responses.put(instances.get(i).id(), CandidateResponse.from(instances.get(i), result));
            }
        }
        if (responses.size() < 2) {
            log.warn("Only {} answer(s) generated; no matches to play.", responses.size());
            String lone = responses.isEmpty() ? null : responses.keySet().iterator().next();
            return helpers.state()
                    .withPhase(TournamentState.Phase.DONE)
                    .withWinner(lone != null ? responses.get(lone).model() : null)
                    .withWinnerInstanceId(lone);
        }

        TournamentBracket bracket = new TournamentBracket(new ArrayList<>(responses.keySet()));
        helpers.setState(helpers.state()
                .withPhase(TournamentState.Phase.COMPETING)
                .withBracket(bracket.rounds())
                .withTotalRounds(TournamentBracket.roundCount(responses.size())));

        while (!bracket.isDecided()) {
            playRound(ctx, helpers, bracket, responses);
            helpers.setState(helpers.state()
                    .withBracket(bracket.rounds())
                    .withEliminatedPerRound(bracket.eliminatedPerRound())
                    .withCurrentRound(bracket.currentRound()));
        }

        String champion = bracket.champion();
        log.info("Tournament decided after {} round(s); winner {}.", bracket.currentRound(), champion);
        return helpers.state()
                .withPhase(TournamentState.Phase.DONE)
                .withWinner(responses.get(champion).model())
                .withWinnerInstanceId(champion);
    }

    @Override
    public List<ModeResult> finalize(TournamentState state, ModeContext ctx) {
        String winnerId = state.winnerInstanceId();
        CandidateResponse winner = state.initialResponses().stream()
                .filter(response -> response.instanceId().equals(winnerId))
                .findFirst()
                .orElse(null);
        if (winner == null) {
            return ModeResults.empty(ctx.instances());
        }
        MessageUsage total = UsageAggregator.aggregate(state.initialResponses());
        for (TournamentMatch match : state.matches()) {
            total = total.plus(match.judgeUsage());
        }
        ModeMetadata metadata = new ModeMetadata(mode(), ResultKind.SELECTION, winner.model(), state, total);
        return ModeResults.at(ctx.instances(), winnerId, new ModeResult(winner.content(), winner.usage(), metadata));
    }

    private void playRound(ModeContext ctx, RunnerHelpers<TournamentState> helpers, TournamentBracket bracket,
                           Map<String, CandidateResponse> responses) {
        int round = bracket.currentRound();
        RoundPairing pairing = TournamentBracket.pairRound(bracket.current());
        List<TournamentMatch> matches = new ArrayList<>();
        List<InstanceCall> calls = new ArrayList<>();
        for (Pairing pair : pairing.pairs()) {
            ModelInstance judge = selectJudge(ctx, pair.competitor1(), pair.competitor2());
            TournamentMatch match = new TournamentMatch(round + "-" + pair.index(), round, pair.competitor1(),
                    pair.competitor2(), judge.id(), null, TournamentMatch.Status.JUDGING, null, null);
            matches.add(match);
            calls.add(new InstanceCall(judge, judge.id() + "__match_" + match.id(), List.of(
                    InputItem.system(promptService.judgingPrompt(ctx.config(), ctx.userContent(),
                            responses.get(pair.competitor1()).content(), responses.get(pair.competitor2()).content())),
                    InputItem.user(JUDGE_INSTRUCTION)), null));
        }
        TournamentState state = helpers.state();
        for (TournamentMatch match : matches) {
            state = state.withMatch(match);
        }
        helpers.setState(state);

        List<String> winners = new ArrayList<>();
        List<String> losers = new ArrayList<>();
        if (pairing.bye() != null) {
            winners.add(pairing.bye());
        }
        GatherResult judged = helpers.gatherCalls(calls, (call, result, index) ->
                helpers.updateState(current -> current.withCompletedMatch(decide(matches.get(index), result))));
        for (int i = 0; i < matches.size(); i++) {
            TournamentMatch decided = decide(matches.get(i), judged.resultAt(i));
            winners.add(decided.winner());
            losers.add(decided.winner().equals(decided.competitor1()) ? decided.competitor2() : decided.competitor1());
        }
        bracket.advance(winners, losers);
    }

    private TournamentMatch decide(TournamentMatch match, @Nullable StreamResult verdict) {
        if (verdict == null) {
            log.warn("Judge {} failed on match {}; competitor 1 advances.", match.judge(), match.id());
            return match.withStatus(TournamentMatch.Status.COMPLETE).withWinner(match.competitor1());
        }
        String winner = judgePrefersSecond(verdict.content()) ? match.competitor2() : match.competitor1();
        return match.withStatus(TournamentMatch.Status.COMPLETE)
                .withWinner(winner)
                .withReasoning(verdict.content())
                .withJudgeUsage(verdict.usage());
    }

    /**
     * A leading {@code A}/{@code 1} or {@code B}/{@code 2} token decides. Otherwise the answer must name exactly one
     * side. Anything ambiguous goes to competitor 1.
     */
    static boolean judgePrefersSecond(String verdict) {
        boolean first = false;
        boolean second = false;
        boolean leading = true;
        for (String token : TOKEN_SPLIT.split(verdict.trim().toUpperCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            boolean isFirst = token.equals("A") || token.equals("1");
            boolean isSecond = token.equals("B") || token.equals("2");
            if (leading && (isFirst || isSecond)) {
                return isSecond;
            }
            leading = false;
            first |= isFirst;
            second |= isSecond;
        }
        return second && !first;
    }

    /**
     * Configured primary instance, else the first instance outside the match, else the first instance.
     */
    static ModelInstance selectJudge(ModeContext ctx, String competitor1, String competitor2) {
        ModeConfig config = ctx.config();
        return ModelNames.findConfiguredInstance(ctx.instances(), config.primaryInstanceId(), config.primaryModel())
                .or(() -> ctx.instances().stream()
                        .filter(instance -> !instance.id().equals(competitor1) && !instance.id().equals(competitor2))
                        .findFirst())
                .orElse(ctx.instances().get(0));
    }
}
