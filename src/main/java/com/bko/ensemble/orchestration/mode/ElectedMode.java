package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.VOTE_INSTRUCTION;

import com.bko.ensemble.config.EnsembleProperties;
import com.bko.ensemble.orchestration.model.ConversationMode;
import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.ModeMetadata;
import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.model.ModelParameters;
import com.bko.ensemble.orchestration.model.ResultKind;
import com.bko.ensemble.orchestration.runner.GatherResult;
import com.bko.ensemble.orchestration.runner.InstanceCall;
import com.bko.ensemble.orchestration.runner.ModeContext;
import com.bko.ensemble.orchestration.runner.ModeSpec;
import com.bko.ensemble.orchestration.runner.RunnerHelpers;
import com.bko.ensemble.orchestration.service.ModePromptService;
import com.bko.ensemble.orchestration.state.CandidateResponse;
import com.bko.ensemble.orchestration.state.ElectedState;
import com.bko.ensemble.orchestration.state.ElectedState.Vote;
import com.bko.ensemble.orchestration.support.UsageAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Every instance answers, then every instance votes for the best answer. Most votes wins; ties go to the
 * alphabetically first display name.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElectedMode implements ModeSpec<ElectedState> {

    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");

    private final ModePromptService promptService;
    private final EnsembleProperties properties;

    @Override
    public ConversationMode mode() {
        return ConversationMode.ELECTED;
    }

    @Override
    public int minInstances() {
        return 3;
    }

    @Override
    public ElectedState initialize(ModeContext ctx) {
        return new ElectedState(ElectedState.Phase.RESPONDING, List.of(), List.of(), null, null, Map.of());
    }

    @Override
    public ElectedState execute(ModeContext ctx, RunnerHelpers<ElectedState> helpers) {
        List<ModelInstance> instances = helpers.instances();
        GatherResult gathered = helpers.gather(instances,
                instance -> helpers.buildConversationInput(instance.modelId(), ctx.userContent()),
                (call, result, index) -> {
                    if (result != null) {
                        helpers.updateState(state -> state.withCandidate(CandidateResponse.from(call.instance(), result)));
                    }
                });

        List<CandidateResponse> candidates = helpers.state().candidates();
        if (gathered.successCount() < 2) {
            log.warn("Only {} candidate(s) answered; skipping the vote.", gathered.successCount());
            ElectedState done = helpers.state().withPhase(ElectedState.Phase.DONE);
            if (candidates.size() == 1) {
                CandidateResponse only = candidates.get(0);
                return done.withWinner(only.model())
                        .withWinnerInstanceId(only.instanceId())
                        .withVoteCounts(Map.of(only.model(), 0));
            }
            return done;
        }

        helpers.setState(helpers.state().withPhase(ElectedState.Phase.VOTING));
        String votingPrompt = promptService.votingPrompt(ctx.config(), ctx.userContent(), formatCandidates(candidates));
        ModelParameters voteParameters = ModelParameters.ofMaxTokens(properties.getModes().getVoteMaxTokens());
        List<InstanceCall> ballots = instances.stream()
                .map(instance -> InstanceCall.of(instance, List.of(
                        InputItem.system(votingPrompt),
                        InputItem.user(VOTE_INSTRUCTION)), voteParameters))
                .toList();
        helpers.gatherCalls(ballots, (call, result, index) -> {
            if (result == null) {
                return;
            }
            String ballot = result.content().trim();
            OptionalInt choice = parseVote(ballot, candidates.size());
            if (choice.isEmpty()) {
                log.warn("Ignoring unreadable vote from {}: {}", call.instance().displayName(), ballot);
                return;
            }
            Vote vote = new Vote(call.instance().id(), call.instance().displayName(),
                    candidates.get(choice.getAsInt()).model(), ballot, result.usage());
            helpers.updateState(state -> state.withVote(vote));
        });

        ElectedState voted = helpers.state();
        int winnerIndex = pickWinner(candidates, voted.votes());
        CandidateResponse winner = candidates.get(winnerIndex);
        return voted.withPhase(ElectedState.Phase.DONE)
                .withWinner(winner.model())
                .withWinnerInstanceId(winner.instanceId())
                .withVoteCounts(countVotes(candidates, voted.votes()));
    }

    @Override
    public List<ModeResult> finalize(ElectedState state, ModeContext ctx) {
        if (state.winnerInstanceId() == null) {
            return ModeResults.empty(ctx.instances());
        }
        CandidateResponse winner = state.candidates().stream()
                .filter(candidate -> candidate.instanceId().equals(state.winnerInstanceId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Winning candidate not found"));
        ModeMetadata metadata = new ModeMetadata(mode(), ResultKind.SELECTION, winner.model(), state,
                UsageAggregator.aggregate(state.candidates()).plus(UsageAggregator.aggregate(state.votes())));
        return ModeResults.at(ctx.instances(), winner.instanceId(),
                new ModeResult(winner.content(), winner.usage(), metadata));
    }

    static String formatCandidates(List<CandidateResponse> candidates) {
        return IntStream.range(0, candidates.size())
                .mapToObj(i -> "--- Candidate " + (i + 1) + " (" + candidates.get(i).model() + ") ---\n"
                        + candidates.get(i).content())
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * First integer in the ballot, 1-based. Returns a 0-based index, or empty when out of range.
     */
    static OptionalInt parseVote(String ballot, int candidateCount) {
        Matcher matcher = FIRST_NUMBER.matcher(ballot);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            int index = Integer.parseInt(matcher.group()) - 1;
            return index >= 0 && index < candidateCount ? OptionalInt.of(index) : OptionalInt.empty();
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    static Map<String, Integer> countVotes(List<CandidateResponse> candidates, List<Vote> votes) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        candidates.forEach(candidate -> counts.put(candidate.model(), 0));
        for (Vote vote : votes) {
            counts.computeIfPresent(vote.votedFor(), (name, count) -> count + 1);
        }
        return counts;
    }

    static int pickWinner(List<CandidateResponse> candidates, List<Vote> votes) {
        Map<String, Integer> counts = countVotes(candidates, votes);
        int winner = 0;
        for (int i = 1; i < candidates.size(); i++) {
            String name = candidates.get(i).model();
            String best = candidates.get(winner).model();
            int count = counts.get(name);
            int bestCount = counts.get(best);
            if (count > bestCount || (count == bestCount && name.compareTo(best) < 0)) {
                winner = i;
            }
        }
        return winner;
    }
}
