package com.bko.ensemble.orchestration.support;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-elimination bracket over competitor ids. {@code rounds().get(0)} is the full field and every later
 * round holds exactly the winners of the previous one, byes included.
 */
public final class TournamentBracket {

    private final List<List<String>> rounds = new ArrayList<>();
    private final List<List<String>> eliminated = new ArrayList<>();

    public TournamentBracket(List<String> competitors) {
        rounds.add(List.copyOf(competitors));
    }

    /** {@code ceil(log2(n))}; zero for a field of one or none. */
    public static int roundCount(int competitors) {
        if (competitors <= 1) {
            return 0;
        }
        return 32 - Integer.numberOfLeadingZeros(competitors - 1);
    }

    /**
     * Pairs competitors in list order. With an odd count the first competitor sits out with a bye.
     */
    public static RoundPairing pairRound(List<String> competitors) {
        int start = competitors.size() % 2 == 1 ? 1 : 0;
        String bye = start == 1 ? competitors.get(0) : null;
        List<Pairing> pairs = new ArrayList<>();
        for (int i = start; i + 1 < competitors.size(); i += 2) {
            pairs.add(new Pairing((i - start) / 2, competitors.get(i), competitors.get(i + 1)));
        }
        return new RoundPairing(bye, pairs);
    }

    public List<String> current() {
        return rounds.get(rounds.size() - 1);
    }

    public int currentRound() {
        return rounds.size() - 1;
    }

    public boolean isDecided() {
        return current().size() <= 1;
    }

    /**
     * Closes the current round. {@code winners} must list the bye first (if any) and then each match winner.
     */
    public void advance(List<String> winners, List<String> losers) {
        rounds.add(List.copyOf(winners));
        eliminated.add(List.copyOf(losers));
    }

    @Nullable
    public String champion() {
        List<String> last = current();
        return last.size() == 1 ? last.get(0) : null;
    }

    public List<List<String>> rounds() {
        return Collections.unmodifiableList(rounds);
    }

    public List<List<String>> eliminatedPerRound() {
        return Collections.unmodifiableList(eliminated);
    }

    public record Pairing(int index, String competitor1, String competitor2) {
    }

    public record RoundPairing(@Nullable String bye, List<Pairing> pairs) {

        public RoundPairing {
            pairs = List.copyOf(pairs);
        }
    }
}
