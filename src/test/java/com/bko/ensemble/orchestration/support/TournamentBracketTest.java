package com.bko.ensemble.orchestration.support;

import com.bko.ensemble.orchestration.support.TournamentBracket.RoundPairing;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TournamentBracketTest {

    @Test
    void testRoundCount() {
        assertEquals(0, TournamentBracket.roundCount(1));
        assertEquals(1, TournamentBracket.roundCount(2));
        assertEquals(2, TournamentBracket.roundCount(3));
        assertEquals(2, TournamentBracket.roundCount(4));
        assertEquals(3, TournamentBracket.roundCount(5));
        assertEquals(3, TournamentBracket.roundCount(8));
    }

    @Test
    void testOddFieldGivesFirstCompetitorABye() {
        RoundPairing pairing = TournamentBracket.pairRound(List.of("a", "b", "c"));

        assertEquals("a", pairing.bye());
        assertEquals(1, pairing.pairs().size());
        assertEquals("b", pairing.pairs().get(0).competitor1());
        assertEquals("c", pairing.pairs().get(0).competitor2());
        assertEquals(0, pairing.pairs().get(0).index());
    }

    @Test
    void testEvenFieldPairsInOrder() {
        RoundPairing pairing = TournamentBracket.pairRound(List.of("a", "b", "c", "d"));

        assertNull(pairing.bye());
        assertEquals(2, pairing.pairs().size());
        assertEquals("c", pairing.pairs().get(1).competitor1());
        assertEquals(1, pairing.pairs().get(1).index());
    }

    @Test
    void testAdvanceUntilChampion() {
        TournamentBracket bracket = new TournamentBracket(List.of("a", "b", "c"));
        assertFalse(bracket.isDecided());
        assertNull(bracket.champion());

        bracket.advance(List.of("a", "c"), List.of("b"));
        bracket.advance(List.of("c"), List.of("a"));

        assertTrue(bracket.isDecided());
        assertEquals("c", bracket.champion());
        assertEquals(2, bracket.currentRound());
        assertEquals(List.of(List.of("a", "b", "c"), List.of("a", "c"), List.of("c")), bracket.rounds());
        assertEquals(List.of(List.of("b"), List.of("a")), bracket.eliminatedPerRound());
    }
}
