package com.bko.ensemble.orchestration.support;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * Renders round entries as prompt-ready markdown. Pure functions of their input.
 */
public final class TranscriptFormatter {

    static final String ROUND_SEPARATOR = "\n\n---\n\n";
    private static final String ITEM_SEPARATOR = "\n\n";

    private TranscriptFormatter() {
    }

    /**
     * Every round in ascending order, each under a {@code ### label} heading.
     *
     * @param itemLabel label shown in parentheses; a blank label falls back to the short model name
     */
    public static String formatRounds(List<? extends TranscriptEntry> entries,
                                      IntFunction<String> roundLabel,
                                      @Nullable Function<TranscriptEntry, String> itemLabel) {
        Map<Integer, List<TranscriptEntry>> byRound = entries.stream()
                .collect(Collectors.groupingBy(TranscriptEntry::round, TreeMap::new, Collectors.toList()));
        return byRound.entrySet().stream()
                .map(round -> "### " + roundLabel.apply(round.getKey()) + ITEM_SEPARATOR
                        + formatItems(round.getValue(), itemLabel))
                .collect(Collectors.joining(ROUND_SEPARATOR));
    }

    /**
     * Entries of a single round without a heading; empty when the round has none.
     */
    public static String formatRound(List<? extends TranscriptEntry> entries, int round,
                                     @Nullable Function<TranscriptEntry, String> itemLabel) {
        List<TranscriptEntry> inRound = entries.stream()
                .filter(entry -> entry.round() == round)
                .map(TranscriptEntry.class::cast)
                .toList();
        if (inRound.isEmpty()) {
            return "";
        }
        return formatItems(inRound, itemLabel);
    }

    private static String formatItems(List<TranscriptEntry> entries,
                                      @Nullable Function<TranscriptEntry, String> itemLabel) {
        return entries.stream()
                .map(entry -> formatItem(entry, itemLabel))
                .collect(Collectors.joining(ITEM_SEPARATOR));
    }

    private static String formatItem(TranscriptEntry entry, @Nullable Function<TranscriptEntry, String> itemLabel) {
        String shortName = ModelNames.shortName(entry.model());
        String label = itemLabel != null ? itemLabel.apply(entry) : null;
        if (!StringUtils.hasText(label)) {
            label = shortName;
        }
        return "**" + shortName + "** (" + label + "): " + entry.content();
    }
}
