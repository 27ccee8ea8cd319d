package com.bko.ensemble.orchestration.runner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One token per call issued in a round. A group is never reused: the next round creates a new one.
 */
public final class CancellationGroup {

    private static final CancellationGroup EMPTY = new CancellationGroup(0);

    private final List<CancellationToken> tokens;

    private CancellationGroup(int size) {
        List<CancellationToken> created = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            created.add(new CancellationToken());
        }
        this.tokens = Collections.unmodifiableList(created);
    }

    public static CancellationGroup of(int size) {
        return new CancellationGroup(size);
    }

    public static CancellationGroup empty() {
        return EMPTY;
    }

    public CancellationToken token(int index) {
        return tokens.get(index);
    }

    public int size() {
        return tokens.size();
    }

    public void cancelAll() {
        tokens.forEach(CancellationToken::cancel);
    }

    public boolean anyCancelled() {
        return tokens.stream().anyMatch(CancellationToken::isCancelled);
    }
}
