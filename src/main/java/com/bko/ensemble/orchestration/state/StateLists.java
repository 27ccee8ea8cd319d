package com.bko.ensemble.orchestration.state;

import java.util.ArrayList;
import java.util.List;

final class StateLists {

    private StateLists() {
    }

    static <T> List<T> append(List<T> list, T item) {
        List<T> updated = new ArrayList<>(list.size() + 1);
        updated.addAll(list);
        updated.add(item);
        return updated;
    }
}
