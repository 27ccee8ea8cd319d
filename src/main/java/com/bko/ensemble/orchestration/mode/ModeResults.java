package com.bko.ensemble.orchestration.mode;

import static com.bko.ensemble.orchestration.ModeConstants.RESPONSE_SEPARATOR;

import com.bko.ensemble.orchestration.model.ModeResult;
import com.bko.ensemble.orchestration.model.ModelInstance;
import com.bko.ensemble.orchestration.support.ModelNames;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

final class ModeResults {

    private ModeResults() {
    }

    /** A fixed-size list of {@code null}s, one per instance. */
    static List<ModeResult> empty(List<ModelInstance> instances) {
        return Arrays.asList(new ModeResult[instances.size()]);
    }

    static List<ModeResult> at(List<ModelInstance> instances, String instanceId, ModeResult result) {
        List<ModeResult> results = empty(instances);
        int index = ModelNames.indexOf(instances, instanceId);
        if (index >= 0) {
            results.set(index, result);
        }
        return results;
    }

    /** {@code [header]:\ncontent} blocks separated by horizontal rules. */
    static <T> String joinSources(List<T> items, Function<T, String> header, Function<T, String> content) {
        return items.stream()
                .map(item -> "[" + header.apply(item) + "]:\n" + content.apply(item))
                .collect(Collectors.joining(RESPONSE_SEPARATOR));
    }
}
