package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.state.ModeState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RecordingPublisher extends LatestStatePublisher {

    private final List<ModeState> states = new ArrayList<>();
    private final List<List<String>> streamRounds = new ArrayList<>();

    @Override
    public void initStreaming(List<String> streamIds, Map<String, String> modelsByStreamId) {
        streamRounds.add(List.copyOf(streamIds));
    }

    @Override
    protected void onState(ModeState state) {
        states.add(state);
    }

    public List<ModeState> states() {
        return states;
    }

    public List<String> phases() {
        return states.stream().map(ModeState::phaseName).toList();
    }

    public List<List<String>> streamRounds() {
        return streamRounds;
    }
}
