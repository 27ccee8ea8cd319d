package com.bko.ensemble.orchestration.state;

import com.bko.ensemble.orchestration.model.ConversationMode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Live state of one run, published after every transition. One variant per mode, tagged by {@code mode}
 * on the wire. Variants are immutable; every transition replaces the whole record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "mode")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MultipleState.class, name = "multiple"),
        @JsonSubTypes.Type(value = SynthesizedState.class, name = "synthesized"),
        @JsonSubTypes.Type(value = ConfidenceState.class, name = "confidence-weighted"),
        @JsonSubTypes.Type(value = RoutedState.class, name = "routed"),
        @JsonSubTypes.Type(value = ElectedState.class, name = "elected"),
        @JsonSubTypes.Type(value = ConsensusState.class, name = "consensus"),
        @JsonSubTypes.Type(value = DebatedState.class, name = "debated"),
        @JsonSubTypes.Type(value = CouncilState.class, name = "council"),
        @JsonSubTypes.Type(value = CritiquedState.class, name = "critiqued"),
        @JsonSubTypes.Type(value = HierarchicalState.class, name = "hierarchical"),
        @JsonSubTypes.Type(value = TournamentState.class, name = "tournament"),
        @JsonSubTypes.Type(value = ExplainerState.class, name = "explainer"),
        @JsonSubTypes.Type(value = ScattershotState.class, name = "scattershot")
})
public sealed interface ModeState permits MultipleState, SynthesizedState, ConfidenceState, RoutedState,
        ElectedState, ConsensusState, DebatedState, CouncilState, CritiquedState, HierarchicalState,
        TournamentState, ExplainerState, ScattershotState {

    @JsonIgnore
    ConversationMode mode();

    @JsonIgnore
    String phaseName();
}
