package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.ModeResult;

import java.util.List;

@FunctionalInterface
public interface ModeFallback {

    ModeFallback NONE = userContent -> List.of();

    List<ModeResult> respond(String userContent);
}
