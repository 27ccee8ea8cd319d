package com.bko.ensemble.orchestration.support;

/**
 * One statement made by one instance in one round.
 */
public interface TranscriptEntry {

    String instanceId();

    /** Display name of the speaking instance. */
    String model();

    String content();

    int round();
}
