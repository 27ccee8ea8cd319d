package com.bko.ensemble.orchestration.model;

public enum HistoryMode {
    ALL,
    SAME_MODEL
}
