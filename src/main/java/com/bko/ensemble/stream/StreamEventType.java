package com.bko.ensemble.stream;

public final class StreamEventType {

    public static final String STREAM_INIT = "stream-init";
    public static final String MODE_STATE = "mode-state";
    public static final String INSTANCE_OUTPUT = "instance-output";
    public static final String RESULT = "result";
    public static final String STATUS = "status";
    public static final String ERROR = "error";
    public static final String RUN_COMPLETE = "run-complete";
    public static final String RUN_CANCEL = "run-cancel";

    private StreamEventType() {
    }

    static boolean isTerminal(String type) {
        return RUN_CANCEL.equals(type) || RUN_COMPLETE.equals(type) || ERROR.equals(type);
    }
}
