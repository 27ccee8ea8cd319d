package com.bko.ensemble.orchestration.model;

public record InputItem(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static InputItem system(String content) {
        return new InputItem(SYSTEM, content);
    }

    public static InputItem user(String content) {
        return new InputItem(USER, content);
    }

    public static InputItem assistant(String content) {
        return new InputItem(ASSISTANT, content);
    }
}
