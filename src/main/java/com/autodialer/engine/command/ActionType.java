package com.autodialer.engine.command;

public enum ActionType {
    CALL_ALL,
    CALL_ONE,
    CALL_NUMBERS,
    UNRECOGNIZED
}
