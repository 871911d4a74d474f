package com.autodialer.engine.model;

/** 单个号码加入登记表时落入的桶。 */
public enum AddOutcome {
    ADDED,
    DUPLICATE,
    INVALID
}
