package com.autodialer.engine.controller;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RemoveNumberResponse {
    private boolean success;
    private String message;
    private int remaining;
    private int purgedCalls;
}
