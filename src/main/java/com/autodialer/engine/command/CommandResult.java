package com.autodialer.engine.command;

import com.autodialer.engine.model.CallRecord;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CommandResult {
    private boolean success;
    private String message;
    private String action;        // call_all / call_number:... / unrecognized
    private String parsedBy;      // oracle / heuristic
    private int callsMade;
    private List<CallRecord> results = new ArrayList<>();
    private List<String> invalidNumbers = new ArrayList<>();
}
