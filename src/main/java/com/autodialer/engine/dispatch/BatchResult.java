package com.autodialer.engine.dispatch;

import com.autodialer.engine.model.CallRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {
    private String gateway;
    private int callsMade;
    private List<CallRecord> results;
}
