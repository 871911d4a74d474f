package com.autodialer.engine.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量上传号码的结果：added / invalid / duplicates 三个桶。
 */
@Data
public class BulkAddResult {
    private int added;
    private int invalid;
    private int duplicates;
    private int total;
    private List<String> addedNumbers = new ArrayList<>();
    private List<String> invalidNumbers = new ArrayList<>();
    private List<String> duplicateNumbers = new ArrayList<>();

    public void record(AddOutcome outcome, String raw, String normalized) {
        switch (outcome) {
            case ADDED -> {
                added++;
                addedNumbers.add(normalized);
            }
            case INVALID -> {
                invalid++;
                invalidNumbers.add(raw);
            }
            case DUPLICATE -> {
                duplicates++;
                duplicateNumbers.add(raw);
            }
        }
    }
}
