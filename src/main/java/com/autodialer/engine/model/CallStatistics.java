package com.autodialer.engine.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 从呼叫日志实时计算出的统计，不做缓存。
 * successRate 取值 [0, 1]，total 为 0 时为 0。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CallStatistics {
    private long totalCalls;
    private long answered;
    private long failed;
    private long queued;
    private double successRate;
}
