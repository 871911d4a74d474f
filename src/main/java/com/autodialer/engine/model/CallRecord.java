package com.autodialer.engine.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * 呼叫日志里的一条记录。不可变，重试会产生新记录。
 */
@Value
@Builder
@Jacksonized
public class CallRecord {
    String callId;
    String phoneNumber;
    CallStatus status;
    Double duration;
    Instant timestamp;
    String errorMessage;
    String message;
    String providerSid;
}
