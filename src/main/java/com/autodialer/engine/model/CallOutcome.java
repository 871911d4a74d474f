package com.autodialer.engine.model;

import lombok.Data;

/**
 * 网关返回的单次呼叫结果，还没有 callId / 时间戳，由 Dispatcher 包装成 {@link CallRecord}。
 */
@Data
public class CallOutcome {
    private CallStatus status;
    private Double duration;       // 仅 answered 时有值，秒
    private String errorMessage;   // 仅 failed 时有值
    private String message;        // 给人看的描述
    private String providerSid;    // 真实网关创建的呼叫 SID

    public static CallOutcome answered(double duration, String message) {
        CallOutcome o = new CallOutcome();
        o.setStatus(CallStatus.ANSWERED);
        o.setDuration(Math.max(0d, duration));
        o.setMessage(message);
        return o;
    }

    public static CallOutcome queued(String message) {
        CallOutcome o = new CallOutcome();
        o.setStatus(CallStatus.QUEUED);
        o.setMessage(message);
        return o;
    }

    public static CallOutcome failed(String errorMessage) {
        CallOutcome o = new CallOutcome();
        o.setStatus(CallStatus.FAILED);
        o.setErrorMessage(errorMessage);
        o.setMessage("Call failed: " + errorMessage);
        return o;
    }
}
