package com.autodialer.engine.gateway;

import com.autodialer.engine.exception.GatewayTransportException;
import com.autodialer.engine.model.CallOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;

/**
 * 真实网关：通过 {@link TelephonyClient} 发起呼叫，把服务商状态映射成
 * queued / answered / failed。传输错误一律变成 failed，错误信息放进 errorMessage。
 */
@Slf4j
public class TwilioCallGateway implements CallGateway {

    private final TelephonyClient client;
    private final TwilioCredentials credentials;
    private final Duration statusPollDelay;

    public TwilioCallGateway(TelephonyClient client, TwilioCredentials credentials, Duration statusPollDelay) {
        this.client = client;
        this.credentials = credentials;
        this.statusPollDelay = statusPollDelay;
    }

    @Override
    public String name() {
        return "twilio";
    }

    @Override
    public CallOutcome placeCall(String phoneNumber) {
        long start = System.nanoTime();
        try {
            TelephonyCall call = client.createCall(phoneNumber, credentials);
            log.info("Twilio call {} created for {} with status {}", call.getSid(), phoneNumber, call.getStatus());

            // 创建后稍等片刻再读一次状态
            if (!statusPollDelay.isZero() && !statusPollDelay.isNegative()) {
                Thread.sleep(statusPollDelay.toMillis());
                call = client.fetchCall(call.getSid(), credentials);
            }

            double elapsed = (System.nanoTime() - start) / 1_000_000_000d;
            CallOutcome outcome = map(call, elapsed);
            outcome.setProviderSid(call.getSid());
            return outcome;
        } catch (GatewayTransportException e) {
            log.warn("Twilio call to {} failed: {}", phoneNumber, e.getMessage());
            return CallOutcome.failed(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallOutcome.failed("Call interrupted");
        }
    }

    static CallOutcome map(TelephonyCall call, double elapsedSeconds) {
        String status = call.getStatus() == null ? "" : call.getStatus().toLowerCase(Locale.ROOT);
        return switch (status) {
            case "queued", "ringing", "in-progress" ->
                    CallOutcome.queued("Call " + call.getSid() + " is " + status);
            case "completed" ->
                    CallOutcome.answered(parseDuration(call.getDuration(), elapsedSeconds),
                            "Call " + call.getSid() + " completed successfully");
            default -> CallOutcome.failed("Call " + call.getSid() + " status: " + status);
        };
    }

    private static double parseDuration(String raw, double fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double parsed = Double.parseDouble(raw.strip());
            return Double.isFinite(parsed) ? parsed : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
