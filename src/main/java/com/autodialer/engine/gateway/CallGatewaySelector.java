package com.autodialer.engine.gateway;

import com.autodialer.engine.config.AutodialerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 每个批次选择一次网关，保证同一批次内所有号码走同一种网关。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallGatewaySelector {

    private final AutodialerProperties properties;
    private final TelephonyClient telephonyClient;
    private final SimulatedCallGateway simulatedGateway;

    public CallGateway select() {
        AutodialerProperties.Twilio twilio = properties.getTwilio();
        TwilioCredentials credentials = new TwilioCredentials(
                twilio.getAccountSid(), twilio.getAuthToken(), twilio.getFromNumber());

        if (credentials.isEmpty()) {
            log.debug("Twilio credentials not configured - using simulated gateway");
            return simulatedGateway;
        }
        List<String> problems = credentials.problems();
        if (!problems.isEmpty()) {
            log.warn("Twilio credentials unusable ({}) - using simulated gateway", String.join(", ", problems));
            return simulatedGateway;
        }
        return new TwilioCallGateway(telephonyClient, credentials, twilio.getStatusPollDelay());
    }
}
