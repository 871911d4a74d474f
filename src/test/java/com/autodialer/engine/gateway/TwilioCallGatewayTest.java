package com.autodialer.engine.gateway;

import com.autodialer.engine.exception.GatewayTransportException;
import com.autodialer.engine.model.CallOutcome;
import com.autodialer.engine.model.CallStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TwilioCallGatewayTest {

    private static final TwilioCredentials CREDENTIALS = new TwilioCredentials(
            "AC" + "0123456789abcdef0123456789abcdef", "secret", "+15005550006");

    private final TelephonyClient client = mock(TelephonyClient.class);

    @Test
    void queuedProviderStatusMapsToQueued() {
        when(client.createCall(eq("+12345678900"), any())).thenReturn(new TelephonyCall("CA1", "ringing", null));
        TwilioCallGateway gateway = new TwilioCallGateway(client, CREDENTIALS, Duration.ZERO);

        CallOutcome outcome = gateway.placeCall("+12345678900");

        assertThat(outcome.getStatus()).isEqualTo(CallStatus.QUEUED);
        assertThat(outcome.getProviderSid()).isEqualTo("CA1");
        verify(client, never()).fetchCall(any(), any());
    }

    @Test
    void statusIsReReadAfterPollDelay() {
        when(client.createCall(any(), any())).thenReturn(new TelephonyCall("CA2", "queued", null));
        when(client.fetchCall(eq("CA2"), any())).thenReturn(new TelephonyCall("CA2", "completed", "17"));
        TwilioCallGateway gateway = new TwilioCallGateway(client, CREDENTIALS, Duration.ofMillis(1));

        CallOutcome outcome = gateway.placeCall("+12345678900");

        assertThat(outcome.getStatus()).isEqualTo(CallStatus.ANSWERED);
        assertThat(outcome.getDuration()).isEqualTo(17.0);
    }

    @Test
    void otherProviderStatusesMapToFailed() {
        when(client.createCall(any(), any())).thenReturn(new TelephonyCall("CA3", "busy", null));
        TwilioCallGateway gateway = new TwilioCallGateway(client, CREDENTIALS, Duration.ZERO);

        CallOutcome outcome = gateway.placeCall("+12345678900");

        assertThat(outcome.getStatus()).isEqualTo(CallStatus.FAILED);
        assertThat(outcome.getErrorMessage()).contains("busy");
    }

    @Test
    void transportErrorBecomesFailedOutcome() {
        when(client.createCall(any(), any())).thenThrow(new GatewayTransportException("Twilio error: 503 Service Unavailable"));
        TwilioCallGateway gateway = new TwilioCallGateway(client, CREDENTIALS, Duration.ZERO);

        CallOutcome outcome = gateway.placeCall("+12345678900");

        assertThat(outcome.getStatus()).isEqualTo(CallStatus.FAILED);
        assertThat(outcome.getErrorMessage()).isEqualTo("Twilio error: 503 Service Unavailable");
    }

    @Test
    void answeredWithoutProviderDurationFallsBackToElapsed() {
        CallOutcome outcome = TwilioCallGateway.map(new TelephonyCall("CA4", "completed", null), 2.5);

        assertThat(outcome.getDuration()).isEqualTo(2.5);
    }

    @ParameterizedTest
    @ValueSource(strings = {"NaN", "Infinity", "-Infinity", "abc"})
    void nonFiniteProviderDurationFallsBackToElapsed(String raw) {
        CallOutcome outcome = TwilioCallGateway.map(new TelephonyCall("CA5", "completed", raw), 4.0);

        assertThat(outcome.getStatus()).isEqualTo(CallStatus.ANSWERED);
        assertThat(outcome.getDuration()).isEqualTo(4.0);
    }
}
