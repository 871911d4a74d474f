package com.autodialer.engine.gateway;

import com.autodialer.engine.config.AutodialerProperties;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CallGatewaySelectorTest {

    private final AutodialerProperties properties = new AutodialerProperties();
    private final SimulatedCallGateway simulated = new SimulatedCallGateway(new Random(1), properties.getSimulation());
    private final CallGatewaySelector selector =
            new CallGatewaySelector(properties, mock(TelephonyClient.class), simulated);

    @Test
    void noCredentialsSelectsSimulation() {
        assertThat(selector.select()).isSameAs(simulated);
    }

    @Test
    void completeCredentialsSelectTwilio() {
        configure("AC0123456789abcdef0123456789abcdef", "token", "+15005550006");

        CallGateway gateway = selector.select();

        assertThat(gateway).isInstanceOf(TwilioCallGateway.class);
        assertThat(gateway.name()).isEqualTo("twilio");
    }

    @Test
    void partialCredentialsFallBackToSimulation() {
        configure("AC0123456789abcdef0123456789abcdef", "token", null);

        assertThat(selector.select()).isSameAs(simulated);
    }

    @Test
    void malformedCredentialsFallBackToSimulation() {
        configure("not-a-sid", "token", "+15005550006");
        assertThat(selector.select()).isSameAs(simulated);

        configure("AC0123456789abcdef0123456789abcdef", "token", "555");
        assertThat(selector.select()).isSameAs(simulated);
    }

    @Test
    void problemsNameEachMissingItem() {
        assertThat(new TwilioCredentials(null, " ", "12").problems())
                .containsExactly("account SID missing", "auth token missing", "from number malformed");
    }

    private void configure(String sid, String token, String from) {
        properties.getTwilio().setAccountSid(sid);
        properties.getTwilio().setAuthToken(token);
        properties.getTwilio().setFromNumber(from);
    }
}
