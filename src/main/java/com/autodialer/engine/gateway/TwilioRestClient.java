package com.autodialer.engine.gateway;

import com.autodialer.engine.exception.GatewayTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 基于 Twilio REST API 的电话客户端。超时在 RestClient 的 request factory 上配置。
 */
@Slf4j
public class TwilioRestClient implements TelephonyClient {

    private static final String CALLS_PATH = "/2010-04-01/Accounts/{accountSid}/Calls.json";
    private static final String CALL_PATH = "/2010-04-01/Accounts/{accountSid}/Calls/{callSid}.json";

    private final RestClient restClient;
    private final String twimlUrl;

    public TwilioRestClient(RestClient restClient, String twimlUrl) {
        this.restClient = restClient;
        this.twimlUrl = twimlUrl;
    }

    @Override
    public TelephonyCall createCall(String to, TwilioCredentials credentials) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("To", to);
        form.add("From", credentials.getFromNumber());
        form.add("Url", twimlUrl);

        try {
            TelephonyCall call = restClient.post()
                    .uri(CALLS_PATH, credentials.getAccountSid())
                    .headers(h -> h.setBasicAuth(credentials.getAccountSid(), credentials.getAuthToken()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(TelephonyCall.class);
            return requireBody(call, "create call");
        } catch (RestClientException e) {
            throw new GatewayTransportException("Twilio error: " + e.getMessage(), e);
        }
    }

    @Override
    public TelephonyCall fetchCall(String sid, TwilioCredentials credentials) {
        try {
            TelephonyCall call = restClient.get()
                    .uri(CALL_PATH, credentials.getAccountSid(), sid)
                    .headers(h -> h.setBasicAuth(credentials.getAccountSid(), credentials.getAuthToken()))
                    .retrieve()
                    .body(TelephonyCall.class);
            return requireBody(call, "fetch call " + sid);
        } catch (RestClientException e) {
            throw new GatewayTransportException("Twilio error: " + e.getMessage(), e);
        }
    }

    private TelephonyCall requireBody(TelephonyCall call, String operation) {
        if (call == null || call.getSid() == null) {
            throw new GatewayTransportException("Twilio returned an empty response to " + operation);
        }
        return call;
    }
}
