package com.autodialer.engine.config;

import com.autodialer.engine.command.GeminiLanguageOracle;
import com.autodialer.engine.command.LanguageOracle;
import com.autodialer.engine.gateway.SimulatedCallGateway;
import com.autodialer.engine.gateway.TelephonyClient;
import com.autodialer.engine.gateway.TwilioRestClient;
import com.autodialer.engine.model.CallRecord;
import com.autodialer.engine.registry.PhoneNumberSnapshot;
import com.autodialer.engine.store.JsonFileStore;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@Configuration
public class AutodialerConfig {

    @Bean
    public JsonFileStore<PhoneNumberSnapshot> phoneNumberStore(AutodialerProperties properties) {
        return new JsonFileStore<>(
                Path.of(properties.getStorage().getPhoneNumbersFile()),
                new TypeReference<PhoneNumberSnapshot>() {},
                PhoneNumberSnapshot::new);
    }

    @Bean
    public JsonFileStore<List<CallRecord>> callLogStore(AutodialerProperties properties) {
        return new JsonFileStore<>(
                Path.of(properties.getStorage().getCallLogFile()),
                new TypeReference<List<CallRecord>>() {},
                ArrayList::new);
    }

    @Bean
    public SimulatedCallGateway simulatedCallGateway(AutodialerProperties properties) {
        return new SimulatedCallGateway(new Random(), properties.getSimulation());
    }

    @Bean
    public TelephonyClient telephonyClient(AutodialerProperties properties, RestClient.Builder builder) {
        AutodialerProperties.Twilio twilio = properties.getTwilio();
        RestClient restClient = builder.clone()
                .baseUrl(twilio.getBaseUrl())
                .requestFactory(requestFactory(twilio.getConnectTimeout(), twilio.getReadTimeout()))
                .build();
        return new TwilioRestClient(restClient, twilio.getTwimlUrl());
    }

    @Bean
    public LanguageOracle languageOracle(AutodialerProperties properties, RestClient.Builder builder) {
        AutodialerProperties.Gemini gemini = properties.getGemini();
        RestClient restClient = builder.clone()
                .baseUrl(gemini.getBaseUrl())
                .requestFactory(requestFactory(gemini.getTimeout(), gemini.getTimeout()))
                .build();
        return new GeminiLanguageOracle(restClient, gemini.getModel(), gemini.getApiKey());
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }
}
