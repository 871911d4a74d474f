package com.autodialer.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "autodialer")
@Data
@Validated
public class AutodialerProperties {

    @Valid
    private Storage storage = new Storage();
    @Valid
    private Twilio twilio = new Twilio();
    @Valid
    private Simulation simulation = new Simulation();
    @Valid
    private Gemini gemini = new Gemini();
    @Valid
    private Dispatch dispatch = new Dispatch();
    @Valid
    private CallLog callLog = new CallLog();

    @Data
    public static class Storage {
        @NotBlank
        private String phoneNumbersFile = "data/phone_numbers.json";
        @NotBlank
        private String callLogFile = "data/call_logs.json";
    }

    /**
     * 三项凭据齐全且格式正确才会走真实网关，否则一律模拟。
     */
    @Data
    public static class Twilio {
        private String accountSid;
        private String authToken;
        private String fromNumber;
        @NotBlank
        private String baseUrl = "https://api.twilio.com";
        @NotBlank
        private String twimlUrl = "http://demo.twilio.com/docs/voice.xml";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration statusPollDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Simulation {
        @NotNull
        private Duration minLatency = Duration.ofSeconds(1);
        @NotNull
        private Duration maxLatency = Duration.ofSeconds(3);
        @PositiveOrZero
        private double minDuration = 5;
        @Positive
        private double maxDuration = 60;
    }

    @Data
    public static class Gemini {
        private String apiKey;
        @NotBlank
        private String model = "gemini-2.5-flash";
        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com";
        @NotNull
        private Duration timeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Dispatch {
        @Min(1)
        private int concurrency = 1;
        private boolean requireRegistered = false;
    }

    @Data
    public static class CallLog {
        @Positive
        private int defaultLimit = 100;
    }
}
