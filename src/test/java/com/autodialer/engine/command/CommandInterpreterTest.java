package com.autodialer.engine.command;

import com.autodialer.engine.TestFixtures;
import com.autodialer.engine.calllog.CallLog;
import com.autodialer.engine.config.AutodialerProperties;
import com.autodialer.engine.dispatch.CallDispatcher;
import com.autodialer.engine.exception.OracleUnavailableException;
import com.autodialer.engine.gateway.CallGatewaySelector;
import com.autodialer.engine.gateway.SimulatedCallGateway;
import com.autodialer.engine.gateway.TelephonyClient;
import com.autodialer.engine.model.CallRecord;
import com.autodialer.engine.registry.PhoneRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CommandInterpreterTest {

    @TempDir
    Path dir;

    private PhoneRegistry registry;
    private CallLog callLog;
    private CallDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        AutodialerProperties properties = TestFixtures.properties(dir);
        registry = TestFixtures.registry(dir);
        callLog = TestFixtures.callLog(dir);
        SimulatedCallGateway simulated = new SimulatedCallGateway(new Random(3), properties.getSimulation());
        CallGatewaySelector selector = new CallGatewaySelector(properties, mock(TelephonyClient.class), simulated);
        dispatcher = new CallDispatcher(registry, callLog, selector, properties);
    }

    private CommandInterpreter withReply(String reply) {
        return new CommandInterpreter((text, schema, key) -> reply, dispatcher);
    }

    private CommandInterpreter withUnavailableOracle() {
        return new CommandInterpreter((text, schema, key) -> {
            throw new OracleUnavailableException("GEMINI_API_KEY not set or not provided");
        }, dispatcher);
    }

    @Test
    void oracleCallAllRunsBatch() {
        registry.addAll(List.of("+12345678900", "19998887777"));

        CommandResult result = withReply("call_all").execute("Call all uploaded numbers", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAction()).isEqualTo("call_all");
        assertThat(result.getParsedBy()).isEqualTo("oracle");
        assertThat(result.getCallsMade()).isEqualTo(2);
        assertThat(callLog.stats().getTotalCalls()).isEqualTo(2);
    }

    @Test
    void oracleSingleNumberCallsIt() {
        CommandResult result = withReply("call_number:9876543210").execute("Call the number 9876543210", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResults()).extracting(CallRecord::getPhoneNumber).containsExactly("9876543210");
    }

    @Test
    void unrecognizedCommandHasNoSideEffect() {
        registry.add("19998887777");

        CommandResult result = withReply("unknown").execute("florp the wibble", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAction()).isEqualTo("unrecognized");
        assertThat(result.getMessage()).contains("Could not understand");
        assertThat(callLog.size()).isZero();
    }

    @Test
    void invalidNumberIsValidationErrorNotReparse() {
        AtomicReference<Integer> oracleCalls = new AtomicReference<>(0);
        CommandInterpreter interpreter = new CommandInterpreter((text, schema, key) -> {
            oracleCalls.set(oracleCalls.get() + 1);
            return "call_number:12345";
        }, dispatcher);

        CommandResult result = interpreter.execute("Call 12345", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("Invalid phone number");
        assertThat(result.getInvalidNumbers()).containsExactly("12345");
        assertThat(oracleCalls.get()).isEqualTo(1);
        assertThat(callLog.size()).isZero();
    }

    @Test
    void severalNumbersCallValidOnesAndReportInvalid() {
        CommandResult result = withReply("call_number:1234567890,555,0987654321")
                .execute("Call 1234567890, 555 and 0987654321", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCallsMade()).isEqualTo(2);
        assertThat(result.getInvalidNumbers()).containsExactly("555");
    }

    @Test
    void unavailableOracleFallsBackToHeuristic() {
        registry.add("19998887777");
        CommandInterpreter interpreter = withUnavailableOracle();

        CommandAction all = interpreter.interpret("Call all uploaded numbers", null);
        assertThat(all.getType()).isEqualTo(ActionType.CALL_ALL);
        assertThat(all.getParsedBy()).isEqualTo("heuristic");

        CommandAction one = interpreter.interpret("Call the number 9876543210", null);
        assertThat(one.getType()).isEqualTo(ActionType.CALL_ONE);
        assertThat(one.getPhoneNumbers()).containsExactly("9876543210");

        CommandResult nonsense = interpreter.execute("purple monkey dishwasher", null);
        assertThat(nonsense.isSuccess()).isFalse();
        assertThat(callLog.size()).isZero();
    }

    @Test
    void callAllWithEmptyRegistryReportsMessage() {
        CommandResult result = withReply("call_all").execute("Call all numbers", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("No phone numbers uploaded");
        assertThat(result.getCallsMade()).isZero();
    }

    @Test
    void apiKeyOverrideIsPassedToOracle() {
        AtomicReference<String> seenKey = new AtomicReference<>();
        CommandInterpreter interpreter = new CommandInterpreter((text, schema, key) -> {
            seenKey.set(key);
            assertThat(schema).contains("call_number:");
            return "unknown";
        }, dispatcher);

        interpreter.interpret("Call all", "request-key");

        assertThat(seenKey.get()).isEqualTo("request-key");
    }

    @Test
    void fallbackIgnoresWordsThatOnlyStartLikeVerbs() {
        registry.addAll(List.of("+12345678900", "19998887777"));

        CommandResult result = withUnavailableOracle().execute("Open the dialog box", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCallsMade()).isZero();
        assertThat(callLog.size()).isZero();
    }
}
