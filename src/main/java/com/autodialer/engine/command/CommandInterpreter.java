package com.autodialer.engine.command;

import com.autodialer.engine.dispatch.BatchResult;
import com.autodialer.engine.dispatch.CallDispatcher;
import com.autodialer.engine.exception.InvalidPhoneNumberException;
import com.autodialer.engine.exception.NoPhoneNumbersException;
import com.autodialer.engine.exception.NumberNotRegisteredException;
import com.autodialer.engine.exception.OracleUnavailableException;
import com.autodialer.engine.model.CallRecord;
import com.autodialer.engine.registry.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 自然语言命令：解析 -> 分类 -> 交给 {@link CallDispatcher}。
 * 这里只做翻译，从不直接接触网关。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandInterpreter {

    private final LanguageOracle oracle;
    private final CallDispatcher dispatcher;

    /**
     * 解析阶段。语言模型不可用时退回到 {@link HeuristicCommandParser}。
     */
    public CommandAction interpret(String command, String apiKeyOverride) {
        if (command == null || command.isBlank()) {
            CommandAction empty = CommandAction.unrecognized(command);
            empty.setParsedBy("heuristic");
            return empty;
        }
        CommandAction action;
        try {
            String reply = oracle.interpret(command, CommandSchema.INSTRUCTIONS, apiKeyOverride);
            action = OracleReplyParser.parse(reply, command);
            action.setParsedBy("oracle");
        } catch (OracleUnavailableException e) {
            log.warn("Language oracle unavailable ({}), using heuristic parsing", e.getMessage());
            action = HeuristicCommandParser.parse(command);
            action.setParsedBy("heuristic");
        }
        log.info("Parsed command intent: '{}' -> {} ({})", command, action.describe(), action.getParsedBy());
        return action;
    }

    public CommandResult execute(String command, String apiKeyOverride) {
        CommandAction action = interpret(command, apiKeyOverride);

        CommandResult result = new CommandResult();
        result.setAction(action.describe());
        result.setParsedBy(action.getParsedBy());

        switch (action.getType()) {
            case UNRECOGNIZED -> fail(result, "Could not understand the command: '" + command
                    + "'. Try \"Call all uploaded numbers\" or \"Call the number 9876543210\".");
            case CALL_ALL -> executeCallAll(result);
            case CALL_ONE -> executeCallOne(action.getPhoneNumbers().get(0), result);
            case CALL_NUMBERS -> executeCallNumbers(action.getPhoneNumbers(), result);
        }
        return result;
    }

    private void executeCallAll(CommandResult result) {
        try {
            BatchResult batch = dispatcher.callAll();
            succeed(result, batch.getResults(), "Called " + batch.getCallsMade() + " numbers");
        } catch (NoPhoneNumbersException e) {
            fail(result, e.getMessage());
        }
    }

    private void executeCallOne(String candidate, CommandResult result) {
        Optional<String> number = PhoneNumberNormalizer.tryNormalize(candidate);
        if (number.isEmpty()) {
            result.getInvalidNumbers().add(candidate);
            fail(result, new InvalidPhoneNumberException(candidate).getMessage());
            return;
        }
        try {
            CallRecord record = dispatcher.callOne(number.get());
            succeed(result, List.of(record), "Called 1 number(s)");
        } catch (NumberNotRegisteredException e) {
            fail(result, e.getMessage());
        }
    }

    private void executeCallNumbers(List<String> candidates, CommandResult result) {
        List<String> valid = new ArrayList<>();
        for (String c : candidates) {
            PhoneNumberNormalizer.tryNormalize(c).ifPresentOrElse(valid::add, () -> result.getInvalidNumbers().add(c));
        }
        if (valid.isEmpty()) {
            fail(result, "No valid phone numbers in command: " + String.join(", ", result.getInvalidNumbers()));
            return;
        }
        try {
            BatchResult batch = dispatcher.callNumbers(valid);
            succeed(result, batch.getResults(), "Called " + batch.getCallsMade() + " number(s)");
        } catch (NumberNotRegisteredException e) {
            fail(result, e.getMessage());
        }
    }

    private static void succeed(CommandResult result, List<CallRecord> records, String message) {
        result.setSuccess(true);
        result.setMessage(message);
        result.setCallsMade(records.size());
        result.setResults(new ArrayList<>(records));
    }

    private static void fail(CommandResult result, String message) {
        result.setSuccess(false);
        result.setMessage(message);
        result.setCallsMade(0);
    }
}
