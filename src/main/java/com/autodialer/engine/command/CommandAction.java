package com.autodialer.engine.command;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 命令解析结果，只在单次请求内存在，不落盘。
 */
@Data
@NoArgsConstructor
public class CommandAction {

    private ActionType type;
    /** CALL_ONE 时一个元素，CALL_NUMBERS 时多个；为候选号码，尚未规范化 */
    private List<String> phoneNumbers = List.of();
    private String rawText;
    /** oracle / heuristic */
    private String parsedBy;

    public static CommandAction callAll() {
        CommandAction a = new CommandAction();
        a.setType(ActionType.CALL_ALL);
        return a;
    }

    public static CommandAction callOne(String phoneNumber) {
        CommandAction a = new CommandAction();
        a.setType(ActionType.CALL_ONE);
        a.setPhoneNumbers(List.of(phoneNumber));
        return a;
    }

    public static CommandAction callNumbers(List<String> phoneNumbers) {
        if (phoneNumbers.size() == 1) {
            return callOne(phoneNumbers.get(0));
        }
        CommandAction a = new CommandAction();
        a.setType(ActionType.CALL_NUMBERS);
        a.setPhoneNumbers(List.copyOf(phoneNumbers));
        return a;
    }

    public static CommandAction unrecognized(String rawText) {
        CommandAction a = new CommandAction();
        a.setType(ActionType.UNRECOGNIZED);
        a.setRawText(rawText);
        return a;
    }

    public String describe() {
        return switch (type) {
            case CALL_ALL -> "call_all";
            case CALL_ONE -> "call_number:" + phoneNumbers.get(0);
            case CALL_NUMBERS -> "call_number:" + String.join(",", phoneNumbers);
            case UNRECOGNIZED -> "unrecognized";
        };
    }
}
