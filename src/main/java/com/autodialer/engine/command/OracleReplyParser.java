package com.autodialer.engine.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把语言模型的回复解析成 {@link CommandAction}。
 * 模型偶尔会包一层代码块或引号，这里宽松处理；解析不出来的一律视为无法识别。
 * 号码列表只取标记所在的那一行。
 */
final class OracleReplyParser {

    private static final Pattern CALL_ALL = Pattern.compile("\\bcall_all\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALL_NUMBER = Pattern.compile(
            "\\bcall_numbers?[ \\t]*:[ \\t]*([+\\d][\\d \\t,+()\\-.]*)", Pattern.CASE_INSENSITIVE);

    private OracleReplyParser() {
    }

    static CommandAction parse(String reply, String rawCommand) {
        if (reply == null || reply.isBlank()) {
            return CommandAction.unrecognized(rawCommand);
        }
        String text = reply.strip().toLowerCase(Locale.ROOT);

        Matcher m = CALL_NUMBER.matcher(text);
        if (m.find()) {
            List<String> numbers = new ArrayList<>();
            for (String part : m.group(1).split(",")) {
                String candidate = keepDialable(part);
                if (!candidate.isEmpty() && !candidate.equals("+")) {
                    numbers.add(candidate);
                }
            }
            if (!numbers.isEmpty()) {
                return CommandAction.callNumbers(numbers);
            }
        }
        if (CALL_ALL.matcher(text).find()) {
            return CommandAction.callAll();
        }
        return CommandAction.unrecognized(rawCommand);
    }

    private static String keepDialable(String s) {
        String trimmed = s.strip();
        StringBuilder sb = new StringBuilder();
        if (trimmed.startsWith("+")) {
            sb.append('+');
        }
        for (char c : trimmed.toCharArray()) {
            if (Character.isDigit(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
