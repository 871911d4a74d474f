package com.autodialer.engine.command;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语言模型不可用时的确定性解析规则：
 * <ul>
 *   <li>没有 call / dial / ring 的动词形式 -> 无法识别（dialog、ringtone 这类词不算）</li>
 *   <li>有动词且出现 "all" -> call_all</li>
 *   <li>有动词且能找到数字串 -> 第一个数字串作为候选号码</li>
 *   <li>有动词但没有数字 -> call_all</li>
 * </ul>
 * 数字串允许中间夹空格、括号、横线和点，开头的 '+' 保留。
 */
public final class HeuristicCommandParser {

    private static final Pattern VERB = Pattern.compile(
            "\\b(call|calls|called|calling|dial|dials|dialed|dialled|dialing|dialling|ring|rings|ringing)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL = Pattern.compile("\\ball\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGIT_RUN = Pattern.compile("\\+?\\d(?:[\\d().\\-]|\\s(?=[\\d(]))*");

    private HeuristicCommandParser() {
    }

    public static CommandAction parse(String command) {
        if (command == null || !VERB.matcher(command).find()) {
            return CommandAction.unrecognized(command);
        }
        if (ALL.matcher(command).find()) {
            return CommandAction.callAll();
        }
        Matcher m = DIGIT_RUN.matcher(command);
        if (m.find()) {
            return CommandAction.callOne(stripFormatting(m.group()));
        }
        return CommandAction.callAll();
    }

    private static String stripFormatting(String run) {
        StringBuilder sb = new StringBuilder(run.length());
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            if (Character.isDigit(c) || (c == '+' && i == 0)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
