package com.autodialer.engine.command;

/**
 * 发给语言模型的固定指令模板，约定了三种回复格式。
 */
final class CommandSchema {

    static final String INSTRUCTIONS =
            "You control an autodialer. Classify the user's command and reply with exactly one line:\n" +
            "- call_all  when the user wants to call every uploaded number " +
            "(e.g. \"Call all uploaded numbers\", \"Call all numbers\")\n" +
            "- call_number:<digits>  when the user names one number " +
            "(e.g. \"Call the number 9876543210\" -> call_number:9876543210)\n" +
            "- call_number:<d1>,<d2>  when the user names several numbers " +
            "(e.g. \"Call 1234567890 and 0987654321\" -> call_number:1234567890,0987654321)\n" +
            "- unknown  for anything else\n" +
            "Keep a leading + on a number if the user gave one. Do not add any other text.\n";

    private CommandSchema() {
    }
}
