package com.autodialer.engine.exception;

import lombok.Getter;

/**
 * 号码规范化失败（去掉非数字字符后不足 10 位）。
 */
@Getter
public class InvalidPhoneNumberException extends AutodialerException {
    private final String rawInput;

    public InvalidPhoneNumberException(String rawInput) {
        super("Invalid phone number: '" + rawInput + "' (at least 10 digits required)");
        this.rawInput = rawInput;
    }
}
