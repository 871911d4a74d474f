package com.autodialer.engine.registry;

import com.autodialer.engine.exception.InvalidPhoneNumberException;

import java.util.Optional;

/**
 * 号码规范化：只保留数字，开头的 '+' 保留，至少 10 位数字。
 * 规范化结果同时也是登记表里判重、查找用的 key。
 */
public final class PhoneNumberNormalizer {

    public static final int MIN_DIGITS = 10;

    private PhoneNumberNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            throw new InvalidPhoneNumberException("null");
        }
        String trimmed = raw.strip();
        StringBuilder digits = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        if (digits.length() < MIN_DIGITS) {
            throw new InvalidPhoneNumberException(raw);
        }
        return trimmed.startsWith("+") ? "+" + digits : digits.toString();
    }

    public static Optional<String> tryNormalize(String raw) {
        try {
            return Optional.of(normalize(raw));
        } catch (InvalidPhoneNumberException e) {
            return Optional.empty();
        }
    }

    public static boolean isValid(String raw) {
        return tryNormalize(raw).isPresent();
    }
}
