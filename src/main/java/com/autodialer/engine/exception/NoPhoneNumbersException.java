package com.autodialer.engine.exception;

public class NoPhoneNumbersException extends AutodialerException {
    public NoPhoneNumbersException() {
        super("No phone numbers uploaded");
    }
}
