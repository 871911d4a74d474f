package com.autodialer.engine.exception;

public class PhoneNumberNotFoundException extends AutodialerException {
    public PhoneNumberNotFoundException(String phoneNumber) {
        super("Phone number " + phoneNumber + " not found");
    }
}
