package com.autodialer.engine.exception;

/**
 * 开启 require-registered 时，单呼的号码不在登记表里。
 */
public class NumberNotRegisteredException extends AutodialerException {
    public NumberNotRegisteredException(String phoneNumber) {
        super("Phone number " + phoneNumber + " is not registered");
    }
}
