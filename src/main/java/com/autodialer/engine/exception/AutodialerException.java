package com.autodialer.engine.exception;

/**
 * 引擎内所有业务异常的基类，message 必须是可以直接给调用方看的文字。
 */
public class AutodialerException extends RuntimeException {
    public AutodialerException(String message) {
        super(message);
    }

    public AutodialerException(String message, Throwable cause) {
        super(message, cause);
    }
}
