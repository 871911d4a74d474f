package com.autodialer.engine.exception;

/**
 * 存储读写失败。当前请求失败，进程不退出。
 */
public class PersistenceException extends AutodialerException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
