package com.autodialer.engine.exception;

/**
 * 语言模型不可用（没有 key、网络错误、返回内容无法读取）。调用方会退回到规则解析。
 */
public class OracleUnavailableException extends AutodialerException {
    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
