package com.autodialer.engine.exception;

/**
 * 电话服务商不可达或返回错误。只在网关内部流转，最终都会变成 failed 记录。
 */
public class GatewayTransportException extends AutodialerException {
    public GatewayTransportException(String message) {
        super(message);
    }

    public GatewayTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
