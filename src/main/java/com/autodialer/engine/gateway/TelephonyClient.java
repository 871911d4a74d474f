package com.autodialer.engine.gateway;

import com.autodialer.engine.exception.GatewayTransportException;

/**
 * 外部电话服务的最小契约。任何传输层错误都以 {@link GatewayTransportException} 抛出。
 */
public interface TelephonyClient {

    TelephonyCall createCall(String to, TwilioCredentials credentials);

    TelephonyCall fetchCall(String sid, TwilioCredentials credentials);
}
