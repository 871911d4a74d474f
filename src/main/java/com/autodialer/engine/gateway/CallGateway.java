package com.autodialer.engine.gateway;

import com.autodialer.engine.model.CallOutcome;

/**
 * 真正去“打电话”的组件，真实网关或模拟网关。
 * 实现应尽量把错误转换成 failed 结果返回，而不是抛出；
 * 超时由实现自己负责，不能无限阻塞。
 */
public interface CallGateway {

    /** 日志和接口返回里显示的网关名称 */
    String name();

    CallOutcome placeCall(String phoneNumber);
}
