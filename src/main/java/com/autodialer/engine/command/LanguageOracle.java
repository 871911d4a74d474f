package com.autodialer.engine.command;

import com.autodialer.engine.exception.OracleUnavailableException;

/**
 * 外部语言理解服务。输入原始命令和指令模板，返回模型的原始回复文本。
 */
public interface LanguageOracle {

    /**
     * @param apiKeyOverride 单次请求带来的 key，为空时使用预先配置的 key
     * @throws OracleUnavailableException 没有可用 key 或服务调用失败
     */
    String interpret(String rawText, String schema, String apiKeyOverride);
}
