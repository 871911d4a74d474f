package com.autodialer.engine.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 服务商 Calls 资源里我们关心的字段。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelephonyCall {
    private String sid;
    private String status;     // queued / ringing / in-progress / completed / busy / failed / no-answer / canceled
    private String duration;   // 服务商返回的是字符串秒数，未结束时为 null
}
