package com.autodialer.engine.controller;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CommandRequest {
    @NotBlank(message = "command is required")
    private String command;
    /** 可选，单次请求使用的 Gemini key */
    private String apiKey;
}
