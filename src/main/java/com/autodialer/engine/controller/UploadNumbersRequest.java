package com.autodialer.engine.controller;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class UploadNumbersRequest {
    @NotNull(message = "phoneNumbers is required")
    private List<String> phoneNumbers;
}
