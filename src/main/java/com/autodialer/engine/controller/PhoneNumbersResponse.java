package com.autodialer.engine.controller;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PhoneNumbersResponse {
    private int total;
    private List<String> phoneNumbers;
}
