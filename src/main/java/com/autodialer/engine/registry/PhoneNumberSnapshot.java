package com.autodialer.engine.registry;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** 号码登记表落盘的结构：{"phoneNumbers": [...]}，保持插入顺序。 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PhoneNumberSnapshot {
    private List<String> phoneNumbers = new ArrayList<>();
}
