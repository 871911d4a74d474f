package com.autodialer.engine.gateway;

import com.autodialer.engine.registry.PhoneNumberNormalizer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 电话服务商凭据：账号 SID、auth token、主叫号码，三者缺一不可。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TwilioCredentials {

    private static final Pattern ACCOUNT_SID_PATTERN = Pattern.compile("^AC[0-9a-fA-F]{32}$");

    private String accountSid;
    @ToString.Exclude
    private String authToken;
    private String fromNumber;

    /**
     * @return 不可用的原因；为空表示凭据齐全且格式正确
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (isBlank(accountSid)) {
            problems.add("account SID missing");
        } else if (!ACCOUNT_SID_PATTERN.matcher(accountSid.strip()).matches()) {
            problems.add("account SID malformed");
        }
        if (isBlank(authToken)) {
            problems.add("auth token missing");
        }
        if (isBlank(fromNumber)) {
            problems.add("from number missing");
        } else if (!PhoneNumberNormalizer.isValid(fromNumber)) {
            problems.add("from number malformed");
        }
        return problems;
    }

    public boolean isUsable() {
        return problems().isEmpty();
    }

    public boolean isEmpty() {
        return isBlank(accountSid) && isBlank(authToken) && isBlank(fromNumber);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
