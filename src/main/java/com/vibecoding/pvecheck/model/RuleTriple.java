package com.vibecoding.pvecheck.model;

import com.vibecoding.pvecheck.exception.ProbeConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.regex.Pattern;

/**
 * pattern^field^value 형식의 규칙
 *
 * override에서는 (패턴, 필드, 숫자 값), warnstr/critstr에서는 (패턴, 짧은 라벨, 긴 메시지)로 쓰인다.
 */
@Data
@AllArgsConstructor
public class RuleTriple {

    private static final Pattern NUMERIC_VALUE = Pattern.compile("^[0-9]*(\\.[0-9]*)?$");
    private static final Pattern HAS_DIGIT = Pattern.compile("[0-9]");

    private final String pattern;
    private final String field;
    private final String value;

    public static RuleTriple parse(String option, String raw) {
        if (raw == null) {
            throw new ProbeConfigurationException("Missing value for --" + option);
        }
        String[] parts = raw.split("\\^", -1);
        if (parts.length != 3) {
            throw new ProbeConfigurationException(
                    "Invalid --" + option + " '" + raw + "': expected pattern^field^value");
        }
        return new RuleTriple(parts[0], parts[1], parts[2]);
    }

    /**
     * override 규칙: 값은 숫자여야 한다. 빈 값은 임계값 해제로 허용하지만 "." 처럼 숫자가 없는 값은 거부.
     */
    public static RuleTriple parseOverride(String raw) {
        RuleTriple triple = parse("override", raw);
        if (triple.getField().isEmpty()) {
            throw new ProbeConfigurationException("Invalid --override '" + raw + "': field name is empty");
        }
        String value = triple.getValue();
        if (!NUMERIC_VALUE.matcher(value).matches()
                || (!value.isEmpty() && !HAS_DIGIT.matcher(value).find())) {
            throw new ProbeConfigurationException(
                    "Invalid --override '" + raw + "': value '" + triple.getValue() + "' is not numeric");
        }
        return triple;
    }
}
