package com.vibecoding.pvecheck.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 클러스터 API가 반환한 단일 객체 (node, qemu, lxc, storage, status 레코드)
 *
 * 필드 값은 문자열 또는 숫자(BigDecimal)이며, 없는 필드는 빈 문자열 / 0으로 읽힌다.
 */
public class ResourceObject {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public ResourceObject() {
    }

    public ResourceObject(Map<String, ?> values) {
        values.forEach(this::put);
    }

    public static ResourceObject fromJson(JsonNode node) {
        ResourceObject object = new ResourceObject();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                object.fields.put(entry.getKey(), value.decimalValue());
            } else if (value.isBoolean()) {
                object.fields.put(entry.getKey(), value.booleanValue() ? BigDecimal.ONE : BigDecimal.ZERO);
            } else if (value.isTextual()) {
                object.fields.put(entry.getKey(), value.textValue());
            } else {
                object.fields.put(entry.getKey(), value.toString());
            }
        }
        return object;
    }

    public void put(String key, Object value) {
        if (value == null) {
            fields.remove(key);
        } else if (value instanceof BigDecimal || value instanceof String) {
            fields.put(key, value);
        } else if (value instanceof Number) {
            fields.put(key, new BigDecimal(value.toString()));
        } else {
            fields.put(key, value.toString());
        }
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /**
     * 텍스트 값 (없으면 빈 문자열)
     */
    public String getString(String key) {
        Object value = fields.get(key);
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal) {
            return format((BigDecimal) value);
        }
        return value.toString();
    }

    /**
     * 숫자 값 (없거나 숫자가 아니면 0)
     */
    public BigDecimal getNumber(String key) {
        Object value = fields.get(key);
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        String text = value == null ? "" : value.toString().trim();
        if (!text.isEmpty()) {
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }

    /**
     * 없음, 빈 문자열, "0", 숫자 0은 false
     */
    public boolean isTruthy(String key) {
        Object value = fields.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() != 0;
        }
        String text = value.toString();
        return !text.isEmpty() && !"0".equals(text);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public static String format(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
