package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 성능 필드마다 임계값 하위 필드의 기본값을 채우고 max 대비 퍼센트 값을 계산한다.
 *
 * override 적용 이후에 실행해야 덮어쓴 값이 퍼센트 계산에 반영된다.
 */
@Component
public class MetricAugmenter {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 2;

    public void augment(CheckMode mode, List<ResourceObject> objects) {
        for (ResourceObject object : objects) {
            for (String field : mode.getPerfFields().keySet()) {
                augmentField(object, field);
            }
        }
    }

    void augmentField(ResourceObject object, String field) {
        defaultIfFalsy(object, "warn" + field, "");
        defaultIfFalsy(object, "crit" + field, "");
        defaultIfFalsy(object, "min" + field, "0");
        defaultIfFalsy(object, "max" + field, "");
        defaultIfFalsy(object, "warn" + field + "percent", "");
        defaultIfFalsy(object, "crit" + field + "percent", "");

        BigDecimal max = object.getNumber("max" + field);
        if (max.signum() > 0 && object.isTruthy(field)) {
            BigDecimal percent = object.getNumber(field)
                    .multiply(HUNDRED)
                    .divide(max, PERCENT_SCALE, RoundingMode.HALF_UP);
            object.put(field + "percent", percent);
        }
    }

    private static void defaultIfFalsy(ResourceObject object, String key, String defaultValue) {
        if (!object.isTruthy(key)) {
            object.put(key, defaultValue);
        }
    }
}
