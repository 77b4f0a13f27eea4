package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.model.Severity;
import com.vibecoding.pvecheck.report.HealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 임계값 평가기 (node, qemu, lxc, storage)
 *
 * 성능 필드마다:
 * - warn&lt;field&gt; &lt;= 값 이면 WARNING, crit&lt;field&gt; &lt;= 값 이면 CRITICAL (서로 독립)
 * - 퍼센트 값이 계산된 경우 &lt;field&gt;percent 에 대해 같은 검사
 * - 임계값 초과 여부와 무관하게 성능 데이터 토큰 출력
 */
@Component
public class ThresholdEvaluator implements ModeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ThresholdEvaluator.class);

    private static final String PERCENT = "percent";

    @Override
    public boolean canEvaluate(CheckMode mode) {
        return mode.isResourceMode();
    }

    @Override
    public void evaluate(CheckMode mode, List<ResourceObject> objects, ProbeOptions options, HealthReport report) {
        for (ResourceObject object : objects) {
            String name = mode.displayName(object);
            log.debug("Evaluating {} {}", mode.getModeName(), name);

            for (Map.Entry<String, String> perf : mode.getPerfFields().entrySet()) {
                evaluateField(report, object, name, perf.getKey(), perf.getValue());
            }

            if (options.isVerbose()) {
                report.detail(describe(mode, object, name));
            }
        }
    }

    private void evaluateField(HealthReport report, ResourceObject object, String name, String field, String unit) {
        BigDecimal value = object.getNumber(field);
        checkThreshold(report, object, name, field, unit, value, Severity.WARNING, "warn");
        checkThreshold(report, object, name, field, unit, value, Severity.CRITICAL, "crit");
        report.perf(perfToken(name, field, ResourceObject.format(value), unit,
                object.getString("warn" + field),
                object.getString("crit" + field),
                object.getString("min" + field),
                object.getString("max" + field)));

        String percentField = field + PERCENT;
        if (!object.has(percentField)) {
            return;
        }
        BigDecimal percent = object.getNumber(percentField);
        checkThreshold(report, object, name, percentField, "%", percent, Severity.WARNING, "warn");
        checkThreshold(report, object, name, percentField, "%", percent, Severity.CRITICAL, "crit");
        report.perf(perfToken(name, percentField, ResourceObject.format(percent), "%",
                object.getString("warn" + percentField),
                object.getString("crit" + percentField),
                "0", "100"));
    }

    private void checkThreshold(HealthReport report, ResourceObject object, String name, String field,
                                String unit, BigDecimal value, Severity severity, String prefix) {
        String key = prefix + field;
        if (!object.isTruthy(key)) {
            return;
        }
        BigDecimal threshold = object.getNumber(key);
        if (threshold.compareTo(value) > 0) {
            return;
        }
        String thresholdText = object.getString(key);
        report.emit(severity,
                name + " " + field + ">" + thresholdText + unit,
                severity.name() + ": " + name + ": " + field + " is " + ResourceObject.format(value) + unit
                        + " (threshold " + thresholdText + unit + ")");
    }

    static String perfToken(String name, String field, String value, String unit,
                            String warn, String crit, String min, String max) {
        return name + "." + field + "=" + value + unit + ";" + warn + ";" + crit + ";" + min + ";" + max;
    }

    private static String describe(CheckMode mode, ResourceObject object, String name) {
        StringBuilder sb = new StringBuilder(name).append(':');
        for (Map.Entry<String, String> perf : mode.getPerfFields().entrySet()) {
            String field = perf.getKey();
            sb.append(' ').append(field).append('=')
                    .append(ResourceObject.format(object.getNumber(field))).append(perf.getValue());
            if (object.has(field + PERCENT)) {
                sb.append(" (").append(object.getString(field + PERCENT)).append("%)");
            }
        }
        return sb.toString();
    }
}
