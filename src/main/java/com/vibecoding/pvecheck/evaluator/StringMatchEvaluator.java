package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.expression.ObjectFilter;
import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.model.RuleTriple;
import com.vibecoding.pvecheck.model.Severity;
import com.vibecoding.pvecheck.report.HealthReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * warnstr / critstr 규칙 평가기
 *
 * 패턴과 일치하는 객체마다 임계값과 무관하게 경고/심각 결과를 남긴다.
 */
@Component
@RequiredArgsConstructor
public class StringMatchEvaluator {

    private final ObjectFilter objectFilter;

    public void evaluate(CheckMode mode, List<ResourceObject> objects,
                         List<RuleTriple> warnRules, List<RuleTriple> critRules, HealthReport report) {
        apply(mode, objects, warnRules, Severity.WARNING, report);
        apply(mode, objects, critRules, Severity.CRITICAL, report);
    }

    private void apply(CheckMode mode, List<ResourceObject> objects, List<RuleTriple> rules,
                       Severity severity, HealthReport report) {
        for (RuleTriple rule : rules) {
            for (ResourceObject object : objectFilter.filter(rule.getPattern(), objects)) {
                String name = mode.displayName(object);
                String shortText = rule.getField().isEmpty() ? name : name + " " + rule.getField();
                report.emit(severity, shortText, severity.name() + ": " + name + ": " + rule.getValue());
            }
        }
    }
}
