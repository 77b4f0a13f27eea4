package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.expression.ObjectFilter;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.model.RuleTriple;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * override 규칙 적용기
 *
 * 패턴과 일치하는 객체의 필드를 주어진 값으로 덮어쓴다. 규칙은 입력 순서대로 적용되므로
 * 같은 필드에 대해서는 나중 규칙이 이긴다.
 */
@Component
@RequiredArgsConstructor
public class OverrideApplier {

    private static final Logger log = LoggerFactory.getLogger(OverrideApplier.class);

    private final ObjectFilter objectFilter;

    public void apply(List<RuleTriple> overrides, List<ResourceObject> objects) {
        for (RuleTriple override : overrides) {
            List<ResourceObject> targets = objectFilter.filter(override.getPattern(), objects);
            for (ResourceObject target : targets) {
                target.put(override.getField(), override.getValue());
            }
            log.debug("Override {}={} applied to {} objects matching '{}'",
                    override.getField(), override.getValue(), targets.size(), override.getPattern());
        }
    }
}
