package com.vibecoding.pvecheck.expression;

import com.vibecoding.pvecheck.model.ResourceObject;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 표현식과 일치하는 객체만 순서를 유지한 채 골라낸다
 */
@Component
@RequiredArgsConstructor
public class ObjectFilter {

    private static final Logger log = LoggerFactory.getLogger(ObjectFilter.class);

    private final ExpressionMatcher matcher;

    public List<ResourceObject> filter(String expression, List<ResourceObject> objects) {
        List<ResourceObject> selected = objects.stream()
                .filter(object -> matcher.matches(expression, object))
                .collect(Collectors.toList());
        log.debug("Filter '{}' selected {} of {} objects", expression, selected.size(), objects.size());
        return selected;
    }
}
