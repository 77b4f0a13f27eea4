package com.vibecoding.pvecheck.expression;

import com.vibecoding.pvecheck.exception.ProbeConfigurationException;
import com.vibecoding.pvecheck.model.ResourceObject;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * key=glob / key!=glob 절로 이루어진 필터 표현식 평가기
 *
 * 절은 공백으로 구분되며 모든 절이 일치해야 한다 (AND). 빈 표현식은 항상 일치한다.
 */
@Component
public class ExpressionMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CLAUSE = Pattern.compile("^([^=!\\s]+)(!=|=)(\\S*)$");

    public boolean matches(String expression, ResourceObject object) {
        for (String clause : clauses(expression)) {
            if (!matchesClause(clause, object)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 실행 전에 표현식 문법만 검사 (잘못된 절이 있으면 예외)
     */
    public void validate(String expression) {
        for (String clause : clauses(expression)) {
            parseClause(clause);
        }
    }

    /**
     * 공백 문자(스페이스, 탭 등)로 절을 나눈다. matches와 validate가 같은 규칙을 쓴다.
     */
    static List<String> clauses(String expression) {
        if (expression == null || expression.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.asList(WHITESPACE.split(expression.trim()));
    }

    private boolean matchesClause(String clause, ResourceObject object) {
        Matcher m = parseClause(clause);
        String key = m.group(1);
        boolean negate = "!=".equals(m.group(2));
        boolean hit = GlobPattern.matches(m.group(3), object.getString(key));
        return negate != hit;
    }

    private Matcher parseClause(String clause) {
        Matcher m = CLAUSE.matcher(clause);
        if (!m.matches()) {
            throw new ProbeConfigurationException(
                    "Invalid expression clause '" + clause + "': expected key=glob or key!=glob");
        }
        return m;
    }
}
