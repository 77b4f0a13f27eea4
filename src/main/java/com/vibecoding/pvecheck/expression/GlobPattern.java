package com.vibecoding.pvecheck.expression;

import java.util.regex.Pattern;

/**
 * 셸 와일드카드(*, ?, [...], [!...])를 정규식으로 변환
 *
 * '*'는 '/'를 포함한 모든 문자열과 매칭되며, 값 전체가 일치해야 한다.
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    public static Pattern compile(String glob) {
        return Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    public static boolean matches(String glob, String value) {
        return compile(glob).matcher(value == null ? "" : value).matches();
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                case '[':
                    int end = findClassEnd(glob, i);
                    if (end < 0) {
                        regex.append("\\[");
                    } else {
                        regex.append(characterClass(glob.substring(i, end)));
                        i = end + 1;
                    }
                    break;
                default:
                    appendLiteral(regex, c);
            }
        }
        return regex.toString();
    }

    // ']' 바로 앞이 '[' 또는 '[!' 이면 클래스 안의 문자로 취급
    private static int findClassEnd(String glob, int start) {
        int j = start;
        if (j < glob.length() && glob.charAt(j) == '!') {
            j++;
        }
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        while (j < glob.length() && glob.charAt(j) != ']') {
            j++;
        }
        return j < glob.length() ? j : -1;
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int i = 0;
        if (body.startsWith("!")) {
            cls.append('^');
            i = 1;
        }
        for (; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '-' && i > 0 && i < body.length() - 1) {
                cls.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                cls.append(c);
            } else {
                cls.append('\\').append(c);
            }
        }
        return cls.append(']').toString();
    }

    private static void appendLiteral(StringBuilder regex, char c) {
        if (Character.isLetterOrDigit(c)) {
            regex.append(c);
        } else {
            regex.append('\\').append(c);
        }
    }
}
