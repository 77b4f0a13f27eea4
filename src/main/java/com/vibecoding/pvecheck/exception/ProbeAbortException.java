package com.vibecoding.pvecheck.exception;

import com.vibecoding.pvecheck.model.Severity;

/**
 * 점검을 더 진행하지 않고 최종 판정으로 바로 넘어갈 때 사용
 */
public class ProbeAbortException extends RuntimeException {

    private final Severity severity;
    private final String shortText;
    private final String longText;

    public ProbeAbortException(Severity severity, String shortText, String longText) {
        super(shortText);
        this.severity = severity;
        this.shortText = shortText;
        this.longText = longText;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getShortText() {
        return shortText;
    }

    public String getLongText() {
        return longText;
    }
}
