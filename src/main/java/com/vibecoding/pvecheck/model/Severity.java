package com.vibecoding.pvecheck.model;

/**
 * 점검 결과 심각도 (Nagios 플러그인 종료 코드와 동일)
 */
public enum Severity {
    OK(0),
    WARNING(1),
    CRITICAL(2),
    UNKNOWN(3);

    private final int exitCode;

    Severity(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * 종료 코드 기준으로 더 나쁜 심각도인지 확인
     */
    public boolean isWorseThan(Severity other) {
        return other == null || this.exitCode > other.exitCode;
    }
}
