package com.vibecoding.pvecheck.exception;

/**
 * 잘못된 옵션, 표현식, 규칙 등 실행을 즉시 중단해야 하는 설정 오류
 */
public class ProbeConfigurationException extends RuntimeException {

    public ProbeConfigurationException(String message) {
        super(message);
    }

    public ProbeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
