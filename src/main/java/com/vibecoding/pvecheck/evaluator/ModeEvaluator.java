package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.report.HealthReport;

import java.util.List;

/**
 * 모드별 평가기 인터페이스
 */
public interface ModeEvaluator {
    /**
     * 이 평가기가 해당 모드를 처리할 수 있는지 확인
     */
    boolean canEvaluate(CheckMode mode);

    /**
     * 필터링/override/보강이 끝난 객체들을 평가해 결과를 누적
     */
    void evaluate(CheckMode mode, List<ResourceObject> objects, ProbeOptions options, HealthReport report);
}
