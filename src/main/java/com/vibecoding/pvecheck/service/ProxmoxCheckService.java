package com.vibecoding.pvecheck.service;

import com.vibecoding.pvecheck.client.ClusterApiClient;
import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.evaluator.MetricAugmenter;
import com.vibecoding.pvecheck.evaluator.ModeEvaluator;
import com.vibecoding.pvecheck.evaluator.OverrideApplier;
import com.vibecoding.pvecheck.evaluator.StringMatchEvaluator;
import com.vibecoding.pvecheck.exception.ClusterApiException;
import com.vibecoding.pvecheck.exception.ProbeAbortException;
import com.vibecoding.pvecheck.expression.ObjectFilter;
import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.model.Severity;
import com.vibecoding.pvecheck.report.HealthReport;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.util.List;

/**
 * 점검 1회 실행
 *
 * 연결 -> 조회 -> 타입/사용자 필터 -> override -> 지표 보강 -> 문자열 규칙 -> 모드별 평가 -> 최종 판정
 */
@Service
@RequiredArgsConstructor
public class ProxmoxCheckService {

    private static final Logger log = LoggerFactory.getLogger(ProxmoxCheckService.class);

    private final HostFailoverDriver failoverDriver;
    private final ObjectFilter objectFilter;
    private final OverrideApplier overrideApplier;
    private final MetricAugmenter metricAugmenter;
    private final StringMatchEvaluator stringMatchEvaluator;
    private final List<ModeEvaluator> evaluators;

    /**
     * 점검을 실행하고 판정을 out에 출력한 뒤 종료 코드를 반환
     */
    public int run(ProbeOptions options, PrintStream out) {
        HealthReport report = new HealthReport(out);
        try {
            check(options, report);
            return report.finish(null, null, null);
        } catch (ProbeAbortException e) {
            return report.finish(e.getSeverity(), e.getShortText(), e.getLongText());
        } catch (ClusterApiException e) {
            log.error("Cluster API request failed: {}", e.getMessage());
            return report.finish(Severity.UNKNOWN, "API request failed", "UNKNOWN: " + e.getMessage());
        }
    }

    void check(ProbeOptions options, HealthReport report) {
        CheckMode mode = CheckMode.fromName(options.getMode())
                .orElseThrow(() -> new ProbeAbortException(Severity.UNKNOWN,
                        "Unknown mode " + options.getMode(),
                        "UNKNOWN: valid modes are " + CheckMode.availableModes()));

        ClusterApiClient client = failoverDriver.connect(options, report);

        List<ResourceObject> objects = client.get(mode.getApiPath());
        if (mode.isResourceMode()) {
            objects = objectFilter.filter(mode.typeExpression(), objects);
        }
        if (options.getFilter() != null && !options.getFilter().isBlank()) {
            objects = objectFilter.filter(options.getFilter(), objects);
        }
        if (objects.isEmpty()) {
            // 빈 클러스터나 필터 결과 없음은 장애가 아니다
            log.debug("No {} objects selected on {}", mode.getModeName(), client.getHost());
            report.detail("No " + mode.getModeName() + " objects on " + client.getHost() + " matched the filter");
            return;
        }
        log.debug("Checking {} {} objects on {}", objects.size(), mode.getModeName(), client.getHost());

        overrideApplier.apply(options.getOverrides(), objects);
        if (mode.isResourceMode()) {
            metricAugmenter.augment(mode, objects);
        }
        stringMatchEvaluator.evaluate(mode, objects, options.getWarnStrings(), options.getCritStrings(), report);

        for (ModeEvaluator evaluator : evaluators) {
            if (evaluator.canEvaluate(mode)) {
                evaluator.evaluate(mode, objects, options, report);
            }
        }
    }
}
