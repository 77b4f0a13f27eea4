package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.model.Severity;
import com.vibecoding.pvecheck.report.HealthReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdEvaluatorTest {

    private final ThresholdEvaluator evaluator = new ThresholdEvaluator();
    private final MetricAugmenter augmenter = new MetricAugmenter();

    private HealthReport report;

    @BeforeEach
    void setUp() {
        report = new HealthReport(new PrintStream(new ByteArrayOutputStream()));
    }

    private ResourceObject storage(Map<String, ?> values) {
        Map<String, Object> fields = new HashMap<>(values);
        fields.put("type", "storage");
        fields.put("node", "pve1");
        fields.put("storage", "local");
        return new ResourceObject(fields);
    }

    private void evaluate(CheckMode mode, ResourceObject object, boolean verbose) {
        augmenter.augment(mode, List.of(object));
        evaluator.evaluate(mode, List.of(object), ProbeOptions.builder().verbose(verbose).build(), report);
    }

    @Test
    void warningAndCriticalAreIndependent() {
        evaluate(CheckMode.STORAGE, storage(Map.of("disk", 150, "warndisk", 10, "critdisk", 100)), false);

        assertThat(report.getWorst()).isEqualTo(Severity.CRITICAL);
        assertThat(report.getShortTexts()).containsExactly("pve1.local disk>10B", "pve1.local disk>100B");
        assertThat(report.getLongTexts()).containsExactly(
                "WARNING: pve1.local: disk is 150B (threshold 10B)",
                "CRITICAL: pve1.local: disk is 150B (threshold 100B)");
    }

    @Test
    void thresholdEqualToValueTriggers() {
        evaluate(CheckMode.STORAGE, storage(Map.of("disk", 100, "critdisk", 100)), false);

        assertThat(report.getWorst()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void belowThresholdOnlyEmitsPerfData() {
        evaluate(CheckMode.STORAGE, storage(Map.of("disk", 5, "warndisk", 10, "critdisk", 100)), false);

        assertThat(report.getWorst()).isEqualTo(Severity.OK);
        assertThat(report.getShortTexts()).isEmpty();
        assertThat(report.getPerfData()).containsExactly("pve1.local.disk=5B;10;100;0;");
    }

    @Test
    void percentThresholds() {
        evaluate(CheckMode.STORAGE, storage(Map.of("disk", 90, "maxdisk", 100, "critdiskpercent", 85)), false);

        assertThat(report.getShortTexts()).containsExactly("pve1.local diskpercent>85%");
        assertThat(report.getPerfData()).containsExactly(
                "pve1.local.disk=90B;;;0;100",
                "pve1.local.diskpercent=90%;;85;0;100");
    }

    @Test
    void perfDataForEveryFieldInSortedOrder() {
        ResourceObject node = new ResourceObject(Map.of(
                "type", "node", "node", "pve1", "cpu", 0.05, "maxcpu", 8,
                "mem", 2048, "maxmem", 8192, "uptime", 3600));

        evaluate(CheckMode.NODE, node, false);

        assertThat(report.getPerfData()).containsExactly(
                "pve1.cpu=0.05;;;0;8",
                "pve1.cpupercent=0.63%;;;0;100",
                "pve1.disk=0B;;;0;",
                "pve1.mem=2048B;;;0;8192",
                "pve1.mempercent=25%;;;0;100",
                "pve1.uptime=3600s;;;0;");
    }

    @Test
    void verboseAddsObjectDetail() {
        evaluate(CheckMode.STORAGE, storage(Map.of("disk", 50, "maxdisk", 200)), true);

        assertThat(report.getLongTexts()).containsExactly("pve1.local: disk=50B (25%)");
    }

    @Test
    void onlyResourceModes() {
        assertThat(evaluator.canEvaluate(CheckMode.QEMU)).isTrue();
        assertThat(evaluator.canEvaluate(CheckMode.STATUS)).isFalse();
    }
}
