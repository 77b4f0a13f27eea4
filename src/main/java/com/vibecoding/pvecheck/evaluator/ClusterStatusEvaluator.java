package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.model.Severity;
import com.vibecoding.pvecheck.report.HealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 클러스터 상태 평가기 (status 모드)
 *
 * /cluster/status 결과에서:
 * - type=cluster 레코드의 quorate가 거짓이면 CRITICAL
 * - type=node 레코드의 online이 거짓이면 WARNING
 */
@Component
public class ClusterStatusEvaluator implements ModeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ClusterStatusEvaluator.class);

    // 단일 노드 설치에서는 cluster 레코드가 없다
    static final String STANDALONE_NAME = "cluster";

    @Override
    public boolean canEvaluate(CheckMode mode) {
        return mode == CheckMode.STATUS;
    }

    @Override
    public void evaluate(CheckMode mode, List<ResourceObject> objects, ProbeOptions options, HealthReport report) {
        String clusterName = STANDALONE_NAME;
        String expectedNodes = null;
        int nodeCount = 0;
        int onlineCount = 0;

        for (ResourceObject object : objects) {
            String type = object.getString("type");
            String name = mode.displayName(object);

            if ("cluster".equals(type)) {
                clusterName = name;
                expectedNodes = ResourceObject.format(object.getNumber("nodes"));
                if (!object.isTruthy("quorate")) {
                    report.emit(Severity.CRITICAL, name + " not quorate",
                            "CRITICAL: " + name + ": cluster is not quorate");
                }
                report.perf(name + ".nodes=" + expectedNodes + ";;;0;");
            } else if ("node".equals(type)) {
                nodeCount++;
                if (object.isTruthy("online")) {
                    onlineCount++;
                } else {
                    report.emit(Severity.WARNING, name + " offline",
                            "WARNING: " + name + ": node is offline");
                }
                if (options.isVerbose()) {
                    report.detail(name + ": " + (object.isTruthy("online") ? "online" : "offline")
                            + (object.has("ip") ? " (" + object.getString("ip") + ")" : ""));
                }
            } else {
                log.debug("Ignoring status record of type '{}'", type);
            }
        }

        if (nodeCount > 0) {
            String max = expectedNodes != null ? expectedNodes : String.valueOf(nodeCount);
            report.perf(clusterName + ".online=" + onlineCount + ";;;0;" + max);
        }
    }
}
