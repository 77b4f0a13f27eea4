package com.vibecoding.pvecheck.report;

import com.vibecoding.pvecheck.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 점검 1회 실행 동안의 결과 누적 상태
 *
 * 가장 나쁜 심각도, 짧은 요약, 상세 메시지, 성능 데이터 토큰을 순서대로 모은 뒤
 * finish()에서 한 번만 출력한다.
 */
public class HealthReport {

    private static final Logger log = LoggerFactory.getLogger(HealthReport.class);

    private final PrintStream out;

    private Severity worst = Severity.OK;
    private final List<String> shortTexts = new ArrayList<>();
    private final List<String> longTexts = new ArrayList<>();
    private final List<String> perfData = new ArrayList<>();
    private boolean finished;

    public HealthReport(PrintStream out) {
        this.out = out;
    }

    /**
     * 결과 하나를 누적. null 이나 빈 문자열은 건너뛴다.
     */
    public void emit(Severity severity, String shortText, String longText, String perfToken) {
        if (finished) {
            throw new IllegalStateException("Report already finished");
        }
        if (severity != null && severity.isWorseThan(worst)) {
            log.debug("Severity raised {} -> {}", worst, severity);
            worst = severity;
        }
        addIfPresent(shortTexts, shortText);
        addIfPresent(longTexts, longText);
        addIfPresent(perfData, perfToken);
    }

    public void emit(Severity severity, String shortText, String longText) {
        emit(severity, shortText, longText, null);
    }

    public void perf(String perfToken) {
        emit(null, null, null, perfToken);
    }

    public void detail(String longText) {
        emit(null, null, longText, null);
    }

    /**
     * 마지막 결과를 누적하고 최종 판정을 출력한 뒤 종료 코드를 반환
     */
    public int finish(Severity severity, String shortText, String longText) {
        emit(severity, shortText, longText, null);
        finished = true;

        out.print(render());
        out.flush();

        log.debug("Finished with {} ({} findings, {} perf tokens)", worst, shortTexts.size(), perfData.size());
        return worst.getExitCode();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Proxmox ").append(worst.name()).append(": ")
                .append(String.join(". ", shortTexts))
                .append(" |")
                .append(String.join(" ", perfData))
                .append('\n');
        for (String line : longTexts) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    public Severity getWorst() {
        return worst;
    }

    public List<String> getShortTexts() {
        return Collections.unmodifiableList(shortTexts);
    }

    public List<String> getLongTexts() {
        return Collections.unmodifiableList(longTexts);
    }

    public List<String> getPerfData() {
        return Collections.unmodifiableList(perfData);
    }

    public boolean isFinished() {
        return finished;
    }

    private static void addIfPresent(List<String> target, String text) {
        if (text != null && !text.isEmpty()) {
            target.add(text);
        }
    }
}
