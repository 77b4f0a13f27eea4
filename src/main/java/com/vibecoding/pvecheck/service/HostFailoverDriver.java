package com.vibecoding.pvecheck.service;

import com.vibecoding.pvecheck.client.ApiVersion;
import com.vibecoding.pvecheck.client.ClusterApiClient;
import com.vibecoding.pvecheck.client.ClusterApiClientFactory;
import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.exception.ClusterApiException;
import com.vibecoding.pvecheck.exception.ProbeAbortException;
import com.vibecoding.pvecheck.model.Severity;
import com.vibecoding.pvecheck.report.HealthReport;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 호스트 목록을 순서대로 시도해 처음 인증에 성공한 호스트의 클라이언트를 반환
 *
 * 실패한 호스트마다 DOWN:&lt;host&gt; 경고를 남기고, 모두 실패하면 UNKNOWN으로 점검을 끝낸다.
 * 병렬로 시도하지 않는다 (경고 순서가 출력에 그대로 드러남).
 */
@Service
@RequiredArgsConstructor
public class HostFailoverDriver {

    private static final Logger log = LoggerFactory.getLogger(HostFailoverDriver.class);

    private final ClusterApiClientFactory clientFactory;

    public ClusterApiClient connect(ProbeOptions options, HealthReport report) {
        for (String host : options.getHosts()) {
            log.debug("Trying {}", host);
            ClusterApiClient client = clientFactory.create(host, options);

            String failure;
            try {
                if (!client.login()) {
                    failure = "login as " + options.getLoginName() + " failed";
                } else if (!client.checkLoginTicket()) {
                    failure = "login ticket is not valid";
                } else {
                    ApiVersion version = client.apiVersion();
                    log.debug("Connected to {} (version {})", host, version.getVersion());
                    report.detail("Connected to " + host + " (Proxmox VE " + version.getVersion() + ")");
                    return client;
                }
            } catch (ClusterApiException e) {
                failure = e.getMessage();
            }

            log.warn("Host {} is not usable: {}", host, failure);
            report.emit(Severity.WARNING, "DOWN:" + host, "WARNING: " + host + ": " + failure);
        }

        throw new ProbeAbortException(Severity.UNKNOWN,
                "Failed connection", "Failed to find a suitable server to connect to");
    }
}
