package com.vibecoding.pvecheck.service;

import com.vibecoding.pvecheck.client.ApiVersion;
import com.vibecoding.pvecheck.client.ClusterApiClient;
import com.vibecoding.pvecheck.client.ClusterApiClientFactory;
import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.exception.ClusterApiException;
import com.vibecoding.pvecheck.exception.ProbeAbortException;
import com.vibecoding.pvecheck.model.Severity;
import com.vibecoding.pvecheck.report.HealthReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HostFailoverDriverTest {

    private ClusterApiClientFactory factory;
    private HostFailoverDriver driver;
    private HealthReport report;

    @BeforeEach
    void setUp() {
        factory = mock(ClusterApiClientFactory.class);
        driver = new HostFailoverDriver(factory);
        report = new HealthReport(new PrintStream(new ByteArrayOutputStream()));
    }

    private ClusterApiClient client(String host, boolean login, boolean ticket) {
        ClusterApiClient client = mock(ClusterApiClient.class);
        when(client.getHost()).thenReturn(host);
        when(client.login()).thenReturn(login);
        when(client.checkLoginTicket()).thenReturn(ticket);
        when(client.apiVersion()).thenReturn(ApiVersion.builder().version("8.1.4").build());
        when(factory.create(eq(host), any(ProbeOptions.class))).thenReturn(client);
        return client;
    }

    private static ProbeOptions options(String... hosts) {
        return ProbeOptions.builder().hosts(List.of(hosts)).password("secret").build();
    }

    @Test
    void failsOverToNextHost() {
        client("A", false, false);
        ClusterApiClient b = client("B", true, true);

        ClusterApiClient connected = driver.connect(options("A", "B"), report);

        assertThat(connected).isSameAs(b);
        assertThat(report.getWorst()).isEqualTo(Severity.WARNING);
        assertThat(report.getShortTexts()).containsExactly("DOWN:A");
        assertThat(report.getLongTexts()).containsExactly(
                "WARNING: A: login as root@pam failed",
                "Connected to B (Proxmox VE 8.1.4)");
    }

    @Test
    void stopsAtFirstSuccess() {
        client("A", true, true);

        driver.connect(options("A", "B", "C"), report);

        assertThat(report.getShortTexts()).isEmpty();
        verify(factory, never()).create(eq("B"), any(ProbeOptions.class));
        verify(factory, never()).create(eq("C"), any(ProbeOptions.class));
    }

    @Test
    void invalidTicketCountsAsDown() {
        client("A", true, false);
        client("B", true, true);

        driver.connect(options("A", "B"), report);

        assertThat(report.getLongTexts()).first().isEqualTo("WARNING: A: login ticket is not valid");
    }

    @Test
    void apiErrorCountsAsDown() {
        ClusterApiClient a = client("A", true, true);
        when(a.apiVersion()).thenThrow(new ClusterApiException("GET /version on A failed: 500"));
        client("B", true, true);

        ClusterApiClient connected = driver.connect(options("A", "B"), report);

        assertThat(connected.getHost()).isEqualTo("B");
        assertThat(report.getShortTexts()).containsExactly("DOWN:A");
    }

    @Test
    void exhaustedHostsAbortWithUnknown() {
        client("A", false, false);
        client("B", false, false);

        assertThatThrownBy(() -> driver.connect(options("A", "B"), report))
                .isInstanceOfSatisfying(ProbeAbortException.class, e -> {
                    assertThat(e.getSeverity()).isEqualTo(Severity.UNKNOWN);
                    assertThat(e.getShortText()).isEqualTo("Failed connection");
                    assertThat(e.getLongText()).isEqualTo("Failed to find a suitable server to connect to");
                });
        assertThat(report.getShortTexts()).containsExactly("DOWN:A", "DOWN:B");
    }
}
