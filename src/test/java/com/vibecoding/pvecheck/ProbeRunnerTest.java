package com.vibecoding.pvecheck;

import com.vibecoding.pvecheck.config.ConfigFileLoader;
import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.config.ProbeOptionsParser;
import com.vibecoding.pvecheck.expression.ExpressionMatcher;
import com.vibecoding.pvecheck.service.ProxmoxCheckService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProbeRunnerTest {

    @Mock
    private ProxmoxCheckService checkService;

    private ProbeRunner runner;
    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() {
        ProbeOptionsParser parser = new ProbeOptionsParser(new ConfigFileLoader(), new ExpressionMatcher());
        runner = new ProbeRunner(parser, checkService);
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
        err = new PrintStream(stderr, true, StandardCharsets.UTF_8);
    }

    @Test
    void helpPrintsUsageAndExitsZero() {
        int code = runner.execute(out, err, "-h");

        assertThat(code).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("Usage: check_pve");
        verifyNoInteractions(checkService);
    }

    @Test
    void invalidArgumentsExitWithFatalCode() {
        int code = runner.execute(out, err, "-m", "node");

        assertThat(code).isEqualTo(ProbeRunner.FATAL_EXIT_CODE);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(stderr.toString(StandardCharsets.UTF_8))
                .startsWith("check_pve: At least one --host is required")
                .contains("Usage: check_pve");
        verifyNoInteractions(checkService);
    }

    @Test
    void validArgumentsRunTheCheck() {
        when(checkService.run(any(ProbeOptions.class), eq(out))).thenReturn(2);

        int code = runner.execute(out, err, "-H", "pve1", "-m", "qemu", "-p", "secret");

        assertThat(code).isEqualTo(2);
        ArgumentCaptor<ProbeOptions> captor = ArgumentCaptor.forClass(ProbeOptions.class);
        verify(checkService).run(captor.capture(), eq(out));
        assertThat(captor.getValue().getMode()).isEqualTo("qemu");
        assertThat(captor.getValue().getHosts()).containsExactly("pve1");
    }
}
