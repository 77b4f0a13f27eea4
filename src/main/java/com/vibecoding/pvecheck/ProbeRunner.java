package com.vibecoding.pvecheck;

import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.config.ProbeOptionsParser;
import com.vibecoding.pvecheck.exception.ProbeConfigurationException;
import com.vibecoding.pvecheck.service.ProxmoxCheckService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * 명령행 실행 진입점
 *
 * 표준 출력에는 판정 결과만 쓴다. 옵션 오류는 표준 에러에 사용법과 함께 출력하고
 * 심각도 범위 밖의 종료 코드로 끝낸다.
 */
@Component
@RequiredArgsConstructor
public class ProbeRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ProbeRunner.class);

    static final int FATAL_EXIT_CODE = 255;

    private final ProbeOptionsParser optionsParser;
    private final ProxmoxCheckService checkService;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = execute(System.out, System.err, args);
    }

    int execute(PrintStream out, PrintStream err, String... args) {
        try {
            ProbeOptions options = optionsParser.parse(args);
            if (options.isHelp()) {
                out.print(optionsParser.usage());
                return 0;
            }
            if (options.isDebug()) {
                LoggingSystem.get(getClass().getClassLoader())
                        .setLogLevel("com.vibecoding.pvecheck", LogLevel.DEBUG);
            }
            return checkService.run(options, out);
        } catch (ProbeConfigurationException e) {
            log.debug("Invalid configuration", e);
            err.println(ProbeOptionsParser.PROGRAM_NAME + ": " + e.getMessage());
            err.print(optionsParser.usage());
            err.flush();
            return FATAL_EXIT_CODE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
