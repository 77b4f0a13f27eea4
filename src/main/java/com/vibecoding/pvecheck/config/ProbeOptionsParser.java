package com.vibecoding.pvecheck.config;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.vibecoding.pvecheck.exception.ProbeConfigurationException;
import com.vibecoding.pvecheck.expression.ExpressionMatcher;
import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.RuleTriple;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 명령행 인자와 설정 파일을 합쳐 ProbeOptions를 만든다.
 *
 * 설정 파일 값이 먼저 적용되고 명령행 값이 뒤에 적용된다
 * (단일 값 옵션은 명령행이 이기고, 반복 옵션은 누적).
 */
@Component
@RequiredArgsConstructor
public class ProbeOptionsParser {

    private static final Logger log = LoggerFactory.getLogger(ProbeOptionsParser.class);

    public static final String PROGRAM_NAME = "check_pve";
    static final String PASSWORD_VARIABLE = "PROXMOX_PASSWORD";

    private final ConfigFileLoader configFileLoader;
    private final ExpressionMatcher expressionMatcher;

    public ProbeOptions parse(String... args) {
        ProbeArguments cli = parseArguments(Arrays.asList(args));

        ProbeArguments merged = cli;
        if (cli.config != null && !cli.help) {
            List<String> combined = new ArrayList<>(configFileLoader.load(Paths.get(cli.config)));
            combined.addAll(Arrays.asList(args));
            merged = parseArguments(combined);
        }

        if (merged.help) {
            return ProbeOptions.builder().help(true).build();
        }
        return validate(merged);
    }

    public String usage() {
        StringBuilder sb = new StringBuilder();
        newCommander(new ProbeArguments()).getUsageFormatter().usage(sb);
        sb.append("\n  Modes:\n");
        for (CheckMode mode : CheckMode.values()) {
            sb.append(String.format("    %-10s%s%n", mode.getModeName(), mode.getHelp()));
        }
        sb.append("\n  Expressions are space separated key=glob / key!=glob clauses, all must match.\n");
        return sb.toString();
    }

    private ProbeArguments parseArguments(List<String> args) {
        ProbeArguments arguments = new ProbeArguments();
        try {
            newCommander(arguments).parse(args.toArray(new String[0]));
        } catch (ParameterException e) {
            throw new ProbeConfigurationException(e.getMessage(), e);
        }
        return arguments;
    }

    private JCommander newCommander(ProbeArguments arguments) {
        return JCommander.newBuilder()
                .programName(PROGRAM_NAME)
                .addObject(arguments)
                .allowParameterOverwriting(true)
                .build();
    }

    private ProbeOptions validate(ProbeArguments args) {
        if (args.hosts.isEmpty()) {
            throw new ProbeConfigurationException("At least one --host is required");
        }
        if (args.mode == null || args.mode.isBlank()) {
            throw new ProbeConfigurationException("--mode is required (" + CheckMode.availableModes() + ")");
        }
        if (args.port < 1 || args.port > 65535) {
            throw new ProbeConfigurationException("Invalid --port " + args.port);
        }

        String password = args.password;
        if (password == null || password.isEmpty()) {
            password = resolvePasswordFromEnvironment();
        }
        if (password == null || password.isEmpty()) {
            throw new ProbeConfigurationException("--password is required (or set " + PASSWORD_VARIABLE + ")");
        }

        List<RuleTriple> overrides = args.overrides.stream()
                .map(RuleTriple::parseOverride)
                .collect(Collectors.toList());
        List<RuleTriple> warnStrings = args.warnStrings.stream()
                .map(raw -> RuleTriple.parse("warnstr", raw))
                .collect(Collectors.toList());
        List<RuleTriple> critStrings = args.critStrings.stream()
                .map(raw -> RuleTriple.parse("critstr", raw))
                .collect(Collectors.toList());

        // 실행 도중이 아니라 시작 시점에 문법 오류를 잡는다
        expressionMatcher.validate(args.filter);
        overrides.forEach(rule -> expressionMatcher.validate(rule.getPattern()));
        warnStrings.forEach(rule -> expressionMatcher.validate(rule.getPattern()));
        critStrings.forEach(rule -> expressionMatcher.validate(rule.getPattern()));

        log.debug("Parsed options: hosts={}, mode={}, user={}@{}, port={}, filter={}, overrides={}",
                args.hosts, args.mode, args.username, args.realm, args.port, args.filter, overrides.size());

        return ProbeOptions.builder()
                .hosts(new ArrayList<>(args.hosts))
                .username(args.username)
                .password(password)
                .port(args.port)
                .realm(args.realm)
                .mode(args.mode)
                .warnStrings(warnStrings)
                .critStrings(critStrings)
                .overrides(overrides)
                .filter(args.filter)
                .insecure(args.insecure)
                .debug(args.debug)
                .verbose(args.verbose)
                .build();
    }

    /**
     * .env 로드 시 시스템 프로퍼티로 등록되므로 프로퍼티 우선, 환경변수 대체
     */
    private String resolvePasswordFromEnvironment() {
        String password = System.getProperty(PASSWORD_VARIABLE);
        if (password == null || password.isBlank()) {
            password = System.getenv(PASSWORD_VARIABLE);
        }
        return password;
    }
}
