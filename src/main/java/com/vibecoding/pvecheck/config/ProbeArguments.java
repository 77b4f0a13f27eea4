package com.vibecoding.pvecheck.config;

import com.beust.jcommander.Parameter;

import java.util.ArrayList;
import java.util.List;

/**
 * 명령행 인자 정의 (JCommander)
 */
public class ProbeArguments {

    @Parameter(names = {"-H", "--host"}, description = "Proxmox host to connect to, repeat for failover")
    List<String> hosts = new ArrayList<>();

    @Parameter(names = {"-u", "--username"}, description = "Login user name")
    String username = "root";

    @Parameter(names = {"-p", "--password"}, description = "Login password (default: PROXMOX_PASSWORD)")
    String password;

    @Parameter(names = {"-P", "--port"}, description = "API port")
    int port = 8006;

    @Parameter(names = {"-r", "--realm"}, description = "Authentication realm")
    String realm = "pam";

    @Parameter(names = {"-m", "--mode"}, description = "Check mode")
    String mode;

    @Parameter(names = "--warnstr", description = "pattern^label^message, WARNING for every matching object")
    List<String> warnStrings = new ArrayList<>();

    @Parameter(names = "--critstr", description = "pattern^label^message, CRITICAL for every matching object")
    List<String> critStrings = new ArrayList<>();

    @Parameter(names = "--override", description = "pattern^field^value, force a field value on matching objects")
    List<String> overrides = new ArrayList<>();

    @Parameter(names = {"-f", "--filter"}, description = "Only check objects matching this expression")
    String filter;

    @Parameter(names = {"-c", "--config"}, description = "Config file with one 'option value' pair per line")
    String config;

    @Parameter(names = {"-k", "--insecure"}, description = "Do not verify the TLS certificate")
    boolean insecure;

    @Parameter(names = {"-h", "--help"}, description = "Show this help", help = true)
    boolean help;

    @Parameter(names = {"-d", "--debug"}, description = "Debug logging on stderr")
    boolean debug;

    @Parameter(names = {"-v", "--verbose"}, description = "Add per-object detail lines")
    boolean verbose;
}
