package com.vibecoding.pvecheck.config;

import com.vibecoding.pvecheck.exception.ProbeConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 설정 파일 로더
 *
 * 한 줄에 "option value" 하나. 빈 줄과 '#' 주석은 무시한다.
 * 결과는 명령행 인자와 같은 형태(--option value)로 돌려준다.
 */
@Component
public class ConfigFileLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigFileLoader.class);

    private static final Set<String> FLAGS = Set.of("insecure", "help", "debug", "verbose");
    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "off");

    public List<String> load(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProbeConfigurationException("Cannot read config file " + path + ": " + e.getMessage(), e);
        }

        List<String> args = new ArrayList<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            String option = parts[0].replaceFirst("^-+", "");
            String value = parts.length > 1 ? parts[1].trim() : "";

            if (option.isEmpty()) {
                throw new ProbeConfigurationException("Invalid config line " + lineNo + " in " + path);
            }
            if (FLAGS.contains(option)) {
                if (!FALSE_VALUES.contains(value.toLowerCase())) {
                    args.add("--" + option);
                }
                continue;
            }
            if (value.isEmpty()) {
                throw new ProbeConfigurationException(
                        "Missing value for '" + option + "' on line " + lineNo + " in " + path);
            }
            args.add("--" + option);
            args.add(value);
        }
        log.debug("Loaded {} arguments from {}", args.size(), path);
        return args;
    }
}
