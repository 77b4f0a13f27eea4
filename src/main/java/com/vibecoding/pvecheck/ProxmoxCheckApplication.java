package com.vibecoding.pvecheck;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class ProxmoxCheckApplication {

    private static final Logger log = LoggerFactory.getLogger(ProxmoxCheckApplication.class);

    public static void main(String[] args) {
        // Load .env file and set as system properties
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

            dotenv.entries().forEach(entry -> {
                if (System.getProperty(entry.getKey()) == null) {
                    System.setProperty(entry.getKey(), entry.getValue());
                }
                log.debug("Loaded environment variable: {}", entry.getKey());
            });
        } catch (Exception e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
        }

        SpringApplication application = new SpringApplication(ProxmoxCheckApplication.class);
        // 인자는 JCommander가 해석한다
        application.setAddCommandLineProperties(false);

        System.exit(SpringApplication.exit(application.run(args)));
    }
}
