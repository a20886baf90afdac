package com.apogee;

import com.apogee.config.PipelineProperties;
import com.apogee.runner.PipelineCommandLineRunner;
import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Apogee pipeline orchestrator.
 *
 * <pre>
 *   java -jar apogee-pipeline.jar           # recurring schedule (PIPELINE_SCHEDULE)
 *   java -jar apogee-pipeline.jar --once    # one batch now, then exit
 *   java -jar apogee-pipeline.jar --check   # environment check, then exit
 * </pre>
 */
@SpringBootApplication(
        exclude = {
            org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration
                    .class
        })
@EnableConfigurationProperties(PipelineProperties.class)
public class ApogeePipelineApplication {

    static {
        // Load .env file before Spring Boot starts
        loadEnvironmentVariables();
    }

    public static void main(String[] args) {
        ConfigurableApplicationContext context =
                SpringApplication.run(ApogeePipelineApplication.class, args);
        if (PipelineCommandLineRunner.isOneShot(args)) {
            System.exit(SpringApplication.exit(context));
        }
    }

    private static void loadEnvironmentVariables() {
        try {
            Path currentPath = Paths.get(System.getProperty("user.dir"));
            Path envPath = currentPath.resolve(".env");

            // If running from backend directory, check parent
            if (!Files.exists(envPath) && currentPath.getFileName().toString().equals("backend")) {
                envPath = currentPath.getParent().resolve(".env");
            }

            if (Files.exists(envPath)) {
                System.out.println("Loading environment variables from: " + envPath);

                Dotenv dotenv =
                        Dotenv.configure()
                                .directory(envPath.getParent().toString())
                                .ignoreIfMissing()
                                .load();

                // variables already set in the process environment take precedence
                dotenv.entries()
                        .forEach(
                                entry -> {
                                    if (System.getenv(entry.getKey()) == null) {
                                        System.setProperty(entry.getKey(), entry.getValue());
                                    }
                                });

                System.out.println(
                        "Loaded " + dotenv.entries().size() + " environment variables from .env");
            } else {
                System.out.println(
                        "WARNING: .env file not found, using system environment variables");
            }
        } catch (Exception e) {
            System.err.println("Error loading .env file: " + e.getMessage());
        }
    }
}
