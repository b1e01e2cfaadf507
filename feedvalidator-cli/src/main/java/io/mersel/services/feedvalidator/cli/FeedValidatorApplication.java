package io.mersel.services.feedvalidator.cli;

import io.mersel.services.feedvalidator.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Election feed validator command line entry point.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class FeedValidatorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FeedValidatorApplication.class, args)));
    }
}
