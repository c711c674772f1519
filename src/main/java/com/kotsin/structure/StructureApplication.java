package com.kotsin.structure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Market structure analytics core.
 *
 * Runs dealer gamma metrics and Wyckoff structure detection per symbol, either
 * for every trigger arriving on the execution topic or once for a batch passed
 * on the command line ({@code --mode=batch}).
 */
@SpringBootApplication(scanBasePackages = "com.kotsin.structure")
public class StructureApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(StructureApplication.class, args);

        // Batch runs once in the runner; exit with its code instead of idling
        if ("batch".equals(context.getEnvironment().getProperty("mode"))) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
