package com.intentflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main application entry point for IntentFlow.
 *
 * Repositories are chosen by {@code intentflow.persistence.type}; the data source is only
 * created when it is {@code jdbc}.
 */
@SpringBootApplication(
    scanBasePackages = {
        "com.intentflow.api",
        "com.intentflow.engine"
    },
    exclude = DataSourceAutoConfiguration.class)
public class IntentFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntentFlowApplication.class, args);
    }
}
