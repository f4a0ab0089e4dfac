package com.agentflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main application entry point for the AgentFlow engine service.
 *
 * The execution store is chosen by {@code agentflow.engine.store}, so no
 * DataSource is auto-configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class AgentFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentFlowApplication.class, args);
    }
}
