package com.copilot.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@SpringBootApplication
@EnableScheduling
public class CopilotGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(CopilotGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CopilotGatewayApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady(ApplicationReadyEvent event) {
        Environment env = event.getApplicationContext().getEnvironment();
        String port = env.getProperty("local.server.port", env.getProperty("server.port", "4141"));
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           Copilot Gateway Java v1.0.0             ║");
        log.info("║   Anthropic Messages API → Copilot Chat Backend   ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("监听端口: {}", port);
        log.info("API 端点:");
        log.info("  POST /v1/messages          (Anthropic)");
        log.info("  POST /v1/chat/completions  (OpenAI 透传)");
        log.info("  GET  /v1/models");
        log.info("  GET  /health");
    }
}
