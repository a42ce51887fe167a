package org.tanzu.pvemcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.pvemcp.pve.PveService;

import java.util.List;

/**
 * Main Spring Boot application class for the PVE fleet MCP (Model Context Protocol) Server.
 *
 * The server manages several PVE clusters at once. It keeps a live inventory of their
 * nodes and guests by polling, dispatches power, backup and shell actions to many
 * targets concurrently, raises alerts from the polled metrics and exposes all of it as
 * MCP tools.
 *
 * Key features:
 * - Ticket-based sessions with transparent re-authentication and bounded retries
 * - Per-endpoint poll loops with change events for subscribers
 * - Concurrent batch dispatch with per-target results
 * - Threshold alerts with automatic resolution
 * - Cloud Foundry deployment with service binding
 */
@SpringBootApplication
@EnableConfigurationProperties
public class PveMcpApplication {

    /**
     * Main application entry point.
     *
     * Sets the MCP server identification as system properties so it is the same
     * whatever the deployment environment provides, then starts Spring Boot.
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "pve-mcp");
        System.setProperty("spring.ai.mcp.server.name", "pve-mcp");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");

        SpringApplication.run(PveMcpApplication.class, args);
    }

    /**
     * Registers the PVE service tools with the MCP server.
     *
     * @param pveService The service containing the PVE tools
     * @return ToolCallback objects for every @Tool method of the service
     */
    @Bean
    public List<ToolCallback> registerTools(PveService pveService) {
        return List.of(ToolCallbacks.from(pveService));
    }
}
