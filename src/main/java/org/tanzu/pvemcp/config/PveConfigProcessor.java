package org.tanzu.pvemcp.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Processor for Cloud Foundry service bindings that describe PVE endpoints.
 *
 * When the application is bound to a user-provided service whose name contains
 * "pve" or "proxmox", Cloud Foundry publishes its credentials in VCAP_SERVICES.
 * Each such binding becomes one entry of {@link PveProperties#getEndpoints()}, unless
 * an endpoint with the same id is already configured: explicit configuration always wins.
 *
 * Expected credentials document:
 * <pre>
 * { "id": "lab", "host": "pve1.lab", "port": 8006, "username": "root",
 *   "realm": "pam", "password": "...", "ssl": true, "insecure": true }
 * </pre>
 * The id defaults to the service name. Passwords are masked in every log line.
 */
@Component
public class PveConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(PveConfigProcessor.class);

    /** The configuration object to be supplemented */
    @Autowired
    private PveProperties pveProperties;

    /** Spring environment for accessing VCAP_SERVICES */
    @Autowired
    private Environment environment;

    /**
     * Adds endpoints found in VCAP_SERVICES to the configuration.
     *
     * Called once after the context is initialized, before the configured endpoints are
     * registered. Parsing problems are logged and leave the configuration unchanged.
     */
    @PostConstruct
    public void processVCapServices() {
        logger.info("Processing PVE endpoint configuration...");
        logger.info("Configured endpoints: {}", pveProperties.getEndpoints());

        String vcapServices = environment.getProperty("VCAP_SERVICES");
        if (vcapServices == null || vcapServices.isEmpty()) {
            logger.debug("VCAP_SERVICES not available, using configured endpoints only");
            return;
        }

        try {
            JsonNode vcapServicesNode = new ObjectMapper().readTree(vcapServices);
            List<PveProperties.Endpoint> found = findPveEndpoints(vcapServicesNode);
            if (found.isEmpty()) {
                logger.warn("No PVE service found in VCAP_SERVICES");
                return;
            }
            for (PveProperties.Endpoint endpoint : found) {
                if (isConfigured(endpoint.getId())) {
                    logger.info("Endpoint '{}' already configured, ignoring VCAP binding", endpoint.getId());
                    continue;
                }
                if (!endpoint.isComplete()) {
                    logger.warn("Incomplete PVE binding ignored: {}", endpoint);
                    continue;
                }
                pveProperties.getEndpoints().add(endpoint);
                logger.info("Added endpoint from VCAP_SERVICES: {}", endpoint);
            }
        } catch (Exception e) {
            logger.error("Error processing VCAP_SERVICES: {}", e.getMessage(), e);
        }
    }

    /**
     * Finds every service whose name contains "pve" or "proxmox" (case-insensitive).
     *
     * @param vcapServicesNode The parsed VCAP_SERVICES document
     * @return One endpoint binding per matching service
     */
    List<PveProperties.Endpoint> findPveEndpoints(JsonNode vcapServicesNode) {
        List<PveProperties.Endpoint> result = new ArrayList<>();
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText();
                String lowerName = serviceName.toLowerCase(Locale.ROOT);
                logger.debug("Found service: {}", serviceName);
                if (lowerName.contains("pve") || lowerName.contains("proxmox")) {
                    logger.info("Found PVE service: {}", serviceName);
                    result.add(fromCredentials(serviceName, service.path("credentials")));
                }
            }
        }
        return result;
    }

    private PveProperties.Endpoint fromCredentials(String serviceName, JsonNode credentials) {
        PveProperties.Endpoint endpoint = new PveProperties.Endpoint();
        endpoint.setId(credentials.path("id").asText(serviceName));
        endpoint.setName(credentials.path("name").asText(serviceName));
        endpoint.setHost(credentials.path("host").asText(null));
        endpoint.setPort(credentials.path("port").asInt(endpoint.getPort()));
        endpoint.setUsername(credentials.path("username").asText(null));
        endpoint.setPassword(credentials.path("password").asText(null));
        endpoint.setRealm(credentials.path("realm").asText(endpoint.getRealm()));
        endpoint.setSsl(credentials.path("ssl").asBoolean(true));
        if (credentials.has("insecure")) {
            boolean insecure = credentials.path("insecure").asBoolean(true);
            pveProperties.getHttp().setInsecure(insecure);
            logger.info("Set insecure from VCAP: {}", insecure);
        }
        return endpoint;
    }

    private boolean isConfigured(String id) {
        return pveProperties.getEndpoints().stream().anyMatch(e -> id != null && id.equals(e.getId()));
    }
}
