package org.tanzu.pvemcp.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.pvemcp.config.PveProperties;

/**
 * Builds one {@link WebClientPveTransport} per endpoint from the shared, TLS-configured
 * {@link WebClient.Builder}.
 */
@Component
public class WebClientTransportFactory implements PveTransportFactory {

    private static final Logger logger = LoggerFactory.getLogger(WebClientTransportFactory.class);

    private final WebClient.Builder webClientBuilder;
    private final PveProperties properties;

    public WebClientTransportFactory(WebClient.Builder webClientBuilder, PveProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.properties = properties;
    }

    @Override
    public PveTransport create(EndpointConfig config) {
        String baseUrl = config.baseUrl();
        logger.info("Creating WebClient transport for endpoint '{}': {}", config.getId(), baseUrl);
        WebClient webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
        return new WebClientPveTransport(webClient, properties.getHttp().getTimeout());
    }
}
