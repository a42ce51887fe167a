package org.tanzu.pvemcp.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * Configuration of the WebClient used to talk to PVE endpoints.
 *
 * PVE installations normally serve the API with a self-signed certificate. When
 * pve.http.insecure is true (the default) the client trusts any certificate while still
 * encrypting the transport. The per-call timeout is applied at the connection level here
 * and again on each exchange by the transport.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder shared by all endpoint transports.
     *
     * Each endpoint clones this builder and sets its own base URL.
     *
     * @param pveProperties The configuration containing the TLS and timeout settings
     * @return A configured WebClient.Builder
     * @throws RuntimeException if the SSL context cannot be created
     */
    @Bean
    public WebClient.Builder webClientBuilder(PveProperties pveProperties) {
        PveProperties.Http http = pveProperties.getHttp();
        logger.info("Configuring WebClient.Builder for PVE endpoints (timeout={}, insecure={})",
                   http.getTimeout(), http.isInsecure());

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getTimeout().toMillis())
            .responseTimeout(http.getTimeout());

        if (http.isInsecure()) {
            try {
                logger.warn("SSL certificate validation is DISABLED for PVE endpoints (insecure=true)");
                SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
                logger.debug("Created HttpClient with insecure SSL context");
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new RuntimeException("Failed to configure insecure SSL context", e);
            }
        } else {
            logger.info("Using default SSL validation for PVE endpoints");
        }

        return WebClient.builder()
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
