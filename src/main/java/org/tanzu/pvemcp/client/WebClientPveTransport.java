package org.tanzu.pvemcp.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link PveTransport} backed by Spring WebClient.
 *
 * The WebClient is bound to the endpoint's API root and carries the TLS settings from
 * {@link org.tanzu.pvemcp.config.WebClientConfig}. Each exchange is blocked on with the
 * fixed per-call timeout; every HTTP status is returned to the caller as data.
 */
public class WebClientPveTransport implements PveTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebClientPveTransport.class);

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientPveTransport(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public TransportResponse exchange(TransportRequest request) {
        logger.debug("PVE request: {}", request);
        try {
            WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                .uri(builder -> buildUri(builder, request))
                .headers(headers -> request.getHeaders().forEach(headers::set));

            WebClient.RequestHeadersSpec<?> ready = spec;
            if (request.isMutating() && !request.getParams().isEmpty()) {
                MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                request.getParams().forEach(form::add);
                ready = spec.contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form));
            }

            TransportResponse response = ready
                .exchangeToMono(clientResponse -> {
                    int status = clientResponse.statusCode().value();
                    HttpStatus resolved = HttpStatus.resolve(status);
                    String reason = resolved != null ? resolved.getReasonPhrase() : "";
                    return clientResponse.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new TransportResponse(status, reason, body));
                })
                .timeout(timeout)
                .block();

            if (response == null) {
                throw new TransportException("No answer to " + request.getMethod() + " " + request.getPath());
            }
            logger.debug("PVE response: {}", response);
            return response;
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new TransportException("Timed out after " + timeout.toMillis() + " ms", cause);
            }
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new TransportException(message, cause);
        }
    }

    private static URI buildUri(UriBuilder builder, TransportRequest request) {
        builder.path(request.getPath());
        if (!request.isMutating()) {
            request.getParams().forEach(builder::queryParam);
        }
        return builder.build();
    }
}
