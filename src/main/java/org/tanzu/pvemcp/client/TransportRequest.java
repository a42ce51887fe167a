package org.tanzu.pvemcp.client;

import org.springframework.http.HttpMethod;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One HTTP exchange to issue against an endpoint, relative to its API root.
 *
 * Parameters travel as query parameters on GET and as a form body otherwise.
 */
public final class TransportRequest {

    private final HttpMethod method;
    private final String path;
    private final Map<String, String> params;
    private final Map<String, String> headers;

    public TransportRequest(HttpMethod method, String path, Map<String, String> params, Map<String, String> headers) {
        this.method = method;
        this.path = path;
        this.params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public HttpMethod getMethod() { return method; }
    public String getPath() { return path; }
    public Map<String, String> getParams() { return params; }
    public Map<String, String> getHeaders() { return headers; }

    public boolean isMutating() {
        return !HttpMethod.GET.equals(method);
    }

    @Override
    public String toString() {
        // parameters may carry a password, so only their names are shown
        return "TransportRequest{" + method + " " + path + ", params=" + params.keySet() + "}";
    }
}
