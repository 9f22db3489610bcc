package com.riskscan.connect.service;

import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;

import java.io.IOException;
import java.time.Duration;

/**
 * Request settings shared by the provider clients: bounded timeouts, no automatic retries,
 * and non-2xx responses returned to the caller instead of thrown.
 */
final class ProviderHttp {

    private ProviderHttp() {
    }

    static HttpRequestFactory requestFactory(HttpTransport transport, int timeoutSeconds) {
        int timeoutMillis = (int) Duration.ofSeconds(timeoutSeconds).toMillis();
        return transport.createRequestFactory(request -> {
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
            request.setNumberOfRetries(0);
            request.setThrowExceptionOnExecuteError(false);
        });
    }

    static ProviderResponse execute(HttpRequest request) throws IOException {
        HttpResponse response = request.execute();
        try {
            return new ProviderResponse(response.getStatusCode(), response.parseAsString());
        } finally {
            response.disconnect();
        }
    }

    record ProviderResponse(int status, String body) {
        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
