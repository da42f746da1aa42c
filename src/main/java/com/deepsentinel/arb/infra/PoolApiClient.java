package com.deepsentinel.arb.infra;

import com.deepsentinel.arb.config.ArbProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionSpec;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * HTTP access to the pool price feed.
 */
@Slf4j
@Service
public class PoolApiClient {

    private static final int MAX_ATTEMPTS = 3;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;

    @Autowired
    public PoolApiClient(ObjectMapper objectMapper, ArbProperties properties) {
        this(buildClient(), objectMapper, properties.getPools().getRequestsPerSecond());
    }

    PoolApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, double requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            throw new IllegalStateException("arb.pools.requests-per-second must be positive");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = new RateLimiter(requestsPerSecond);
    }

    private static OkHttpClient buildClient() {
        ConnectionSpec spec = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
                .allEnabledTlsVersions()
                .allEnabledCipherSuites()
                .build();

        return new OkHttpClient.Builder()
                .connectionSpecs(Arrays.asList(spec, ConnectionSpec.CLEARTEXT))
                .readTimeout(30, TimeUnit.SECONDS)
                .connectTimeout(10, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    /**
     * GETs {@code url} and parses the body as JSON.
     *
     * @throws PoolFeedException when the feed keeps failing after retries
     */
    public JsonNode fetch(String url) {
        rateLimiter.acquire();

        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .build();

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    if (response.code() == 429 && attempt < MAX_ATTEMPTS - 1) {
                        log.warn("Pool feed rate limited, backing off (attempt {})", attempt + 1);
                        backoff(1000L * (attempt + 1));
                        continue;
                    }
                    throw new PoolFeedException("Pool feed request failed: " + response.code() + " "
                            + response.message());
                }
                ResponseBody body = response.body();
                if (body == null) {
                    throw new PoolFeedException("Pool feed returned an empty body");
                }
                return objectMapper.readTree(body.string());
            } catch (IOException e) {
                if (attempt == MAX_ATTEMPTS - 1) {
                    throw new PoolFeedException("Failed to call pool feed after retries: " + url, e);
                }
                // Transient network error
                backoff(500);
            }
        }
        throw new PoolFeedException("Pool feed still rate limited after retries: " + url);
    }

    private static void backoff(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolFeedException("Interrupted while backing off", e);
        }
    }

    public static class PoolFeedException extends RuntimeException {
        public PoolFeedException(String message) {
            super(message);
        }

        public PoolFeedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Simple Token Bucket Rate Limiter
     */
    private static class RateLimiter {
        private final double permitsPerSecond;
        private long lastSync = System.nanoTime();
        private double storedPermits = 1.0;

        RateLimiter(double permitsPerSecond) {
            this.permitsPerSecond = permitsPerSecond;
        }

        synchronized void acquire() {
            long now = System.nanoTime();
            double newPermits = (now - lastSync) / 1_000_000_000.0 * permitsPerSecond;
            storedPermits = Math.min(1.0, storedPermits + newPermits); // Max burst 1.0
            lastSync = now;

            if (storedPermits >= 1.0) {
                storedPermits -= 1.0;
                return;
            }

            double missing = 1.0 - storedPermits;
            long waitNanos = (long) (missing / permitsPerSecond * 1_000_000_000.0);

            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            lastSync = System.nanoTime();
            storedPermits = 0;
        }
    }
}
