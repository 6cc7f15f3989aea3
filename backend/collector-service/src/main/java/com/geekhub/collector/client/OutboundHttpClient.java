package com.geekhub.collector.client;

import com.geekhub.collector.exception.HttpFetchException;
import com.geekhub.collector.service.proxy.ProxyEndpoint;
import com.geekhub.collector.service.proxy.ProxyResolver;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Blocking HTTP access for the pipeline, routed through whatever proxy
 * {@link ProxyResolver} currently resolves to.
 *
 * The underlying {@link WebClient} is rebuilt when the resolved proxy changes.
 * Callers must not invoke this from an event-loop thread.
 */
@Component
@Slf4j
public class OutboundHttpClient {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/143.0.0.0 Safari/537.36";

    private final ProxyResolver proxyResolver;
    private final int connectTimeoutMs;
    private final int maxInMemorySize;
    private final AtomicReference<Dispatcher> dispatcher = new AtomicReference<>();

    public OutboundHttpClient(
            ProxyResolver proxyResolver,
            @Value("${collector.http.timeout.connect:10000}") int connectTimeoutMs,
            @Value("${collector.http.max-in-memory-size:10485760}") int maxInMemorySize) {
        this.proxyResolver = proxyResolver;
        this.connectTimeoutMs = connectTimeoutMs;
        this.maxInMemorySize = maxInMemorySize;
    }

    /**
     * GETs a resource without decoding it, so the caller can pick the charset from the
     * document itself.
     *
     * @throws HttpFetchException on non-2xx responses, timeouts and connection failures
     */
    public RawResponse getBytes(String url, Map<String, String> headers, Duration timeout) {
        Mono<RawResponse> request = webClient().get()
                .uri(URI.create(url))
                .headers(h -> headers.forEach(h::set))
                .exchangeToMono(OutboundHttpClient::readRaw);
        return execute(url, request, timeout);
    }

    /**
     * POSTs a JSON body and returns the response body as text.
     *
     * @throws HttpFetchException on non-2xx responses, timeouts and connection failures
     */
    public String postJson(String url, Map<String, String> headers, Object body, Duration timeout) {
        Mono<String> request = webClient().post()
                .uri(URI.create(url))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> headers.forEach(h::set))
                .bodyValue(body)
                .exchangeToMono(OutboundHttpClient::readBody);
        return execute(url, request, timeout);
    }

    /**
     * @return the proxy the current dispatcher routes through, if any
     */
    public Optional<ProxyEndpoint> currentProxy() {
        return proxyResolver.resolve();
    }

    private <T> T execute(String url, Mono<T> request, Duration timeout) {
        try {
            return request.timeout(timeout).block();
        } catch (HttpFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof HttpFetchException httpFetchException) {
                throw httpFetchException;
            }
            String message = cause instanceof TimeoutException
                    ? "Request timed out after " + timeout.toMillis() + "ms"
                    : Objects.requireNonNullElse(cause.getMessage(), cause.getClass().getSimpleName());
            log.debug("Request to {} failed: {}", url, message);
            throw new HttpFetchException(message, cause);
        }
    }

    private static Mono<String> readBody(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is2xxSuccessful()) {
            return response.bodyToMono(String.class).defaultIfEmpty("");
        }
        return response.releaseBody()
                .then(Mono.error(new HttpFetchException(status.value(), reasonPhrase(status))));
    }

    private static Mono<RawResponse> readRaw(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is2xxSuccessful()) {
            String contentType = response.headers().contentType().map(MediaType::toString).orElse(null);
            return response.bodyToMono(byte[].class)
                    .defaultIfEmpty(new byte[0])
                    .map(body -> new RawResponse(body, contentType));
        }
        return response.releaseBody()
                .then(Mono.error(new HttpFetchException(status.value(), reasonPhrase(status))));
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.getReasonPhrase() : "Unknown Status";
    }

    private WebClient webClient() {
        ProxyEndpoint proxy = proxyResolver.resolve().orElse(null);
        Dispatcher current = dispatcher.get();
        if (current == null || !Objects.equals(current.proxy(), proxy)) {
            current = new Dispatcher(proxy, buildWebClient(proxy));
            dispatcher.set(current);
            log.debug("Outbound dispatcher rebuilt: {}", proxy != null ? proxy.toUrl() : "direct");
        }
        return current.webClient();
    }

    private WebClient buildWebClient(ProxyEndpoint proxy) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .followRedirect(true);
        if (proxy != null) {
            httpClient = httpClient.proxy(spec -> spec
                    .type(ProxyProvider.Proxy.HTTP)
                    .host(proxy.host())
                    .port(proxy.port()));
        }
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();
    }

    /**
     * Undecoded response body with the {@code Content-Type} header it was served with.
     */
    public record RawResponse(byte[] body, String contentType) {
    }

    private record Dispatcher(ProxyEndpoint proxy, WebClient webClient) {
    }
}
