package com.geekhub.collector.service.proxy;

import com.geekhub.collector.dto.ProxySettings;
import com.geekhub.collector.dto.ProxyStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides which HTTP proxy outbound requests go through.
 *
 * Resolution order:
 * <ol>
 *   <li>enabled proxy settings: a local port scan when auto-detect is on, otherwise host/port</li>
 *   <li>{@code HTTP_PROXY} / {@code HTTPS_PROXY}, then the local port scan</li>
 *   <li>direct connection</li>
 * </ol>
 * Every candidate must accept a TCP connection; an unreachable proxy never fails a caller,
 * it only falls through to the next option. The result is memoized until the settings
 * change or {@link #invalidate()} is called. Two threads resolving at the same time may
 * both check ports; the last result wins.
 */
@Service
@Slf4j
public class ProxyResolver {

    /**
     * Default ports of common local proxy clients (Clash, Clash Verge, v2rayN, ...).
     */
    public static final List<Integer> CANDIDATE_PORTS = List.of(7890, 7891, 7897, 7898, 10808, 10809, 1080, 789);

    static final String LOCAL_HOST = "127.0.0.1";

    private final PortChecker portChecker;
    private final Map<String, String> environment;
    private final Duration checkTimeout;
    private final Clock clock;

    private volatile ProxySettings settings;
    private final AtomicReference<Resolution> resolution = new AtomicReference<>();

    @Autowired
    public ProxyResolver(
            PortChecker portChecker,
            Clock clock,
            @Value("${collector.proxy.enabled:false}") boolean enabled,
            @Value("${collector.proxy.auto-detect:true}") boolean autoDetect,
            @Value("${collector.proxy.host:}") String host,
            @Value("${collector.proxy.port:}") String port,
            @Value("${collector.proxy.check-timeout-ms:500}") long checkTimeoutMs) {
        this(portChecker, clock, new ProxySettings(enabled, autoDetect, host, port), System.getenv(),
                Duration.ofMillis(checkTimeoutMs));
    }

    public ProxyResolver(PortChecker portChecker, Clock clock, ProxySettings settings,
                         Map<String, String> environment, Duration checkTimeout) {
        this.portChecker = portChecker;
        this.clock = clock;
        this.settings = settings != null ? settings : ProxySettings.disabled();
        this.environment = environment;
        this.checkTimeout = checkTimeout;
    }

    /**
     * @return the proxy to use, or empty for a direct connection
     */
    public Optional<ProxyEndpoint> resolve() {
        Resolution current = resolution.get();
        if (current == null) {
            current = new Resolution(detect(), LocalDateTime.now(clock));
            resolution.set(current);
            if (current.endpoint() != null) {
                log.info("[Proxy] Using proxy: {} ({})", current.endpoint().toUrl(), current.endpoint().mode());
            } else {
                log.info("[Proxy] No proxy detected, using direct connection");
            }
        }
        return Optional.ofNullable(current.endpoint());
    }

    /**
     * Resolves if needed and reports the active route.
     */
    public ProxyStatus describe() {
        resolve();
        Resolution current = resolution.get();
        LocalDateTime resolvedAt = current != null ? current.resolvedAt() : LocalDateTime.now(clock);
        if (current == null || current.endpoint() == null) {
            return ProxyStatus.direct(resolvedAt);
        }
        return ProxyStatus.of(current.endpoint(), resolvedAt);
    }

    public ProxySettings getSettings() {
        return settings;
    }

    /**
     * Replaces the settings; the next {@link #resolve()} checks ports again.
     */
    public void updateSettings(ProxySettings newSettings) {
        this.settings = newSettings != null ? newSettings : ProxySettings.disabled();
        invalidate();
        log.info("[Proxy] Settings updated: enabled={}, autoDetect={}", settings.isEnabled(), settings.isAutoDetect());
    }

    public void invalidate() {
        resolution.set(null);
    }

    private ProxyEndpoint detect() {
        ProxySettings current = settings;
        if (current.isEnabled()) {
            if (current.isAutoDetect()) {
                return scanLocalPorts();
            }
            ProxyEndpoint configured = configuredEndpoint(current);
            if (configured != null) {
                return configured;
            }
            log.warn("[Proxy] Configured proxy {}:{} is not reachable, using direct connection",
                    current.getHost(), current.getPort());
            return null;
        }

        ProxyEndpoint fromEnvironment = environmentEndpoint();
        if (fromEnvironment != null) {
            return fromEnvironment;
        }
        return scanLocalPorts();
    }

    private ProxyEndpoint configuredEndpoint(ProxySettings current) {
        String host = current.getHost();
        if (host == null || host.isBlank()) {
            return null;
        }
        Integer port = parsePort(current.getPort());
        if (port == null) {
            log.warn("[Proxy] Invalid configured port: {}", current.getPort());
            return null;
        }
        return portChecker.isReachable(host, port, checkTimeout)
                ? new ProxyEndpoint(host, port, ProxyMode.CONFIGURED)
                : null;
    }

    private ProxyEndpoint environmentEndpoint() {
        String proxyUrl = firstNonBlank(environment.get("HTTP_PROXY"), environment.get("HTTPS_PROXY"));
        if (proxyUrl == null) {
            return null;
        }
        try {
            URI uri = URI.create(proxyUrl);
            String host = uri.getHost();
            if (host == null) {
                log.debug("[Proxy] Ignoring environment proxy without host: {}", proxyUrl);
                return null;
            }
            int port = uri.getPort() > 0 ? uri.getPort() : 80;
            if (portChecker.isReachable(host, port, checkTimeout)) {
                return new ProxyEndpoint(host, port, ProxyMode.ENVIRONMENT);
            }
            log.debug("[Proxy] Environment proxy {} is not reachable", proxyUrl);
        } catch (IllegalArgumentException e) {
            log.debug("[Proxy] Invalid environment proxy URL '{}': {}", proxyUrl, e.getMessage());
        }
        return null;
    }

    private ProxyEndpoint scanLocalPorts() {
        for (int port : CANDIDATE_PORTS) {
            if (portChecker.isReachable(LOCAL_HOST, port, checkTimeout)) {
                log.info("[Proxy] Auto-detected proxy on port {}", port);
                return new ProxyEndpoint(LOCAL_HOST, port, ProxyMode.AUTO_DETECTED);
            }
        }
        return null;
    }

    private static Integer parsePort(String port) {
        if (port == null || port.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(port.trim());
            return value > 0 && value <= 65535 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }

    private record Resolution(ProxyEndpoint endpoint, LocalDateTime resolvedAt) {
    }
}
