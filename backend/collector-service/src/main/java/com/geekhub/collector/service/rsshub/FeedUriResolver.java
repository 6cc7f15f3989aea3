package com.geekhub.collector.service.rsshub;

import com.geekhub.collector.dto.FeedUriParseResult;
import com.geekhub.collector.dto.GatewayRoute;
import com.geekhub.collector.dto.RssHubSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Turns feed addresses that point at a RssHub gateway into plain HTTPS feed URLs.
 *
 * Accepted shapes:
 * <ul>
 *   <li>{@code rsshub://namespace/route} and {@code rsshub://custom.host/namespace/route}</li>
 *   <li>{@code https://rsshub.app/namespace/route} and other known gateway hosts</li>
 *   <li>bare {@code namespace/route}</li>
 * </ul>
 * {@link #parse(String, String)} is a pure string transform; it never touches the network.
 */
@Service
@Slf4j
public class FeedUriResolver {

    public static final String SCHEME = "rsshub://";
    public static final String DEFAULT_INSTANCE = "https://rsshub.app";

    static final List<String> KNOWN_HOSTS = List.of("rsshub.app", "rsshub.rssforever.com", "rss.wifease.com");
    static final String GATEWAY_KEYWORD = "rsshub";

    static final String ERROR_INVALID_INPUT = "Invalid input";
    static final String ERROR_NOT_GATEWAY = "Not a RssHub URL";
    static final String ERROR_INVALID_FORMAT = "Invalid RssHub URL format";

    private volatile RssHubSettings settings;

    public FeedUriResolver(
            @Value("${collector.rsshub.enabled:false}") boolean enabled,
            @Value("${collector.rsshub.instance-url:}") String instanceUrl) {
        this.settings = new RssHubSettings(enabled, instanceUrl);
    }

    /**
     * Parses against the configured instance when one is enabled, the public instance otherwise.
     */
    public FeedUriParseResult parse(String input) {
        return parse(input, configuredInstance());
    }

    /**
     * @param input       feed address as entered by the user
     * @param instanceUrl gateway base URL for scheme and bare-route forms; {@code null} means the public instance
     */
    public static FeedUriParseResult parse(String input, String instanceUrl) {
        if (input == null || input.isBlank()) {
            return FeedUriParseResult.invalid(ERROR_INVALID_INPUT);
        }
        String defaultInstance = normalizeInstance(instanceUrl);

        if (input.startsWith(SCHEME)) {
            return parseScheme(input.substring(SCHEME.length()), defaultInstance);
        }

        if (input.startsWith("https://") || input.startsWith("http://")) {
            return parseGatewayUrl(input);
        }

        if (input.contains("/") && !input.contains("://")) {
            return FeedUriParseResult.of(defaultInstance + "/" + input, defaultInstance);
        }

        return FeedUriParseResult.invalid(ERROR_INVALID_FORMAT);
    }

    /**
     * @return the feed URL, or empty when the input is not a gateway address
     */
    public Optional<String> resolve(String input) {
        FeedUriParseResult result = parse(input);
        return Optional.ofNullable(result.valid() ? result.feedUrl() : null);
    }

    public boolean isGatewayUrl(String input) {
        return parse(input).valid();
    }

    /**
     * Splits a gateway address into namespace and route, e.g. {@code twitter} and {@code user/karlseguin}.
     * Addresses that are not gateway addresses, or have fewer than two path segments, yield {@link GatewayRoute#EMPTY}.
     */
    public GatewayRoute extractRoute(String input) {
        FeedUriParseResult result = parse(input, DEFAULT_INSTANCE);
        if (!result.valid() || result.feedUrl() == null) {
            return GatewayRoute.EMPTY;
        }
        try {
            String path = new URI(result.feedUrl()).getPath();
            if (path == null) {
                return GatewayRoute.EMPTY;
            }
            List<String> parts = Arrays.stream(path.split("/"))
                    .filter(part -> !part.isEmpty())
                    .toList();
            if (parts.size() < 2) {
                return GatewayRoute.EMPTY;
            }
            return new GatewayRoute(
                    parts.get(0),
                    String.join("/", parts.subList(1, parts.size())),
                    String.join("/", parts));
        } catch (URISyntaxException e) {
            log.debug("Cannot extract route from {}: {}", input, e.getMessage());
            return GatewayRoute.EMPTY;
        }
    }

    public RssHubSettings getSettings() {
        return settings;
    }

    public void updateSettings(RssHubSettings newSettings) {
        this.settings = newSettings != null ? newSettings : new RssHubSettings(false, null);
        log.info("RssHub settings updated: enabled={}, url={}", settings.isEnabled(), settings.getUrl());
    }

    private String configuredInstance() {
        RssHubSettings current = settings;
        if (current.isEnabled() && current.getUrl() != null && !current.getUrl().isBlank()) {
            return current.getUrl();
        }
        return null;
    }

    private static FeedUriParseResult parseScheme(String remainder, String defaultInstance) {
        int firstSlash = remainder.indexOf('/');
        if (firstSlash == -1) {
            return FeedUriParseResult.of(defaultInstance + "/" + remainder, defaultInstance);
        }
        String firstSegment = remainder.substring(0, firstSlash);
        if (firstSegment.contains(".")) {
            String customInstance = "https://" + firstSegment;
            return FeedUriParseResult.of(customInstance + "/" + remainder.substring(firstSlash + 1), customInstance);
        }
        return FeedUriParseResult.of(defaultInstance + "/" + remainder, defaultInstance);
    }

    private static FeedUriParseResult parseGatewayUrl(String input) {
        URI uri;
        try {
            uri = new URI(input);
        } catch (URISyntaxException e) {
            return FeedUriParseResult.invalid(e.getMessage());
        }
        String host = uri.getHost();
        if (host == null) {
            return FeedUriParseResult.invalid(ERROR_INVALID_FORMAT);
        }
        host = host.toLowerCase();
        if (isGatewayHost(host)) {
            return FeedUriParseResult.of(input, uri.getScheme() + "://" + host);
        }
        return FeedUriParseResult.invalid(ERROR_NOT_GATEWAY);
    }

    static boolean isGatewayHost(String host) {
        for (String known : KNOWN_HOSTS) {
            if (host.equals(known) || host.endsWith("." + known)) {
                return true;
            }
        }
        return host.contains(GATEWAY_KEYWORD);
    }

    private static String normalizeInstance(String instanceUrl) {
        if (instanceUrl == null || instanceUrl.isBlank()) {
            return DEFAULT_INSTANCE;
        }
        String trimmed = instanceUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? DEFAULT_INSTANCE : trimmed;
    }
}
