package com.geekhub.collector.dto;

/**
 * Namespace and route of a RssHub address, e.g. {@code sspai} / {@code index}.
 */
public record GatewayRoute(String namespace, String route, String fullRoute) {

    public static final GatewayRoute EMPTY = new GatewayRoute(null, null, null);

    public boolean isEmpty() {
        return fullRoute == null;
    }
}
