package com.geekhub.collector.service.proxy;

/**
 * An HTTP proxy that accepted a connection when it was resolved.
 */
public record ProxyEndpoint(String host, int port, ProxyMode mode) {

    public String toUrl() {
        return "http://" + host + ":" + port;
    }
}
