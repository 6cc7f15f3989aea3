package com.geekhub.collector.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geekhub.collector.service.proxy.ProxyEndpoint;
import com.geekhub.collector.service.proxy.ProxyMode;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProxyStatus(ProxyMode mode, String proxyUrl, LocalDateTime resolvedAt) {

    public static ProxyStatus direct(LocalDateTime resolvedAt) {
        return new ProxyStatus(ProxyMode.DIRECT, null, resolvedAt);
    }

    public static ProxyStatus of(ProxyEndpoint endpoint, LocalDateTime resolvedAt) {
        return new ProxyStatus(endpoint.mode(), endpoint.toUrl(), resolvedAt);
    }
}
