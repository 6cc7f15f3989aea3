package com.geekhub.collector.service.proxy;

/**
 * How the active outbound route was chosen.
 */
public enum ProxyMode {
    CONFIGURED,
    AUTO_DETECTED,
    ENVIRONMENT,
    DIRECT
}
