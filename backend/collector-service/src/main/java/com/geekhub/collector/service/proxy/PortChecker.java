package com.geekhub.collector.service.proxy;

import java.time.Duration;

/**
 * Checks whether something is listening on a TCP port.
 */
@FunctionalInterface
public interface PortChecker {

    boolean isReachable(String host, int port, Duration timeout);
}
