package com.geekhub.collector.service.proxy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

@Component
@Slf4j
public class SocketPortChecker implements PortChecker {

    @Override
    public boolean isReachable(String host, int port, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException | IllegalArgumentException e) {
            log.trace("Port {}:{} not reachable: {}", host, port, e.getMessage());
            return false;
        }
    }
}
