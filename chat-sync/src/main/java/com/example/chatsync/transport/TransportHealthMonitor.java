package com.example.chatsync.transport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TransportHealthMonitor {

    private final RedissonPubSubTransport transport;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${chat.transport.health-check-interval:PT10S}').toMillis()}")
    public void checkBroker() {
        boolean wasConnected = transport.isConnected();
        boolean connected = transport.checkReachable();
        if (wasConnected && !connected) {
            log.warn("Redis broker unreachable; channel deliveries are paused until it answers again");
        }
    }
}
