package com.fleetwarden.dispatch.api;

import com.fleetwarden.core.events.UiBroadcaster;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link UiBroadcaster} that forwards bus broadcasts to connected SSE clients.
 * <p>
 * Each client subscribes to one channel, or to all channels when none is given. Idle
 * connections get a comment heartbeat so proxies do not close them.
 */
@Service
public class SseBroadcaster implements UiBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SseBroadcaster.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final long timeoutMs;
    private final CopyOnWriteArrayList<Client> clients = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseBroadcaster() {
        this(DEFAULT_TIMEOUT_MS);
    }

    SseBroadcaster(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        clients.forEach(client -> client.emitter.complete());
        clients.clear();
    }

    /**
     * Registers a client.
     *
     * @param channel channel to receive, {@code null} for every channel
     */
    public SseEmitter subscribe(String channel) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Client client = new Client(channel, emitter);
        clients.add(client);

        emitter.onCompletion(() -> clients.remove(client));
        emitter.onTimeout(() -> clients.remove(client));
        emitter.onError(ex -> clients.remove(client));

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.debug("SSE client went away before the handshake: {}", e.getMessage());
            clients.remove(client);
        }
        log.debug("SSE client subscribed (channel={}, clients={})", channel == null ? "*" : channel, clients.size());
        return emitter;
    }

    @Override
    public void broadcast(List<String> channels, String type, Map<String, Object> payload) {
        for (Client client : clients) {
            if (client.channel != null && !channels.contains(client.channel)) {
                continue;
            }
            try {
                client.emitter.send(SseEmitter.event().name(type).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE client after failed send of {}: {}", type, e.getMessage());
                clients.remove(client);
            }
        }
    }

    public int clientCount() {
        return clients.size();
    }

    private void sendHeartbeats() {
        for (Client client : clients) {
            try {
                client.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                clients.remove(client);
            }
        }
    }

    private record Client(String channel, SseEmitter emitter) {}
}
