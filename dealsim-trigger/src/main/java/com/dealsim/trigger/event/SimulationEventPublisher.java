package com.dealsim.trigger.event;

import com.dealsim.domain.queue.model.valobj.SimulationEvent;
import com.dealsim.types.enums.SimulationEventTypeEnum;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sql.DataSource;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Simulation event broadcaster: in-process fan-out per queue and globally, plus best-effort
 * cross-instance fan-out through PostgreSQL NOTIFY. Events are not persisted and never replayed.
 */
@Slf4j
@Component
public class SimulationEventPublisher {

    private static final int LISTEN_TIMEOUT_MILLIS = 3000;
    private static final int RECONNECT_BACKOFF_MILLIS = 1000;
    /**
     * NOTIFY payloads are limited to 8000 bytes
     */
    private static final int MAX_NOTIFY_PAYLOAD_BYTES = 7900;
    private static final String DEFAULT_CHANNEL = "simulation_events_channel";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final ConcurrentMap<Long, ConcurrentMap<String, Consumer<SimulationEvent>>> subscribersByQueue;
    private final ConcurrentMap<String, Consumer<SimulationEvent>> globalSubscribers;
    private final ExecutorService notifyListenExecutor;
    private final String notifyChannel;
    private final String publisherInstanceId;
    private volatile boolean running;

    public SimulationEventPublisher() {
        this(null, new ObjectMapper().findAndRegisterModules(), DEFAULT_CHANNEL, "local");
    }

    @Autowired
    public SimulationEventPublisher(ObjectProvider<DataSource> dataSourceProvider,
                                    ObjectProvider<ObjectMapper> objectMapperProvider,
                                    @Value("${event.notify.channel:" + DEFAULT_CHANNEL + "}") String notifyChannel,
                                    @Value("${event.publisher.instance-id:}") String configuredInstanceId) {
        this(dataSourceProvider == null ? null : dataSourceProvider.getIfAvailable(),
                objectMapperProvider == null ? null : objectMapperProvider.getIfAvailable(),
                notifyChannel,
                configuredInstanceId);
    }

    private SimulationEventPublisher(DataSource dataSource,
                                     ObjectMapper objectMapper,
                                     String notifyChannel,
                                     String configuredInstanceId) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper == null ? new ObjectMapper().findAndRegisterModules() : objectMapper;
        this.subscribersByQueue = new ConcurrentHashMap<>();
        this.globalSubscribers = new ConcurrentHashMap<>();
        this.notifyListenExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "simulation-event-notify-listener");
            thread.setDaemon(true);
            return thread;
        });
        this.notifyChannel = (notifyChannel == null || notifyChannel.isBlank()) ? DEFAULT_CHANNEL : notifyChannel;
        this.publisherInstanceId = resolvePublisherId(configuredInstanceId);
        this.running = false;
    }

    @PostConstruct
    public void startNotifyListener() {
        if (dataSource == null) {
            log.info("Simulation event notify listener disabled because DataSource is unavailable.");
            return;
        }
        running = true;
        notifyListenExecutor.execute(this::listenLoop);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        notifyListenExecutor.shutdownNow();
    }

    public SimulationEvent publish(SimulationEventTypeEnum eventType,
                                   Long queueId,
                                   Long negotiationId,
                                   Map<String, Object> data) {
        if (eventType == null || queueId == null) {
            return null;
        }
        SimulationEvent event = SimulationEvent.builder()
                .type(eventType)
                .queueId(queueId)
                .negotiationId(negotiationId)
                .data(data == null ? Collections.emptyMap() : data)
                .timestamp(LocalDateTime.now())
                .build();
        dispatch(event);
        notifyCrossInstance(event);
        return event;
    }

    public void subscribe(Long queueId, String subscriberId, Consumer<SimulationEvent> consumer) {
        if (queueId == null || subscriberId == null || consumer == null) {
            return;
        }
        subscribersByQueue.computeIfAbsent(queueId, key -> new ConcurrentHashMap<>()).put(subscriberId, consumer);
    }

    public void unsubscribe(Long queueId, String subscriberId) {
        if (queueId == null || subscriberId == null) {
            return;
        }
        ConcurrentMap<String, Consumer<SimulationEvent>> subscribers = subscribersByQueue.get(queueId);
        if (subscribers == null) {
            return;
        }
        subscribers.remove(subscriberId);
        if (subscribers.isEmpty()) {
            subscribersByQueue.remove(queueId, subscribers);
        }
    }

    /**
     * Receives the events of every queue.
     */
    public void subscribeAll(String subscriberId, Consumer<SimulationEvent> consumer) {
        if (subscriberId == null || consumer == null) {
            return;
        }
        globalSubscribers.put(subscriberId, consumer);
    }

    public void unsubscribeAll(String subscriberId) {
        if (subscriberId != null) {
            globalSubscribers.remove(subscriberId);
        }
    }

    private void dispatch(SimulationEvent event) {
        ConcurrentMap<String, Consumer<SimulationEvent>> subscribers = subscribersByQueue.get(event.getQueueId());
        if (subscribers != null) {
            deliver(event, subscribers);
        }
        deliver(event, globalSubscribers);
    }

    private void deliver(SimulationEvent event, Map<String, Consumer<SimulationEvent>> subscribers) {
        for (Map.Entry<String, Consumer<SimulationEvent>> entry : subscribers.entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (Exception ex) {
                log.debug("Simulation event dispatch failed. queueId={}, subscriberId={}, type={}, error={}",
                        event.getQueueId(), entry.getKey(), event.getType(), ex.getMessage());
            }
        }
    }

    private void notifyCrossInstance(SimulationEvent event) {
        if (dataSource == null) {
            return;
        }
        String payload;
        try {
            ObjectNode node = objectMapper.valueToTree(event);
            node.put("publisherId", publisherInstanceId);
            payload = objectMapper.writeValueAsString(node);
        } catch (Exception ex) {
            log.debug("Simulation event serialization failed. queueId={}, type={}, error={}",
                    event.getQueueId(), event.getType(), ex.getMessage());
            return;
        }
        if (payload.getBytes(StandardCharsets.UTF_8).length > MAX_NOTIFY_PAYLOAD_BYTES) {
            log.debug("Simulation event too large for notify, skipped. queueId={}, type={}",
                    event.getQueueId(), event.getType());
            return;
        }
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT pg_notify(?, ?)")) {
            statement.setString(1, notifyChannel);
            statement.setString(2, payload);
            statement.execute();
        } catch (Exception ex) {
            log.debug("Simulation event notify failed. queueId={}, type={}, error={}",
                    event.getQueueId(), event.getType(), ex.getMessage());
        }
    }

    private void listenLoop() {
        while (running) {
            try (Connection connection = dataSource.getConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + notifyChannel);
                PGConnection pgConnection = connection.unwrap(PGConnection.class);
                while (running && !connection.isClosed()) {
                    PGNotification[] notifications = pgConnection.getNotifications(LISTEN_TIMEOUT_MILLIS);
                    if (notifications == null || notifications.length == 0) {
                        continue;
                    }
                    for (PGNotification notification : notifications) {
                        handleNotification(notification == null ? null : notification.getParameter());
                    }
                }
            } catch (Exception ex) {
                if (!running) {
                    return;
                }
                log.warn("Simulation event notify listener failed, retrying. channel={}, error={}",
                        notifyChannel, ex.getMessage());
                try {
                    Thread.sleep(RECONNECT_BACKOFF_MILLIS);
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void handleNotification(String payload) {
        if (payload == null || payload.isBlank()) {
            return;
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (publisherInstanceId.equals(node.path("publisherId").asText(null))) {
                return;
            }
            SimulationEventTypeEnum type = SimulationEventTypeEnum.fromEventName(node.path("type").asText(null));
            if (type == null || !node.hasNonNull("queueId")) {
                return;
            }
            Map<String, Object> data = node.hasNonNull("data")
                    ? objectMapper.convertValue(node.get("data"), Map.class)
                    : new LinkedHashMap<>();
            SimulationEvent event = SimulationEvent.builder()
                    .type(type)
                    .queueId(node.get("queueId").asLong())
                    .negotiationId(node.hasNonNull("negotiationId") ? node.get("negotiationId").asLong() : null)
                    .data(data)
                    .timestamp(LocalDateTime.now())
                    .build();
            dispatch(event);
        } catch (Exception ex) {
            log.debug("Simulation event notification ignored. channel={}, error={}", notifyChannel, ex.getMessage());
        }
    }

    private String resolvePublisherId(String configuredInstanceId) {
        if (configuredInstanceId != null && !configuredInstanceId.isBlank()) {
            return configuredInstanceId;
        }
        try {
            String host = InetAddress.getLocalHost().getHostName();
            String pid = ManagementFactory.getRuntimeMXBean().getName();
            return host + "-" + pid;
        } catch (Exception ex) {
            return "instance-" + System.nanoTime();
        }
    }
}
