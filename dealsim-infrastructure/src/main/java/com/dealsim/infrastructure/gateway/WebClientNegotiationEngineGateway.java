package com.dealsim.infrastructure.gateway;

import com.dealsim.domain.run.adapter.gateway.INegotiationEngineGateway;
import com.dealsim.domain.run.model.valobj.NegotiationRequest;
import com.dealsim.domain.run.model.valobj.NegotiationResult;
import com.dealsim.domain.run.model.valobj.RoundUpdate;
import com.dealsim.domain.result.service.DimensionKeys;
import com.dealsim.types.enums.NegotiationOutcomeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Negotiation engine adapter over HTTP.
 * <p>
 * The engine answers with newline-delimited JSON: zero or more {@code round} events followed
 * by one {@code result} event. Rounds are forwarded to the listener in arrival order.
 * </p>
 */
@Slf4j
@Component
public class WebClientNegotiationEngineGateway implements INegotiationEngineGateway {

    private static final ParameterizedTypeReference<Map<String, Object>> EVENT_TYPE =
            new ParameterizedTypeReference<Map<String, Object>>() {};

    private final WebClient webClient;
    private final String runPath;
    private final String cancelPath;
    private final Duration timeout;
    private final ConcurrentMap<Long, Sinks.Empty<Void>> inFlight = new ConcurrentHashMap<>();

    public WebClientNegotiationEngineGateway(WebClient.Builder webClientBuilder,
                                             @Value("${engine.base-url:http://localhost:8090}") String baseUrl,
                                             @Value("${engine.run-path:/api/negotiations/run}") String runPath,
                                             @Value("${engine.cancel-path:/api/negotiations/cancel}") String cancelPath,
                                             @Value("${engine.timeout-seconds:900}") long timeoutSeconds) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.runPath = runPath;
        this.cancelPath = cancelPath;
        this.timeout = Duration.ofSeconds(timeoutSeconds <= 0 ? 900 : timeoutSeconds);
    }

    @Override
    public NegotiationResult run(NegotiationRequest request, Consumer<RoundUpdate> roundListener) {
        Long runId = request.getRunId();
        Sinks.Empty<Void> cancelSignal = Sinks.empty();
        inFlight.put(runId, cancelSignal);
        AtomicReference<Map<String, Object>> resultRef = new AtomicReference<>();
        try {
            webClient.post()
                    .uri(runPath)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_NDJSON)
                    .bodyValue(toBody(request))
                    .retrieve()
                    .bodyToFlux(EVENT_TYPE)
                    .takeUntilOther(cancelSignal.asMono())
                    .doOnNext(event -> dispatch(runId, event, roundListener, resultRef))
                    .timeout(timeout)
                    .blockLast();
        } finally {
            inFlight.remove(runId);
        }
        Map<String, Object> result = resultRef.get();
        if (result == null) {
            throw new IllegalStateException("Negotiation engine returned no result. runId=" + runId);
        }
        return toResult(result);
    }

    @Override
    public void cancel(Long runId) {
        Sinks.Empty<Void> signal = inFlight.get(runId);
        if (signal != null) {
            signal.tryEmitEmpty();
        }
        if (StringUtils.isBlank(cancelPath)) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        webClient.post()
                .uri(cancelPath)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(10))
                .subscribe(ok -> log.debug("Engine cancel accepted. runId={}", runId),
                        ex -> log.warn("Engine cancel failed. runId={}, error={}", runId, ex.getMessage()));
    }

    private void dispatch(Long runId,
                          Map<String, Object> event,
                          Consumer<RoundUpdate> roundListener,
                          AtomicReference<Map<String, Object>> resultRef) {
        String type = event.get("type") == null ? "" : String.valueOf(event.get("type"));
        if ("result".equalsIgnoreCase(type)) {
            resultRef.set(event);
            return;
        }
        if (!"round".equalsIgnoreCase(type) || roundListener == null) {
            log.debug("Ignoring engine event. runId={}, type={}", runId, type);
            return;
        }
        Double round = DimensionKeys.coerceNumber(event.get("round"));
        roundListener.accept(RoundUpdate.builder()
                .round(round == null ? null : round.intValue())
                .agent(event.get("agent") == null ? null : String.valueOf(event.get("agent")))
                .message(event.get("message") == null ? null : String.valueOf(event.get("message")))
                .offer(asMap(event.get("offer")))
                .build());
    }

    @SuppressWarnings("unchecked")
    private NegotiationResult toResult(Map<String, Object> event) {
        String rawOutcome = event.get("outcome") == null ? null : String.valueOf(event.get("outcome"));
        Double rounds = DimensionKeys.coerceNumber(event.get("totalRounds"));
        List<Map<String, Object>> conversationLog = new ArrayList<>();
        Object rawLog = event.get("conversationLog");
        if (rawLog instanceof List) {
            for (Object item : (List<Object>) rawLog) {
                if (item instanceof Map) {
                    conversationLog.add((Map<String, Object>) item);
                }
            }
        }
        Map<String, Object> finalOffer = asMap(event.get("finalOffer"));
        Map<String, Object> dimensionValues = finalOffer == null ? null : asMap(finalOffer.get("dimension_values"));
        return NegotiationResult.builder()
                .outcome(NegotiationOutcomeEnum.resolve(rawOutcome))
                .rawOutcome(rawOutcome)
                .outcomeReason(event.get("outcomeReason") == null ? null : String.valueOf(event.get("outcomeReason")))
                .totalRounds(rounds == null ? 0 : rounds.intValue())
                .conversationLog(conversationLog)
                .finalDimensionValues(dimensionValues == null ? new LinkedHashMap<>() : dimensionValues)
                .build();
    }

    private Map<String, Object> toBody(NegotiationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("negotiationId", request.getNegotiationId());
        body.put("simulationRunId", request.getRunId());
        body.put("queueId", request.getQueueId());
        body.put("techniqueId", request.getTechniqueId());
        body.put("tacticId", request.getTacticId());
        body.put("personalityId", request.getPersonalityId());
        body.put("zopaDistance", request.getZopaDistance());
        body.put("maxRounds", request.getMaxRounds());
        return body;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
