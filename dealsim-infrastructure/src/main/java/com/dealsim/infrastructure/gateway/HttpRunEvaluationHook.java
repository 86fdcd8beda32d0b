package com.dealsim.infrastructure.gateway;

import com.dealsim.domain.run.adapter.gateway.IRunEvaluationHook;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts finished runs to the evaluation service. Disabled when no path is configured.
 */
@Slf4j
@Component
public class HttpRunEvaluationHook implements IRunEvaluationHook {

    private final WebClient webClient;
    private final String evaluationPath;

    public HttpRunEvaluationHook(WebClient.Builder webClientBuilder,
                                 @Value("${engine.base-url:http://localhost:8090}") String baseUrl,
                                 @Value("${engine.evaluation-path:}") String evaluationPath) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.evaluationPath = evaluationPath;
    }

    @Override
    public void evaluate(Long runId, Long negotiationId, String outcome) {
        if (StringUtils.isBlank(evaluationPath)) {
            log.debug("Evaluation hook disabled. runId={}", runId);
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("simulationRunId", runId);
        body.put("negotiationId", negotiationId);
        body.put("outcome", outcome);
        webClient.post()
                .uri(evaluationPath)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .block(Duration.ofSeconds(60));
        log.info("Run evaluation submitted. runId={}, outcome={}", runId, outcome);
    }
}
