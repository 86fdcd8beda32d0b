package com.dealsim.trigger.http;

import com.dealsim.api.dto.ExecuteRequestDTO;
import com.dealsim.api.dto.ExecuteResponseDTO;
import com.dealsim.api.dto.QueueCreateRequestDTO;
import com.dealsim.api.dto.QueueCreateResponseDTO;
import com.dealsim.api.dto.QueueStatusDTO;
import com.dealsim.api.dto.QueueSummaryDTO;
import com.dealsim.api.dto.RestartResponseDTO;
import com.dealsim.api.dto.RetryRunsRequestDTO;
import com.dealsim.api.dto.RunResultDTO;
import com.dealsim.api.dto.SimulationStatsDTO;
import com.dealsim.api.dto.SystemStatusDTO;
import com.dealsim.api.response.Response;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueCreateCommand;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.trigger.application.command.SimulationQueueCommandService;
import com.dealsim.trigger.application.query.SimulationQueueQueryService;
import com.dealsim.trigger.job.SimulationQueueScheduler;
import com.dealsim.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Simulation queue control API.
 */
@RestController
@RequestMapping("/api/simulation")
public class SimulationQueueController {

    private final SimulationQueueCommandService simulationQueueCommandService;
    private final SimulationQueueQueryService simulationQueueQueryService;
    private final SimulationQueueScheduler simulationQueueScheduler;

    public SimulationQueueController(SimulationQueueCommandService simulationQueueCommandService,
                                     SimulationQueueQueryService simulationQueueQueryService,
                                     SimulationQueueScheduler simulationQueueScheduler) {
        this.simulationQueueCommandService = simulationQueueCommandService;
        this.simulationQueueQueryService = simulationQueueQueryService;
        this.simulationQueueScheduler = simulationQueueScheduler;
    }

    @PostMapping("/queues")
    public Response<QueueCreateResponseDTO> createQueue(@RequestBody QueueCreateRequestDTO request) {
        if (request == null) {
            return illegal("Request body is required");
        }
        SimulationQueueEntity queue = simulationQueueCommandService.createQueue(QueueCreateCommand.builder()
                .negotiationId(request.getNegotiationId())
                .techniqueIds(request.getTechniqueIds())
                .tacticIds(request.getTacticIds())
                .personalitySelector(request.getPersonalities())
                .distanceSelector(request.getDistances())
                .build());
        QueueCreateResponseDTO data = new QueueCreateResponseDTO();
        data.setQueueId(queue.getId());
        data.setNegotiationId(queue.getNegotiationId());
        data.setTotalSimulations(queue.getTotalSimulations());
        data.setStatus(queue.getStatus() == null ? null : queue.getStatus().getCode());
        return success(data);
    }

    @GetMapping("/queues")
    public Response<List<QueueSummaryDTO>> listQueues(@RequestParam("negotiationId") Long negotiationId) {
        return success(simulationQueueQueryService.getQueuesByNegotiation(negotiationId));
    }

    @GetMapping("/queues/by-negotiation/{negotiationId}")
    public Response<List<QueueSummaryDTO>> listQueuesByNegotiation(@PathVariable("negotiationId") Long negotiationId) {
        return success(simulationQueueQueryService.getQueuesByNegotiation(negotiationId));
    }

    @GetMapping("/queues/{id}/status")
    public Response<QueueStatusDTO> status(@PathVariable("id") Long queueId) {
        return success(simulationQueueQueryService.getQueueStatus(queueId));
    }

    @GetMapping("/queues/{id}/results")
    public Response<List<RunResultDTO>> results(@PathVariable("id") Long queueId) {
        return success(simulationQueueQueryService.getQueueResults(queueId));
    }

    @PostMapping("/queues/{id}/start")
    public Response<QueueStatusDTO> start(@PathVariable("id") Long queueId) {
        simulationQueueCommandService.startQueue(queueId);
        return success(simulationQueueQueryService.getQueueStatus(queueId));
    }

    @PostMapping("/queues/{id}/pause")
    public Response<QueueStatusDTO> pause(@PathVariable("id") Long queueId) {
        simulationQueueCommandService.pauseQueue(queueId);
        return success(simulationQueueQueryService.getQueueStatus(queueId));
    }

    @PostMapping("/queues/{id}/resume")
    public Response<QueueStatusDTO> resume(@PathVariable("id") Long queueId) {
        simulationQueueCommandService.resumeQueue(queueId);
        return success(simulationQueueQueryService.getQueueStatus(queueId));
    }

    @PostMapping("/queues/{id}/stop")
    public Response<RestartResponseDTO> stop(@PathVariable("id") Long queueId) {
        return success(affected(queueId, simulationQueueCommandService.stopQueue(queueId)));
    }

    @PostMapping("/queues/{id}/restart-failed")
    public Response<RestartResponseDTO> restartFailed(@PathVariable("id") Long queueId) {
        return success(affected(queueId, simulationQueueCommandService.restartFailedSimulations(queueId)));
    }

    @PostMapping("/queues/{id}/retry")
    public Response<RestartResponseDTO> retry(@PathVariable("id") Long queueId,
                                              @RequestBody(required = false) RetryRunsRequestDTO request) {
        List<Long> runIds = request == null ? null : request.getRunIds();
        return success(affected(queueId, simulationQueueCommandService.retryFailedRuns(queueId, runIds)));
    }

    @PostMapping("/queues/{id}/execute")
    public Response<ExecuteResponseDTO> execute(@PathVariable("id") Long queueId,
                                                @RequestBody(required = false) ExecuteRequestDTO request) {
        String mode = request == null || request.getMode() == null
                ? SimulationQueueCommandService.MODE_NEXT : request.getMode();
        boolean hasMore = simulationQueueCommandService.executeQueue(queueId, mode);
        ExecuteResponseDTO data = new ExecuteResponseDTO();
        data.setQueueId(queueId);
        data.setMode(mode);
        data.setHasMore(hasMore);
        data.setQueueStatus(simulationQueueQueryService.getQueueStatus(queueId).getStatus());
        return success(data);
    }

    @PostMapping("/runs/{id}/restart")
    public Response<RestartResponseDTO> restartRun(@PathVariable("id") Long runId) {
        SimulationRunEntity run = simulationQueueCommandService.restartSingleRun(runId);
        return success(affected(run.getQueueId(), 1));
    }

    @PostMapping("/negotiations/{id}/stop")
    public Response<Integer> stopNegotiation(@PathVariable("id") Long negotiationId) {
        return success(simulationQueueCommandService.stopQueuesForNegotiation(negotiationId));
    }

    @GetMapping("/negotiations/{id}/stats")
    public Response<SimulationStatsDTO> stats(@PathVariable("id") Long negotiationId) {
        return success(simulationQueueQueryService.getSimulationStats(negotiationId));
    }

    @GetMapping("/system/status")
    public Response<SystemStatusDTO> systemStatus() {
        return success(simulationQueueQueryService.getSystemStatus());
    }

    @PostMapping("/system/reset-processing")
    public Response<Integer> resetProcessing() {
        return success(simulationQueueScheduler.resetProcessingQueues());
    }

    private RestartResponseDTO affected(Long queueId, int count) {
        RestartResponseDTO data = new RestartResponseDTO();
        data.setQueueId(queueId);
        data.setAffectedCount(count);
        return data;
    }

    private <T> Response<T> illegal(String message) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(message)
                .build();
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
