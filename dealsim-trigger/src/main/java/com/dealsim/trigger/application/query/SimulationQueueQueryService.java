package com.dealsim.trigger.application.query;

import com.dealsim.api.dto.CurrentRunDTO;
import com.dealsim.api.dto.QueueStatusDTO;
import com.dealsim.api.dto.QueueSummaryDTO;
import com.dealsim.api.dto.RunResultDTO;
import com.dealsim.api.dto.SimulationStatsDTO;
import com.dealsim.api.dto.SystemStatusDTO;
import com.dealsim.domain.negotiation.adapter.repository.INegotiationRepository;
import com.dealsim.domain.negotiation.model.entity.NegotiationEntity;
import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.CurrentRunView;
import com.dealsim.domain.queue.model.valobj.QueueProgressView;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.queue.service.QueueProgressDomainService;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.trigger.job.SimulationQueueScheduler;
import com.dealsim.types.enums.NegotiationStatusEnum;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.exception.AppException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Queue read use cases. Nothing here writes.
 */
@Service
public class SimulationQueueQueryService {

    private static final List<QueueStatusEnum> ACTIVE = Arrays.asList(
            QueueStatusEnum.PENDING, QueueStatusEnum.RUNNING, QueueStatusEnum.PAUSED);

    private final ISimulationQueueRepository simulationQueueRepository;
    private final ISimulationRunRepository simulationRunRepository;
    private final INegotiationRepository negotiationRepository;
    private final QueueProgressDomainService queueProgressDomainService;
    private final SimulationQueueScheduler simulationQueueScheduler;
    private final long averageRunSeconds;

    public SimulationQueueQueryService(ISimulationQueueRepository simulationQueueRepository,
                                       ISimulationRunRepository simulationRunRepository,
                                       INegotiationRepository negotiationRepository,
                                       QueueProgressDomainService queueProgressDomainService,
                                       SimulationQueueScheduler simulationQueueScheduler,
                                       @Value("${simulation.queue.average-run-seconds:60}") long averageRunSeconds) {
        this.simulationQueueRepository = simulationQueueRepository;
        this.simulationRunRepository = simulationRunRepository;
        this.negotiationRepository = negotiationRepository;
        this.queueProgressDomainService = queueProgressDomainService;
        this.simulationQueueScheduler = simulationQueueScheduler;
        this.averageRunSeconds = averageRunSeconds > 0 ? averageRunSeconds : 60L;
    }

    public QueueStatusDTO getQueueStatus(Long queueId) {
        SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
        if (queue == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Queue not found: " + queueId);
        }
        QueueRunStats stats = simulationRunRepository.summarize(queueId);
        List<SimulationRunEntity> running = simulationRunRepository.findByQueueIdAndStatuses(queueId,
                Collections.singletonList(RunStatusEnum.RUNNING));
        SimulationRunEntity current = running == null || running.isEmpty() ? null : running.get(0);
        return toStatusDTO(queueProgressDomainService.buildView(queue, stats, current, averageRunSeconds));
    }

    public List<QueueSummaryDTO> getQueuesByNegotiation(Long negotiationId) {
        if (negotiationId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "negotiationId must not be null");
        }
        return simulationQueueRepository.findByNegotiationId(negotiationId).stream()
                .map(this::toSummaryDTO)
                .collect(Collectors.toList());
    }

    public List<RunResultDTO> getQueueResults(Long queueId) {
        if (simulationQueueRepository.findById(queueId) == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Queue not found: " + queueId);
        }
        return simulationRunRepository.findByQueueId(queueId).stream()
                .map(this::toRunResultDTO)
                .collect(Collectors.toList());
    }

    public SimulationStatsDTO getSimulationStats(Long negotiationId) {
        NegotiationEntity negotiation = negotiationRepository.findById(negotiationId);
        if (negotiation == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Negotiation not found: " + negotiationId);
        }
        List<SimulationRunEntity> runs = simulationRunRepository.findByNegotiationId(negotiationId);
        int completed = countStatus(runs, RunStatusEnum.COMPLETED);
        int failed = countStatus(runs, RunStatusEnum.FAILED) + countStatus(runs, RunStatusEnum.TIMEOUT);
        SimulationStatsDTO dto = new SimulationStatsDTO();
        dto.setNegotiationId(negotiationId);
        dto.setTotalRuns(runs.size());
        dto.setCompletedRuns(completed);
        dto.setRunningRuns(countStatus(runs, RunStatusEnum.RUNNING));
        dto.setFailedRuns(failed);
        dto.setPendingRuns(countStatus(runs, RunStatusEnum.PENDING));
        dto.setSuccessRate(runs.isEmpty() ? 0D
                : BigDecimal.valueOf(completed * 100D / runs.size()).setScale(2, RoundingMode.HALF_UP).doubleValue());
        dto.setIsPlanned(negotiation.getStatus() == NegotiationStatusEnum.PLANNED);
        return dto;
    }

    public SystemStatusDTO getSystemStatus() {
        List<SimulationQueueEntity> active = simulationQueueRepository.findByStatuses(ACTIVE);
        List<Long> processing = simulationQueueScheduler.getProcessingQueueIds();
        SystemStatusDTO dto = new SystemStatusDTO();
        dto.setBackgroundProcessorRunning(simulationQueueScheduler.isRunning());
        dto.setActiveQueues(active.size());
        dto.setProcessingQueuesCount(processing.size());
        dto.setProcessingQueues(processing);
        dto.setQueues(active.stream().map(this::toSummaryDTO).collect(Collectors.toList()));
        return dto;
    }

    private int countStatus(List<SimulationRunEntity> runs, RunStatusEnum status) {
        return (int) runs.stream().filter(run -> run.getStatus() == status).count();
    }

    private QueueStatusDTO toStatusDTO(QueueProgressView view) {
        QueueStatusDTO dto = new QueueStatusDTO();
        dto.setQueueId(view.getQueueId());
        dto.setNegotiationId(view.getNegotiationId());
        dto.setStatus(view.getStatus() == null ? null : view.getStatus().getCode());
        dto.setTotalSimulations(view.getTotalSimulations());
        dto.setCompletedCount(view.getCompletedCount());
        dto.setFailedCount(view.getFailedCount());
        dto.setPendingCount(view.getPendingCount());
        dto.setRunningCount(view.getRunningCount());
        dto.setPausedCount(view.getPausedCount());
        dto.setAbortedCount(view.getAbortedCount());
        dto.setProgressPercentage(view.getProgressPercentage());
        dto.setEstimatedTimeRemaining(view.getEstimatedTimeRemaining());
        dto.setActualCost(view.getActualCost());
        dto.setEstimatedCost(view.getEstimatedCost());
        CurrentRunView current = view.getCurrentSimulation();
        if (current != null) {
            CurrentRunDTO currentDTO = new CurrentRunDTO();
            currentDTO.setRunId(current.getRunId());
            currentDTO.setRunNumber(current.getRunNumber());
            currentDTO.setTechniqueId(current.getTechniqueId());
            currentDTO.setTacticId(current.getTacticId());
            currentDTO.setStartedAt(current.getStartedAt());
            dto.setCurrentSimulation(currentDTO);
        }
        return dto;
    }

    private QueueSummaryDTO toSummaryDTO(SimulationQueueEntity queue) {
        QueueSummaryDTO dto = new QueueSummaryDTO();
        dto.setQueueId(queue.getId());
        dto.setNegotiationId(queue.getNegotiationId());
        dto.setStatus(queue.getStatus() == null ? null : queue.getStatus().getCode());
        dto.setTotalSimulations(queue.getTotalSimulations());
        dto.setCompletedCount(queue.getCompletedCount());
        dto.setFailedCount(queue.getFailedCount());
        dto.setEstimatedTotalCost(queue.getEstimatedTotalCost());
        dto.setActualTotalCost(queue.getActualTotalCost());
        dto.setLastError(queue.getLastError());
        dto.setCreatedAt(queue.getCreatedAt());
        dto.setStartedAt(queue.getStartedAt());
        dto.setCompletedAt(queue.getCompletedAt());
        return dto;
    }

    private RunResultDTO toRunResultDTO(SimulationRunEntity run) {
        RunResultDTO dto = new RunResultDTO();
        dto.setRunId(run.getId());
        dto.setQueueId(run.getQueueId());
        dto.setRunNumber(run.getRunNumber());
        dto.setExecutionOrder(run.getExecutionOrder());
        dto.setTechniqueId(run.getTechniqueId());
        dto.setTacticId(run.getTacticId());
        dto.setPersonalityId(run.getPersonalityId());
        dto.setZopaDistance(run.getZopaDistance());
        dto.setStatus(run.getStatus() == null ? null : run.getStatus().getCode());
        dto.setOutcome(run.getOutcome());
        dto.setOutcomeReason(run.getOutcomeReason());
        dto.setTotalRounds(run.getTotalRounds());
        dto.setRetryCount(run.getRetryCount());
        dto.setDealValue(run.getDealValue());
        dto.setActualCost(run.getActualCost());
        dto.setOtherDimensions(run.getOtherDimensions());
        dto.setStartedAt(run.getStartedAt());
        dto.setCompletedAt(run.getCompletedAt());
        return dto;
    }
}
