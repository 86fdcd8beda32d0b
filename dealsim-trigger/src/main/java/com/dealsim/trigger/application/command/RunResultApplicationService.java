package com.dealsim.trigger.application.command;

import com.dealsim.domain.catalog.adapter.repository.IReferenceCatalogRepository;
import com.dealsim.domain.negotiation.adapter.repository.INegotiationRepository;
import com.dealsim.domain.negotiation.model.entity.NegotiationEntity;
import com.dealsim.domain.result.adapter.repository.IRunResultRepository;
import com.dealsim.domain.result.model.valobj.ResultProcessingInput;
import com.dealsim.domain.result.model.valobj.SimulationResultArtifacts;
import com.dealsim.domain.result.service.SimulationResultDomainService;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.NegotiationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Turns a finished run into persisted artifacts. Failures are recorded on the run and never
 * change its status.
 */
@Slf4j
@Service
public class RunResultApplicationService {

    private final ISimulationRunRepository simulationRunRepository;
    private final IRunResultRepository runResultRepository;
    private final INegotiationRepository negotiationRepository;
    private final IReferenceCatalogRepository referenceCatalogRepository;
    private final SimulationResultDomainService simulationResultDomainService;

    public RunResultApplicationService(ISimulationRunRepository simulationRunRepository,
                                       IRunResultRepository runResultRepository,
                                       INegotiationRepository negotiationRepository,
                                       IReferenceCatalogRepository referenceCatalogRepository,
                                       SimulationResultDomainService simulationResultDomainService) {
        this.simulationRunRepository = simulationRunRepository;
        this.runResultRepository = runResultRepository;
        this.negotiationRepository = negotiationRepository;
        this.referenceCatalogRepository = referenceCatalogRepository;
        this.simulationResultDomainService = simulationResultDomainService;
    }

    /**
     * @return false when processing failed and the error was stored in the run metadata
     */
    public boolean processResult(SimulationRunEntity run, NegotiationResult result) {
        try {
            NegotiationEntity negotiation = negotiationRepository.findById(run.getNegotiationId());
            ResultProcessingInput input = ResultProcessingInput.builder()
                    .runId(run.getId())
                    .userRole(negotiation == null ? null : negotiation.getUserRole())
                    .dimensionValues(result.getFinalDimensionValues())
                    .conversationLog(result.getConversationLog())
                    .products(referenceCatalogRepository.findProductsByNegotiationId(run.getNegotiationId()))
                    .dimensions(negotiation == null ? null : negotiation.getDimensions())
                    .build();
            SimulationResultArtifacts artifacts = simulationResultDomainService.buildArtifacts(input);
            run.applyArtifacts(artifacts.getDealValue(), artifacts.getOtherDimensions());
            simulationRunRepository.updateArtifacts(run);
            runResultRepository.replaceForRun(run.getId(), artifacts.getDimensionRows(), artifacts.getProductRows());
            return true;
        } catch (Exception ex) {
            log.warn("Result processing failed. runId={}, queueId={}, error={}",
                    run.getId(), run.getQueueId(), ex.getMessage());
            run.recordAnalyticsError(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(),
                    LocalDateTime.now());
            try {
                simulationRunRepository.updateArtifacts(run);
            } catch (Exception persistEx) {
                log.warn("Failed to persist analytics error. runId={}, error={}", run.getId(), persistEx.getMessage());
            }
            return false;
        }
    }
}
