package com.dealsim.trigger.http;

import com.dealsim.api.dto.RecoverRequestDTO;
import com.dealsim.api.dto.RecoveryOpportunityDTO;
import com.dealsim.api.response.Response;
import com.dealsim.domain.run.model.valobj.RecoveryOpportunity;
import com.dealsim.trigger.application.command.RunRecoveryApplicationService;
import com.dealsim.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Crash recovery API.
 */
@RestController
@RequestMapping("/api/simulation/recovery")
public class SimulationRecoveryController {

    private final RunRecoveryApplicationService runRecoveryApplicationService;

    public SimulationRecoveryController(RunRecoveryApplicationService runRecoveryApplicationService) {
        this.runRecoveryApplicationService = runRecoveryApplicationService;
    }

    @GetMapping("/{negotiationId}")
    public Response<RecoveryOpportunityDTO> opportunities(@PathVariable("negotiationId") Long negotiationId) {
        RecoveryOpportunity opportunity = runRecoveryApplicationService.findRecoveryOpportunities(negotiationId);
        RecoveryOpportunityDTO data = new RecoveryOpportunityDTO();
        data.setHasRecoverableSession(opportunity.isHasRecoverableSession());
        data.setQueueId(opportunity.getQueueId());
        data.setCheckpoint(opportunity.getCheckpoint());
        data.setOrphanedSimulations(opportunity.getOrphanedSimulations());
        return success(data);
    }

    @PostMapping("/{negotiationId}/recover")
    public Response<Integer> recover(@PathVariable("negotiationId") Long negotiationId,
                                     @RequestBody(required = false) RecoverRequestDTO request) {
        if (request == null || request.getRunIds() == null || request.getRunIds().isEmpty()) {
            RecoveryOpportunity opportunity = runRecoveryApplicationService.findRecoveryOpportunities(negotiationId);
            return success(runRecoveryApplicationService.recoverOrphanedSimulations(opportunity.getOrphanedSimulations()));
        }
        return success(runRecoveryApplicationService.recoverOrphanedSimulations(request.getRunIds()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
