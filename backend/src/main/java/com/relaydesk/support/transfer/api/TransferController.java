package com.relaydesk.support.transfer.api;

import com.relaydesk.support.auth.service.jwt.JwtService;
import com.relaydesk.support.common.api.ApiResponse;
import com.relaydesk.support.transfer.service.TransferQueueService;
import com.relaydesk.support.transfer.service.TransferService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
public class TransferController {

    private final TransferService transferService;
    private final TransferQueueService transferQueueService;
    private final JwtService jwtService;

    public TransferController(
            TransferService transferService,
            TransferQueueService transferQueueService,
            JwtService jwtService
    ) {
        this.transferService = transferService;
        this.transferQueueService = transferQueueService;
        this.jwtService = jwtService;
    }

    @GetMapping("/transfers")
    public ApiResponse<TransferListResponse> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "team_id", required = false) String teamId
    ) {
        var claims = jwtService.requireClaims(authorization);
        return ApiResponse.ok(transferService.listTransfers(claims, status, teamId));
    }

    @PostMapping("/transfers")
    public ApiResponse<TransferItem> create(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody CreateTransferRequest req
    ) {
        var claims = jwtService.requireClaims(authorization);
        return ApiResponse.ok(transferService.createTransfer(claims, req));
    }

    @PostMapping("/transfers/{id}/assign")
    public ApiResponse<AssignTransferResponse> assign(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String transferId,
            @RequestBody(required = false) AssignTransferRequest req
    ) {
        var claims = jwtService.requireClaims(authorization);
        return ApiResponse.ok(transferService.assignTransfer(claims, transferId, req));
    }

    @PostMapping("/transfers/pick")
    public ApiResponse<PickTransferResponse> pick(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "team_id", required = false) String teamId
    ) {
        var claims = jwtService.requireClaims(authorization);
        return ApiResponse.ok(transferQueueService.pickNextTransfer(claims, teamId)
                .map(t -> new PickTransferResponse(t, "picked"))
                .orElseGet(() -> new PickTransferResponse(null, "queue_empty")));
    }

    @PostMapping("/transfers/{id}/resume")
    public ApiResponse<Void> resume(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String transferId
    ) {
        var claims = jwtService.requireClaims(authorization);
        transferService.resumeFromTransfer(claims, transferId);
        return ApiResponse.ok(null);
    }
}
