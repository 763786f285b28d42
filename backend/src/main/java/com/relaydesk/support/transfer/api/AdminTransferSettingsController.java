package com.relaydesk.support.transfer.api;

import com.relaydesk.support.auth.service.jwt.JwtService;
import com.relaydesk.support.common.api.ApiResponse;
import com.relaydesk.support.transfer.service.TransferSettingsService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminTransferSettingsController {

    private final TransferSettingsService transferSettingsService;
    private final JwtService jwtService;

    public AdminTransferSettingsController(TransferSettingsService transferSettingsService, JwtService jwtService) {
        this.transferSettingsService = transferSettingsService;
        this.jwtService = jwtService;
    }

    @GetMapping("/transfer-settings")
    public ApiResponse<TransferSettingsDto> get(
            @RequestHeader(value = "Authorization", required = false) String authorization
    ) {
        var claims = jwtService.requireClaims(authorization);
        return ApiResponse.ok(transferSettingsService.get(claims));
    }

    @PutMapping("/transfer-settings")
    public ApiResponse<TransferSettingsDto> update(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestBody TransferSettingsDto req
    ) {
        var claims = jwtService.requireClaims(authorization);
        return ApiResponse.ok(transferSettingsService.update(claims, req));
    }
}
