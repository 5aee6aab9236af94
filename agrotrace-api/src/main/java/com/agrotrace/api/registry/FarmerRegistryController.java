package com.agrotrace.api.registry;

import com.agrotrace.api.web.ApiResponses;
import com.agrotrace.api.web.ApiResult;
import com.agrotrace.api.web.CallerHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * REST API of the farmer registry.
 */
@RestController
@RequestMapping("/api/v1")
public class FarmerRegistryController {

    private final FarmerRegistryService registryService;

    public FarmerRegistryController(FarmerRegistryService registryService) {
        this.registryService = registryService;
    }

    /**
     * Register the caller as a farmer.
     * POST /api/v1/farmers
     */
    @PostMapping("/farmers")
    public ResponseEntity<ApiResult<Long>> register(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody RegisterRequest request) {
        return ApiResponses.created(registryService.register(
                callerId,
                request.name(),
                request.location(),
                request.farmSize() != null ? request.farmSize() : 0L,
                request.additionalInfo()));
    }

    /**
     * Owner-only bulk onboarding.
     * POST /api/v1/farmers/batch
     */
    @PostMapping("/farmers/batch")
    public ResponseEntity<ApiResult<List<Long>>> registerBatch(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody BatchRequest request) {
        return ApiResponses.created(registryService.registerBatch(callerId, request.entries()));
    }

    /**
     * GET /api/v1/farmers/{principal}
     */
    @GetMapping("/farmers/{principal}")
    public ResponseEntity<ApiResult<FarmerProfileView>> getProfile(@PathVariable String principal) {
        return registryService.getProfile(principal)
                .map(profile -> ResponseEntity.ok(ApiResult.ok(profile)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResult.absent("No farmer registered as " + principal)));
    }

    /**
     * GET /api/v1/farmers/by-id/{id}
     */
    @GetMapping("/farmers/by-id/{id}")
    public ResponseEntity<ApiResult<FarmerProfileView>> getById(@PathVariable long id) {
        return registryService.getById(id)
                .map(profile -> ResponseEntity.ok(ApiResult.ok(profile)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResult.absent("No farmer with id " + id)));
    }

    /**
     * GET /api/v1/farmers/{principal}/verified
     */
    @GetMapping("/farmers/{principal}/verified")
    public ResponseEntity<ApiResult<Boolean>> isVerified(@PathVariable String principal) {
        return ResponseEntity.ok(ApiResult.ok(registryService.isVerified(principal)));
    }

    /**
     * Verifier decision on a pending profile.
     * POST /api/v1/farmers/{principal}/verification
     */
    @PostMapping("/farmers/{principal}/verification")
    public ResponseEntity<ApiResult<Boolean>> verify(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable String principal,
            @RequestBody VerificationRequest request) {
        return ApiResponses.of(registryService.verify(callerId, principal, request.status()));
    }

    /**
     * Partial update of the caller's own profile.
     * PATCH /api/v1/farmers/me
     */
    @PatchMapping("/farmers/me")
    public ResponseEntity<ApiResult<Boolean>> updateProfile(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody ProfileUpdateRequest request) {
        return ApiResponses.of(registryService.updateProfile(callerId, ProfileUpdate.of(
                request.name(), request.location(), request.farmSize(), request.additionalInfo())));
    }

    /**
     * POST /api/v1/farmers/{principal}/deactivation
     */
    @PostMapping("/farmers/{principal}/deactivation")
    public ResponseEntity<ApiResult<Boolean>> deactivate(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable String principal) {
        return ApiResponses.of(registryService.deactivate(callerId, principal));
    }

    // ==================== Registry settings ====================

    /**
     * GET /api/v1/registry/settings
     */
    @GetMapping("/registry/settings")
    public ResponseEntity<ApiResult<RegistrySettingsView>> getSettings() {
        return ResponseEntity.ok(ApiResult.ok(registryService.getSettings()));
    }

    /**
     * PUT /api/v1/registry/fee
     */
    @PutMapping("/registry/fee")
    public ResponseEntity<ApiResult<Boolean>> setRegistrationFee(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody FeeRequest request) {
        return ApiResponses.of(registryService.setRegistrationFee(callerId, request.fee()));
    }

    /**
     * PUT /api/v1/registry/verifier
     */
    @PutMapping("/registry/verifier")
    public ResponseEntity<ApiResult<Boolean>> setVerifier(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody AccountRequest request) {
        return ApiResponses.of(registryService.setVerifier(callerId, request.account()));
    }

    /**
     * PUT /api/v1/registry/owner
     */
    @PutMapping("/registry/owner")
    public ResponseEntity<ApiResult<Boolean>> transferOwnership(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody AccountRequest request) {
        return ApiResponses.of(registryService.transferOwnership(callerId, request.account()));
    }

    /**
     * POST /api/v1/registry/withdrawals
     */
    @PostMapping("/registry/withdrawals")
    public ResponseEntity<ApiResult<Boolean>> withdrawFees(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody AmountRequest request) {
        return ApiResponses.of(registryService.withdrawFees(callerId, request.amount()));
    }

    // Request DTOs
    public record RegisterRequest(String name, String location, Long farmSize, String additionalInfo) {}

    public record BatchRequest(List<BatchRegistration> entries) {}

    public record VerificationRequest(String status) {}

    public record ProfileUpdateRequest(String name, String location, Long farmSize, String additionalInfo) {}

    public record FeeRequest(BigInteger fee) {}

    public record AccountRequest(String account) {}

    public record AmountRequest(BigInteger amount) {}
}
