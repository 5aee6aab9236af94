package com.agrotrace.api.access;

import com.agrotrace.api.web.ApiResult;
import com.agrotrace.api.web.CallerHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

/**
 * Lets a caller see which roles it holds.
 */
@RestController
@RequestMapping("/api/v1/roles")
public class AccessController {

    private final RoleResolver roleResolver;

    public AccessController(RoleResolver roleResolver) {
        this.roleResolver = roleResolver;
    }

    /**
     * GET /api/v1/roles/me?subject={identity}
     */
    @GetMapping("/me")
    public ResponseEntity<ApiResult<CallerRoles>> getRoles(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestParam(required = false) String subject) {
        return ResponseEntity.ok(ApiResult.ok(
                new CallerRoles(callerId, subject, roleResolver.rolesOf(callerId, subject))));
    }

    public record CallerRoles(String caller, String subject, Set<Role> roles) {}
}
