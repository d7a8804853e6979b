package com.tessera.tenancy.api;

import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantRole;
import com.tessera.tenancy.api.dto.MemberResponse;
import com.tessera.tenancy.api.dto.RoleAssignmentRequest;
import com.tessera.tenancy.infrastructure.web.RequireTenantRole;
import com.tessera.tenancy.service.MembershipChange;
import com.tessera.tenancy.service.TenantLifecycleService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Membership management within one tenant.
 */
@RestController
@RequestMapping("/api/tenant/{tenantIdentifier}/members")
public class TenantMembershipController {

    private final TenantLifecycleService lifecycle;

    public TenantMembershipController(TenantLifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @GetMapping
    @RequireTenantRole(TenantRole.VIEWER)
    public List<MemberResponse> list(ResolvedTenantContext context) {
        return lifecycle.listMembers(context).stream().map(MemberResponse::from).toList();
    }

    /** Grants a role, or changes an existing one. 201 when the membership is new. */
    @PutMapping("/{userId}")
    @RequireTenantRole(TenantRole.OWNER)
    public ResponseEntity<MemberResponse> assign(
            ResolvedTenantContext context,
            @PathVariable String userId,
            @Valid @RequestBody RoleAssignmentRequest request) {
        TenantRole role = request.toRole();
        MembershipChange change = lifecycle.grantOrChangeRole(context, userId, role);
        HttpStatus status = change == MembershipChange.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(new MemberResponse(userId, role.claimName()));
    }

    /** Any member may leave; removing someone else needs Owner, checked by the service. */
    @DeleteMapping("/{userId}")
    @RequireTenantRole(TenantRole.VIEWER)
    public ResponseEntity<Void> revoke(
            ResolvedTenantContext context, AuthenticatedCaller caller, @PathVariable String userId) {
        lifecycle.revokeRole(context, caller, userId);
        return ResponseEntity.noContent().build();
    }
}
