package com.tessera.tenancy.api;

import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantRole;
import com.tessera.tenancy.api.dto.TenantRequest;
import com.tessera.tenancy.api.dto.TenantResponse;
import com.tessera.tenancy.api.dto.UserTenantResponse;
import com.tessera.tenancy.domain.Tenant;
import com.tessera.tenancy.infrastructure.web.RequireTenantRole;
import com.tessera.tenancy.service.TenantLifecycleService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant endpoints. Listing and creation only need an authenticated caller; everything under
 * {@code /{tenantIdentifier}} is gated by a tenant role.
 */
@RestController
@RequestMapping("/api/tenant")
public class TenantController {

    private final TenantLifecycleService lifecycle;

    public TenantController(TenantLifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @GetMapping
    public List<UserTenantResponse> listMyTenants(AuthenticatedCaller caller) {
        return lifecycle.listTenantsForUser(caller).stream().map(UserTenantResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<TenantResponse> create(AuthenticatedCaller caller, @Valid @RequestBody TenantRequest request) {
        Tenant tenant = lifecycle.createTenant(caller, request.name(), request.description());
        return ResponseEntity.created(URI.create("/api/tenant/" + tenant.identifier()))
                .body(TenantResponse.from(tenant));
    }

    @GetMapping("/{tenantIdentifier}")
    @RequireTenantRole(TenantRole.VIEWER)
    public TenantResponse get(ResolvedTenantContext context) {
        return TenantResponse.from(lifecycle.getTenant(context));
    }

    @PutMapping("/{tenantIdentifier}")
    @RequireTenantRole(TenantRole.OWNER)
    public TenantResponse update(ResolvedTenantContext context, @Valid @RequestBody TenantRequest request) {
        return TenantResponse.from(
                lifecycle.updateTenant(context, request.name(), request.description(), request.active()));
    }

    @DeleteMapping("/{tenantIdentifier}")
    @RequireTenantRole(TenantRole.OWNER)
    public ResponseEntity<Void> delete(ResolvedTenantContext context) {
        lifecycle.deleteTenant(context);
        return ResponseEntity.noContent().build();
    }
}
