package com.tessera.tenancy.infrastructure.web;

import com.tessera.security.TenantRole;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler as addressed to one tenant and names the minimum role it requires.
 *
 * <p>The tenant comes from the {@code {tenantIdentifier}} route variable. The handler may then
 * declare a {@link com.tessera.security.ResolvedTenantContext} parameter to receive the
 * resolved context.
 *
 * <pre>
 * &#64;RequireTenantRole(TenantRole.EDITOR)
 * &#64;PostMapping("/api/tenant/{tenantIdentifier}/transactions")
 * public ResponseEntity&lt;TransactionResponse&gt; create(ResolvedTenantContext context, ...) { ... }
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequireTenantRole {

    /** The least powerful role that may call the handler. */
    TenantRole value();
}
