package com.tessera.tenancy.infrastructure.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.security.TenantRole;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Maps access outcomes to HTTP responses.
 *
 * <p>The {@link AccessOutcome#NO_ACCESS} response is serialized once, at startup, and the same
 * bytes are written for every cause: no membership, unknown tenant, deleted tenant and
 * cross-tenant writes. It carries no timestamp, correlation ID, instance or tenant identifier,
 * so nothing in it tells a caller whether the tenant exists.
 */
@Component
public class TenancyResponsePolicy {

    /** Outcomes of tenant access that reach the caller. */
    public enum AccessOutcome {
        MALFORMED_TENANT_IDENTIFIER(HttpStatus.BAD_REQUEST, "Bad Request", "malformed-tenant-identifier"),
        NO_ACCESS(HttpStatus.FORBIDDEN, "Forbidden", "no-access"),
        INSUFFICIENT_ROLE(HttpStatus.FORBIDDEN, "Forbidden", "insufficient-role"),
        RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "Not Found", "resource-not-found");

        private final HttpStatus status;
        private final String title;
        private final URI type;

        AccessOutcome(HttpStatus status, String title, String slug) {
            this.status = status;
            this.title = title;
            this.type = URI.create(ERROR_TYPE_BASE + slug);
        }

        public HttpStatus status() {
            return status;
        }

        public String title() {
            return title;
        }

        public URI type() {
            return type;
        }
    }

    public static final String ERROR_TYPE_BASE = "https://tessera.dev/errors/";
    public static final String NO_ACCESS_DETAIL = "Access to the requested tenant is denied.";

    private final byte[] noAccessBody;

    public TenancyResponsePolicy(ObjectMapper objectMapper) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", AccessOutcome.NO_ACCESS.type().toString());
        body.put("title", AccessOutcome.NO_ACCESS.title());
        body.put("status", AccessOutcome.NO_ACCESS.status().value());
        body.put("detail", NO_ACCESS_DETAIL);
        try {
            this.noAccessBody = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize the no-access response", e);
        }
    }

    /** The constant 403 response for every "no access" cause. */
    public ResponseEntity<byte[]> noAccess() {
        return ResponseEntity.status(AccessOutcome.NO_ACCESS.status())
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(noAccessBody.clone());
    }

    public ProblemDetail malformedTenantIdentifier(String rawValue) {
        return problem(AccessOutcome.MALFORMED_TENANT_IDENTIFIER,
                "'%s' is not a valid tenant identifier".formatted(rawValue));
    }

    public ProblemDetail insufficientRole(TenantRole requiredRole) {
        ProblemDetail problem = problem(AccessOutcome.INSUFFICIENT_ROLE,
                "This operation requires the %s role in the tenant".formatted(requiredRole.claimName()));
        problem.setProperty("requiredRole", requiredRole.claimName());
        return problem;
    }

    public ProblemDetail resourceNotFound(String resourceType, String detail) {
        ProblemDetail problem = problem(AccessOutcome.RESOURCE_NOT_FOUND, detail);
        problem.setProperty("resourceType", resourceType);
        return problem;
    }

    private static ProblemDetail problem(AccessOutcome outcome, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(outcome.status(), detail);
        problem.setTitle(outcome.title());
        problem.setType(outcome.type());
        return problem;
    }
}
