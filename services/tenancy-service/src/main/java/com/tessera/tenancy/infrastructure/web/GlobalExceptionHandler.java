package com.tessera.tenancy.infrastructure.web;

import com.tessera.database.retry.StorageUnavailableException;
import com.tessera.observability.CorrelationContextHolder;
import com.tessera.observability.SecurityEventRecorder;
import com.tessera.observability.SecurityEventType;
import com.tessera.security.TenantMismatchException;
import com.tessera.tenancy.domain.exception.DuplicateMembershipException;
import com.tessera.tenancy.domain.exception.InsufficientTenantRoleException;
import com.tessera.tenancy.domain.exception.LastOwnerException;
import com.tessera.tenancy.domain.exception.MalformedTenantIdentifierException;
import com.tessera.tenancy.domain.exception.TenancyResourceNotFoundException;
import com.tessera.tenancy.domain.exception.TenantAccessDeniedException;
import com.tessera.tenancy.domain.exception.TenantContextNotResolvedException;
import com.tessera.tenancy.domain.exception.UnauthenticatedCallerException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://tessera.dev/errors/insufficient-role",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "This operation requires the Owner role in the tenant",
 *   "requiredRole": "Owner",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every response carries the correlation ID and a timestamp, except the "no access" 403,
 * whose body is constant (see {@link TenancyResponsePolicy}). Access failures are also recorded
 * as security events.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final TenancyResponsePolicy responses;
    private final SecurityEventRecorder securityEvents;

    public GlobalExceptionHandler(TenancyResponsePolicy responses, SecurityEventRecorder securityEvents) {
        this.responses = responses;
        this.securityEvents = securityEvents;
    }

    @ExceptionHandler(MalformedTenantIdentifierException.class)
    public ProblemDetail handleMalformedTenantIdentifier(MalformedTenantIdentifierException ex) {
        securityEvents.record(SecurityEventType.MALFORMED_TENANT_ID, ex.getMessage());
        return enrichWithCorrelation(responses.malformedTenantIdentifier(ex.rawValue()));
    }

    @ExceptionHandler(TenantAccessDeniedException.class)
    public ResponseEntity<byte[]> handleTenantAccessDenied(TenantAccessDeniedException ex) {
        securityEvents.record(SecurityEventType.TENANT_ACCESS_DENIED, "reason=" + ex.reason());
        return responses.noAccess();
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ResponseEntity<byte[]> handleTenantMismatch(TenantMismatchException ex) {
        securityEvents.record(SecurityEventType.CROSS_TENANT_WRITE, ex.getMessage());
        return responses.noAccess();
    }

    @ExceptionHandler(InsufficientTenantRoleException.class)
    public ProblemDetail handleInsufficientRole(InsufficientTenantRoleException ex) {
        securityEvents.record(SecurityEventType.INSUFFICIENT_ROLE, ex.getMessage());
        return enrichWithCorrelation(responses.insufficientRole(ex.requiredRole()));
    }

    @ExceptionHandler(TenancyResourceNotFoundException.class)
    public ProblemDetail handleResourceNotFound(TenancyResourceNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return enrichWithCorrelation(responses.resourceNotFound(ex.resourceType(), ex.getMessage()));
    }

    @ExceptionHandler(UnauthenticatedCallerException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedCallerException ex) {
        securityEvents.record(SecurityEventType.UNAUTHENTICATED, ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthenticated", ex.getMessage());
    }

    @ExceptionHandler(LastOwnerException.class)
    public ProblemDetail handleLastOwner(LastOwnerException ex) {
        securityEvents.record(SecurityEventType.LAST_OWNER_PROTECTED, ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "last-owner", ex.getMessage());
    }

    @ExceptionHandler(DuplicateMembershipException.class)
    public ProblemDetail handleDuplicateMembership(DuplicateMembershipException ex) {
        log.warn("Membership conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "duplicate-membership", ex.getMessage());
    }

    @ExceptionHandler(TenantContextNotResolvedException.class)
    public ProblemDetail handleContextNotResolved(TenantContextNotResolvedException ex) {
        log.error("Handler wiring error: {}", ex.getMessage());
        return internalError();
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ProblemDetail handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage unavailable during {}", ex.operation(), ex);
        return internalError();
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String detail = ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed request";
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework errors such as 404 for unknown routes and 405 keep their own status.
            return enrichWithCorrelation(errorResponse.getBody());
        }
        log.error("Internal server error", ex);
        return internalError();
    }

    private ProblemDetail internalError() {
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String slug, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TenancyResponsePolicy.ERROR_TYPE_BASE + slug));
        return enrichWithCorrelation(problem);
    }

    private ProblemDetail enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = CorrelationContextHolder.currentCorrelationId();
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
        return problem;
    }
}
