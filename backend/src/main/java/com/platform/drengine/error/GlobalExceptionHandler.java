package com.platform.drengine.error;

import com.platform.drengine.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps engine and framework exceptions to {@link ErrorResponse} bodies.
 *
 * Not-found codes answer 404, contention 409, bad input 400 and unreachable
 * collaborators 503. Every error is counted under {@code drengine.errors}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] Rejected request: {}", traceId, ex.getMessage());

        ErrorResponse.ErrorResponseBuilder body = base(ex.getErrorCode(), statusOf(ex.getErrorCode()), request, traceId)
            .message(ex.getMessage());
        if (ex.getField() != null) {
            body.fieldErrors(List.of(ErrorResponse.FieldError.builder()
                .field(ex.getField())
                .message(ex.getMessage())
                .rejectedValue(ex.getRejectedValue())
                .build()));
        }
        return respond(ex.getErrorCode(), body);
    }

    @ExceptionHandler(DrEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(DrEngineException ex, HttpServletRequest request) {
        String traceId = traceId();
        ErrorCode code = ex.getErrorCode();
        if (code.isFatal()) {
            log.error("[{}] {} {}", traceId, code.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} {}", traceId, code.getCode(), ex.getMessage());
        }
        return respond(code, base(code, statusOf(code), request, traceId)
            .message(ex.getMessage())
            .metadata(metadataFor(ex)));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex,
                                                              HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        String traceId = traceId();
        log.warn("[{}] Request body failed validation on {} field(s)", traceId, fieldErrors.size());
        return respond(ErrorCode.VALIDATION_ERROR,
            base(ErrorCode.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, request, traceId)
                .message("Validation failed")
                .fieldErrors(fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        return badInput(ErrorCode.INVALID_REQUEST, "Invalid request body",
            ex.getMostSpecificCause().getMessage(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                HttpServletRequest request) {
        return badInput(ErrorCode.MISSING_REQUIRED_FIELD,
            "Missing required parameter: " + ex.getParameterName(), null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        return badInput(ErrorCode.INVALID_FIELD_VALUE,
            "Invalid value for parameter '" + ex.getName() + "': " + ex.getValue(), null, request);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(OptimisticLockingFailureException ex,
                                                                HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] Concurrent update: {}", traceId, ex.getMessage());
        return respond(ErrorCode.OPTIMISTIC_LOCK_FAILURE,
            base(ErrorCode.OPTIMISTIC_LOCK_FAILURE, HttpStatus.CONFLICT, request, traceId)
                .message("Record was modified concurrently, retry the request"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] Metadata store failure: {}", traceId, ex.getMessage(), ex);
        return respond(ErrorCode.DATABASE_ERROR,
            base(ErrorCode.DATABASE_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
                .message("Metadata store operation failed")
                .detail(ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] Unexpected error: {}", traceId, ex.getMessage(), ex);
        return respond(ErrorCode.UNEXPECTED_ERROR,
            base(ErrorCode.UNEXPECTED_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
                .message("An unexpected error occurred")
                .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage()));
    }

    private ResponseEntity<ErrorResponse> badInput(ErrorCode code, String message, String detail,
                                                   HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] {}", traceId, message);
        return respond(code, base(code, HttpStatus.BAD_REQUEST, request, traceId)
            .message(message)
            .detail(detail));
    }

    private ErrorResponse.ErrorResponseBuilder base(ErrorCode code, HttpStatus status,
                                                    HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(code.getCode())
            .fatal(code.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, ErrorResponse.ErrorResponseBuilder body) {
        metricsRegistry.incrementCounter("drengine.errors",
            "code", code.getCode(),
            "fatal", String.valueOf(code.isFatal()));
        ErrorResponse response = body.build();
        return ResponseEntity.status(response.getStatus()).body(response);
    }

    private String traceId() {
        String correlationId = MDC.get("correlationId");
        return correlationId != null ? correlationId : UUID.randomUUID().toString().substring(0, 8);
    }

    private Map<String, Object> metadataFor(DrEngineException ex) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (ex instanceof ResourceNotFoundException notFound) {
            metadata.put("resourceType", notFound.getResourceType());
            metadata.put("resourceId", notFound.getResourceId());
        } else if (ex instanceof FailoverInProgressException inProgress) {
            metadata.put("primaryRegion", inProgress.getPrimaryRegion());
            metadata.put("activeEventId", inProgress.getActiveEventId());
        } else if (ex instanceof LagTooHighException lagTooHigh) {
            metadata.put("linkId", lagTooHigh.getLinkId());
            metadata.put("currentLag", lagTooHigh.getCurrentLag().toString());
            metadata.put("threshold", lagTooHigh.getThreshold().toString());
        } else if (ex instanceof InvalidStateTransitionException transition) {
            metadata.put("eventId", transition.getEventId());
            metadata.put("from", transition.getFrom());
            metadata.put("to", transition.getTo());
        } else if (ex instanceof StorageException storage && storage.getKey() != null) {
            metadata.put("key", storage.getKey());
        } else if (ex instanceof ExternalSystemException external) {
            metadata.put("system", external.getSystem());
        }
        return metadata.isEmpty() ? null : metadata;
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case RESOURCE_NOT_FOUND, BACKUP_JOB_NOT_FOUND, BACKUP_EXECUTION_NOT_FOUND,
                 REPLICATION_LINK_NOT_FOUND, FAILOVER_EVENT_NOT_FOUND, RECOVERY_TEST_NOT_FOUND,
                 CONFIGURATION_NOT_FOUND, STORAGE_OBJECT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILOVER_IN_PROGRESS, BACKUP_ALREADY_RUNNING, CONFIGURATION_LOCKED, LAG_TOO_HIGH,
                 CANCELLATION_REJECTED, OPTIMISTIC_LOCK_FAILURE, STATE_TRANSITION_INVALID -> HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE,
                 UNKNOWN_REGION, UNKNOWN_ENVIRONMENT, PRODUCTION_ENVIRONMENT_REJECTED, INVALID_SCHEDULE,
                 STORAGE_KEY_INVALID -> HttpStatus.BAD_REQUEST;
            case STORAGE_UNAVAILABLE, ROUTER_UNAVAILABLE, METRICS_UNAVAILABLE, REGION_UNREACHABLE ->
                HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
