package com.intentflow.api.rest;

import com.intentflow.core.exception.ConfirmationTimeoutException;
import com.intentflow.core.exception.DuplicateTaskException;
import com.intentflow.core.exception.InvalidConfirmationException;
import com.intentflow.core.exception.InvalidStateTransitionException;
import com.intentflow.core.exception.LeaseAcquisitionException;
import com.intentflow.core.exception.MemoryUnavailableException;
import com.intentflow.core.exception.MissingCompensationException;
import com.intentflow.core.exception.NotFoundException;
import com.intentflow.core.exception.OptimisticLockException;
import com.intentflow.core.exception.OrchestratorException;
import com.intentflow.core.exception.PlanCycleException;
import com.intentflow.core.exception.PlanValidationException;
import com.intentflow.core.exception.RiskExceededException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Maps domain errors to HTTP responses of the form {@code {taskId, errorCode, message}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<ErrorResponse> handleOrchestratorException(OrchestratorException ex,
                                                                     HttpServletRequest request) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("{} {} failed with {}: {}", request.getMethod(), request.getRequestURI(), ex.getErrorCode(),
                ex.getMessage(), ex);
        } else {
            log.warn("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), ex.getErrorCode(),
                ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(taskIdOf(request), ex.getErrorCode(),
            ex.getMessage()));
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("{} {} bad request: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(taskIdOf(request), BAD_REQUEST, ex.getMessage()));
    }

    static HttpStatus statusOf(String errorCode) {
        return switch (errorCode) {
            case NotFoundException.ERROR_CODE -> HttpStatus.NOT_FOUND;
            case InvalidConfirmationException.ERROR_CODE,
                 ConfirmationTimeoutException.ERROR_CODE,
                 InvalidStateTransitionException.ERROR_CODE,
                 DuplicateTaskException.ERROR_CODE,
                 OptimisticLockException.ERROR_CODE,
                 LeaseAcquisitionException.ERROR_CODE -> HttpStatus.CONFLICT;
            case PlanCycleException.ERROR_CODE,
                 MissingCompensationException.ERROR_CODE,
                 PlanValidationException.ERROR_CODE,
                 RiskExceededException.ERROR_CODE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case MemoryUnavailableException.ERROR_CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @SuppressWarnings("unchecked")
    private static String taskIdOf(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            Object taskId = ((Map<String, Object>) map).get("taskId");
            return taskId != null ? taskId.toString() : null;
        }
        return null;
    }

    public record ErrorResponse(String taskId, String errorCode, String message) {}
}
