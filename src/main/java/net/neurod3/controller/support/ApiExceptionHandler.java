package net.neurod3.controller.support;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.exception.CatalogUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps catalog and validation failures to JSON error bodies with the matching status.
 */
@RestControllerAdvice(basePackages = "net.neurod3.controller")
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleCatalogUnavailable(CatalogUnavailableException ex) {
        log.debug("Answering 503 for catalog failure {}", ex.reason());
        return ErrorResponseUtils.serviceUnavailable(ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(code.value());
        String error = status != null ? status.getReasonPhrase() : String.valueOf(code.value());
        return ResponseEntity.status(code).body(ErrorResponseUtils.errorBody(error, ex.getReason()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ErrorResponseUtils.badRequest("Invalid value for parameter '" + ex.getName() + "': " + ex.getValue());
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, String>> handleBind(BindException ex) {
        FieldError fieldError = ex.getFieldError();
        String message = fieldError != null
            ? "Invalid value for parameter '" + fieldError.getField() + "': " + fieldError.getRejectedValue()
            : "Invalid request parameters";
        return ErrorResponseUtils.badRequest(message);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ErrorResponseUtils.badRequest(ex.getMessage());
    }
}
