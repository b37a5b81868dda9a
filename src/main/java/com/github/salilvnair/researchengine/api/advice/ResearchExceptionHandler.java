package com.github.salilvnair.researchengine.api.advice;

import com.github.salilvnair.researchengine.api.dto.ErrorResponse;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Error bodies carry the code's default message only, never the exception text.
 */
@Slf4j
@RestControllerAdvice(basePackages = "com.github.salilvnair.researchengine.api")
public class ResearchExceptionHandler {

    @ExceptionHandler(ResearchEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(ResearchEngineException ex) {
        ResearchEngineErrorCode code = ex.getErrorCode();
        HttpStatus status = code == ResearchEngineErrorCode.INVALID_REQUEST
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.SERVICE_UNAVAILABLE;
        log.warn("Research request rejected errorCode={} message={}", code, ex.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(code.name(), code.defaultMessage(), ex.isRecoverable()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected research request failure", ex);
        ResearchEngineErrorCode code = ResearchEngineErrorCode.QUERY_FAILED;
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(code.name(), code.defaultMessage(), false));
    }
}
