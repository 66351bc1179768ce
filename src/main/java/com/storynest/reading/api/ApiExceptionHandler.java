package com.storynest.reading.api;

import com.storynest.reading.error.InvalidRequestException;
import com.storynest.reading.error.InvalidStatusException;
import com.storynest.reading.error.NotFoundException;
import com.storynest.reading.error.ProfileAccessDeniedException;
import com.storynest.reading.error.ReadingPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidStatusException.class, InvalidRequestException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadRequest(ReadingPlatformException e) {
        log.warn("Rejected request: [{}] {}", e.getErrorCode(), e.getMessage());
        return new ErrorResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNotFound(NotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return new ErrorResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(ProfileAccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public ErrorResponse handleForbidden(ProfileAccessDeniedException e) {
        log.warn("Access denied: {}", e.getMessage());
        return new ErrorResponse(e.getErrorCode(), "Unauthorized");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public ErrorResponse handleMissingUser(MissingRequestHeaderException e) {
        return new ErrorResponse("UNAUTHENTICATED", "Missing header: " + e.getHeaderName());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleMalformed(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return new ErrorResponse("INVALID_REQUEST", "Malformed request");
    }

    @ExceptionHandler(ReadingPlatformException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleOther(ReadingPlatformException e) {
        log.warn("Business error: [{}] {}", e.getErrorCode(), e.getMessage());
        return new ErrorResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return new ErrorResponse("SYSTEM_ERROR", "Internal error, please retry later");
    }
}
