package com.regimeplatform.regime.controller;

import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.regime.dto.ErrorResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Invalid input raised by the HMM library is a client error. */
@RestControllerAdvice
public class HmmExceptionHandler {

    @ExceptionHandler(HmmException.class)
    public ResponseEntity<ErrorResponse> handle(HmmException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getKind().name(), e.getMessage()));
    }
}
