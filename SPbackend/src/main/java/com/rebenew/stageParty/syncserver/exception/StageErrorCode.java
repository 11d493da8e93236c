package com.rebenew.stageParty.syncserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Códigos de error comunes al protocolo WebSocket ({@code error.code}) y a la API REST.
 */
public enum StageErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_ORDER(HttpStatus.BAD_REQUEST),
    DUPLICATE_PENDING(HttpStatus.CONFLICT),
    INVALID_COMMAND(HttpStatus.BAD_REQUEST),
    // Fallo de transporte: dispara el bucle de reconexión, nunca se muestra como error terminal
    CONNECTION_LOST(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    StageErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
