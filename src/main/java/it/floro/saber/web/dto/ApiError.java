package it.floro.saber.web.dto;

import org.springframework.http.HttpStatus;

/**
 * Corpo JSON delle risposte di errore.
 */
public record ApiError(int status, String error, String message, long timestamp) {

    public static ApiError of(HttpStatus status, String message) {
        return new ApiError(status.value(), status.getReasonPhrase(), message, System.currentTimeMillis());
    }
}
