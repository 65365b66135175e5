package it.floro.saber.config;

import it.floro.saber.exception.EncodingMismatchException;
import it.floro.saber.exception.MalformedInputException;
import it.floro.saber.web.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Traduce gli errori del motore di analisi in risposte JSON.
 *
 * - Input malformato o parametri non validi: 400
 * - Confronto tra run con codifiche diverse: 409
 */
@RestControllerAdvice
public class AnalyticsExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsExceptionHandler.class);

    @ExceptionHandler(MalformedInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleMalformed(MalformedInputException ex) {
        logger.warn("Input malformato: {}", ex.getMessage());
        return ApiError.of(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError handleBadParameter(Exception ex) {
        logger.debug("Parametro non valido: {}", ex.getMessage());
        return ApiError.of(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(EncodingMismatchException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ApiError handleEncodingMismatch(EncodingMismatchException ex) {
        logger.warn("Confronto tra codifiche diverse: {}", ex.getMessage());
        return ApiError.of(HttpStatus.CONFLICT, ex.getMessage());
    }

    /**
     * Run non disponibili usati dove serve un modello stimato.
     */
    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ApiError handleIllegalState(IllegalStateException ex) {
        logger.warn("Operazione non eseguibile: {}", ex.getMessage());
        return ApiError.of(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }
}
