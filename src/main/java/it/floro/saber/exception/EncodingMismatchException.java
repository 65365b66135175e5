package it.floro.saber.exception;

/**
 * Due run del modello di valore aggiunto codificano le variabili categoriche in modo
 * diverso: i loro residui non sono confrontabili.
 */
public class EncodingMismatchException extends RuntimeException {

    public EncodingMismatchException(String message) {
        super(message);
    }
}
