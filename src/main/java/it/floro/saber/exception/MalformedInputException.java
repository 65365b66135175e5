package it.floro.saber.exception;

/**
 * Input strutturalmente inutilizzabile: batch senza alcuna colonna identificativa,
 * righe di lunghezza incoerente, campi o livelli sconosciuti in una richiesta.
 *
 * È l'unico errore non recuperabile della pipeline: l'operazione intera fallisce
 * invece di restituire numeri inventati.
 */
public class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
