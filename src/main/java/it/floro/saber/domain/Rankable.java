package it.floro.saber.domain;

import java.util.OptionalDouble;

/**
 * Entità ordinabile per graduatorie top/bottom.
 */
public interface Rankable {

    /** Identificativo usato anche come criterio secondario in caso di parità. */
    String entityId();

    /**
     * Valore numerico della misura richiesta.
     *
     * @param name nome della misura (es. "residual", "standardized")
     * @return valore, vuoto se la misura non esiste per questa entità
     */
    OptionalDouble measure(String name);
}
