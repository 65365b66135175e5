package it.floro.saber.web.dto;

import java.util.List;

/**
 * Valori disponibili per popolare i filtri lato client.
 */
public record FilterOptions(
        List<String> departments,
        List<String> municipalities,        // Ristretti al dipartimento richiesto, se presente
        List<Integer> years,
        List<String> subjects,
        List<String> levels
) {}
