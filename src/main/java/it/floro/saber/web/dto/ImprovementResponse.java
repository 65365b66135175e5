package it.floro.saber.web.dto;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.EntityChange;

import java.util.List;

/**
 * Confronto anno su anno: tutte le entità confrontabili più le due graduatorie.
 */
public record ImprovementResponse(
        AggregationLevel level,
        String subject,
        int yearStart,
        int yearEnd,
        int entities,
        List<EntityChange> mostImproved,
        List<EntityChange> mostDeclined,
        List<EntityChange> changes
) {}
