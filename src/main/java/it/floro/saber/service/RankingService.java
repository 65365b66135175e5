package it.floro.saber.service;

import it.floro.saber.domain.Rankable;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Graduatorie top/bottom-N su residui, misure standardizzate o variazioni.
 *
 * L'ordinamento è stabile: a parità di valore decide l'identificativo dell'entità
 * (crescente), quindi chiamate ripetute sullo stesso input danno la stessa lista.
 * Entità senza la misura richiesta, o con valore non finito, restano fuori.
 */
@Service
public class RankingService {

    /**
     * Le prime {@code n} entità ordinate per la misura {@code by}.
     *
     * @param ascending false = valori più alti per primi
     */
    public <T extends Rankable> List<T> topN(Collection<T> entities, String by, int n, boolean ascending) {
        if (n < 0) {
            throw new IllegalArgumentException("n negativo: " + n);
        }
        Comparator<Scored<T>> byValue = Comparator.comparingDouble(Scored::value);
        if (!ascending) {
            byValue = byValue.reversed();
        }
        Comparator<Scored<T>> order = byValue.thenComparing(s -> s.entity().entityId());

        return entities.stream()
                .map(e -> Scored.of(e, by))
                .filter(Objects::nonNull)
                .sorted(order)
                .limit(n)
                .map(Scored::entity)
                .toList();
    }

    /** Valori più alti per primi (migliori prestazioni, maggiori miglioramenti). */
    public <T extends Rankable> List<T> topN(Collection<T> entities, String by, int n) {
        return topN(entities, by, n, false);
    }

    /** Valori più bassi per primi: l'estremo opposto di {@link #topN(Collection, String, int)}. */
    public <T extends Rankable> List<T> bottomN(Collection<T> entities, String by, int n) {
        return topN(entities, by, n, true);
    }

    private record Scored<T extends Rankable>(T entity, double value) {

        static <T extends Rankable> Scored<T> of(T entity, String by) {
            OptionalDouble v = entity.measure(by);
            if (v.isEmpty() || !Double.isFinite(v.getAsDouble())) return null;
            return new Scored<>(entity, v.getAsDouble());
        }
    }
}
