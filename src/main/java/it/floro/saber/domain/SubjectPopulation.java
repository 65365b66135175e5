package it.floro.saber.domain;

/**
 * Parametri di popolazione usati per standardizzare una materia.
 */
public record SubjectPopulation(String subject, long groups, double mean, double std) {
}
