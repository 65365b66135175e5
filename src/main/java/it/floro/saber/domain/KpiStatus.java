package it.floro.saber.domain;

public enum KpiStatus {
    GREEN,      // Target raggiunto
    YELLOW,     // Mancato di poco (entro la banda gialla)
    RED         // Lontano dal target
}
