package it.aw.textingest.model;

/**
 * Stato di un'esecuzione di ingestione.
 * <p>
 * ABORTED si raggiunge solo da health check fallito o da output non apribile;
 * CANCELLED quando il thread viene interrotto durante l'elaborazione.
 */
public enum RunState {
    IDLE,
    HEALTH_CHECKING,
    DISCOVERING,
    PROCESSING,
    FINALIZING,
    DONE,
    ABORTED,
    CANCELLED
}
