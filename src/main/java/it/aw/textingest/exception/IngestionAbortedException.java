package it.aw.textingest.exception;

/**
 * Errore fatale: l'esecuzione termina senza elaborare alcun file.
 * Lanciata per health check fallito, output non apribile o directory non esplorabile.
 */
public class IngestionAbortedException extends RuntimeException {

    public IngestionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
