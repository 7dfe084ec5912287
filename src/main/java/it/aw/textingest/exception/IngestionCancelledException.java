package it.aw.textingest.exception;

/**
 * Eccezione lanciata quando il thread di ingestione viene interrotto durante
 * una chiamata di rete o l'attesa tra due tentativi.
 */
public class IngestionCancelledException extends RuntimeException {

    public IngestionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
