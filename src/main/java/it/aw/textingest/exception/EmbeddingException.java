package it.aw.textingest.exception;

/** Eccezione lanciata quando il servizio di embedding non restituisce un vettore valido. */
public class EmbeddingException extends RuntimeException {

    private final int attempts;

    public EmbeddingException(String message) {
        super(message);
        this.attempts = 1;
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
        this.attempts = 1;
    }

    public EmbeddingException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /** Numero di tentativi effettuati prima di arrendersi. */
    public int getAttempts() {
        return attempts;
    }
}
