package it.aw.textingest.exception;

/** Eccezione lanciata quando l'health check del servizio di embedding fallisce. */
public class ConnectivityException extends RuntimeException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
