package it.aw.pagesearch.store;

/**
 * Errore di accesso al database delle pagine (connessione, schema o transazione).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
