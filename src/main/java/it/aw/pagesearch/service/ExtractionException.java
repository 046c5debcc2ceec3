package it.aw.pagesearch.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Il file non è leggibile come PDF (corrotto, cifrato, troncato...).
 * Il messaggio contiene sempre il path del file di origine.
 */
public class ExtractionException extends IOException {

    public ExtractionException(Path source, Throwable cause) {
        super("Impossibile leggere il PDF '" + source + "': " + cause.getMessage(), cause);
    }
}
