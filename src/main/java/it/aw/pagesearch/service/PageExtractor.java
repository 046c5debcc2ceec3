package it.aw.pagesearch.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Estrae il testo grezzo di un documento, una stringa per pagina, nell'ordine delle pagine.
 * La normalizzazione del testo è a carico del chiamante.
 */
@FunctionalInterface
public interface PageExtractor {

    /**
     * @param content byte grezzi del file
     * @param source  path di origine, usato solo nei messaggi di errore
     * @throws ExtractionException se il documento non è leggibile
     */
    List<String> extractPages(byte[] content, Path source) throws ExtractionException;
}
