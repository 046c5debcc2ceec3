package it.aw.pagesearch.service;

import it.aw.pagesearch.model.SearchHit;
import it.aw.pagesearch.model.StoredPage;
import it.aw.pagesearch.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Ricerca full-text sulle pagine di un database esistente.
 * <p>
 * Il database non viene mai creato da una ricerca: path inesistente o non regolare
 * è un errore di configurazione. Il corpus viene letto per intero a ogni chiamata,
 * quindi i risultati riflettono sempre lo stato corrente dello store.
 */
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final Bm25Ranker ranker;

    public SearchService(Bm25Ranker ranker) {
        this.ranker = ranker;
    }

    public List<SearchHit> search(Path dbPath, String query, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("top-k deve essere > 0 (ricevuto: " + topK + ")");
        }
        if (!Files.exists(dbPath)) {
            throw new IllegalArgumentException("Il database SQLite non esiste: " + dbPath);
        }
        if (!Files.isRegularFile(dbPath)) {
            throw new IllegalArgumentException("Il path del database non è un file: " + dbPath);
        }

        List<StoredPage> pages;
        try (DocumentStore store = DocumentStore.open(dbPath)) {
            pages = store.loadAllPages();
        }
        List<SearchHit> hits = ranker.rank(pages, query, topK);
        log.debug("Ricerca '{}' su {} pagine: {} risultati", query, pages.size(), hits.size());
        return hits;
    }
}
