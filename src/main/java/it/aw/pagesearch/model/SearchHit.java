package it.aw.pagesearch.model;

/**
 * Risultato di una ricerca BM25 su una singola pagina.
 */
public record SearchHit(
        int    rank,        // 1-based, riflette l'ordinamento finale
        String filename,
        String path,
        int    pageIndex,   // 0-based
        double score,
        String snippet
) {}
