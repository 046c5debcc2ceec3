package it.aw.pagesearch.model;

/**
 * Pagina letta dallo store per la ricerca, già unita ai metadati del documento.
 */
public record StoredPage(
        String filename,
        String path,
        int    pageIndex,   // 0-based
        String text
) {}
