package it.aw.pagesearch.model;

import java.util.List;

/**
 * Pagina del corpus in memoria con la sua forma tokenizzata.
 * Ricostruita a ogni ricerca: nessun indice persistito.
 */
public record SearchDocument(
        String       filename,
        String       path,
        int          pageIndex,
        String       text,
        List<String> tokens,
        int          loadOrder   // posizione nel corpus caricato, ultimo criterio di tie-break
) {}
