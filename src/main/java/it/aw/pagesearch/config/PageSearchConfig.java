package it.aw.pagesearch.config;

import it.aw.pagesearch.service.Bm25Ranker;
import it.aw.pagesearch.service.IngestListener;
import it.aw.pagesearch.service.IngestionService;
import it.aw.pagesearch.service.LoggingIngestListener;
import it.aw.pagesearch.service.PageExtractor;
import it.aw.pagesearch.service.PdfBoxPageExtractor;
import it.aw.pagesearch.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configura i bean della pipeline di ingestione e ricerca.
 *
 * PageExtractor: PDFBox, pagina per pagina.
 * Bm25Ranker:    costanti k1/b fisse da application.properties (default 1.5 / 0.75),
 *                così il ranking è riproducibile tra esecuzioni.
 * Clock:         UTC, usato per il timestamp ingested_at.
 */
@Configuration
public class PageSearchConfig {

    private static final Logger log = LoggerFactory.getLogger(PageSearchConfig.class);

    @Value("${search.bm25.k1:1.5}")
    private double k1;

    @Value("${search.bm25.b:0.75}")
    private double b;

    @Value("${search.snippet.max-chars:240}")
    private int snippetMaxChars;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PageExtractor pageExtractor() {
        return new PdfBoxPageExtractor();
    }

    @Bean
    public IngestListener ingestListener() {
        return new LoggingIngestListener();
    }

    @Bean
    public IngestionService ingestionService(PageExtractor pageExtractor, IngestListener ingestListener) {
        return new IngestionService(pageExtractor, ingestListener);
    }

    @Bean
    public Bm25Ranker bm25Ranker() {
        log.debug("Bm25Ranker: k1={}, b={}, snippet={} caratteri", k1, b, snippetMaxChars);
        return new Bm25Ranker(k1, b, snippetMaxChars);
    }

    @Bean
    public SearchService searchService(Bm25Ranker bm25Ranker) {
        return new SearchService(bm25Ranker);
    }
}
