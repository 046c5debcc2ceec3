package it.aw.pagesearch.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Estrattore PDF pagina per pagina via PDFBox.
 * <p>
 * Per ogni pagina lo stripper viene limitato a quella sola pagina
 * ({@code setStartPage/setEndPage}), così il risultato ha esattamente
 * una stringa per pagina, anche vuota se la pagina non ha layer testuale.
 */
public class PdfBoxPageExtractor implements PageExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageExtractor.class);

    @Override
    public List<String> extractPages(byte[] content, Path source) throws ExtractionException {
        try (PDDocument doc = PDDocument.load(content)) {
            int totalPages = doc.getNumberOfPages();
            log.debug("PdfBoxPageExtractor: {} pagine trovate in {}", totalPages, source);

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(totalPages);
            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                pages.add(stripper.getText(doc));
            }
            return pages;
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(source, e);
        }
    }
}
