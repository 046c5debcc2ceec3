package it.aw.pagesearch.service;

import it.aw.pagesearch.model.SearchDocument;
import it.aw.pagesearch.model.SearchHit;
import it.aw.pagesearch.model.StoredPage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranking BM25 sull'intero corpus di pagine, ricostruito in memoria a ogni chiamata.
 * <p>
 * Formula per ogni termine della query (i termini ripetuti contano più volte):
 * <pre>
 *   idf(q)   = ln(1 + (N - n(q) + 0.5) / (n(q) + 0.5))
 *   score   += idf(q) * tf * (k1 + 1) / (tf + k1 * (1 - b + b * dl / avgdl))
 * </pre>
 * L'idf è sempre positivo, quindi una pagina ha score {@code > 0} se e solo se
 * contiene almeno un termine della query. Le pagine con score {@code <= 0} non
 * compaiono mai nei risultati.
 * <p>
 * L'idf è volutamente la forma di Lucene, non quella Okapi classica
 * {@code ln((N - n + 0.5) / (n + 0.5))} con il floor a {@code 0.25 * idf medio}
 * per i termini a idf negativo: gli score assoluti quindi differiscono da quelli
 * di un'implementazione Okapi, ma l'ordinamento dei risultati e la regola di
 * esclusione restano significativi anche su corpus di una o due pagine.
 * <p>
 * Ordinamento totale: score decrescente, poi filename, page index, path e infine
 * ordine di caricamento del corpus. Due pagine con statistiche identiche hanno
 * score identico, quindi il tie-break deve essere completo.
 */
public class Bm25Ranker {

    public static final double DEFAULT_K1 = 1.5;
    public static final double DEFAULT_B  = 0.75;

    private static final Comparator<Scored> ORDER = Comparator
            .comparingDouble(Scored::score).reversed()
            .thenComparing(s -> s.doc().filename())
            .thenComparingInt(s -> s.doc().pageIndex())
            .thenComparing(s -> s.doc().path())
            .thenComparingInt(s -> s.doc().loadOrder());

    private final double k1;
    private final double b;
    private final int snippetMaxChars;

    public Bm25Ranker(double k1, double b, int snippetMaxChars) {
        if (k1 < 0) throw new IllegalArgumentException("k1 deve essere >= 0 (ricevuto: " + k1 + ")");
        if (b < 0 || b > 1) throw new IllegalArgumentException("b deve essere in [0, 1] (ricevuto: " + b + ")");
        if (snippetMaxChars < 1) {
            throw new IllegalArgumentException("snippetMaxChars deve essere >= 1 (ricevuto: " + snippetMaxChars + ")");
        }
        this.k1 = k1;
        this.b = b;
        this.snippetMaxChars = snippetMaxChars;
    }

    public Bm25Ranker() {
        this(DEFAULT_K1, DEFAULT_B, SnippetBuilder.DEFAULT_MAX_CHARS);
    }

    private record Scored(SearchDocument doc, double score) {}

    /**
     * @param pages pagine nell'ordine restituito dallo store
     * @param topK  numero massimo di risultati
     * @return al più {@code topK} hit con rank 1-based
     * @throws IllegalArgumentException se {@code topK <= 0}
     */
    public List<SearchHit> rank(List<StoredPage> pages, String query, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("top-k deve essere > 0 (ricevuto: " + topK + ")");
        }
        List<String> queryTokens = Tokenizer.tokenize(query);
        if (pages.isEmpty() || queryTokens.isEmpty()) {
            return List.of();
        }

        List<SearchDocument> corpus = buildCorpus(pages);
        List<Map<String, Integer>> termFrequencies = new ArrayList<>(corpus.size());
        Map<String, Integer> documentFrequencies = new HashMap<>();
        long totalLength = 0;
        for (SearchDocument doc : corpus) {
            Map<String, Integer> tf = new HashMap<>();
            for (String token : doc.tokens()) tf.merge(token, 1, Integer::sum);
            for (String term : tf.keySet()) documentFrequencies.merge(term, 1, Integer::sum);
            termFrequencies.add(tf);
            totalLength += doc.tokens().size();
        }
        int n = corpus.size();
        double avgLength = (double) totalLength / n;

        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            SearchDocument doc = corpus.get(i);
            Map<String, Integer> tf = termFrequencies.get(i);
            double lengthNorm = avgLength > 0 ? doc.tokens().size() / avgLength : 0.0;
            double score = 0.0;
            for (String term : queryTokens) {
                Integer freq = tf.get(term);
                if (freq == null) continue;
                double idf = idf(n, documentFrequencies.get(term));
                score += idf * freq * (k1 + 1) / (freq + k1 * (1 - b + b * lengthNorm));
            }
            if (score > 0.0) scored.add(new Scored(doc, score));
        }

        scored.sort(ORDER);

        List<SearchHit> hits = new ArrayList<>(Math.min(topK, scored.size()));
        for (int i = 0; i < scored.size() && i < topK; i++) {
            SearchDocument doc = scored.get(i).doc();
            hits.add(new SearchHit(
                    i + 1,
                    doc.filename(),
                    doc.path(),
                    doc.pageIndex(),
                    scored.get(i).score(),
                    SnippetBuilder.snippet(doc.text(), snippetMaxChars)));
        }
        return hits;
    }

    private static double idf(int totalDocs, int docFreq) {
        return Math.log(1.0 + (totalDocs - docFreq + 0.5) / (docFreq + 0.5));
    }

    private static List<SearchDocument> buildCorpus(List<StoredPage> pages) {
        List<SearchDocument> corpus = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            StoredPage page = pages.get(i);
            corpus.add(new SearchDocument(
                    page.filename(), page.path(), page.pageIndex(), page.text(),
                    Tokenizer.tokenize(page.text()), i));
        }
        return corpus;
    }
}
