package it.aw.pagesearch.service;

import java.util.regex.Pattern;

/**
 * Estratto su una sola riga del testo di una pagina, di lunghezza limitata.
 */
public class SnippetBuilder {

    public static final int DEFAULT_MAX_CHARS = 240;

    // anche NBSP, U+0085, U+2028 e gli altri spazi Unicode
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String ELLIPSIS = "...";

    private SnippetBuilder() {}

    /**
     * La lunghezza è in unità {@code char}; il taglio non lascia mai un surrogato
     * alto isolato, quindi con caratteri fuori dal BMP l'estratto può risultare
     * di un carattere più corto del limite.
     *
     * @param maxChars lunghezza massima del risultato, ellissi compresa
     * @throws IllegalArgumentException se {@code maxChars < 1}
     */
    public static String snippet(String text, int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars deve essere >= 1 (ricevuto: " + maxChars + ")");
        }
        String singleLine = WHITESPACE.matcher(text == null ? "" : text).replaceAll(" ").strip();
        if (singleLine.length() <= maxChars) {
            return singleLine;
        }
        // caso degenere: nessuno spazio per il contenuto
        if (maxChars <= ELLIPSIS.length()) {
            return ".".repeat(maxChars);
        }
        int cut = maxChars - ELLIPSIS.length();
        // non spezzare una coppia surrogata
        if (Character.isHighSurrogate(singleLine.charAt(cut - 1))) {
            cut--;
        }
        return singleLine.substring(0, cut).stripTrailing() + ELLIPSIS;
    }
}
