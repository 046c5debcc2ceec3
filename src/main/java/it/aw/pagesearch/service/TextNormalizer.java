package it.aw.pagesearch.service;

import java.util.regex.Pattern;

/**
 * Canonicalizza il testo estratto da una pagina prima della memorizzazione.
 * <p>
 * Regole, nell'ordine:
 * <ol>
 *   <li>{@code \r\n} e {@code \r} diventano {@code \n}</li>
 *   <li>sequenze di spazi e tab diventano un solo spazio (i newline restano)</li>
 *   <li>tre o più newline consecutivi diventano esattamente due</li>
 *   <li>trim del risultato, con qualsiasi spazio Unicode (NBSP, U+2007, U+202F compresi)</li>
 * </ol>
 */
public class TextNormalizer {

    private static final Pattern SPACE_TAB = Pattern.compile("[ \\t]+");
    private static final Pattern THREE_PLUS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern EDGE_WHITESPACE =
            Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null) return "";
        String normalized = raw.replace("\r\n", "\n").replace('\r', '\n');
        normalized = SPACE_TAB.matcher(normalized).replaceAll(" ");
        normalized = THREE_PLUS_NEWLINES.matcher(normalized).replaceAll("\n\n");
        return EDGE_WHITESPACE.matcher(normalized).replaceAll("");
    }
}
