package it.aw.pagesearch.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Spezza il testo in termini minuscoli alfanumerici (ASCII).
 * Usato sia per il corpus sia per la query, così i termini coincidono.
 */
public class Tokenizer {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^0-9A-Za-z]+");

    private Tokenizer() {}

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) return tokens;
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }
}
