package it.aw.pagesearch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SnippetBuilderTest {

    @Test
    void shouldTruncateLongTextWithEllipsis() {
        String snippet = SnippetBuilder.snippet("a".repeat(500), 240);

        assertThat(snippet).hasSize(240).endsWith("...");
    }

    @Test
    void shouldReturnShortTextUnchanged() {
        assertThat(SnippetBuilder.snippet("short", 240)).isEqualTo("short");
    }

    @Test
    void shouldReturnOnlyDots_whenMaxCharsIsThreeOrLess() {
        assertThat(SnippetBuilder.snippet("abcdef", 2)).isEqualTo("..");
        assertThat(SnippetBuilder.snippet("abcdef", 3)).isEqualTo("...");
        assertThat(SnippetBuilder.snippet("abcdef", 1)).isEqualTo(".");
    }

    @Test
    void shouldCollapseWhitespaceIntoSingleLine() {
        assertThat(SnippetBuilder.snippet("  first line\n\nsecond\t line  ", 240))
                .isEqualTo("first line second line");
    }

    @Test
    void shouldTrimTrailingWhitespaceAtCutPoint() {
        // "abcd efgh" tagliato a 5 caratteri lascia "abcd " -> "abcd"
        assertThat(SnippetBuilder.snippet("abcd efgh ijkl", 8)).isEqualTo("abcd...");
    }

    @Test
    void shouldRejectNonPositiveMaxChars() {
        assertThatThrownBy(() -> SnippetBuilder.snippet("text", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCollapseUnicodeWhitespace() {
        assertThat(SnippetBuilder.snippet("alpha\u2028beta\u00a0\u00a0gamma", 240))
                .isEqualTo("alpha beta gamma");
        assertThat(SnippetBuilder.snippet("\u00a0one\u0085two\u202f", 240)).isEqualTo("one two");
    }

    @Test
    void shouldNotSplitSurrogatePair_whenCutFallsInsideEmoji() {
        String snippet = SnippetBuilder.snippet("\uD83D\uDE00".repeat(300), 240);

        assertThat(snippet).endsWith("...");
        assertThat(snippet.length()).isLessThanOrEqualTo(240);
        char beforeEllipsis = snippet.charAt(snippet.length() - 4);
        assertThat(Character.isHighSurrogate(beforeEllipsis)).isFalse();
        assertThat(snippet.codePoints().noneMatch(cp -> Character.isSurrogate((char) cp))).isTrue();
    }
}
