package it.aw.pagesearch.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void shouldUnifyLineEndings() {
        assertThat(TextNormalizer.normalize("a\r\nb\r\rc")).isEqualTo("a\nb\nc");
    }

    @Test
    void shouldCollapseSpacesAndParagraphBreaks() {
        assertThat(TextNormalizer.normalize("x   y\n\n\n\nz")).isEqualTo("x y\n\nz");
    }

    @Test
    void shouldCollapseTabsButKeepSingleAndDoubleNewlines() {
        assertThat(TextNormalizer.normalize("a\t\t b\nc\n\nd")).isEqualTo("a b\nc\n\nd");
    }

    @Test
    void shouldStripLeadingAndTrailingWhitespace() {
        assertThat(TextNormalizer.normalize("  \n\t title \n\n")).isEqualTo("title");
    }

    @Test
    void shouldReturnEmptyString_whenInputIsBlankOrNull() {
        assertThat(TextNormalizer.normalize(" \r\n\t ")).isEmpty();
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void shouldBeIdempotent() {
        String once = TextNormalizer.normalize("A  b\r\n\r\n\r\nc\t d ");
        assertThat(TextNormalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void shouldReturnEmptyString_whenInputIsOnlyNonBreakingSpaces() {
        assertThat(TextNormalizer.normalize("\u00a0\u00a0")).isEmpty();
        assertThat(TextNormalizer.normalize("\u202f\n\u2007")).isEmpty();
    }

    @Test
    void shouldStripNonBreakingSpacesAtEdgesButKeepThemInside() {
        assertThat(TextNormalizer.normalize("\u00a0 page\u00a0one \u202f")).isEqualTo("page\u00a0one");
    }
}
