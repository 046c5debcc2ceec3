package it.aw.pagesearch.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentFingerprinterTest {

    @Test
    void shouldComputeSha256Hex() {
        assertThat(ContentFingerprinter.digest("abc".getBytes(StandardCharsets.US_ASCII)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(ContentFingerprinter.digest(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void shouldChange_whenOneByteChanges() {
        byte[] original = {1, 2, 3, 4};
        byte[] changed = {1, 2, 3, 5};

        assertThat(ContentFingerprinter.digest(original))
                .hasSize(64)
                .isEqualTo(ContentFingerprinter.digest(original.clone()))
                .isNotEqualTo(ContentFingerprinter.digest(changed));
    }
}
