package it.aw.pagesearch.service;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Impronta SHA-256 dei byte grezzi di un file, usata solo per rilevare modifiche.
 */
public class ContentFingerprinter {

    private ContentFingerprinter() {}

    /** @return 64 caratteri esadecimali minuscoli */
    public static String digest(byte[] content) {
        return DigestUtils.sha256Hex(content);
    }
}
