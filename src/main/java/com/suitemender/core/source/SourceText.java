package com.suitemender.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;

/**
 * Source text plus its UTF-8 bytes.
 *
 * tree-sitter reports UTF-8 byte offsets; Java strings index UTF-16 code units.
 * Any non-ASCII character before a node makes the two diverge, so node text is
 * always cut from the bytes.
 */
public final class SourceText {

    private static final Logger log = LoggerFactory.getLogger(SourceText.class);

    private final String text;
    private final byte[] utf8;

    private SourceText(String text) {
        this.text = text;
        this.utf8 = text.getBytes(StandardCharsets.UTF_8);
    }

    public static SourceText of(String text) {
        return new SourceText(text != null ? stripBom(text) : "");
    }

    public String text()      { return text; }
    public int    byteLength() { return utf8.length; }

    /** Substring for the UTF-8 byte range [startByte, endByte), clamped to the source. */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn("[SourceText] Invalid byte range {}..{} (length {})", startByte, endByte, utf8.length);
            return "";
        }
        if (startByte >= utf8.length) return "";
        int end = Math.min(endByte, utf8.length);
        return new String(utf8, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    public String textOf(TSNode node) {
        if (node == null || node.isNull()) return "";
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
