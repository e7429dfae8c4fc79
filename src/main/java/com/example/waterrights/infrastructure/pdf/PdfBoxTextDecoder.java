package com.example.waterrights.infrastructure.pdf;

import com.example.waterrights.application.service.extraction.TextDecoder;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.font.encoding.Encoding;
import org.apache.pdfbox.pdmodel.font.encoding.GlyphList;

/**
 * Decodes single byte text operands through one of PDFBox's standard encodings and the Adobe glyph list.
 */
public final class PdfBoxTextDecoder implements TextDecoder {

    private final Encoding encoding;
    private final GlyphList glyphList = GlyphList.getAdobeGlyphList();

    private PdfBoxTextDecoder(Encoding encoding) {
        this.encoding = encoding;
    }

    /**
     * @param encodingName standard encoding such as {@code WinAnsiEncoding}
     * @return decoder for that encoding
     * @throws IllegalArgumentException for names PDFBox does not know
     */
    public static PdfBoxTextDecoder forEncoding(String encodingName) {
        Encoding encoding = Encoding.getInstance(COSName.getPDFName(encodingName));
        if (encoding == null) {
            throw new IllegalArgumentException("Unsupported text encoding: " + encodingName);
        }
        return new PdfBoxTextDecoder(encoding);
    }

    @Override
    public String decode(byte[] bytes) {
        StringBuilder text = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int code = b & 0xFF;
            String unicode = glyphList.toUnicode(encoding.getName(code));
            // codes without a glyph name keep their Latin-1 meaning
            if (unicode == null) {
                text.append((char) code);
            } else {
                text.append(unicode);
            }
        }
        return text.toString();
    }
}
