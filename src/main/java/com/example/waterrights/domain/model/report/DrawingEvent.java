package com.example.waterrights.domain.model.report;

/**
 * Text related drawing instructions of one page, in content stream order.
 */
public sealed interface DrawingEvent {

    /** {@code BT} */
    record BeginText() implements DrawingEvent {
    }

    /** {@code Tm}: translation part of the text matrix. */
    record SetPosition(float x, float y) implements DrawingEvent {
    }

    /** {@code Tf}: font resource name and size. */
    record SetFont(String family, float size) implements DrawingEvent {
    }

    /** {@code rg}: non-stroking fill color. */
    record SetFillColor(float r, float g, float b) implements DrawingEvent {
    }

    /** {@code Tj}/{@code TJ}: still encoded text bytes. */
    record ShowText(byte[] bytes) implements DrawingEvent {
        public ShowText {
            bytes = bytes == null ? new byte[0] : bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }
    }

    /** {@code ET} */
    record EndText() implements DrawingEvent {
    }
}
