package com.example.waterrights.domain.model.report;

/**
 * Text of one {@code BT}..{@code ET} region with the first position, font and color set inside it.
 *
 * @param page       zero based page index
 * @param x          horizontal position or {@code null}
 * @param y          vertical position or {@code null}
 * @param fontFamily font resource name such as {@code F1}
 * @param fontSize   font size
 * @param fillColor  fill color
 * @param content    merged text, {@code null} when every fragment was empty
 */
public record TextBlock(
        int page,
        Float x,
        Float y,
        String fontFamily,
        Float fontSize,
        RgbColor fillColor,
        String content
) {

    /**
     * @return truncated {@code x} used to compare columns, {@code null} without a position
     */
    public Integer column() {
        return x == null ? null : (int) x.floatValue();
    }
}
