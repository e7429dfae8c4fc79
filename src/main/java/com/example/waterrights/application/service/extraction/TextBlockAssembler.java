package com.example.waterrights.application.service.extraction;

import com.example.waterrights.domain.model.report.DrawingEvent;
import com.example.waterrights.domain.model.report.RgbColor;
import com.example.waterrights.domain.model.report.TextBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds text blocks from the drawing events of a report.
 * Each {@code BeginText}..{@code EndText} region yields one block carrying the first position, font and
 * fill color set inside it and the merged text of all its fragments.
 * Events arriving in an unexpected state are logged and skipped; they never fail a report.
 */
@Component
public class TextBlockAssembler {

    private static final Logger log = LoggerFactory.getLogger(TextBlockAssembler.class);

    /**
     * Assembles the blocks of all pages, keeping page order and event order.
     *
     * @param pages   drawing events per page
     * @param decoder decoder for text show operands
     * @return text blocks per page
     */
    public List<List<TextBlock>> assemble(List<List<DrawingEvent>> pages, TextDecoder decoder) {
        List<List<TextBlock>> blocks = new ArrayList<>(pages.size());
        for (int page = 0; page < pages.size(); page++) {
            blocks.add(assemblePage(page, pages.get(page), decoder));
        }
        return blocks;
    }

    /**
     * Assembles the blocks of a single page. A block left open at the end of the page is discarded.
     *
     * @param page    zero based page index stored on every block
     * @param events  drawing events of that page
     * @param decoder decoder for text show operands
     * @return finished text blocks in event order
     */
    public List<TextBlock> assemblePage(int page, List<DrawingEvent> events, TextDecoder decoder) {
        List<TextBlock> blocks = new ArrayList<>();
        OpenBlock open = null;
        for (DrawingEvent event : events) {
            if (event instanceof DrawingEvent.BeginText) {
                if (open != null) {
                    log.warn("Page {}: text block did already begin, ignoring BT", page);
                } else {
                    open = new OpenBlock(page);
                }
                continue;
            }
            if (open == null) {
                if (!(event instanceof DrawingEvent.SetFillColor)) {
                    log.warn("Page {}: no text block opened, ignoring {}", page, event.getClass().getSimpleName());
                }
                continue;
            }
            if (event instanceof DrawingEvent.SetPosition position) {
                open.position(position);
            } else if (event instanceof DrawingEvent.SetFont font) {
                open.font(font);
            } else if (event instanceof DrawingEvent.SetFillColor color) {
                open.fillColor(color);
            } else if (event instanceof DrawingEvent.ShowText text) {
                open.append(decoder.decode(text.bytes()));
            } else if (event instanceof DrawingEvent.EndText) {
                blocks.add(open.finish());
                open = null;
            }
        }
        if (open != null) {
            log.warn("Page {}: text block was not closed, dropping it", page);
        }
        return blocks;
    }

    /**
     * Joins a new fragment onto the text collected so far.
     * A trailing {@code -} or {@code /} marks a word split across lines, a trailing {@code .} or {@code ;}
     * ends a printed line; everything else is separated by a space.
     *
     * @param previous text collected so far, {@code null} when nothing was collected yet
     * @param fragment decoded fragment
     * @return merged text, {@code null} while every fragment was empty
     */
    static String join(String previous, String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return previous;
        }
        if (previous == null || previous.isEmpty()) {
            return fragment;
        }
        return switch (previous.charAt(previous.length() - 1)) {
            case '-', '/' -> previous + fragment;
            case '.', ';' -> previous + "\n" + fragment;
            default -> previous + " " + fragment;
        };
    }

    /**
     * Mutable state of the block between {@code BT} and {@code ET}.
     */
    static final class OpenBlock {
        private final int page;
        private Float x;
        private Float y;
        private String fontFamily;
        private Float fontSize;
        private RgbColor fillColor;
        private String content;

        OpenBlock(int page) {
            this.page = page;
        }

        void position(DrawingEvent.SetPosition position) {
            if (x == null && y == null) {
                x = position.x();
                y = position.y();
            }
        }

        void font(DrawingEvent.SetFont font) {
            if (fontFamily == null && fontSize == null) {
                fontFamily = font.family();
                fontSize = font.size();
            }
        }

        void fillColor(DrawingEvent.SetFillColor color) {
            if (fillColor == null) {
                fillColor = new RgbColor(color.r(), color.g(), color.b());
            }
        }

        void append(String fragment) {
            content = join(content, fragment);
        }

        TextBlock finish() {
            return new TextBlock(page, x, y, fontFamily, fontSize, fillColor, content);
        }
    }
}
