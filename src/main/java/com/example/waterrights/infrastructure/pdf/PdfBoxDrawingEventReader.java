package com.example.waterrights.infrastructure.pdf;

import com.example.waterrights.domain.model.report.DrawingEvent;
import com.example.waterrights.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the text related drawing instructions of every page with PDFBox.
 * Only {@code BT}, {@code ET}, {@code Tm}, {@code Tf}, {@code rg} and the text show operators are kept;
 * operands are passed on undecoded.
 */
@Component
public class PdfBoxDrawingEventReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDrawingEventReader.class);

    /**
     * Loads a report and reads its drawing events.
     *
     * @param pdfBytes raw PDF
     * @return drawing events per page
     * @throws PdfProcessingException when PDFBox cannot load the document or parse a content stream
     */
    public List<List<DrawingEvent>> read(byte[] pdfBytes) {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            return read(document);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the report PDF.", e);
        }
    }

    /**
     * @param document loaded report
     * @return drawing events per page in page order
     * @throws IOException when a content stream cannot be parsed
     */
    public List<List<DrawingEvent>> read(PDDocument document) throws IOException {
        List<List<DrawingEvent>> pages = new ArrayList<>(document.getNumberOfPages());
        int index = 0;
        for (PDPage page : document.getPages()) {
            DrawingEventCollector collector = new DrawingEventCollector(index++);
            collector.processPage(page);
            pages.add(collector.events);
        }
        log.debug("Read drawing events of {} pages", pages.size());
        return pages;
    }

    /**
     * Receives every operator of a page's content stream without executing it.
     */
    static final class DrawingEventCollector extends PDFStreamEngine {
        private final int page;
        private final List<DrawingEvent> events = new ArrayList<>();

        DrawingEventCollector(int page) {
            this.page = page;
        }

        @Override
        protected void processOperator(Operator operator, List<COSBase> operands) {
            switch (operator.getName()) {
                case OperatorName.BEGIN_TEXT -> events.add(new DrawingEvent.BeginText());
                case OperatorName.END_TEXT -> events.add(new DrawingEvent.EndText());
                case OperatorName.SET_MATRIX -> position(operands);
                case OperatorName.SET_FONT_AND_SIZE -> font(operands);
                case OperatorName.NON_STROKING_RGB -> fillColor(operands);
                case OperatorName.SHOW_TEXT, OperatorName.SHOW_TEXT_LINE -> showText(operands, 0);
                case OperatorName.SHOW_TEXT_LINE_AND_SPACE -> showText(operands, 2);
                case OperatorName.SHOW_TEXT_ADJUSTED -> showTextArray(operands);
                default -> {
                    // not relevant for text blocks
                }
            }
        }

        private void position(List<COSBase> operands) {
            Float x = number(operands, 4);
            Float y = number(operands, 5);
            if (x == null || y == null) {
                log.warn("Page {}: expected numbers for 'Tm' operands 4 and 5", page);
                return;
            }
            events.add(new DrawingEvent.SetPosition(x, y));
        }

        private void font(List<COSBase> operands) {
            if (operands.isEmpty() || !(operands.get(0) instanceof COSName name)) {
                log.warn("Page {}: expected font name for 'Tf' operand 0", page);
                return;
            }
            Float size = number(operands, 1);
            events.add(new DrawingEvent.SetFont(name.getName(), size == null ? 0f : size));
        }

        private void fillColor(List<COSBase> operands) {
            Float r = number(operands, 0);
            Float g = number(operands, 1);
            Float b = number(operands, 2);
            if (r == null || g == null || b == null) {
                log.warn("Page {}: expected three numbers for 'rg'", page);
                return;
            }
            events.add(new DrawingEvent.SetFillColor(r, g, b));
        }

        private void showText(List<COSBase> operands, int index) {
            if (operands.size() <= index || !(operands.get(index) instanceof COSString text)) {
                log.warn("Page {}: expected string operand for text show", page);
                return;
            }
            events.add(new DrawingEvent.ShowText(text.getBytes()));
        }

        private void showTextArray(List<COSBase> operands) {
            if (operands.isEmpty() || !(operands.get(0) instanceof COSArray array)) {
                log.warn("Page {}: expected array operand for 'TJ'", page);
                return;
            }
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            for (COSBase item : array) {
                if (item instanceof COSString text) {
                    bytes.writeBytes(text.getBytes());
                }
            }
            events.add(new DrawingEvent.ShowText(bytes.toByteArray()));
        }

        private static Float number(List<COSBase> operands, int index) {
            if (operands.size() <= index || !(operands.get(index) instanceof COSNumber number)) {
                return null;
            }
            return number.floatValue();
        }
    }
}
