package com.example.waterrights.application.service.extraction;

import com.example.waterrights.domain.model.report.KeyValuePair;
import com.example.waterrights.domain.model.report.TextBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeyValueGrouperTest {

    private final KeyValueGrouper grouper = new KeyValueGrouper(FontRoleTable.of(List.of("F1"), List.of("F2", "F3")));

    @Test
    void labelFontStartsAPairAndValueFontsAppend() {
        List<KeyValuePair> pairs = grouper.group(List.of(List.of(
                block(0, 50, "F1", "Gemeindegebiet:"),
                block(0, 200, "F2", "123"),
                block(0, 260, "F3", "Hameln"),
                block(0, 50, "F1", "Bemerkung:"),
                block(0, 50, "F1", "wichtig"))));

        assertThat(pairs).containsExactly(
                KeyValuePair.of("Gemeindegebiet:", "123", "Hameln"),
                KeyValuePair.of("Bemerkung:"),
                KeyValuePair.of("wichtig"));
    }

    @Test
    void skipsBlocksWithoutFontOrContentAndUnknownFonts() {
        List<KeyValuePair> pairs = grouper.group(List.of(List.of(
                block(0, 50, "F1", "Gewässer:"),
                block(0, 200, null, "ohne Font"),
                block(0, 200, "F2", null),
                block(0, 200, "F9", "Kopfzeile"),
                block(0, 200, "F2", "Weser"))));

        assertThat(pairs).containsExactly(KeyValuePair.of("Gewässer:", "Weser"));
    }

    @Test
    void valueWrappedOntoNextPageContinuesItsColumn() {
        List<KeyValuePair> pairs = grouper.group(List.of(
                List.of(
                        block(0, 50, "F1", "Betreff:"),
                        block(0, 200, "F2", "Entnahme von Grundwasser zur"),
                        block(0, 50, "F1", "Aktenzeichen:"),
                        block(0, 300, "F2", "AZ 1")),
                List.of(
                        block(1, 200, "F2", "Beregnung"),
                        block(1, 50, "F1", "Wasserbuchbehörde"),
                        block(1, 200, "F2", "Hannover"))));

        assertThat(pairs).containsExactly(
                KeyValuePair.of("Betreff:", "Entnahme von Grundwasser zur Beregnung"),
                KeyValuePair.of("Aktenzeichen:", "AZ 1"),
                KeyValuePair.of("Wasserbuchbehörde", "Hannover"));
    }

    @Test
    void orphanValueInKeyColumnBecomesFirstValue() {
        List<KeyValuePair> pairs = grouper.group(List.of(
                List.of(block(0, 50, "F1", "Verordnungszitat:")),
                List.of(block(1, 50, "F2", "VO vom 1.1.2000"))));

        assertThat(pairs).containsExactly(KeyValuePair.of("Verordnungszitat:", "VO vom 1.1.2000"));
    }

    @Test
    void orphanValueWithoutMatchingColumnIsDropped() {
        List<KeyValuePair> pairs = grouper.group(List.of(
                List.of(block(0, 99, "F2", "ohne Label")),
                List.of(block(1, 50, "F1", "Gewässer:"), block(1, 200, "F2", "Weser"))));

        assertThat(pairs).containsExactly(KeyValuePair.of("Gewässer:", "Weser"));
    }

    @Test
    void labelAtTheEndOfAPageTakesTheValueStartingTheNextPage() {
        List<KeyValuePair> pairs = grouper.group(List.of(
                List.of(
                        block(0, 50, "F1", "Nutzungsort Lfd. Nr.:"),
                        block(0, 200, "F2", "1 (aktiv, real)"),
                        block(0, 50, "F1", "Bezeichnung:")),
                List.of(block(1, 200, "F2", "Brunnen 1"))));

        assertThat(pairs).containsExactly(
                KeyValuePair.of("Nutzungsort Lfd. Nr.:", "1 (aktiv, real)"),
                KeyValuePair.of("Bezeichnung:", "Brunnen 1"));
    }

    @Test
    void valueInANewColumnAfterAPageBreakStaysWithTheOpenPair() {
        List<KeyValuePair> pairs = grouper.group(List.of(
                List.of(
                        block(0, 50, "F1", "Gemeindegebiet:"),
                        block(0, 200, "F2", "241001")),
                List.of(
                        block(1, 260, "F3", "Hannover"),
                        block(1, 50, "F1", "Flurstück:"),
                        block(1, 200, "F2", "12/3"))));

        assertThat(pairs).containsExactly(
                KeyValuePair.of("Gemeindegebiet:", "241001", "Hannover"),
                KeyValuePair.of("Flurstück:", "12/3"));
    }

    private static TextBlock block(int page, float x, String font, String content) {
        return new TextBlock(page, x, 700f, font, 9f, null, content);
    }
}
