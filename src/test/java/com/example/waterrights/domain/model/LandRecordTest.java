package com.example.waterrights.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LandRecordTest {

    @Test
    void lettersFollowedByDigitsAreTyped() {
        assertThat(LandRecord.parse("Foo12")).isEqualTo(OrFallback.expected(new LandRecord("Foo", 12)));
    }

    @Test
    void spacesAreIgnoredWhileMatching() {
        assertThat(LandRecord.parse("Groß Berkel 3"))
                .isEqualTo(OrFallback.expected(new LandRecord("GroßBerkel", 3)));
    }

    @Test
    void nonMatchingTextFallsBack() {
        OrFallback<LandRecord> parsed = LandRecord.parse("12Foo");

        assertThat(parsed.isExpected()).isFalse();
        assertThat(parsed.text()).isEqualTo("12Foo");
    }

    @Test
    void fallbackKeepsTheOriginalTextVerbatim() {
        for (String raw : List.of("12Foo", "Flur 3, Teil 2", "-", "  Hof  ", "Ölmühle 1a", "")) {
            OrFallback<LandRecord> parsed = LandRecord.parse(raw);
            assertThat(parsed.isExpected()).as(raw).isFalse();
            assertThat(parsed.text()).isEqualTo(raw);
        }
    }
}
