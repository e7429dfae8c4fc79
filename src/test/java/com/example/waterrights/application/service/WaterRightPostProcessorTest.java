package com.example.waterrights.application.service;

import com.example.waterrights.domain.model.ReportWarning;
import com.example.waterrights.domain.model.WarningKind;
import com.example.waterrights.domain.model.WaterRight;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WaterRightPostProcessorTest {

    private final WaterRightPostProcessor postProcessor = new WaterRightPostProcessor();

    @Test
    void normalizesGermanDates() {
        WaterRight waterRight = new WaterRight(5);
        waterRight.setValidFrom("01.02.2003");
        waterRight.setValidUntil("31.12.2030");
        List<ReportWarning> warnings = new ArrayList<>();

        postProcessor.process(waterRight, warnings);

        assertThat(waterRight.getValidFrom()).isEqualTo("2003-02-01");
        assertThat(waterRight.getValidUntil()).isEqualTo("2030-12-31");
        assertThat(warnings).isEmpty();
    }

    @Test
    void isoDatesAreLeftAlone() {
        WaterRight waterRight = new WaterRight(5);
        waterRight.setLastChange("2021-03-04");
        List<ReportWarning> warnings = new ArrayList<>();

        postProcessor.process(waterRight, warnings);

        assertThat(waterRight.getLastChange()).isEqualTo("2021-03-04");
        assertThat(warnings).isEmpty();
    }

    @Test
    void unreadableDateIsKeptAndReported() {
        WaterRight waterRight = new WaterRight(5);
        waterRight.setInitiallyGranted("unbefristet");
        List<ReportWarning> warnings = new ArrayList<>();

        postProcessor.process(waterRight, warnings);

        assertThat(waterRight.getInitiallyGranted()).isEqualTo("unbefristet");
        assertThat(warnings).singleElement().satisfies(warning -> {
            assertThat(warning.waterRightNo()).isEqualTo(5L);
            assertThat(warning.kind()).isEqualTo(WarningKind.INVALID_DATE_FORMAT);
            assertThat(warning.message()).contains("initiallyGranted", "unbefristet");
        });
    }

    @Test
    void annotationLabelIsRemoved() {
        assertThat(WaterRightPostProcessor.stripAnnotationLabel("Bemerkung: wichtig")).isEqualTo("wichtig");
        assertThat(WaterRightPostProcessor.stripAnnotationLabel("Bemerkung:")).isNull();
        assertThat(WaterRightPostProcessor.stripAnnotationLabel("Hinweis")).isEqualTo("Hinweis");
        assertThat(WaterRightPostProcessor.stripAnnotationLabel(null)).isNull();
    }

    @Test
    void registeringAuthorityStandsInForMissingGrantingAuthority() {
        WaterRight waterRight = new WaterRight(5);
        waterRight.setRegisteringAuthority("Landkreis");

        postProcessor.process(waterRight, new ArrayList<>());

        assertThat(waterRight.getGrantingAuthority()).isEqualTo("Landkreis");
    }

    @Test
    void grantingAuthorityIsNotOverwritten() {
        WaterRight waterRight = new WaterRight(5);
        waterRight.setRegisteringAuthority("Landkreis");
        waterRight.setGrantingAuthority("NLWKN");

        postProcessor.process(waterRight, new ArrayList<>());

        assertThat(waterRight.getGrantingAuthority()).isEqualTo("NLWKN");
    }
}
