package com.example.waterrights.application.service.parse;

import com.example.waterrights.application.service.extraction.HierarchicalSegmenter;
import com.example.waterrights.domain.exception.UnknownFieldException;
import com.example.waterrights.domain.model.LegalDepartment;
import com.example.waterrights.domain.model.LegalDepartmentAbbreviation;
import com.example.waterrights.domain.model.UsageLocation;
import com.example.waterrights.domain.model.WaterRight;
import com.example.waterrights.domain.model.report.KeyValuePair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WaterRightParserTest {

    private final HierarchicalSegmenter segmenter = new HierarchicalSegmenter(true);
    private final WaterRightParser parser = WaterRightParser.create();

    @Test
    void parsesMinimalReport() {
        List<KeyValuePair> pairs = List.of(
                KeyValuePair.of("Wasserbuchbehörde", "X"),
                KeyValuePair.of("Abteilung:", "A Entnahme..."),
                KeyValuePair.of("Nutzungsort Lfd. Nr.:", "1 (aktiv, real)"),
                KeyValuePair.of("Bezeichnung:", "Brunnen 1"));

        WaterRight waterRight = parser.parse(1, segmenter.segment(pairs));

        assertThat(waterRight.getNo()).isEqualTo(1);
        assertThat(waterRight.getWaterAuthority()).isEqualTo("X");
        assertThat(waterRight.getLegalDepartments()).containsOnlyKeys(LegalDepartmentAbbreviation.A);
        LegalDepartment department = waterRight.getLegalDepartments().get(LegalDepartmentAbbreviation.A);
        assertThat(department.getDescription()).isEqualTo("Entnahme...");
        assertThat(department.getUsageLocations()).hasSize(1);
        UsageLocation location = department.getUsageLocations().get(0);
        assertThat(location.getActive()).isTrue();
        assertThat(location.getReal()).isTrue();
        assertThat(location.getName()).isEqualTo("Brunnen 1");
    }

    @Test
    void annotationIsCarriedOver() {
        List<KeyValuePair> pairs = List.of(
                KeyValuePair.of("Wasserbuchbehörde", "X"),
                KeyValuePair.of("Bemerkung:"),
                KeyValuePair.of("wichtig"));

        WaterRight waterRight = parser.parse(2, segmenter.segment(pairs));

        assertThat(waterRight.getAnnotation()).isEqualTo("Bemerkung: wichtig");
        assertThat(waterRight.getLegalDepartments()).isEmpty();
    }

    @Test
    void unknownKeyInsideDepartmentFailsTheReport() {
        List<KeyValuePair> pairs = List.of(
                KeyValuePair.of("Abteilung:", "E Entnahme von Grundwasser"),
                KeyValuePair.of("Nutzungsort Lfd. Nr.:", "1 (aktiv, real)"),
                KeyValuePair.of("Unbekannt:", "x"));

        assertThrows(UnknownFieldException.class, () -> parser.parse(3, segmenter.segment(pairs)));
    }
}
