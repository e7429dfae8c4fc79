package com.example.waterrights.application.service.parse;

import com.example.waterrights.domain.exception.FieldFormatException;
import com.example.waterrights.domain.exception.UnknownFieldException;
import com.example.waterrights.domain.model.CodedName;
import com.example.waterrights.domain.model.LandRecord;
import com.example.waterrights.domain.model.LegalDepartmentAbbreviation;
import com.example.waterrights.domain.model.LegalPurpose;
import com.example.waterrights.domain.model.SingleOrPair;
import com.example.waterrights.domain.model.UsageLocation;
import com.example.waterrights.domain.model.report.KeyValuePair;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link UsageLocation} from the pairs of one usage location block.
 */
@Component
public class UsageLocationParser {

    private static final Pattern HEADER_PATTERN =
            Pattern.compile("^(?<serial>.*) \\((?<active>\\w+), (?<real>\\w+)\\)$", Pattern.UNICODE_CHARACTER_CLASS);

    private final AllowanceValueParser allowanceValueParser;

    public UsageLocationParser(AllowanceValueParser allowanceValueParser) {
        this.allowanceValueParser = allowanceValueParser;
    }

    /**
     * @param pairs      pairs of the usage location, may be empty
     * @param department department the usage location is filed under
     * @return parsed usage location
     * @throws UnknownFieldException when a key is not part of the usage location vocabulary
     * @throws FieldFormatException  when a value does not fit its field
     */
    public UsageLocation parse(List<KeyValuePair> pairs, LegalDepartmentAbbreviation department) {
        UsageLocation location = new UsageLocation();
        for (KeyValuePair pair : pairs) {
            parseField(FieldValues.of(pair), location, department);
        }
        return location;
    }

    private void parseField(FieldValues field, UsageLocation location, LegalDepartmentAbbreviation department) {
        switch (field.key()) {
            case "Nutzungsort Lfd. Nr.:" -> parseHeader(field, location);
            case "Bezeichnung:" -> location.setName(field.first() == null ? null : field.first().replace('\n', ' '));
            case "Rechtszweck:" -> location.setLegalPurpose(LegalPurpose.parse(field.requireFirst()));
            case "East und North:" -> location.setUtmEasting(field.parseLong(field.requireFirst()));
            case "(ETRS89/UTM 32N)" -> location.setUtmNorthing(field.parseLong(field.requireFirst()));
            case "Top. Karte 1:25.000:" -> location.setMapExcerpt(singleOrPair(field));
            case "Einzugsgebietskennzahl:" -> location.setCatchmentAreaCode(singleOrPair(field));
            case "Gemeindegebiet:" -> location.setMunicipalArea(codedName(field));
            case "Unterhaltungsverband:" -> location.setMaintenanceAssociation(codedName(field));
            case "EU-Bearbeitungsgebiet:" -> location.setEuSurveyArea(codedName(field));
            case "Gemarkung, Flur:" -> {
                if (field.first() != null) {
                    location.setLandRecord(LandRecord.parse(field.first()));
                }
            }
            case "Flurstück:" -> location.setPlot(field.first());
            case "Gewässer:" -> location.setWaterBody(field.first());
            case "Verordnungszitat:" -> location.setRegulationCitation(field.first());
            case AllowanceValueParser.ALLOWANCE_KEY ->
                    allowanceValueParser.parse(field.requireFirst(), location, department);
            default -> {
                if (AllowanceKind.fromLabel(field.key()).isEmpty()) {
                    throw new UnknownFieldException("usage location", field.key());
                }
                allowanceValueParser.parseLabelled(field.key(), field.requireFirst(), location, department);
            }
        }
    }

    private static void parseHeader(FieldValues field, UsageLocation location) {
        String value = field.requireFirst();
        Matcher matcher = HEADER_PATTERN.matcher(value);
        if (!matcher.matches()) {
            throw new FieldFormatException(field.key(), "expected '<serial> (<active>, <real>)' but got '" + value + "'");
        }
        location.setSerial(matcher.group("serial"));
        location.setActive("aktiv".equals(matcher.group("active")));
        location.setReal("real".equals(matcher.group("real")));
    }

    private static SingleOrPair singleOrPair(FieldValues field) {
        if (field.isEmpty()) {
            return null;
        }
        if (field.first() == null) {
            throw field.arityMismatch();
        }
        long code = field.parseLong(field.first().replace(" ", ""));
        return field.second() == null ? new SingleOrPair.Single(code) : new SingleOrPair.Pair(code, field.second());
    }

    private static CodedName codedName(FieldValues field) {
        if (field.isEmpty()) {
            return null;
        }
        if (field.first() == null || field.second() == null) {
            throw field.arityMismatch();
        }
        return new CodedName(field.parseLong(field.first()), field.second());
    }
}
