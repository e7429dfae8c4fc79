package com.example.waterrights.application.service.parse;

import com.example.waterrights.domain.exception.FieldFormatException;
import com.example.waterrights.domain.exception.UnknownFieldException;
import com.example.waterrights.domain.model.WaterRight;
import com.example.waterrights.domain.model.report.KeyValuePair;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fills the water right level fields from the root section of a report.
 */
@Component
public class RootSectionParser {

    /**
     * @param pairs      root section pairs
     * @param waterRight water right to fill
     * @throws UnknownFieldException when a key is not part of the root vocabulary
     * @throws FieldFormatException  when {@code Kennziffer} is missing or malformed
     */
    public void parse(List<KeyValuePair> pairs, WaterRight waterRight) {
        for (KeyValuePair pair : pairs) {
            FieldValues field = FieldValues.of(pair);
            String value = field.first();
            switch (pair.key()) {
                case "Wasserbuchbehörde" -> waterRight.setWaterAuthority(value);
                case "Kennziffer" -> parseIdentifier(field, waterRight);
                case "erteilt durch /", "abweichend", "und betrifft Rechtsabteilungen" -> {
                    // connective labels printed between fields
                }
                case "eingetragen durch:" -> waterRight.setRegisteringAuthority(value);
                case "erteilt durch:" -> waterRight.setGrantingAuthority(value);
                case "erteilt am:" -> waterRight.setValidFrom(value);
                // "ertellt" is a misprint found in some reports
                case "erstmalig erteilt am:", "erstmalig ertellt am:" -> waterRight.setInitiallyGranted(value);
                case "Aktenzeichen:" -> waterRight.setFileReference(value);
                case "Das Recht ist befristet bis" -> waterRight.setValidUntil(value);
                case "Betreff:" -> waterRight.setSubject(value);
                default -> throw new UnknownFieldException("root", pair.key());
            }
        }
    }

    /**
     * {@code "<external identifier> (<status>)"}: the last token without its enclosing characters is the status.
     */
    private void parseIdentifier(FieldValues field, WaterRight waterRight) {
        String value = field.requireFirst();
        int split = value.lastIndexOf(' ');
        String status = split < 0 ? value : value.substring(split + 1);
        if (status.length() < 2) {
            throw new FieldFormatException(field.key(), "status is missing in '" + value + "'");
        }
        waterRight.setStatus(status.substring(1, status.length() - 1));
        waterRight.setExternalIdentifier(split < 0 ? null : value.substring(0, split));
    }
}
