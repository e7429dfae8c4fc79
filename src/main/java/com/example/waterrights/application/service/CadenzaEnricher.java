package com.example.waterrights.application.service;

import com.example.waterrights.domain.model.CadenzaRow;
import com.example.waterrights.domain.model.LegalDepartment;
import com.example.waterrights.domain.model.LegalPurpose;
import com.example.waterrights.domain.model.ReportWarning;
import com.example.waterrights.domain.model.UsageLocation;
import com.example.waterrights.domain.model.WarningKind;
import com.example.waterrights.domain.model.WaterRight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Backfills fields a report does not print from the spreadsheet rows of the same water right.
 * Only absent values are filled; each row is matched to at most one usage location.
 */
@Component
public class CadenzaEnricher {

    private static final Logger log = LoggerFactory.getLogger(CadenzaEnricher.class);

    /**
     * @param waterRight parsed water right, enriched in place
     * @param rows       spreadsheet rows of this water right
     * @param warnings   receives warnings about usage locations that could not be matched
     * @return {@code true} when at least one row exists for the water right
     */
    public boolean enrich(WaterRight waterRight, List<CadenzaRow> rows, List<ReportWarning> warnings) {
        if (rows.isEmpty()) {
            return false;
        }
        rows.forEach(row -> backfillWaterRight(waterRight, row));

        List<CadenzaRow> unmatched = new ArrayList<>(rows);
        for (LegalDepartment department : waterRight.getLegalDepartments().values()) {
            for (UsageLocation location : department.getUsageLocations()) {
                Optional<CadenzaRow> match = findByName(unmatched, location).or(() -> findByCoordinates(unmatched, location));
                if (match.isEmpty()) {
                    log.warn("Water right {}: no spreadsheet row for usage location '{}'",
                            waterRight.getNo(), location.getName());
                    warnings.add(ReportWarning.of(waterRight.getNo(), WarningKind.USAGE_LOCATION_NOT_FOUND,
                            "could not find usage location '" + location.getName() + "' in the spreadsheet"));
                    continue;
                }
                unmatched.remove(match.get());
                backfillUsageLocation(location, match.get());
            }
        }

        if (!unmatched.isEmpty()) {
            List<Long> missing = unmatched.stream().map(CadenzaRow::usageLocationNo).filter(Objects::nonNull).toList();
            log.warn("Water right {}: usage locations {} are missing in the report", waterRight.getNo(), missing);
            warnings.add(ReportWarning.of(waterRight.getNo(), WarningKind.MISSING_USAGE_LOCATIONS,
                    "usage locations " + missing + " are missing in the report"));
        }
        return true;
    }

    private static Optional<CadenzaRow> findByName(List<CadenzaRow> rows, UsageLocation location) {
        if (location.getName() == null) {
            return Optional.empty();
        }
        return rows.stream().filter(row -> location.getName().equals(row.usageLocation())).findFirst();
    }

    private static Optional<CadenzaRow> findByCoordinates(List<CadenzaRow> rows, UsageLocation location) {
        if (location.getUtmEasting() == null || location.getUtmNorthing() == null) {
            return Optional.empty();
        }
        return rows.stream()
                .filter(row -> location.getUtmEasting().equals(row.utmEasting())
                        && location.getUtmNorthing().equals(row.utmNorthing()))
                .findFirst();
    }

    private static void backfillWaterRight(WaterRight waterRight, CadenzaRow row) {
        fillIfAbsent(waterRight::getHolder, waterRight::setHolder, row.rightsHolder());
        fillIfAbsent(waterRight::getValidUntil, waterRight::setValidUntil, row.validUntil());
        fillIfAbsent(waterRight::getStatus, waterRight::setStatus, row.status());
        fillIfAbsent(waterRight::getValidFrom, waterRight::setValidFrom, row.validFrom());
        fillIfAbsent(waterRight::getLegalTitle, waterRight::setLegalTitle, row.legalTitle());
        fillIfAbsent(waterRight::getWaterAuthority, waterRight::setWaterAuthority, row.waterAuthority());
        fillIfAbsent(waterRight::getGrantingAuthority, waterRight::setGrantingAuthority, row.grantingAuthority());
        fillIfAbsent(waterRight::getLastChange, waterRight::setLastChange, row.dateOfChange());
        fillIfAbsent(waterRight::getFileReference, waterRight::setFileReference, row.fileReference());
        fillIfAbsent(waterRight::getExternalIdentifier, waterRight::setExternalIdentifier, row.externalIdentifier());
        fillIfAbsent(waterRight::getAddress, waterRight::setAddress, row.address());
    }

    private static void backfillUsageLocation(UsageLocation location, CadenzaRow row) {
        fillIfAbsent(location::getNo, location::setNo, row.usageLocationNo());
        fillIfAbsent(location::getLegalPurpose, location::setLegalPurpose, LegalPurpose.parse(row.legalPurpose()));
        fillIfAbsent(location::getCounty, location::setCounty, row.county());
        fillIfAbsent(location::getRiverBasin, location::setRiverBasin, row.riverBasin());
        fillIfAbsent(location::getGroundwaterBody, location::setGroundwaterBody, row.groundwaterBody());
        fillIfAbsent(location::getFloodArea, location::setFloodArea, row.floodArea());
        fillIfAbsent(location::getWaterProtectionArea, location::setWaterProtectionArea, row.waterProtectionArea());
        // the setters drop zero coordinates
        fillIfAbsent(location::getUtmEasting, location::setUtmEasting, row.utmEasting());
        fillIfAbsent(location::getUtmNorthing, location::setUtmNorthing, row.utmNorthing());
    }

    private static <T> void fillIfAbsent(Supplier<T> getter, Consumer<T> setter, T value) {
        if (getter.get() == null && value != null) {
            setter.accept(value);
        }
    }
}
