package com.example.waterrights.domain.model;

/**
 * One row of the spreadsheet export ("Cadenza" table): water right level columns repeated for
 * every usage location of that water right.
 */
public record CadenzaRow(
        long no,
        String rightsHolder,
        String validUntil,
        String status,
        String validFrom,
        String legalTitle,
        String waterAuthority,
        String grantingAuthority,
        String dateOfChange,
        String fileReference,
        String externalIdentifier,
        String subject,
        String address,
        Long usageLocationNo,
        String usageLocation,
        String legalDepartment,
        String legalPurpose,
        String county,
        String riverBasin,
        String groundwaterBody,
        String floodArea,
        String waterProtectionArea,
        Long utmEasting,
        Long utmNorthing
) {
}
