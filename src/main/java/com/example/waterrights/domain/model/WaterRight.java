package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate root describing a single water right, keyed by its water right number.
 * Text fields hold what the report prints; dates are normalized to {@code yyyy-MM-dd} where possible.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WaterRight {

    private final long no;
    private String holder;
    private String validUntil;
    private String status;
    private String validFrom;
    private String legalTitle;
    private String waterAuthority;
    private String registeringAuthority;
    private String grantingAuthority;
    private String initiallyGranted;
    private String lastChange;
    private String fileReference;
    private String externalIdentifier;
    private String subject;
    private String address;
    private final Map<LegalDepartmentAbbreviation, LegalDepartment> legalDepartments =
            new EnumMap<>(LegalDepartmentAbbreviation.class);
    private String annotation;

    public WaterRight(long no) {
        this.no = no;
    }

    /**
     * @return "Wasserrecht Nr."
     */
    public long getNo() {
        return no;
    }

    /**
     * @return "Rechtsinhaber"
     */
    public String getHolder() {
        return holder;
    }

    public void setHolder(String holder) {
        this.holder = holder;
    }

    /**
     * @return "Das Recht ist befristet bis"
     */
    public String getValidUntil() {
        return validUntil;
    }

    public void setValidUntil(String validUntil) {
        this.validUntil = validUntil;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    /**
     * @return "erteilt am"
     */
    public String getValidFrom() {
        return validFrom;
    }

    public void setValidFrom(String validFrom) {
        this.validFrom = validFrom;
    }

    public String getLegalTitle() {
        return legalTitle;
    }

    public void setLegalTitle(String legalTitle) {
        this.legalTitle = legalTitle;
    }

    /**
     * @return "Wasserbuchbehörde"
     */
    public String getWaterAuthority() {
        return waterAuthority;
    }

    public void setWaterAuthority(String waterAuthority) {
        this.waterAuthority = waterAuthority;
    }

    public String getRegisteringAuthority() {
        return registeringAuthority;
    }

    public void setRegisteringAuthority(String registeringAuthority) {
        this.registeringAuthority = registeringAuthority;
    }

    public String getGrantingAuthority() {
        return grantingAuthority;
    }

    public void setGrantingAuthority(String grantingAuthority) {
        this.grantingAuthority = grantingAuthority;
    }

    /**
     * @return "erstmalig erteilt am"
     */
    public String getInitiallyGranted() {
        return initiallyGranted;
    }

    public void setInitiallyGranted(String initiallyGranted) {
        this.initiallyGranted = initiallyGranted;
    }

    public String getLastChange() {
        return lastChange;
    }

    public void setLastChange(String lastChange) {
        this.lastChange = lastChange;
    }

    /**
     * @return "Aktenzeichen"
     */
    public String getFileReference() {
        return fileReference;
    }

    public void setFileReference(String fileReference) {
        this.fileReference = fileReference;
    }

    public String getExternalIdentifier() {
        return externalIdentifier;
    }

    public void setExternalIdentifier(String externalIdentifier) {
        this.externalIdentifier = externalIdentifier;
    }

    /**
     * @return "Betreff"
     */
    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Map<LegalDepartmentAbbreviation, LegalDepartment> getLegalDepartments() {
        return legalDepartments;
    }

    /**
     * @return "Bemerkung"
     */
    public String getAnnotation() {
        return annotation;
    }

    public void setAnnotation(String annotation) {
        this.annotation = annotation;
    }
}
