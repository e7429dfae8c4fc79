package com.example.waterrights.application.service;

import com.example.waterrights.domain.model.ReportWarning;
import com.example.waterrights.domain.model.WarningKind;
import com.example.waterrights.domain.model.WaterRight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Final clean-up of a parsed water right: annotation prefix, implied granting authority and ISO dates.
 */
@Component
public class WaterRightPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(WaterRightPostProcessor.class);
    private static final String ANNOTATION_LABEL = "Bemerkung:";
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{1,2}-\\d{1,2}$");

    /**
     * @param waterRight water right to clean up in place
     * @param warnings   receives a warning for every date that could not be normalized
     */
    public void process(WaterRight waterRight, List<ReportWarning> warnings) {
        waterRight.setAnnotation(stripAnnotationLabel(waterRight.getAnnotation()));

        // a registering authority without a granting one granted the right itself
        if (waterRight.getGrantingAuthority() == null && waterRight.getRegisteringAuthority() != null) {
            waterRight.setGrantingAuthority(waterRight.getRegisteringAuthority());
        }

        normalizeDate(waterRight, "validUntil", waterRight::getValidUntil, waterRight::setValidUntil, warnings);
        normalizeDate(waterRight, "validFrom", waterRight::getValidFrom, waterRight::setValidFrom, warnings);
        normalizeDate(waterRight, "initiallyGranted", waterRight::getInitiallyGranted,
                waterRight::setInitiallyGranted, warnings);
        normalizeDate(waterRight, "lastChange", waterRight::getLastChange, waterRight::setLastChange, warnings);
    }

    static String stripAnnotationLabel(String annotation) {
        if (annotation == null || annotation.equals(ANNOTATION_LABEL)) {
            return null;
        }
        if (annotation.startsWith(ANNOTATION_LABEL + " ")) {
            return annotation.substring(ANNOTATION_LABEL.length() + 1);
        }
        return annotation;
    }

    /**
     * Rewrites {@code dd.MM.yyyy} to {@code yyyy-MM-dd}.
     *
     * @param date date as printed
     * @return normalized date or {@code null} when the text has not exactly three dot separated parts
     */
    static String toIsoDate(String date) {
        String[] parts = date.split("\\.", -1);
        if (parts.length != 3) {
            return null;
        }
        return parts[2] + "-" + parts[1] + "-" + parts[0];
    }

    /**
     * Rewrites one date field to ISO form. Values already in {@code yyyy-MM-dd} form, as backfilled from the
     * spreadsheet, are kept without a warning; any other shape that is not {@code dd.MM.yyyy} is kept as
     * printed and reported as {@link WarningKind#INVALID_DATE_FORMAT}.
     */
    private void normalizeDate(WaterRight waterRight, String field, Supplier<String> getter, Consumer<String> setter,
                               List<ReportWarning> warnings) {
        String date = getter.get();
        if (date == null || ISO_DATE.matcher(date).matches()) {
            return;
        }
        String normalized = toIsoDate(date);
        if (normalized != null) {
            setter.accept(normalized);
            return;
        }
        log.warn("Water right {}: {} has an invalid date format: '{}'", waterRight.getNo(), field, date);
        warnings.add(ReportWarning.of(waterRight.getNo(), WarningKind.INVALID_DATE_FORMAT,
                field + " has an invalid date format: '" + date + "'"));
    }
}
