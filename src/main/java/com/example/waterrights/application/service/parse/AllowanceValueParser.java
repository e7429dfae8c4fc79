package com.example.waterrights.application.service.parse;

import com.example.waterrights.domain.exception.FieldFormatException;
import com.example.waterrights.domain.exception.UnknownFieldException;
import com.example.waterrights.domain.model.InjectionLimit;
import com.example.waterrights.domain.model.LegalDepartmentAbbreviation;
import com.example.waterrights.domain.model.OrFallback;
import com.example.waterrights.domain.model.PhValues;
import com.example.waterrights.domain.model.Quantity;
import com.example.waterrights.domain.model.Rate;
import com.example.waterrights.domain.model.UsageLocation;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parses allowance values such as {@code "Entnahmemenge 12 m³/2a"} and stores them on a usage location.
 * The last two tokens are value and unit, everything before them names the kind of allowance.
 * Rates that do not follow the rate grammar are kept as their raw {@code "<value> <unit>"} text.
 */
@Component
public class AllowanceValueParser {

    static final String ALLOWANCE_KEY = "Erlaubniswert:";

    /**
     * @param text       allowance text, {@code "<kind> <value> <unit>"}
     * @param location   usage location receiving the value
     * @param department department the usage location is filed under
     * @throws FieldFormatException  when kind, value or unit are missing or a quantity is not numeric
     * @throws UnknownFieldException when the kind is unknown and the department takes no injection limits
     */
    public void parse(String text, UsageLocation location, LegalDepartmentAbbreviation department) {
        String trimmed = text.trim();
        int unitSplit = trimmed.lastIndexOf(' ');
        if (unitSplit < 0) {
            throw new FieldFormatException(ALLOWANCE_KEY, "no value in '" + text + "'");
        }
        int valueSplit = trimmed.lastIndexOf(' ', unitSplit - 1);
        if (valueSplit < 0) {
            throw new FieldFormatException(ALLOWANCE_KEY, "no kind in '" + text + "'");
        }
        String kind = trimmed.substring(0, valueSplit).trim();
        String value = trimmed.substring(valueSplit + 1, unitSplit);
        String unit = trimmed.substring(unitSplit + 1);
        apply(ALLOWANCE_KEY, kind, value, unit, location, department);
    }

    /**
     * Handles an allowance printed with its kind as key, e.g. {@code "Entnahmemenge:"} / {@code "12 m³/2a"}.
     *
     * @param kindLabel  key of the pair
     * @param valueText  {@code "<value> <unit>"}
     * @param location   usage location receiving the value
     * @param department department the usage location is filed under
     */
    public void parseLabelled(String kindLabel, String valueText, UsageLocation location,
                              LegalDepartmentAbbreviation department) {
        String trimmed = valueText.trim();
        int unitSplit = trimmed.lastIndexOf(' ');
        if (unitSplit < 0) {
            throw new FieldFormatException(kindLabel, "no unit in '" + valueText + "'");
        }
        apply(kindLabel, kindLabel, trimmed.substring(0, unitSplit).trim(), trimmed.substring(unitSplit + 1),
                location, department);
    }

    private void apply(String key, String kindLabel, String value, String unit, UsageLocation location,
                       LegalDepartmentAbbreviation department) {
        String raw = value + " " + unit;
        Optional<AllowanceKind> kind = AllowanceKind.fromLabel(kindLabel);
        if (kind.isEmpty()) {
            if (!department.acceptsInjectionLimits()) {
                throw new UnknownFieldException("allowance", kindLabel);
            }
            location.getInjectionLimits().add(new InjectionLimit(
                    AllowanceKind.normalize(kindLabel), new Quantity(parseNumber(key, value), unit)));
            return;
        }
        switch (kind.get()) {
            case WITHDRAWAL -> location.getWithdrawalRates().add(rate(raw));
            case PUMPING -> location.getPumpingRates().add(rate(raw));
            case INJECTION -> location.getInjectionRates().add(rate(raw));
            case WASTE_WATER_FLOW -> location.getWasteWaterFlowVolume().add(rate(raw));
            case RAIN_SUPPLEMENT -> location.getRainSupplement().add(rate(raw));
            case FLUID_DISCHARGE -> location.getFluidDischarge().add(rate(raw));
            case DAM_TARGET_DEFAULT ->
                    location.getDamTargetLevels().setDefaultLevel(new Quantity(parseNumber(key, value), unit));
            case DAM_TARGET_MAX ->
                    location.getDamTargetLevels().setMax(new Quantity(parseNumber(key, value), unit));
            case DAM_TARGET_STEADY ->
                    location.getDamTargetLevels().setSteady(new Quantity(parseNumber(key, value), unit));
            case IRRIGATION_AREA -> location.setIrrigationArea(new Quantity(parseNumber(key, value), unit));
            case PH_MIN -> location.setPhValues(phValues(location).withMin(parseNumber(key, value)));
            case PH_MAX -> location.setPhValues(phValues(location).withMax(parseNumber(key, value)));
        }
    }

    private static OrFallback<Rate> rate(String raw) {
        return OrFallback.of(Rate.parse(raw), raw);
    }

    private static PhValues phValues(UsageLocation location) {
        return location.getPhValues() == null ? new PhValues(null, null) : location.getPhValues();
    }

    private static double parseNumber(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new FieldFormatException(key, "not a number: " + value, ex);
        }
    }
}
