package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One site of water use ("Nutzungsort") belonging to a legal department.
 * Every field is optional; rate fields are sets ordered by their time base.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class UsageLocation {

    private static final Comparator<OrFallback<Rate>> RATE_ORDER = OrFallback.ordering(Comparator.naturalOrder());

    private Long no;
    private String serial;
    private Boolean active;
    private Boolean real;
    private String name;
    private LegalPurpose legalPurpose;
    private SingleOrPair mapExcerpt;
    private CodedName municipalArea;
    private String county;
    private OrFallback<LandRecord> landRecord;
    private String plot;
    private CodedName maintenanceAssociation;
    private CodedName euSurveyArea;
    private SingleOrPair catchmentAreaCode;
    private String regulationCitation;
    private final SortedSet<OrFallback<Rate>> withdrawalRates = new TreeSet<>(RATE_ORDER);
    private final SortedSet<OrFallback<Rate>> pumpingRates = new TreeSet<>(RATE_ORDER);
    private final SortedSet<OrFallback<Rate>> injectionRates = new TreeSet<>(RATE_ORDER);
    private final SortedSet<OrFallback<Rate>> wasteWaterFlowVolume = new TreeSet<>(RATE_ORDER);
    private String riverBasin;
    private String groundwaterBody;
    private String waterBody;
    private String floodArea;
    private String waterProtectionArea;
    private final DamTargets damTargetLevels = new DamTargets();
    private final SortedSet<OrFallback<Rate>> fluidDischarge = new TreeSet<>(RATE_ORDER);
    private final SortedSet<OrFallback<Rate>> rainSupplement = new TreeSet<>(RATE_ORDER);
    private Quantity irrigationArea;
    private PhValues phValues;
    private final List<InjectionLimit> injectionLimits = new ArrayList<>();
    private Long utmEasting;
    private Long utmNorthing;

    /**
     * @return "Nutzungsort Nr." as known from the spreadsheet export
     */
    public Long getNo() {
        return no;
    }

    public void setNo(Long no) {
        this.no = no;
    }

    /**
     * @return "Nutzungsort Lfd. Nr."
     */
    public String getSerial() {
        return serial;
    }

    public void setSerial(String serial) {
        this.serial = serial;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public Boolean getReal() {
        return real;
    }

    public void setReal(Boolean real) {
        this.real = real;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public LegalPurpose getLegalPurpose() {
        return legalPurpose;
    }

    public void setLegalPurpose(LegalPurpose legalPurpose) {
        this.legalPurpose = legalPurpose;
    }

    /**
     * @return "Top. Karte 1:25.000"
     */
    public SingleOrPair getMapExcerpt() {
        return mapExcerpt;
    }

    public void setMapExcerpt(SingleOrPair mapExcerpt) {
        this.mapExcerpt = mapExcerpt;
    }

    public CodedName getMunicipalArea() {
        return municipalArea;
    }

    public void setMunicipalArea(CodedName municipalArea) {
        this.municipalArea = municipalArea;
    }

    public String getCounty() {
        return county;
    }

    public void setCounty(String county) {
        this.county = county;
    }

    public OrFallback<LandRecord> getLandRecord() {
        return landRecord;
    }

    public void setLandRecord(OrFallback<LandRecord> landRecord) {
        this.landRecord = landRecord;
    }

    /**
     * @return "Flurstück"
     */
    public String getPlot() {
        return plot;
    }

    public void setPlot(String plot) {
        this.plot = plot;
    }

    public CodedName getMaintenanceAssociation() {
        return maintenanceAssociation;
    }

    public void setMaintenanceAssociation(CodedName maintenanceAssociation) {
        this.maintenanceAssociation = maintenanceAssociation;
    }

    public CodedName getEuSurveyArea() {
        return euSurveyArea;
    }

    public void setEuSurveyArea(CodedName euSurveyArea) {
        this.euSurveyArea = euSurveyArea;
    }

    /**
     * @return "Einzugsgebietskennzahl"
     */
    public SingleOrPair getCatchmentAreaCode() {
        return catchmentAreaCode;
    }

    public void setCatchmentAreaCode(SingleOrPair catchmentAreaCode) {
        this.catchmentAreaCode = catchmentAreaCode;
    }

    public String getRegulationCitation() {
        return regulationCitation;
    }

    public void setRegulationCitation(String regulationCitation) {
        this.regulationCitation = regulationCitation;
    }

    /**
     * @return "Entnahmemenge"
     */
    public SortedSet<OrFallback<Rate>> getWithdrawalRates() {
        return withdrawalRates;
    }

    /**
     * @return "Förderleistung"
     */
    public SortedSet<OrFallback<Rate>> getPumpingRates() {
        return pumpingRates;
    }

    /**
     * @return "Einleitungsmenge"
     */
    public SortedSet<OrFallback<Rate>> getInjectionRates() {
        return injectionRates;
    }

    /**
     * @return "Abwasservolumenstrom"
     */
    public SortedSet<OrFallback<Rate>> getWasteWaterFlowVolume() {
        return wasteWaterFlowVolume;
    }

    public String getRiverBasin() {
        return riverBasin;
    }

    public void setRiverBasin(String riverBasin) {
        this.riverBasin = riverBasin;
    }

    public String getGroundwaterBody() {
        return groundwaterBody;
    }

    public void setGroundwaterBody(String groundwaterBody) {
        this.groundwaterBody = groundwaterBody;
    }

    public String getWaterBody() {
        return waterBody;
    }

    public void setWaterBody(String waterBody) {
        this.waterBody = waterBody;
    }

    public String getFloodArea() {
        return floodArea;
    }

    public void setFloodArea(String floodArea) {
        this.floodArea = floodArea;
    }

    public String getWaterProtectionArea() {
        return waterProtectionArea;
    }

    public void setWaterProtectionArea(String waterProtectionArea) {
        this.waterProtectionArea = waterProtectionArea;
    }

    public DamTargets getDamTargetLevels() {
        return damTargetLevels;
    }

    /**
     * @return "Ableitungsmenge"
     */
    public SortedSet<OrFallback<Rate>> getFluidDischarge() {
        return fluidDischarge;
    }

    /**
     * @return "Zusatzregen"
     */
    public SortedSet<OrFallback<Rate>> getRainSupplement() {
        return rainSupplement;
    }

    /**
     * @return "Beregnungsfläche"
     */
    public Quantity getIrrigationArea() {
        return irrigationArea;
    }

    public void setIrrigationArea(Quantity irrigationArea) {
        this.irrigationArea = irrigationArea;
    }

    public PhValues getPhValues() {
        return phValues;
    }

    public void setPhValues(PhValues phValues) {
        this.phValues = phValues;
    }

    public List<InjectionLimit> getInjectionLimits() {
        return injectionLimits;
    }

    public Long getUtmEasting() {
        return utmEasting;
    }

    /**
     * Stores the UTM easting; zero means the coordinate is unknown.
     *
     * @param utmEasting easting or {@code null}
     */
    public void setUtmEasting(Long utmEasting) {
        this.utmEasting = zeroAsAbsent(utmEasting);
    }

    public Long getUtmNorthing() {
        return utmNorthing;
    }

    /**
     * Stores the UTM northing; zero means the coordinate is unknown.
     *
     * @param utmNorthing northing or {@code null}
     */
    public void setUtmNorthing(Long utmNorthing) {
        this.utmNorthing = zeroAsAbsent(utmNorthing);
    }

    private static Long zeroAsAbsent(Long value) {
        return value == null || value == 0L ? null : value;
    }
}
