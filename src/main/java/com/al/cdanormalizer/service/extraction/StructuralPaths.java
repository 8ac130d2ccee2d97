package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.ClinicalCategory;
import com.al.cdanormalizer.model.EntryShape;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.cdanormalizer.model.FieldLabels.*;

/**
 * Candidate paths per category and field label, relative to a section's
 * {@code entry} element. Candidates are ordered; the first that yields a value
 * is used. The structural walk and the document-map builder both read from
 * this table, so they agree on raw values.
 */
public final class StructuralPaths {

    private StructuralPaths() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final String OBS = ".//hl7:observation";
    private static final String PARTICIPANT_ENTITY = ".//hl7:participant/hl7:participantRole/hl7:playingEntity";
    private static final String MATERIAL = ".//hl7:consumable/hl7:manufacturedProduct/hl7:manufacturedMaterial";
    private static final String SUBSTANCE = ".//hl7:substanceAdministration";

    private static final Map<ClinicalCategory, Map<String, List<String>>> CANDIDATES = Map.of(
            ClinicalCategory.ALLERGY, ordered(
                    AGENT_DISPLAY, List.of(
                            ".//hl7:participant[@typeCode='CSM']/hl7:participantRole/hl7:playingEntity/hl7:code",
                            PARTICIPANT_ENTITY + "/hl7:code",
                            PARTICIPANT_ENTITY + "/hl7:name"),
                    REACTION_TYPE, List.of(OBS + "/hl7:code"),
                    MANIFESTATION, List.of(".//hl7:entryRelationship[@typeCode='MFST']/hl7:observation/hl7:value"),
                    SEVERITY, List.of(OBS + "[hl7:code/@code='SEV']/hl7:value"),
                    CRITICALITY, List.of(OBS + "[hl7:code/@code='82606-5']/hl7:value"),
                    STATUS, List.of(OBS + "[hl7:code/@code='33999-4']/hl7:value"),
                    ONSET_DATE, List.of(OBS + "/hl7:effectiveTime/hl7:low/@value", OBS + "/hl7:effectiveTime/@value")),
            ClinicalCategory.MEDICATION, ordered(
                    MEDICATION_DISPLAY, List.of(MATERIAL + "/hl7:name", MATERIAL + "/hl7:code"),
                    INGREDIENT_DISPLAY, List.of(
                            MATERIAL + "/pharm:ingredient/pharm:ingredientSubstance/pharm:code",
                            MATERIAL + "/pharm:ingredient/pharm:ingredientSubstance/pharm:name"),
                    STRENGTH, List.of(MATERIAL + "/pharm:ingredient/pharm:quantity/pharm:numerator"),
                    DOSE_FORM, List.of(MATERIAL + "/pharm:formCode"),
                    DOSE, List.of(SUBSTANCE + "/hl7:doseQuantity"),
                    ROUTE, List.of(SUBSTANCE + "/hl7:routeCode"),
                    FREQUENCY, List.of(SUBSTANCE + "/hl7:effectiveTime[hl7:period]"),
                    START_DATE, List.of(SUBSTANCE + "/hl7:effectiveTime/hl7:low/@value"),
                    END_DATE, List.of(SUBSTANCE + "/hl7:effectiveTime/hl7:high/@value"),
                    STATUS, List.of(SUBSTANCE + "/hl7:statusCode/@code")),
            ClinicalCategory.PROBLEM, ordered(
                    CONDITION_DISPLAY, List.of(OBS + "/hl7:value", OBS + "/hl7:text"),
                    PROBLEM_TYPE, List.of(OBS + "/hl7:code"),
                    STATUS, List.of(OBS + "[hl7:code/@code='33999-4']/hl7:value", OBS + "/hl7:statusCode/@code"),
                    ONSET_DATE, List.of(OBS + "/hl7:effectiveTime/hl7:low/@value", OBS + "/hl7:effectiveTime/@value")),
            ClinicalCategory.PROCEDURE, ordered(
                    PROCEDURE_DISPLAY, List.of(".//hl7:procedure/hl7:code"),
                    PROCEDURE_DATE, List.of(
                            ".//hl7:procedure/hl7:effectiveTime/@value",
                            ".//hl7:procedure/hl7:effectiveTime/hl7:low/@value"),
                    STATUS, List.of(".//hl7:procedure/hl7:statusCode/@code")),
            ClinicalCategory.IMMUNIZATION, ordered(
                    VACCINE_DISPLAY, List.of(MATERIAL + "/hl7:code", MATERIAL + "/hl7:name"),
                    ADMINISTRATION_DATE, List.of(
                            SUBSTANCE + "/hl7:effectiveTime/@value",
                            SUBSTANCE + "/hl7:effectiveTime/hl7:low/@value"),
                    STATUS, List.of(SUBSTANCE + "/hl7:statusCode/@code")),
            ClinicalCategory.VITAL_SIGN, ordered(
                    OBSERVATION_DISPLAY, List.of(OBS + "/hl7:code"),
                    VALUE, List.of(OBS + "/hl7:value"),
                    OBSERVATION_DATE, List.of(OBS + "/hl7:effectiveTime/@value",
                            ".//hl7:organizer/hl7:effectiveTime/@value")),
            ClinicalCategory.DEVICE, ordered(
                    DEVICE_DISPLAY, List.of(".//hl7:participantRole/hl7:playingDevice/hl7:code"),
                    IMPLANT_DATE, List.of(".//hl7:effectiveTime/hl7:low/@value", ".//hl7:effectiveTime/@value")),
            ClinicalCategory.GENERIC, ordered(
                    OBSERVATION_DISPLAY, List.of(OBS + "/hl7:code", ".//hl7:act/hl7:code"),
                    VALUE, List.of(OBS + "/hl7:value"),
                    TEXT, List.of(OBS + "/hl7:text", ".//hl7:act/hl7:text"),
                    OBSERVATION_DATE, List.of(OBS + "/hl7:effectiveTime/@value",
                            OBS + "/hl7:effectiveTime/hl7:low/@value")));

    public static Map<String, List<String>> candidates(ClinicalCategory category) {
        return CANDIDATES.getOrDefault(category, CANDIDATES.get(ClinicalCategory.GENERIC));
    }

    /**
     * Category that drives field selection for one entry: the section's own
     * category, or the one implied by the entry shape in an uncategorised section.
     */
    public static ClinicalCategory effectiveCategory(ClinicalCategory sectionCategory, EntryShape shape) {
        if (sectionCategory != null && sectionCategory != ClinicalCategory.GENERIC) {
            return sectionCategory;
        }
        return shape != null ? shape.impliedCategory() : ClinicalCategory.GENERIC;
    }

    private static Map<String, List<String>> ordered(Object... labelsAndPaths) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < labelsAndPaths.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> paths = (List<String>) labelsAndPaths[i + 1];
            map.put((String) labelsAndPaths[i], paths);
        }
        return map;
    }
}
