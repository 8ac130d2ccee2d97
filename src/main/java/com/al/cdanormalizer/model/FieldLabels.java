package com.al.cdanormalizer.model;

import org.apache.commons.lang3.StringUtils;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical field labels shared by every extraction strategy, so that the same
 * clinical fact carries the same label whichever strategy produced it.
 */
public final class FieldLabels {

    private FieldLabels() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // Allergy
    public static final String AGENT_DISPLAY = "agent_display";
    public static final String REACTION_TYPE = "reaction_type";
    public static final String MANIFESTATION = "manifestation";
    public static final String SEVERITY = "severity";
    public static final String CRITICALITY = "criticality";

    // Medication
    public static final String MEDICATION_DISPLAY = "medication_display";
    public static final String INGREDIENT_DISPLAY = "ingredient_display";
    public static final String STRENGTH = "strength";
    public static final String DOSE = "dose";
    public static final String ROUTE = "route";
    public static final String FREQUENCY = "frequency";
    public static final String DOSE_FORM = "dose_form";
    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";

    // Problem
    public static final String CONDITION_DISPLAY = "condition_display";
    public static final String PROBLEM_TYPE = "problem_type";

    // Procedure, immunization, device
    public static final String PROCEDURE_DISPLAY = "procedure_display";
    public static final String PROCEDURE_DATE = "procedure_date";
    public static final String VACCINE_DISPLAY = "vaccine_display";
    public static final String ADMINISTRATION_DATE = "administration_date";
    public static final String DEVICE_DISPLAY = "device_display";
    public static final String IMPLANT_DATE = "implant_date";

    // Observation-like and shared
    public static final String OBSERVATION_DISPLAY = "observation_display";
    public static final String VALUE = "value";
    public static final String OBSERVATION_DATE = "observation_date";
    public static final String STATUS = "status";
    public static final String ONSET_DATE = "onset_date";
    public static final String TEXT = "text";

    // Normalized table headers that name a canonical field, per category
    private static final Map<ClinicalCategory, Map<String, String>> HEADER_ALIASES = Map.of(
            ClinicalCategory.ALLERGY, Map.of(
                    "agent", AGENT_DISPLAY,
                    "allergen", AGENT_DISPLAY,
                    "substance", AGENT_DISPLAY,
                    "causative_agent", AGENT_DISPLAY,
                    "reaction", MANIFESTATION,
                    "manifestation", MANIFESTATION,
                    "severity", SEVERITY,
                    "status", STATUS,
                    "onset", ONSET_DATE,
                    "onset_date", ONSET_DATE),
            ClinicalCategory.MEDICATION, Map.of(
                    "medication", MEDICATION_DISPLAY,
                    "medicine", MEDICATION_DISPLAY,
                    "drug", MEDICATION_DISPLAY,
                    "active_ingredient", INGREDIENT_DISPLAY,
                    "strength", STRENGTH,
                    "dose", DOSE,
                    "route", ROUTE,
                    "frequency", FREQUENCY,
                    "start_date", START_DATE,
                    "end_date", END_DATE),
            ClinicalCategory.PROBLEM, Map.of(
                    "condition", CONDITION_DISPLAY,
                    "problem", CONDITION_DISPLAY,
                    "diagnosis", CONDITION_DISPLAY,
                    "status", STATUS,
                    "onset", ONSET_DATE,
                    "onset_date", ONSET_DATE));

    public static boolean isDateLabel(String label) {
        return label != null && label.endsWith("_date");
    }

    /**
     * Field without which an entry of the given category is not worth emitting,
     * or {@code null} when the category has no such requirement.
     */
    public static String requiredLabel(ClinicalCategory category) {
        switch (category) {
            case ALLERGY:
                return AGENT_DISPLAY;
            case MEDICATION:
                return MEDICATION_DISPLAY;
            case PROBLEM:
                return CONDITION_DISPLAY;
            default:
                return null;
        }
    }

    /**
     * Turns a free-text table header into a label: "Active Ingredient" becomes
     * "active_ingredient". Blank headers become {@code column_<n>}.
     */
    public static String fromHeader(String header, int columnIndex) {
        String ascii = Normalizer.normalize(StringUtils.trimToEmpty(header), Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "");
        String label = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return label.isEmpty() ? "column_" + (columnIndex + 1) : label;
    }

    /**
     * Label of a table column: the canonical field label when the header names
     * one for the category ("Agent" in an allergy table is agent_display),
     * otherwise the normalized header.
     */
    public static String forColumn(String header, int columnIndex, ClinicalCategory category) {
        String label = fromHeader(header, columnIndex);
        Map<String, String> aliases = category != null ? HEADER_ALIASES.get(category) : null;
        return aliases != null ? aliases.getOrDefault(label, label) : label;
    }
}
