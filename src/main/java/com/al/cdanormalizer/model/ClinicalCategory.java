package com.al.cdanormalizer.model;

import com.al.cdanormalizer.util.SectionCodes;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Clinical category of a section, derived from its section code or, for
 * uncoded sections, from keywords in its title.
 */
public enum ClinicalCategory {
    ALLERGY,
    MEDICATION,
    PROBLEM,
    PROCEDURE,
    IMMUNIZATION,
    VITAL_SIGN,
    DEVICE,
    GENERIC;

    private static final Map<String, ClinicalCategory> BY_SECTION_CODE = Map.ofEntries(
            Map.entry(SectionCodes.ALLERGIES, ALLERGY),
            Map.entry(SectionCodes.ALLERGY_HISTORY, ALLERGY),
            Map.entry(SectionCodes.MEDICATIONS, MEDICATION),
            Map.entry(SectionCodes.MEDICATIONS_ADMINISTERED, MEDICATION),
            Map.entry(SectionCodes.DISCHARGE_MEDICATIONS, MEDICATION),
            Map.entry(SectionCodes.PROBLEMS, PROBLEM),
            Map.entry(SectionCodes.PAST_ILLNESS, PROBLEM),
            Map.entry(SectionCodes.PROCEDURES, PROCEDURE),
            Map.entry(SectionCodes.IMMUNIZATIONS, IMMUNIZATION),
            Map.entry(SectionCodes.VITAL_SIGNS, VITAL_SIGN),
            Map.entry(SectionCodes.MEDICAL_DEVICES, DEVICE),
            Map.entry(SectionCodes.RESULTS, GENERIC),
            Map.entry(SectionCodes.SOCIAL_HISTORY, GENERIC),
            Map.entry(SectionCodes.FAMILY_HISTORY, GENERIC),
            Map.entry(SectionCodes.PREGNANCY_HISTORY, GENERIC),
            Map.entry(SectionCodes.FUNCTIONAL_STATUS, GENERIC),
            Map.entry(SectionCodes.PLAN_OF_CARE, GENERIC),
            Map.entry(SectionCodes.ADVANCE_DIRECTIVES, GENERIC),
            Map.entry(SectionCodes.PHYSICAL_FINDINGS, GENERIC),
            Map.entry(SectionCodes.ENCOUNTERS, GENERIC),
            Map.entry(SectionCodes.PAYERS, GENERIC));

    // Stems cover the title wording seen across the supported national dialects.
    private static final Map<ClinicalCategory, List<String>> TITLE_STEMS = Map.of(
            ALLERGY, List.of("allerg", "alerg", "intoleran", "adverse reaction", "reacciones adversas"),
            MEDICATION, List.of("medicat", "medicament", "médicament", "medikament", "farmac", "drug", "prescri"),
            PROBLEM, List.of("problem", "condition", "illness", "patolog"),
            PROCEDURE, List.of("procedur", "procédure", "surg", "chirurg", "interven"),
            IMMUNIZATION, List.of("immuni", "vaccin", "impf"),
            VITAL_SIGN, List.of("vital", "signes vitaux", "parametri vitali"),
            DEVICE, List.of("device", "dispositi", "implant"));

    public static ClinicalCategory fromSectionCode(String sectionCode) {
        if (sectionCode == null) {
            return GENERIC;
        }
        return BY_SECTION_CODE.getOrDefault(sectionCode.trim(), GENERIC);
    }

    public static ClinicalCategory fromTitle(String title) {
        if (StringUtils.isBlank(title)) {
            return GENERIC;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (ClinicalCategory category : values()) {
            List<String> stems = TITLE_STEMS.get(category);
            if (stems != null && stems.stream().anyMatch(lower::contains)) {
                return category;
            }
        }
        return GENERIC;
    }

    /**
     * A coded section is classified by its code alone; title keywords apply only
     * to sections without a code.
     */
    public static ClinicalCategory resolve(String sectionCode, String title) {
        return StringUtils.isBlank(sectionCode) ? fromTitle(title) : fromSectionCode(sectionCode);
    }
}
