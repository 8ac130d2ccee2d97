package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.util.SectionCodes;

import java.util.Map;
import java.util.Optional;

/**
 * Last-resort displays for section, route, dose form, frequency and status
 * codes that national catalogues commonly lack. Consulted only after every
 * catalogue lookup has failed.
 */
final class FallbackTerminology {

    private FallbackTerminology() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final Map<String, String> DISPLAYS = Map.ofEntries(
            // Section codes (LOINC)
            Map.entry(SectionCodes.ALLERGIES, "Allergies and adverse reactions"),
            Map.entry(SectionCodes.ALLERGY_HISTORY, "History of allergies"),
            Map.entry(SectionCodes.MEDICATIONS, "History of medication use"),
            Map.entry(SectionCodes.MEDICATIONS_ADMINISTERED, "Medication administered"),
            Map.entry(SectionCodes.DISCHARGE_MEDICATIONS, "Hospital discharge medications"),
            Map.entry(SectionCodes.PROBLEMS, "Problem list"),
            Map.entry(SectionCodes.PAST_ILLNESS, "History of past illness"),
            Map.entry(SectionCodes.PROCEDURES, "History of procedures"),
            Map.entry(SectionCodes.IMMUNIZATIONS, "History of immunizations"),
            Map.entry(SectionCodes.VITAL_SIGNS, "Vital signs"),
            Map.entry(SectionCodes.MEDICAL_DEVICES, "History of medical device use"),
            Map.entry("29545-1", "Physical findings"),
            Map.entry("30954-2", "Relevant diagnostic tests and/or laboratory data"),
            Map.entry("42348-3", "Advance directives"),
            Map.entry("18776-5", "Plan of care"),
            Map.entry("29762-2", "Social history"),
            Map.entry("10162-6", "History of pregnancies"),
            Map.entry("47420-5", "Functional status"),
            // Routes (EDQM and SNOMED CT)
            Map.entry("20053000", "Oral use"),
            Map.entry("20045000", "Intravenous use"),
            Map.entry("20035000", "Intramuscular use"),
            Map.entry("20066000", "Subcutaneous use"),
            Map.entry("20070000", "Transdermal use"),
            Map.entry("26643006", "Oral route"),
            Map.entry("47625008", "Intravenous route"),
            Map.entry("78421000", "Intramuscular route"),
            Map.entry("34206005", "Subcutaneous route"),
            Map.entry("45890007", "Transdermal route"),
            Map.entry("PO", "Oral"),
            Map.entry("IV", "Intravenous"),
            // Dose forms (EDQM)
            Map.entry("10219000", "Tablet"),
            Map.entry("10221000", "Film-coated tablet"),
            Map.entry("10210000", "Capsule, hard"),
            Map.entry("10211000", "Capsule, soft"),
            Map.entry("10117000", "Oral solution"),
            Map.entry("11201000", "Solution for injection"),
            // Frequencies
            Map.entry("QD", "Once daily"),
            Map.entry("BID", "Twice daily"),
            Map.entry("TID", "Three times daily"),
            Map.entry("QID", "Four times daily"),
            Map.entry("PRN", "As needed"),
            // Clinical status (SNOMED CT and HL7 ActStatus)
            Map.entry("55561003", "Active"),
            Map.entry("73425007", "Inactive"),
            Map.entry("413322009", "Resolved"),
            Map.entry("active", "Active"),
            Map.entry("completed", "Completed"),
            Map.entry("aborted", "Aborted"),
            Map.entry("suspended", "Suspended"));

    static Optional<String> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(DISPLAYS.get(code.trim()));
    }
}
