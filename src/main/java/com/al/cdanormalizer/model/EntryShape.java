package com.al.cdanormalizer.model;

/**
 * Tree shape of a structured entry, as observed under its {@code entry} element.
 */
public enum EntryShape {
    ACT_OBSERVATION_PARTICIPANT,
    ACT_OBSERVATION,
    OBSERVATION_PARTICIPANT,
    SUBSTANCE_ADMINISTRATION,
    PROCEDURE,
    ORGANIZER,
    SUPPLY,
    OBSERVATION,
    UNKNOWN;

    /**
     * Category implied by the shape alone, used when the section itself is uncategorised.
     */
    public ClinicalCategory impliedCategory() {
        switch (this) {
            case ACT_OBSERVATION_PARTICIPANT:
            case OBSERVATION_PARTICIPANT:
                return ClinicalCategory.ALLERGY;
            case ACT_OBSERVATION:
                return ClinicalCategory.PROBLEM;
            case SUBSTANCE_ADMINISTRATION:
                return ClinicalCategory.MEDICATION;
            case PROCEDURE:
                return ClinicalCategory.PROCEDURE;
            case SUPPLY:
                return ClinicalCategory.DEVICE;
            default:
                return ClinicalCategory.GENERIC;
        }
    }
}
