package com.al.cdanormalizer.util;

/**
 * LOINC section codes recognised by the pipeline.
 *
 * <p>
 * Several clinical categories are encoded under more than one code across
 * national dialects (for example allergies under both 48765-2 and 10155-0).
 *
 * @author CDA Normalizer Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class SectionCodes {

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private SectionCodes() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // ========================================================================
    // Allergies
    // ========================================================================

    /** Allergies and adverse reactions */
    public static final String ALLERGIES = "48765-2";

    /** History of allergies (legacy) */
    public static final String ALLERGY_HISTORY = "10155-0";

    // ========================================================================
    // Medications
    // ========================================================================

    /** History of medication use */
    public static final String MEDICATIONS = "10160-0";

    /** Medication administered */
    public static final String MEDICATIONS_ADMINISTERED = "29549-3";

    /** Hospital discharge medications */
    public static final String DISCHARGE_MEDICATIONS = "10183-2";

    // ========================================================================
    // Other clinical sections
    // ========================================================================

    /** Problem list */
    public static final String PROBLEMS = "11450-4";

    /** History of past illness */
    public static final String PAST_ILLNESS = "11348-0";

    /** History of procedures */
    public static final String PROCEDURES = "47519-4";

    /** History of immunizations */
    public static final String IMMUNIZATIONS = "11369-6";

    /** Vital signs */
    public static final String VITAL_SIGNS = "8716-3";

    /** History of medical device use */
    public static final String MEDICAL_DEVICES = "46264-8";

    // ========================================================================
    // Sections without a dedicated category
    // ========================================================================

    /** Relevant diagnostic tests and/or laboratory data */
    public static final String RESULTS = "30954-2";

    /** Social history */
    public static final String SOCIAL_HISTORY = "29762-2";

    /** Family history */
    public static final String FAMILY_HISTORY = "10157-6";

    /** History of pregnancies */
    public static final String PREGNANCY_HISTORY = "10162-6";

    /** Functional status */
    public static final String FUNCTIONAL_STATUS = "47420-5";

    /** Plan of care */
    public static final String PLAN_OF_CARE = "18776-5";

    /** Advance directives */
    public static final String ADVANCE_DIRECTIVES = "42348-3";

    /** Physical findings */
    public static final String PHYSICAL_FINDINGS = "29545-1";

    /** Encounters */
    public static final String ENCOUNTERS = "46240-8";

    /** Payers */
    public static final String PAYERS = "48768-6";
}
