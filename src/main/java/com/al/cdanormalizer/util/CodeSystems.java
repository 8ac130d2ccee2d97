package com.al.cdanormalizer.util;

import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Code systems seen in clinical documents, with their OID, URI and name
 * treated as interchangeable identifiers.
 *
 * @author CDA Normalizer Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class CodeSystems {

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private CodeSystems() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /** SNOMED CT */
    public static final String SNOMED_CT = "2.16.840.1.113883.6.96";

    /** LOINC */
    public static final String LOINC = "2.16.840.1.113883.6.1";

    /** RxNorm */
    public static final String RXNORM = "2.16.840.1.113883.6.88";

    /** ICD-10 */
    public static final String ICD_10 = "2.16.840.1.113883.6.3";

    /** ICD-10-PCS */
    public static final String ICD_10_PCS = "2.16.840.1.113883.6.4";

    /** ICD-9-CM */
    public static final String ICD_9_CM = "2.16.840.1.113883.6.103";

    /** UCUM */
    public static final String UCUM = "2.16.840.1.113883.6.8";

    /** WHO ATC */
    public static final String ATC = "2.16.840.1.113883.6.73";

    /** EDQM Standard Terms (dose forms, routes) */
    public static final String EDQM = "0.4.0.127.0.16.1.1.2.1";

    /** HL7 RouteOfAdministration */
    public static final String HL7_ROUTE = "2.16.840.1.113883.5.112";

    /** HL7 ActCode */
    public static final String HL7_ACT_CODE = "2.16.840.1.113883.5.4";

    private static final List<CodeSystem> KNOWN = List.of(
            new CodeSystem(SNOMED_CT, "SNOMED CT", "http://snomed.info/sct", "SNOMED", "SCT"),
            new CodeSystem(LOINC, "LOINC", "http://loinc.org"),
            new CodeSystem(RXNORM, "RxNorm", "http://www.nlm.nih.gov/research/umls/rxnorm"),
            new CodeSystem(ICD_10, "ICD-10", "http://hl7.org/fhir/sid/icd-10"),
            new CodeSystem(ICD_10_PCS, "ICD-10-PCS", "http://www.cms.gov/Medicare/Coding/ICD10"),
            new CodeSystem(ICD_9_CM, "ICD-9-CM", "http://hl7.org/fhir/sid/icd-9-cm"),
            new CodeSystem(UCUM, "UCUM", "http://unitsofmeasure.org"),
            new CodeSystem(ATC, "ATC", "http://www.whocc.no/atc"),
            new CodeSystem(EDQM, "EDQM Standard Terms", "http://standardterms.edqm.eu", "EDQM"),
            new CodeSystem(HL7_ROUTE, "HL7 RouteOfAdministration",
                    "http://terminology.hl7.org/CodeSystem/v3-RouteOfAdministration"),
            new CodeSystem(HL7_ACT_CODE, "HL7 ActCode", "http://terminology.hl7.org/CodeSystem/v3-ActCode"));

    private static final Map<String, CodeSystem> BY_ALIAS = KNOWN.stream()
            .flatMap(system -> system.identifiers().stream().map(id -> Map.entry(normalize(id), system)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    /**
     * Canonical OID of a code system given any of its identifiers; unknown
     * identifiers are returned unchanged.
     */
    public static String canonical(String system) {
        if (StringUtils.isBlank(system)) {
            return null;
        }
        CodeSystem known = BY_ALIAS.get(normalize(system));
        return known != null ? known.oid : system.trim();
    }

    /**
     * Every identifier the given system is known under, canonical OID first.
     */
    public static Set<String> aliases(String system) {
        Set<String> aliases = new LinkedHashSet<>();
        if (StringUtils.isBlank(system)) {
            return aliases;
        }
        CodeSystem known = BY_ALIAS.get(normalize(system));
        if (known == null) {
            aliases.add(system.trim());
        } else {
            aliases.addAll(known.identifiers());
        }
        return aliases;
    }

    public static String displayName(String system) {
        if (StringUtils.isBlank(system)) {
            return null;
        }
        CodeSystem known = BY_ALIAS.get(normalize(system));
        return known != null ? known.name : null;
    }

    public static boolean sameSystem(String left, String right) {
        if (StringUtils.isAnyBlank(left, right)) {
            return false;
        }
        return canonical(left).equals(canonical(right));
    }

    private static String normalize(String identifier) {
        String lower = identifier.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("urn:oid:")) {
            lower = lower.substring("urn:oid:".length());
        }
        return lower.endsWith("/") ? lower.substring(0, lower.length() - 1) : lower;
    }

    private static final class CodeSystem {
        private final String oid;
        private final String name;
        private final List<String> otherIds;

        private CodeSystem(String oid, String name, String... otherIds) {
            this.oid = oid;
            this.name = name;
            this.otherIds = List.of(otherIds);
        }

        private List<String> identifiers() {
            Set<String> ids = new LinkedHashSet<>();
            ids.add(oid);
            ids.add(name);
            ids.addAll(otherIds);
            return List.copyOf(ids);
        }
    }
}
