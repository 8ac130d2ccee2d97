package com.al.cdanormalizer.service.extraction;

import com.al.cdanormalizer.model.EntryShape;
import com.al.cdanormalizer.util.CdaXml;
import org.w3c.dom.Element;

/**
 * Classifies the clinical statement under an {@code entry} element by its tree shape.
 */
public final class EntryShapeClassifier {

    private EntryShapeClassifier() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static EntryShape classify(Element entry) {
        Element statement = CdaXml.firstChildElement(entry);
        if (statement == null) {
            return EntryShape.UNKNOWN;
        }
        switch (statement.getLocalName()) {
            case "act":
                if (CdaXml.firstElement(statement, "hl7:entryRelationship/hl7:observation/hl7:participant") != null) {
                    return EntryShape.ACT_OBSERVATION_PARTICIPANT;
                }
                return CdaXml.firstElement(statement, "hl7:entryRelationship/hl7:observation") != null
                        ? EntryShape.ACT_OBSERVATION
                        : EntryShape.UNKNOWN;
            case "observation":
                return CdaXml.firstElement(statement, "hl7:participant") != null
                        ? EntryShape.OBSERVATION_PARTICIPANT
                        : EntryShape.OBSERVATION;
            case "substanceAdministration":
                return EntryShape.SUBSTANCE_ADMINISTRATION;
            case "procedure":
                return EntryShape.PROCEDURE;
            case "organizer":
                return EntryShape.ORGANIZER;
            case "supply":
                return EntryShape.SUPPLY;
            default:
                return EntryShape.UNKNOWN;
        }
    }
}
