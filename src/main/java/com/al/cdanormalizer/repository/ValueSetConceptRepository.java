package com.al.cdanormalizer.repository;

import com.al.cdanormalizer.model.ValueSetConcept;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface ValueSetConceptRepository extends MongoRepository<ValueSetConcept, String> {

    Optional<ValueSetConcept> findFirstByCodeAndCodeSystemInAndStatus(String code, Collection<String> codeSystems,
            String status);

    Optional<ValueSetConcept> findFirstByCodeAndStatus(String code, String status);

    Optional<ValueSetConcept> findFirstByDisplayIgnoreCaseAndStatus(String display, String status);

    Optional<ValueSetConcept> findFirstByTranslationsTranslatedDisplayIgnoreCaseAndStatus(String translatedDisplay,
            String status);

    Optional<ValueSetConcept> findFirstByCodeAndDisplayContainingIgnoreCaseAndStatus(String code, String fragment,
            String status);
}
