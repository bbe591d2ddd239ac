package com.flamingo.ai.mano.domain.repository;

import com.flamingo.ai.mano.domain.entity.RecurringPattern;
import com.flamingo.ai.mano.domain.enums.PatternType;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for recurring patterns mined by the learning engine. */
@Repository
public interface RecurringPatternRepository extends JpaRepository<RecurringPattern, UUID> {

  List<RecurringPattern> findByUserIdAndPatternType(String userId, PatternType patternType);

  List<RecurringPattern> findByUserIdAndFrequencyGreaterThanEqualOrderByLastOccurrenceDesc(
      String userId, int minFrequency, Pageable pageable);

  List<RecurringPattern> findByUserIdOrderByLastOccurrenceDesc(String userId);

  /** Patterns that involve a given person, most recent first. */
  default List<RecurringPattern> findByUserIdInvolvingPerson(String userId, UUID personId) {
    String id = personId.toString();
    return findByUserIdOrderByLastOccurrenceDesc(userId).stream()
        .filter(p -> p.involves(id))
        .toList();
  }
}
