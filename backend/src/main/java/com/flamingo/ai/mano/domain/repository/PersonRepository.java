package com.flamingo.ai.mano.domain.repository;

import com.flamingo.ai.mano.domain.entity.Person;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the manager's roster. */
@Repository
public interface PersonRepository extends JpaRepository<Person, UUID> {

  List<Person> findByUserIdOrderByNameAsc(String userId);

  Optional<Person> findByIdAndUserId(UUID id, String userId);
}
