package com.flamingo.ai.mano.domain.repository;

import com.flamingo.ai.mano.domain.entity.Topic;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for free-form conversation topics. */
@Repository
public interface TopicRepository extends JpaRepository<Topic, UUID> {

  Optional<Topic> findByIdAndUserId(UUID id, String userId);
}
