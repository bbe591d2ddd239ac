package com.flamingo.ai.mano.domain.repository;

import com.flamingo.ai.mano.domain.entity.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for manager profiles. */
@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, String> {}
