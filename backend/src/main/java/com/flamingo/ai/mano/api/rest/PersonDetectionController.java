package com.flamingo.ai.mano.api.rest;

import com.flamingo.ai.mano.api.dto.request.PersonDetectionRequest;
import com.flamingo.ai.mano.domain.entity.Person;
import com.flamingo.ai.mano.domain.repository.PersonRepository;
import com.flamingo.ai.mano.service.detection.PersonDetectionResult;
import com.flamingo.ai.mano.service.detection.PersonMentionDetector;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Suggests roster additions for people mentioned in a message. */
@RestController
@RequestMapping("/api/people")
@RequiredArgsConstructor
@Slf4j
public class PersonDetectionController {

  private final PersonMentionDetector personMentionDetector;
  private final PersonRepository personRepository;

  @PostMapping("/detect")
  public ResponseEntity<PersonDetectionResult> detectPeople(
      @Valid @RequestBody PersonDetectionRequest request) {
    List<String> existingNames =
        request.getExistingNames() != null
            ? request.getExistingNames()
            : personRepository.findByUserIdOrderByNameAsc(request.getUserId()).stream()
                .map(Person::getName)
                .toList();
    PersonDetectionResult result =
        personMentionDetector.detect(request.getUserId(), request.getMessage(), existingNames);
    log.debug(
        "Detected {} people for user {} via {}",
        result.people().size(),
        request.getUserId(),
        result.method());
    return ResponseEntity.ok(result);
  }
}
