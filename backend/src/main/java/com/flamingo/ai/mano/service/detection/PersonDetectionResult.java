package com.flamingo.ai.mano.service.detection;

import com.flamingo.ai.mano.domain.enums.DetectionMethod;
import java.util.List;

/** People detected in a message and the detector tier that produced them. */
public record PersonDetectionResult(List<DetectedPerson> people, DetectionMethod method) {

  public PersonDetectionResult {
    people = List.copyOf(people);
  }

  public static PersonDetectionResult empty(DetectionMethod method) {
    return new PersonDetectionResult(List.of(), method);
  }
}
