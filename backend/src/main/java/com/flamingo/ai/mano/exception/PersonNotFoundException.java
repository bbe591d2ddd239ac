package com.flamingo.ai.mano.exception;

import java.util.UUID;

/** Thrown when a person does not exist or belongs to another user. */
public class PersonNotFoundException extends RuntimeException {

  private final UUID personId;

  public PersonNotFoundException(UUID personId) {
    super("Person not found: " + personId);
    this.personId = personId;
  }

  public UUID getPersonId() {
    return personId;
  }
}
