package com.flamingo.ai.mano.service.context.model;

/** Roster head-count per relationship kind. */
public record TeamSize(int directReports, int stakeholders, int managers, int peers) {

  public static final TeamSize EMPTY = new TeamSize(0, 0, 0, 0);

  public int total() {
    return directReports + stakeholders + managers + peers;
  }
}
