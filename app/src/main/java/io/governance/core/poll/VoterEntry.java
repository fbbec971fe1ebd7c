package io.governance.core.poll;

/** A voter address paired with the vote it recorded. */
public record VoterEntry(String voter, VoterInfo info) {}
