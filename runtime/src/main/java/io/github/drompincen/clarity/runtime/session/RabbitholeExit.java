package io.github.drompincen.clarity.runtime.session;

public record RabbitholeExit(String label, int pointsRecalledDuring, boolean completionPending) {}
