package dev.contentagents.model;

import java.time.Instant;

public record TraceEvent(String unit, UnitState state, Instant timestamp) {}
