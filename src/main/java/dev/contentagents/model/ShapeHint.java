package dev.contentagents.model;

/**
 * Expected shape of a generator response.
 */
public enum ShapeHint {
    OBJECT,
    ARRAY,
    TEXT
}
