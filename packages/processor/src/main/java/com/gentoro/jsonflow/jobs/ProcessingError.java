package com.gentoro.jsonflow.jobs;

/** A failed item as recorded in {@link ProcessingState#errors()}. */
public record ProcessingError(int index, String message) {}
