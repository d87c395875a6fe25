package com.flamingo.ai.houseanalysis.domain.model;

/** Opaque handle returned by the inference service's asset store. */
public record AssetReference(String handle) {}
