package com.gentoro.factcheck.model;

/** A web source retrieved while grounding an answer. */
public record GroundingChunk(String title, String uri) {}
