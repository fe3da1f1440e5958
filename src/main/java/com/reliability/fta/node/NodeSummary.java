package com.reliability.fta.node;

/** One entry of a flattened pre-order listing. */
public record NodeSummary(String id, String name) {
}
