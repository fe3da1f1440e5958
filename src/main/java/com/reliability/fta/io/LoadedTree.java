package com.reliability.fta.io;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.node.EventNode;

/**
 * Result of reading a document: the normalized tree plus whatever metadata
 * the document carried. Legacy documents carry none, so title and date are
 * null and mode is FTA.
 */
public record LoadedTree(String title, String date, AnalysisMode mode, EventNode root, boolean legacy) {
}
