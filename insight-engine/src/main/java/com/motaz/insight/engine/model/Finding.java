package com.motaz.insight.engine.model;

import java.util.List;

/**
 * Common envelope of every analytical result. The set of variants is closed:
 * {@link AnomalyFinding}, {@link ClusterFinding} and {@link TrendFinding},
 * one per {@link FindingKind}.
 */
public sealed interface Finding permits AnomalyFinding, ClusterFinding, TrendFinding {

    FindingKind getKind();

    /** Identity keys of the records (or the record span) this finding is about. */
    List<String> getSubjectKeys();

    /** Score or confidence, always within [0,1]. */
    double getScore();
}
