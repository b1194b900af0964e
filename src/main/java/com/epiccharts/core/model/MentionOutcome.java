package com.epiccharts.core.model;

/**
 * Terminal state of one mention run through the pipeline.
 */
public enum MentionOutcome {
    /** Chart rendered and posted as a reply. */
    REPLIED,
    /** Something the requester can fix; an explanatory reply was attempted. */
    USER_ERROR,
    /** Infrastructure failure; logged only. */
    SILENT_FAILURE,
    /** Mention id was already processed in this process lifetime. */
    DUPLICATE
}
