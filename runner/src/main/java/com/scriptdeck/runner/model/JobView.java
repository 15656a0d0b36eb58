package com.scriptdeck.runner.model;

import java.util.List;

/**
 * What a viewer sees on one poll: the history lines after its cursor,
 * the cursor to use next time, and the state at that same instant.
 *
 * @param lines        new lines in arrival order (may be empty)
 * @param nextCursor   absolute sequence number of the next unseen line
 * @param skipped      lines the viewer missed because they were evicted from history
 * @param snapshot     job state taken together with {@code lines}
 */
public record JobView(List<String> lines, long nextCursor, long skipped, JobSnapshot snapshot) {}
