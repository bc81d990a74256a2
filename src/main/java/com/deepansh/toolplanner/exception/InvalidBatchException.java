package com.deepansh.toolplanner.exception;

import java.util.List;

/**
 * A batch that breaks the planner's input assumptions (missing or duplicate ids,
 * missing tool names). The planner itself does not check these; the service layer does.
 */
public class InvalidBatchException extends PlanningException {

    private final List<String> problems;

    public InvalidBatchException(List<String> problems) {
        super("Invalid tool-call batch: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
