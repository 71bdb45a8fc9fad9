package com.docsage.api.model;

/**
 * Task types understood by the external queue worker.
 */
public enum JobType {
    INGEST("ingest"),
    SUMMARIZE("summarize");

    private final String taskType;

    JobType(String taskType) {
        this.taskType = taskType;
    }

    public String taskType() {
        return taskType;
    }
}
