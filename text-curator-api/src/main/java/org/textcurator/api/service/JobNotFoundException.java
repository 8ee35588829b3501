package org.textcurator.api.service;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Unknown chunking job: " + jobId);
    }
}
