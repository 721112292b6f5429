package io.github.hotbrkm.autobulk.dispatcher.job;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " not found");
    }
}
