package io.github.hotbrkm.autobulk.dispatcher.recipient;

import io.github.hotbrkm.autobulk.dispatcher.job.Job;

import java.util.List;

/**
 * Produces the recipients of a job. Called on every execution, never cached across runs.
 */
public interface RecipientResolver {

    /**
     * @throws ResolutionException if the recipient source cannot be read or yields nobody
     */
    List<Recipient> resolve(Job job);
}
