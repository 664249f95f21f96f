package com.autobulk.delivery;

import com.autobulk.Job;
import com.autobulk.error.RecipientResolutionException;

import java.util.List;

/**
 * Turns a job's recipient definition into concrete destination addresses.
 */
public interface RecipientResolver {

    /**
     * @return at least one destination
     * @throws RecipientResolutionException when the job resolves to no destination at all
     */
    List<String> resolve(Job job) throws RecipientResolutionException;
}
