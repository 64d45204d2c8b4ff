package com.axlabs.neo.stakegov;

import io.neow3j.devpack.Hash160;

/**
 * Proposal information that is set at the time of creation of a proposal and doesn't change after that.
 * This data was separated from {@link Proposal} in order to save storage costs when updating a proposal.
 */
public class ProposalData {

    /**
     * The creator of the proposal.
     */
    public Hash160 creator;

    public String title;

    public String description;

    /**
     * The vote weight (approving plus rejecting) required for the proposal to reach its quorum. It is a snapshot
     * of a tenth of the total stake at the time of creation and doesn't follow later staking.
     */
    public int minVotesRequired;

    public ProposalData(Hash160 creator, String title, String description, int minVotesRequired) {
        this.creator = creator;
        this.title = title;
        this.description = description;
        this.minVotesRequired = minVotesRequired;
    }
}
