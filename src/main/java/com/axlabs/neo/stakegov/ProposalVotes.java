package com.axlabs.neo.stakegov;

/**
 * The struct holding the approving and rejecting vote weight of a proposal. The single votes are stored separately,
 * keyed by proposal and voter.
 */
public class ProposalVotes {

    /**
     * The summed weight of the votes approving the proposal.
     */
    public int yesWeight;

    /**
     * The summed weight of the votes rejecting the proposal.
     */
    public int noWeight;

    public ProposalVotes() {
        yesWeight = 0;
        noWeight = 0;
    }
}
