package com.axlabs.neo.stakegov;

/**
 * The mutable part of a proposal. It is rewritten when a proposal gets executed.
 * <p>
 * Information that doesn't change after creation is held in {@link ProposalData} and the tallies in
 * {@link ProposalVotes}.
 */
public class Proposal {

    /**
     * The proposal's ID. IDs are assigned incrementally, starting at 1.
     */
    public int id;

    /**
     * The block height at which the proposal was created and voting opened.
     */
    public int startTime;

    /**
     * The last block height at which votes are accepted. Execution is possible from this height on.
     */
    public int endTime;

    /**
     * Either {@link StakeGov#STATUS_ACTIVE} or {@link StakeGov#STATUS_EXECUTED}.
     */
    public int status;

    /**
     * Tells if this proposal was already executed.
     */
    public boolean executed;

    public Proposal(int id, int startTime, int endTime) {
        this.id = id;
        this.startTime = startTime;
        this.endTime = endTime;
        status = StakeGov.STATUS_ACTIVE;
        executed = false;
    }
}
