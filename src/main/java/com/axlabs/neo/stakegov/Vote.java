package com.axlabs.neo.stakegov;

/**
 * A single vote. Never changed once cast.
 */
public class Vote {

    public boolean inFavor;

    /**
     * The voter's stake at the time the vote was cast.
     */
    public int weight;

    public Vote(boolean inFavor, int weight) {
        this.inFavor = inFavor;
        this.weight = weight;
    }
}
