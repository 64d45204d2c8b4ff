package com.axlabs.neo.stakegov;

import io.neow3j.devpack.Hash160;

/**
 * Used to return all proposal information as one structure in getter methods.
 */
public class ProposalDTO {

    public int id;
    public Hash160 creator;
    public String title;
    public String description;
    public int startTime;
    public int endTime;
    public int status;
    public int yesWeight;
    public int noWeight;
    public boolean executed;
    public int minVotesRequired;

    public ProposalDTO() {
    }
}
