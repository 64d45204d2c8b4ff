package com.axlabs.neo.stakegov;

import io.neow3j.protocol.core.stackitem.StackItem;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.List;

/**
 * Client-side view of the proposal struct returned by {@code getProposal}.
 */
public class ProposalStruct {

    public static final int STATUS_ACTIVE = 0;
    public static final int STATUS_EXECUTED = 1;

    public int id;
    public Hash160 creator;
    public String title;
    public String description;
    public BigInteger startTime;
    public BigInteger endTime;
    public int status;
    public BigInteger yesWeight;
    public BigInteger noWeight;
    public boolean executed;
    public BigInteger minVotesRequired;

    public ProposalStruct(List<StackItem> list) {
        this(
                list.get(0).getInteger().intValue(),
                Hash160.fromAddress(list.get(1).getAddress()),
                list.get(2).getString(),
                list.get(3).getString(),
                list.get(4).getInteger(),
                list.get(5).getInteger(),
                list.get(6).getInteger().intValue(),
                list.get(7).getInteger(),
                list.get(8).getInteger(),
                list.get(9).getBoolean(),
                list.get(10).getInteger()
        );
    }

    public ProposalStruct(int id, Hash160 creator, String title, String description, BigInteger startTime,
            BigInteger endTime, int status, BigInteger yesWeight, BigInteger noWeight, boolean executed,
            BigInteger minVotesRequired) {
        this.id = id;
        this.creator = creator;
        this.title = title;
        this.description = description;
        this.startTime = startTime;
        this.endTime = endTime;
        this.status = status;
        this.yesWeight = yesWeight;
        this.noWeight = noWeight;
        this.executed = executed;
        this.minVotesRequired = minVotesRequired;
    }

    public BigInteger totalVotes() {
        return yesWeight.add(noWeight);
    }
}
