package com.axlabs.neo.stakegov;

import io.neow3j.protocol.core.stackitem.StackItem;

import java.math.BigInteger;
import java.util.List;

public class VoteStruct {

    public boolean inFavor;
    public BigInteger weight;

    public VoteStruct(List<StackItem> list) {
        this(list.get(0).getBoolean(), list.get(1).getInteger());
    }

    public VoteStruct(boolean inFavor, BigInteger weight) {
        this.inFavor = inFavor;
        this.weight = weight;
    }
}
