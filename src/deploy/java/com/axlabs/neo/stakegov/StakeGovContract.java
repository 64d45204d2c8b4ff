package com.axlabs.neo.stakegov;

import io.neow3j.contract.SmartContract;
import io.neow3j.contract.exceptions.UnexpectedReturnTypeException;
import io.neow3j.protocol.Neow3j;
import io.neow3j.protocol.core.stackitem.StackItem;
import io.neow3j.transaction.TransactionBuilder;
import io.neow3j.types.Hash160;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.neow3j.types.ContractParameter.bool;
import static io.neow3j.types.ContractParameter.hash160;
import static io.neow3j.types.ContractParameter.integer;
import static io.neow3j.types.ContractParameter.string;
import static java.util.Arrays.asList;

/**
 * Typed client for a deployed {@link StakeGov} contract.
 */
public class StakeGovContract extends SmartContract {

    public StakeGovContract(Hash160 scriptHash, Neow3j neow3j) {
        super(scriptHash, neow3j);
    }

    // region read-only methods

    public Map<String, BigInteger> getParameters() throws IOException, UnexpectedReturnTypeException {
        Map<StackItem, StackItem> map = callInvokeFunction(getMethodName()).getInvocationResult().getStack().get(0)
                .getMap();
        return map.entrySet().stream().collect(Collectors.toMap(
                i -> i.getKey().getString(),
                i -> i.getValue().getInteger()));
    }

    public BigInteger getStake(Hash160 participant) throws IOException {
        return callFunctionReturningInt(getMethodName(), hash160(participant));
    }

    public BigInteger getTotalStaked() throws IOException {
        return callFunctionReturningInt(getMethodName());
    }

    public int getProposalCount() throws IOException {
        return callFunctionReturningInt(getMethodName()).intValue();
    }

    /**
     * @return the proposal or null if no proposal with the given id exists.
     */
    public ProposalStruct getProposal(int id) throws IOException, UnexpectedReturnTypeException {
        StackItem item = callInvokeFunction(getMethodName(), asList(integer(id))).getInvocationResult().getStack()
                .get(0);
        if (item.getValue() == null) {
            return null;
        }
        return new ProposalStruct(item.getList());
    }

    public ProposalPaginatedStruct getProposals(int page, int itemsPerPage) throws IOException,
            UnexpectedReturnTypeException {
        List<StackItem> paginated = callInvokeFunction(getMethodName(), asList(integer(page), integer(itemsPerPage)))
                .getInvocationResult().getStack().get(0).getList();
        return new ProposalPaginatedStruct(paginated);
    }

    /**
     * @return the vote or null if the voter didn't vote on the proposal.
     */
    public VoteStruct getVote(int id, Hash160 voter) throws IOException, UnexpectedReturnTypeException {
        StackItem item = callInvokeFunction(getMethodName(), asList(integer(id), hash160(voter)))
                .getInvocationResult().getStack().get(0);
        if (item.getValue() == null) {
            return null;
        }
        return new VoteStruct(item.getList());
    }

    public boolean isExecutable(int id) throws IOException {
        return callFunctionReturningBool(getMethodName(), integer(id));
    }

    /**
     * @return the derived state of the proposal or null if it doesn't exist.
     */
    public String getProposalState(int id) throws IOException {
        StackItem item = callInvokeFunction(getMethodName(), asList(integer(id))).getInvocationResult().getStack()
                .get(0);
        if (item.getValue() == null) {
            return null;
        }
        return item.getString();
    }

    // endregion read-only methods
    // region transaction builders

    public TransactionBuilder stake(Hash160 staker, BigInteger amount) {
        return invokeFunction(getMethodName(), hash160(staker), integer(amount));
    }

    public TransactionBuilder createProposal(Hash160 creator, String title, String description) {
        return invokeFunction(getMethodName(), hash160(creator), string(title), string(description));
    }

    public TransactionBuilder createProposal(Hash160 creator, String title, String description, int duration) {
        return invokeFunction(getMethodName(), hash160(creator), string(title), string(description),
                integer(duration));
    }

    public TransactionBuilder vote(int id, boolean inFavor, Hash160 voter) {
        return invokeFunction(getMethodName(), integer(id), bool(inFavor), hash160(voter));
    }

    public TransactionBuilder execute(int id) {
        return invokeFunction(getMethodName(), integer(id));
    }

    // endregion transaction builders

    private String getMethodName() {
        return new Exception().getStackTrace()[1].getMethodName();
    }

}
