package com.axlabs.neo.stakegov;

import io.neow3j.devpack.ByteString;
import io.neow3j.devpack.Hash160;
import io.neow3j.devpack.Helper;
import io.neow3j.devpack.Iterator;
import io.neow3j.devpack.List;
import io.neow3j.devpack.Map;
import io.neow3j.devpack.Runtime;
import io.neow3j.devpack.Storage;
import io.neow3j.devpack.StorageContext;
import io.neow3j.devpack.StorageMap;
import io.neow3j.devpack.annotations.ContractSourceCode;
import io.neow3j.devpack.annotations.DisplayName;
import io.neow3j.devpack.annotations.ManifestExtra;
import io.neow3j.devpack.annotations.OnDeployment;
import io.neow3j.devpack.annotations.OnNEP17Payment;
import io.neow3j.devpack.annotations.Permission;
import io.neow3j.devpack.annotations.Safe;
import io.neow3j.devpack.annotations.Struct;
import io.neow3j.devpack.constants.FindOptions;
import io.neow3j.devpack.constants.NativeContract;
import io.neow3j.devpack.contracts.GasToken;
import io.neow3j.devpack.contracts.LedgerContract;
import io.neow3j.devpack.contracts.StdLib;
import io.neow3j.devpack.events.Event1Arg;
import io.neow3j.devpack.events.Event3Args;
import io.neow3j.devpack.events.Event4Args;

import static io.neow3j.devpack.Helper.abort;
import static io.neow3j.devpack.Runtime.checkWitness;
import static io.neow3j.devpack.Storage.getReadOnlyContext;

@Permission(nativeContract = NativeContract.GasToken, methods = "transfer")
@ManifestExtra(key = "Author", value = "AxLabs")
@ManifestExtra(key = "Email", value = "info@axlabs.com")
@ManifestExtra(key = "Description", value = "Stake-weighted governance. Stake GAS, propose, vote and execute.")
@ManifestExtra(key = "Website", value = "https://axlabs.com")
@ContractSourceCode("https://github.com/AxLabs/stakegov-contracts/blob/main/src/main/java/com/axlabs/neo/stakegov/StakeGov.java")
@DisplayName("StakeGov")
@SuppressWarnings("unchecked")
public class StakeGov {

    //region CONTRACT VARIABLES

    // Parameter keys
    static final String MIN_PROPOSAL_STAKE_KEY = "min_proposal_stake"; // GAS fractions
    static final String DEFAULT_DURATION_KEY = "default_duration"; // blocks

    static final String PROPOSALS_COUNT_KEY = "#_proposals"; // int
    static final String TOTAL_STAKED_KEY = "total_staked"; // int

    // Parameter defaults, used if the contract is deployed without data.
    static final int DEFAULT_MIN_PROPOSAL_STAKE = 100000;
    static final int DEFAULT_DURATION = 144;

    // The quorum of a proposal is the total stake at its creation divided by this.
    static final int QUORUM_DIVISOR = 10;
    static final int MAX_TITLE_LENGTH = 50;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    // Persisted proposal status
    static final int STATUS_ACTIVE = 0;
    static final int STATUS_EXECUTED = 1;

    // Proposal states derived at query time
    static final String STATE_VOTING = "voting";
    static final String STATE_EXECUTABLE = "executable";
    static final String STATE_FAILED = "failed";
    static final String STATE_EXECUTED = "executed";

    // Abort messages
    static final String NOT_AUTHORIZED = "NotAuthorized";
    static final String PROPOSAL_NOT_FOUND = "ProposalNotFound";
    static final String INVALID_AMOUNT = "InvalidAmount";
    static final String ALREADY_VOTED = "AlreadyVoted";
    static final String INSUFFICIENT_STAKE = "InsufficientStake";
    static final String PROPOSAL_NOT_ACTIVE = "ProposalNotActive";
    static final String INVALID_STATE = "InvalidState";
    static final String INVALID_TITLE = "InvalidTitle";
    static final String INVALID_DESCRIPTION = "InvalidDescription";
    static final String TRANSFER_FAILED = "TransferFailed";
    static final String UNSUPPORTED_TOKEN = "UnsupportedToken";

    static final StorageContext ctx = Storage.getStorageContext();
    static final StorageMap stakes = new StorageMap(ctx, 1); // [Hash160 participant: int stakedAmount]
    static final StorageMap proposals = new StorageMap(ctx, 2); // [int id: Proposal proposal]
    static final StorageMap proposalData = new StorageMap(ctx, 3); // [int id: ProposalData proposalData]
    static final StorageMap proposalVotes = new StorageMap(ctx, 4); // [int id: ProposalVotes proposalVotes]
    static final StorageMap parameters = new StorageMap(ctx, 5); // [String param_key: int param_value]
    static final StorageMap votes = new StorageMap(ctx, 6); // [int id + Hash160 voter: Vote vote]
    //endregion CONTRACT VARIABLES

    //region EVENTS
    @DisplayName("Staked")
    static Event3Args<Hash160, Integer, Integer> staked;
    @DisplayName("ProposalCreated")
    static Event4Args<Integer, Hash160, Integer, Integer> created;
    @DisplayName("Voted")
    static Event4Args<Integer, Hash160, Boolean, Integer> voted;
    @DisplayName("ProposalExecuted")
    static Event1Arg<Integer> executed;
    //endregion EVENTS

    @Struct
    static class DeployData {
        int minProposalStake;
        int defaultDuration;
    }

    /**
     * Initialises this contract on deployment.
     * <p>
     * The data parameter is either null, in which case the default parameters are used, or structured as follows:
     * <pre>
     * [
     *      int minProposalStake,
     *      int defaultDuration
     * ]
     * </pre>
     *
     * @param data   The data to set up the governance's storage with.
     * @param update Tells if the method is called for updating this contract.
     */
    @OnDeployment
    public static void deploy(Object data, boolean update) {
        if (!update) {
            int minProposalStake = DEFAULT_MIN_PROPOSAL_STAKE;
            int defaultDuration = DEFAULT_DURATION;
            if (data != null) {
                DeployData deployData = (DeployData) data;
                minProposalStake = deployData.minProposalStake;
                defaultDuration = deployData.defaultDuration;
            }
            if (minProposalStake <= 0 || defaultDuration <= 0) abort(INVALID_AMOUNT);
            parameters.put(MIN_PROPOSAL_STAKE_KEY, minProposalStake);
            parameters.put(DEFAULT_DURATION_KEY, defaultDuration);

            Storage.put(ctx, PROPOSALS_COUNT_KEY, 0);
            Storage.put(ctx, TOTAL_STAKED_KEY, 0);
        }
    }

    //region SAFE METHODS

    /**
     * Gets the value of the parameter with {@code paramName}.
     *
     * @param paramName The name of the parameter, which is also its storage key.
     * @return the parameter's value.
     */
    @Safe
    public static Object getParameter(String paramName) {
        return parameters.get(paramName);
    }

    /**
     * @return all parameters and their values.
     */
    @Safe
    public static Map<String, Object> getParameters() {
        Iterator<Iterator.Struct<String, Object>> it = parameters.find(FindOptions.RemovePrefix);
        Map<String, Object> params = new Map<>();
        while (it.next()) {
            Iterator.Struct<String, Object> param = it.get();
            params.put(param.key, param.value);
        }
        return params;
    }

    /**
     * Gets the amount staked by {@code participant}. Participants that never staked have a stake of zero.
     *
     * @param participant The participant's account.
     * @return the staked amount in GAS fractions.
     */
    @Safe
    public static int getStake(Hash160 participant) {
        return stakes.getIntOrZero(participant.toByteString());
    }

    /**
     * @return the sum of all stakes.
     */
    @Safe
    public static int getTotalStaked() {
        return Storage.getInt(getReadOnlyContext(), TOTAL_STAKED_KEY);
    }

    /**
     * Gets the number of proposals created on this contract. It is also the ID of the latest proposal.
     *
     * @return the number of proposals.
     */
    @Safe
    public static int getProposalCount() {
        return Storage.getInt(getReadOnlyContext(), PROPOSALS_COUNT_KEY);
    }

    /**
     * Gets all information of the proposal with {@code id}.
     *
     * @param id The proposal's id.
     * @return the proposal or null if it doesn't exist.
     */
    @Safe
    public static ProposalDTO getProposal(int id) {
        ByteString bytes = proposals.get(id);
        if (bytes == null) {
            return null;
        }
        StdLib stdLib = new StdLib();
        ProposalDTO dto = new ProposalDTO();
        Proposal p = (Proposal) stdLib.deserialize(bytes);
        dto.id = p.id;
        dto.startTime = p.startTime;
        dto.endTime = p.endTime;
        dto.status = p.status;
        dto.executed = p.executed;
        ProposalData d = (ProposalData) stdLib.deserialize(proposalData.get(id));
        dto.creator = d.creator;
        dto.title = d.title;
        dto.description = d.description;
        dto.minVotesRequired = d.minVotesRequired;
        ProposalVotes v = (ProposalVotes) stdLib.deserialize(proposalVotes.get(id));
        dto.yesWeight = v.yesWeight;
        dto.noWeight = v.noWeight;
        return dto;
    }

    /**
     * Gets the proposals on the given page.
     *
     * @param page         The page, starting at 0.
     * @param itemsPerPage The number of proposals per page.
     * @return the chosen page, how many pages there are with the given page size and the proposals on the page.
     */
    @Safe
    public static Paginator.Paginated getProposals(int page, int itemsPerPage) throws Exception {
        if (page < 0)
            throw new Exception("[StakeGov.getProposals] Page number was negative");
        if (itemsPerPage <= 0)
            throw new Exception("[StakeGov.getProposals] Items per page was negative or zero");
        int n = Storage.getInt(getReadOnlyContext(), PROPOSALS_COUNT_KEY);
        int[] pagination = Paginator.calcPagination(n, page, itemsPerPage);
        List<Object> list = new List<>();
        for (int id = pagination[0]; id < pagination[1]; id++) {
            list.add(getProposal(id));
        }
        return new Paginator.Paginated(page, pagination[2], list);
    }

    /**
     * Gets the vote that {@code voter} cast on the proposal with {@code id}.
     *
     * @param id    The proposal's id.
     * @param voter The voter's account.
     * @return the vote or null if the proposal doesn't exist or the voter didn't vote on it.
     */
    @Safe
    public static Vote getVote(int id, Hash160 voter) {
        ByteString bytes = votes.get(voteKey(id, voter));
        if (bytes == null) {
            return null;
        }
        return (Vote) new StdLib().deserialize(bytes);
    }

    /**
     * Checks if the proposal with {@code id} can be executed. That is the case if its voting window has ended, it
     * reached its quorum, strictly more weight approved than rejected it, and it was not executed yet.
     *
     * @param id The proposal's id.
     * @return true if the proposal can be executed. False otherwise, also if the proposal doesn't exist.
     */
    @Safe
    public static boolean isExecutable(int id) {
        ByteString proposalBytes = proposals.get(id);
        if (proposalBytes == null) {
            return false;
        }
        StdLib stdLib = new StdLib();
        Proposal proposal = (Proposal) stdLib.deserialize(proposalBytes);
        if (proposal.executed || currentHeight() < proposal.endTime) {
            return false;
        }
        ProposalData data = (ProposalData) stdLib.deserialize(proposalData.get(id));
        ProposalVotes tally = (ProposalVotes) stdLib.deserialize(proposalVotes.get(id));
        return tally.yesWeight + tally.noWeight >= data.minVotesRequired && tally.yesWeight > tally.noWeight;
    }

    /**
     * Derives the state of the proposal with {@code id} from its record and the current block height.
     * <p>
     * The persisted status only knows active and executed proposals. A proposal whose voting window closed
     * without it becoming executable stays active in storage and is reported as failed here.
     *
     * @param id The proposal's id.
     * @return one of "voting", "executable", "failed" and "executed", or null if the proposal doesn't exist.
     */
    @Safe
    public static String getProposalState(int id) {
        ByteString proposalBytes = proposals.get(id);
        if (proposalBytes == null) {
            return null;
        }
        Proposal proposal = (Proposal) new StdLib().deserialize(proposalBytes);
        if (proposal.executed) {
            return STATE_EXECUTED;
        }
        if (isExecutable(id)) {
            return STATE_EXECUTABLE;
        }
        if (currentHeight() <= proposal.endTime) {
            return STATE_VOTING;
        }
        return STATE_FAILED;
    }

    //endregion SAFE METHODS

    //region STAKING METHODS

    /**
     * Stakes {@code amount} GAS fractions of the {@code staker}. The GAS is transferred from the staker to this
     * contract and the stake is recorded when the contract receives the payment.
     * <p>
     * The invoking script must hold a witness of the staker that is also valid for the GAS contract.
     *
     * @param staker The account staking.
     * @param amount The amount of GAS fractions to stake.
     * @return the staker's new total stake.
     */
    public static int stake(Hash160 staker, int amount) {
        if (!checkWitness(staker)) abort(NOT_AUTHORIZED);
        if (amount <= 0) abort(INVALID_AMOUNT);
        if (!new GasToken().transfer(staker, Runtime.getExecutingScriptHash(), amount, null)) {
            abort(TRANSFER_FAILED);
        }
        return stakes.getIntOrZero(staker.toByteString());
    }

    /**
     * Records GAS received by this contract as stake of the sender. Other tokens are rejected.
     *
     * @param from   The token sender.
     * @param amount The transferred amount.
     * @param data   Data sent with the transfer. Ignored.
     */
    @OnNEP17Payment
    public static void onNep17Payment(Hash160 from, int amount, Object data) {
        if (!Runtime.getCallingScriptHash().equals(new GasToken().getHash())) abort(UNSUPPORTED_TOKEN);
        if (from == null) {
            // Minted GAS is accepted but isn't anybody's stake.
            return;
        }
        if (amount <= 0) abort(INVALID_AMOUNT);
        int newStake = stakes.getIntOrZero(from.toByteString()) + amount;
        stakes.put(from.toByteString(), newStake);
        Storage.put(ctx, TOTAL_STAKED_KEY, Storage.getInt(getReadOnlyContext(), TOTAL_STAKED_KEY) + amount);
        staked.fire(from, amount, newStake);
    }

    //endregion STAKING METHODS

    // region GOVERNANCE PROCESS METHODS

    /**
     * Creates a proposal whose voting window lasts the default number of blocks.
     *
     * @param creator     The account set as the creator.
     * @param title       The title. Between 1 and 50 bytes long.
     * @param description The description. Between 1 and 500 bytes long.
     * @return The id of the proposal.
     */
    public static int createProposal(Hash160 creator, String title, String description) {
        return createProposal(creator, title, description, parameters.getInt(DEFAULT_DURATION_KEY));
    }

    /**
     * Creates a proposal. Voting opens immediately and lasts {@code duration} blocks. The quorum is fixed to a
     * tenth of the total stake at this point.
     *
     * @param creator     The account set as the creator. Its stake must be at least the minimum proposal stake.
     * @param title       The title. Between 1 and 50 bytes long.
     * @param description The description. Between 1 and 500 bytes long.
     * @param duration    The number of blocks after the current one during which votes are accepted.
     * @return The id of the proposal.
     */
    public static int createProposal(Hash160 creator, String title, String description, int duration) {
        if (!checkWitness(creator)) abort(NOT_AUTHORIZED);
        if (title == null || title.length() == 0 || title.length() > MAX_TITLE_LENGTH) abort(INVALID_TITLE);
        if (description == null || description.length() == 0 || description.length() > MAX_DESCRIPTION_LENGTH)
            abort(INVALID_DESCRIPTION);
        if (stakes.getIntOrZero(creator.toByteString()) < parameters.getInt(MIN_PROPOSAL_STAKE_KEY))
            abort(INSUFFICIENT_STAKE);
        if (duration <= 0) abort(INVALID_AMOUNT);

        int id = Storage.getInt(getReadOnlyContext(), PROPOSALS_COUNT_KEY) + 1;
        int now = currentHeight();
        int minVotesRequired = Storage.getInt(getReadOnlyContext(), TOTAL_STAKED_KEY) / QUORUM_DIVISOR;
        Proposal proposal = new Proposal(id, now, now + duration);
        StdLib stdLib = new StdLib();
        proposals.put(id, stdLib.serialize(proposal));
        proposalData.put(id, stdLib.serialize(new ProposalData(creator, title, description, minVotesRequired)));
        proposalVotes.put(id, stdLib.serialize(new ProposalVotes()));
        Storage.put(ctx, PROPOSALS_COUNT_KEY, id);

        created.fire(id, creator, proposal.endTime, minVotesRequired);
        return id;
    }

    /**
     * Casts a vote of the {@code voter} on the proposal with {@code id}. The vote's weight is the voter's stake at
     * this point. Stake added later doesn't change the vote.
     *
     * @param id      The id of the proposal to vote on.
     * @param inFavor True for approving, false for rejecting the proposal.
     * @param voter   The script hash of the voter. The invoking script must hold a witness of the voter.
     */
    public static void vote(int id, boolean inFavor, Hash160 voter) {
        if (!checkWitness(voter)) abort(NOT_AUTHORIZED);
        ByteString proposalBytes = proposals.get(id);
        if (proposalBytes == null) abort(PROPOSAL_NOT_FOUND);
        StdLib stdLib = new StdLib();
        Proposal proposal = (Proposal) stdLib.deserialize(proposalBytes);
        int now = currentHeight();
        if (proposal.status != STATUS_ACTIVE || now < proposal.startTime || now > proposal.endTime)
            abort(PROPOSAL_NOT_ACTIVE);
        int weight = stakes.getIntOrZero(voter.toByteString());
        if (weight <= 0) abort(INSUFFICIENT_STAKE);
        ByteString key = voteKey(id, voter);
        if (votes.get(key) != null) abort(ALREADY_VOTED);

        votes.put(key, stdLib.serialize(new Vote(inFavor, weight)));
        ProposalVotes pv = (ProposalVotes) stdLib.deserialize(proposalVotes.get(id));
        if (inFavor) {
            pv.yesWeight += weight;
        } else {
            pv.noWeight += weight;
        }
        proposalVotes.put(id, stdLib.serialize(pv));
        voted.fire(id, voter, inFavor, weight);
    }

    /**
     * Executes the proposal with the given {@code id}. Anyone can execute any proposal that is executable (see
     * {@link StakeGov#isExecutable(int)}). Execution is final.
     *
     * @param id The proposal id.
     */
    public static void execute(int id) {
        if (!isExecutable(id)) abort(INVALID_STATE);
        StdLib stdLib = new StdLib();
        Proposal proposal = (Proposal) stdLib.deserialize(proposals.get(id));
        proposal.status = STATUS_EXECUTED;
        proposal.executed = true;
        proposals.put(id, stdLib.serialize(proposal));
        executed.fire(id);
    }
    // endregion GOVERNANCE PROCESS METHODS

    // The id's byte length is the key length minus the 20 bytes of the voter, so keys can't collide.
    private static ByteString voteKey(int id, Hash160 voter) {
        return Helper.toByteString(id).concat(voter.toByteString());
    }

    private static int currentHeight() {
        return new LedgerContract().currentIndex();
    }

}
