package com.axlabs.neo.stakegov;

import io.neow3j.protocol.core.response.InvocationResult;
import io.neow3j.protocol.core.response.NeoApplicationLog;
import io.neow3j.transaction.AccountSigner;
import io.neow3j.transaction.Signer;
import io.neow3j.transaction.TransactionBuilder;
import io.neow3j.types.Hash256;
import io.neow3j.utils.Await;
import io.neow3j.wallet.Account;

import java.math.BigInteger;

import static com.axlabs.neo.stakegov.Config.getNeow3j;
import static com.axlabs.neo.stakegov.Config.getStakeGovHash;

/**
 * Invokes a deployed StakeGov contract with the deploy account of a profile. Usage:
 * <pre>
 *  stake [amount]
 *  create [title] [description] (duration)
 *  vote [id] [yes|no]
 *  execute [id]
 *  show [id]
 * </pre>
 * The profile is taken from the system property 'profile' and defaults to 'dev'.
 */
public class Invocations {

    public static void main(String[] args) throws Throwable {
        if (args.length < 2) {
            System.out.println("Usage: stake|create|vote|execute|show <args>");
            return;
        }
        Config.setProfile(System.getProperty("profile", "dev"));
        StakeGovContract gov = new StakeGovContract(getStakeGovHash(), getNeow3j());
        Account a = Config.getDeployAccount();

        switch (args[0]) {
            case "stake":
                stake(gov, a, new BigInteger(args[1]));
                break;
            case "create":
                createProposal(gov, a, args);
                break;
            case "vote":
                vote(gov, a, Integer.parseInt(args[1]), parseDirection(args[2]));
                break;
            case "execute":
                execute(gov, a, Integer.parseInt(args[1]));
                break;
            case "show":
                show(gov, Integer.parseInt(args[1]));
                break;
            default:
                System.out.println("Unknown command " + args[0]);
        }
    }

    static boolean parseDirection(String direction) {
        if (direction.equalsIgnoreCase("yes")) {
            return true;
        } else if (direction.equalsIgnoreCase("no")) {
            return false;
        }
        throw new IllegalArgumentException("Vote must be 'yes' or 'no' but was " + direction);
    }

    static void stake(StakeGovContract gov, Account a, BigInteger amount) throws Throwable {
        // The GAS transfer happens inside the contract, so the witness must reach beyond the entry script.
        signSendAwait(gov.stake(a.getScriptHash(), amount), AccountSigner.global(a));
        System.out.println("Stake: " + gov.getStake(a.getScriptHash()));
    }

    static void createProposal(StakeGovContract gov, Account a, String[] args) throws Throwable {
        TransactionBuilder b;
        if (args.length > 3) {
            b = gov.createProposal(a.getScriptHash(), args[1], args[2], Integer.parseInt(args[3]));
        } else {
            b = gov.createProposal(a.getScriptHash(), args[1], args[2]);
        }
        NeoApplicationLog.Execution exec = signSendAwait(b, AccountSigner.calledByEntry(a));
        System.out.println("Proposal ID: " + exec.getStack().get(0).getInteger());
    }

    static void vote(StakeGovContract gov, Account a, int id, boolean inFavor) throws Throwable {
        signSendAwait(gov.vote(id, inFavor, a.getScriptHash()), AccountSigner.calledByEntry(a));
    }

    static void execute(StakeGovContract gov, Account a, int id) throws Throwable {
        signSendAwait(gov.execute(id), AccountSigner.calledByEntry(a));
    }

    static void show(StakeGovContract gov, int id) throws Throwable {
        ProposalStruct p = gov.getProposal(id);
        if (p == null) {
            System.out.println("Proposal " + id + " doesn't exist.");
            return;
        }
        System.out.printf("\n### Proposal %s: %s\n", p.id, p.title);
        System.out.println("Creator:      " + p.creator.toAddress());
        System.out.println("Window:       " + p.startTime + " - " + p.endTime);
        System.out.println("Yes / No:     " + p.yesWeight + " / " + p.noWeight);
        System.out.println("Quorum:       " + p.minVotesRequired);
        System.out.println("State:        " + gov.getProposalState(id) + "\n");
    }

    static NeoApplicationLog.Execution signSendAwait(TransactionBuilder b, Signer signer) throws Throwable {
        b = b.signers(signer);
        InvocationResult res = b.callInvokeScript().getInvocationResult();
        if (res.hasStateFault()) {
            System.out.println("Contract failed with exception: \n" + res.getException() + "\n");
            throw new RuntimeException(res.getException());
        }
        Hash256 tx = b.sign().send().getSendRawTransaction().getHash();
        System.out.println("Transaction Hash: " + tx);
        Await.waitUntilTransactionIsExecuted(tx, getNeow3j());
        return getNeow3j().getApplicationLog(tx).send().getApplicationLog().getExecutions().get(0);
    }
}
