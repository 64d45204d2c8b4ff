package com.axlabs.neo.stakegov;

import io.neow3j.compiler.CompilationUnit;
import io.neow3j.contract.ContractManagement;
import io.neow3j.contract.SmartContract;
import io.neow3j.protocol.core.response.NeoApplicationLog;
import io.neow3j.transaction.AccountSigner;
import io.neow3j.transaction.TransactionBuilder;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;
import io.neow3j.types.NeoVMStateType;
import io.neow3j.utils.Await;

import static com.axlabs.neo.stakegov.Config.getNeow3j;

public class Deployment {

    public static void main(String[] args) throws Throwable {
        Config.setProfile(args.length > 0 ? args[0] : "dev");
        AccountSigner signer = AccountSigner.none(Config.getDeployAccount());
        deployStakeGov(signer);
    }

    private static Hash160 deployStakeGov(AccountSigner signer) throws Throwable {
        CompilationUnit res = CompilationHelper.compileAndWriteNefAndManifestFiles(StakeGov.class);
        TransactionBuilder builder = new ContractManagement(getNeow3j())
                .deploy(res.getNefFile(), res.getManifest(), DeployConfigs.getStakeGovDeployConfig())
                .signers(signer)
                .throwIfSenderCannotCoverFees(() -> new RuntimeException("Cannot cover fees"));

        Hash256 txHash = builder.sign().send().getSendRawTransaction().getHash();
        System.out.println("StakeGov Deploy Transaction Hash: " + txHash.toString());
        Await.waitUntilTransactionIsExecuted(txHash, getNeow3j());

        NeoApplicationLog log = getNeow3j().getApplicationLog(txHash).send().getApplicationLog();
        if (log.getExecutions().get(0).getState().equals(NeoVMStateType.FAULT)) {
            throw new Exception("Failed to deploy smart contract. NeoVM " +
                    "error message: " + log.getExecutions().get(0).getException());
        }
        Hash160 contractHash = SmartContract.calcContractHash(signer.getScriptHash(),
                res.getNefFile().getCheckSumAsInteger(), res.getManifest().getName());
        System.out.println("StakeGov Contract Hash: " + contractHash);
        return contractHash;
    }
}
