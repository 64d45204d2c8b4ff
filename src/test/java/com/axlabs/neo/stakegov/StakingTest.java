package com.axlabs.neo.stakegov;

import io.neow3j.contract.GasToken;
import io.neow3j.contract.NeoToken;
import io.neow3j.protocol.Neow3j;
import io.neow3j.protocol.core.response.NeoApplicationLog;
import io.neow3j.protocol.core.response.Notification;
import io.neow3j.protocol.core.stackitem.StackItem;
import io.neow3j.test.ContractTest;
import io.neow3j.test.ContractTestExtension;
import io.neow3j.transaction.AccountSigner;
import io.neow3j.wallet.Account;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static com.axlabs.neo.stakegov.util.TestHelper.ALICE;
import static com.axlabs.neo.stakegov.util.TestHelper.BOB;
import static com.axlabs.neo.stakegov.util.TestHelper.CHARLIE;
import static com.axlabs.neo.stakegov.util.TestHelper.DEFAULT_DURATION;
import static com.axlabs.neo.stakegov.util.TestHelper.DEFAULT_DURATION_KEY;
import static com.axlabs.neo.stakegov.util.TestHelper.INVALID_AMOUNT;
import static com.axlabs.neo.stakegov.util.TestHelper.MIN_PROPOSAL_STAKE;
import static com.axlabs.neo.stakegov.util.TestHelper.MIN_PROPOSAL_STAKE_KEY;
import static com.axlabs.neo.stakegov.util.TestHelper.NOT_AUTHORIZED;
import static com.axlabs.neo.stakegov.util.TestHelper.STAKED;
import static com.axlabs.neo.stakegov.util.TestHelper.UNSUPPORTED_TOKEN;
import static com.axlabs.neo.stakegov.util.TestHelper.assertAborted;
import static com.axlabs.neo.stakegov.util.TestHelper.notifications;
import static com.axlabs.neo.stakegov.util.TestHelper.sendAndAwait;
import static com.axlabs.neo.stakegov.util.TestHelper.stake;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

// Deployed without data, so the governance runs with its default parameters.
@ContractTest(contracts = StakeGov.class, blockTime = 1, configFile = "default.neo-express",
        batchFile = "setup.batch")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class StakingTest {

    @RegisterExtension
    private static final ContractTestExtension ext = new ContractTestExtension();

    private static Neow3j neow3j;
    private static StakeGovContract gov;
    private static Account alice;
    private static Account bob;
    private static Account charlie;

    @BeforeAll
    public static void setUp() throws Throwable {
        neow3j = ext.getNeow3j();
        gov = new StakeGovContract(ext.getDeployedContract(StakeGov.class).getScriptHash(), neow3j);
        alice = ext.getAccount(ALICE);
        bob = ext.getAccount(BOB);
        charlie = ext.getAccount(CHARLIE);
    }

    @Test
    @Order(0)
    public void succeed_initialising_with_default_parameters() throws Throwable {
        Map<String, BigInteger> params = gov.getParameters();
        assertThat(params.size(), is(2));
        assertThat(params.get(MIN_PROPOSAL_STAKE_KEY).intValue(), is(MIN_PROPOSAL_STAKE));
        assertThat(params.get(DEFAULT_DURATION_KEY).intValue(), is(DEFAULT_DURATION));
        assertThat(gov.getTotalStaked(), is(BigInteger.ZERO));
        assertThat(gov.getProposalCount(), is(0));
    }

    @Test
    @Order(0)
    public void succeed_reading_zero_stake_of_unknown_account() throws Throwable {
        assertThat(gov.getStake(Account.create().getScriptHash()), is(BigInteger.ZERO));
    }

    @Test
    @Order(1)
    public void succeed_staking() throws Throwable {
        BigInteger totalBefore = gov.getTotalStaked();
        NeoApplicationLog.Execution exec = sendAndAwait(
                gov.stake(alice.getScriptHash(), BigInteger.valueOf(500)).signers(AccountSigner.global(alice)),
                neow3j);

        assertThat(exec.getStack().get(0).getInteger().intValue(), is(500));
        assertThat(gov.getStake(alice.getScriptHash()).intValue(), is(500));
        assertThat(gov.getTotalStaked(), is(totalBefore.add(BigInteger.valueOf(500))));

        List<Notification> ntfs = notifications(exec, STAKED);
        assertThat(ntfs.size(), is(1));
        List<StackItem> state = ntfs.get(0).getState().getList();
        assertThat(state.get(0).getAddress(), is(alice.getAddress()));
        assertThat(state.get(1).getInteger().intValue(), is(500));
        assertThat(state.get(2).getInteger().intValue(), is(500));
    }

    @Test
    @Order(2)
    public void succeed_accumulating_stakes() throws Throwable {
        BigInteger before = gov.getStake(alice.getScriptHash());
        BigInteger totalBefore = gov.getTotalStaked();

        BigInteger after = stake(gov, alice, 300, neow3j);

        assertThat(after, is(before.add(BigInteger.valueOf(300))));
        assertThat(gov.getStake(alice.getScriptHash()), is(after));
        assertThat(gov.getTotalStaked(), is(totalBefore.add(BigInteger.valueOf(300))));
    }

    @Test
    @Order(2)
    public void succeed_staking_with_plain_gas_transfer() throws Throwable {
        BigInteger totalBefore = gov.getTotalStaked();
        NeoApplicationLog.Execution exec = sendAndAwait(
                new GasToken(neow3j).transfer(bob, gov.getScriptHash(), BigInteger.valueOf(1000)), neow3j);

        assertThat(notifications(exec, STAKED).size(), is(1));
        assertThat(gov.getStake(bob.getScriptHash()).intValue(), is(1000));
        assertThat(gov.getTotalStaked(), is(totalBefore.add(BigInteger.valueOf(1000))));
    }

    @Test
    @Order(3)
    public void succeed_keeping_total_equal_to_sum_of_stakes() throws Throwable {
        BigInteger sum = gov.getStake(alice.getScriptHash())
                .add(gov.getStake(bob.getScriptHash()))
                .add(gov.getStake(charlie.getScriptHash()));
        assertThat(gov.getTotalStaked(), is(sum));
    }

    @Test
    @Order(4)
    public void fail_staking_zero_or_negative_amount() throws Throwable {
        assertAborted(gov.stake(alice.getScriptHash(), BigInteger.ZERO).signers(AccountSigner.global(alice)),
                INVALID_AMOUNT);
        assertAborted(gov.stake(alice.getScriptHash(), BigInteger.valueOf(-10))
                .signers(AccountSigner.global(alice)), INVALID_AMOUNT);
    }

    @Test
    @Order(4)
    public void fail_staking_for_another_account() {
        assertAborted(gov.stake(alice.getScriptHash(), BigInteger.TEN).signers(AccountSigner.global(bob)),
                NOT_AUTHORIZED);
    }

    @Test
    @Order(4)
    public void fail_staking_other_token() throws Throwable {
        assertAborted(new NeoToken(neow3j).transfer(alice, gov.getScriptHash(), BigInteger.ONE), UNSUPPORTED_TOKEN);
    }

    @Test
    @Order(5)
    public void succeed_leaving_stakes_unchanged_after_failed_attempts() throws Throwable {
        assertThat(gov.getStake(alice.getScriptHash()).intValue(), is(800));
        assertThat(gov.getStake(charlie.getScriptHash()), is(BigInteger.ZERO));
        assertThat(gov.getTotalStaked().intValue(), is(1800));
    }
}
