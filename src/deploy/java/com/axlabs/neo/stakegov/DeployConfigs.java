package com.axlabs.neo.stakegov;

import io.neow3j.types.ContractParameter;

import static io.neow3j.types.ContractParameter.array;
import static io.neow3j.types.ContractParameter.integer;

public class DeployConfigs {

    // property names
    static final String MIN_PROPOSAL_STAKE_KEY = "min_proposal_stake";
    static final String DEFAULT_DURATION_KEY = "default_duration";

    /**
     * Gets the deploy configuration for the governance contract. Requires that the profile's
     * 'resources/[profile].deploy.properties' file contains the contract parameters:
     * <pre>
     *  min_proposal_stake=100000
     *  default_duration=144
     * </pre>
     */
    static ContractParameter getStakeGovDeployConfig() {
        return getStakeGovDeployConfig(Config.getIntProperty(MIN_PROPOSAL_STAKE_KEY),
                Config.getIntProperty(DEFAULT_DURATION_KEY));
    }

    static ContractParameter getStakeGovDeployConfig(int minProposalStake, int defaultDuration) {
        if (minProposalStake <= 0) {
            throw new IllegalArgumentException("The minimum proposal stake must be positive");
        }
        if (defaultDuration <= 0) {
            throw new IllegalArgumentException("The default proposal duration must be positive");
        }
        return array(integer(minProposalStake), integer(defaultDuration));
    }
}
