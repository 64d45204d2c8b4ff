package com.axlabs.neo.stakegov;

import io.neow3j.protocol.Neow3j;
import io.neow3j.protocol.http.HttpService;
import io.neow3j.types.Hash160;
import io.neow3j.wallet.Account;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads the deployment properties of a profile from the classpath file '[profile].deploy.properties'.
 */
public class Config {

    private static final String PROPS_FILE_SUFFIX = ".deploy.properties";
    private static String profile = "dev";
    private static Properties props;

    public static void setProfile(String profileName) {
        profile = profileName;
        props = null;
    }

    public static String getProfile() {
        return profile;
    }

    public static String getProperty(String name) {
        if (props == null) {
            props = loadProperties(profile + PROPS_FILE_SUFFIX);
        }
        return props.getProperty(name);
    }

    public static int getIntProperty(String name) {
        String value = getProperty(name);
        if (value == null) {
            throw new IllegalStateException("Property '" + name + "' is missing in profile " + profile);
        }
        return Integer.parseInt(value.trim());
    }

    public static Neow3j getNeow3j() {
        return Neow3j.build(new HttpService(getProperty("node")));
    }

    public static Hash160 getStakeGovHash() {
        return new Hash160(getProperty("stakegov"));
    }

    public static Account getDeployAccount() {
        return Account.fromWIF(getProperty("deploy_account_wif"));
    }

    private static Properties loadProperties(String fileName) {
        Properties p = new Properties();
        try (InputStream s = Config.class.getClassLoader().getResourceAsStream(fileName)) {
            if (s == null) {
                throw new IllegalStateException("No properties file " + fileName + " on the classpath");
            }
            p.load(s);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return p;
    }
}
