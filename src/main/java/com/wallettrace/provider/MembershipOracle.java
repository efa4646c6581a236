package com.wallettrace.provider;

/**
 * Answers whether an address participates in the target platform (has any activity there).
 */
public interface MembershipOracle {

    boolean isMember(String address);
}
