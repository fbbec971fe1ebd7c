package io.governance.core.token;

/** Balance query against the external voting-token contract. */
public interface TokenQuerier {
    long balanceOf(String token, String holder);
}
