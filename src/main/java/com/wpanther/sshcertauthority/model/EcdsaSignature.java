package com.wpanther.sshcertauthority.model;

import java.math.BigInteger;

import lombok.Value;

/**
 * Raw (r, s) pair of an ECDSA signature
 */
@Value
public class EcdsaSignature {

    BigInteger r;
    BigInteger s;
}
