package com.wpanther.sshcertauthority.service;

import com.wpanther.sshcertauthority.model.CertificateParameters;
import com.wpanther.sshcertauthority.model.SshPublicKey;

import lombok.Value;

/**
 * Subject key and certificate parameters of a request that passed validation
 */
@Value
public class ValidatedRequest {

    SshPublicKey subjectKey;
    CertificateParameters parameters;
}
