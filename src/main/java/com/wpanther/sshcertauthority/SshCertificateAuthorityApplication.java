package com.wpanther.sshcertauthority;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SshCertificateAuthorityApplication {

    public static void main(String[] args) {
        SpringApplication.run(SshCertificateAuthorityApplication.class, args);
    }
}
