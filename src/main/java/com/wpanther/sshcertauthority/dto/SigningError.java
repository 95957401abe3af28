package com.wpanther.sshcertauthority.dto;

import com.wpanther.sshcertauthority.exception.ErrorCode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SigningError {

    private ErrorCode code;
    private String message;
}
