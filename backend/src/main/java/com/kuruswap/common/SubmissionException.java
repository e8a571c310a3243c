package com.kuruswap.common;

/**
 * Signed transaction rejected by the network.
 */
public class SubmissionException extends KuruSwapException {

    public SubmissionException(String message) {
        super(ErrorKind.SUBMISSION_ERROR, message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(ErrorKind.SUBMISSION_ERROR, message, cause);
    }
}
