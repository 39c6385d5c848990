package com.lodestar.core.workflow;

public enum VerificationMode {
    SINGLE_PASS,
    MULTI_PASS
}
