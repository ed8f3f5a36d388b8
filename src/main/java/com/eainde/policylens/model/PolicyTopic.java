package com.eainde.policylens.model;

public enum PolicyTopic {
    AML,
    KYC,
    SANCTIONS,
    FRAUD,
    GENERAL
}
