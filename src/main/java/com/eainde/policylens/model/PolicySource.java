package com.eainde.policylens.model;

public enum PolicySource {
    INTERNAL,
    OFAC,
    FATF,
    RBI,
    EU_AML
}
