package com.eainde.policylens.gateway;

import com.eainde.policylens.model.ComplianceCase;

/**
 * Append-only case memory.
 */
public interface CaseStore {

    void append(ComplianceCase complianceCase);
}
