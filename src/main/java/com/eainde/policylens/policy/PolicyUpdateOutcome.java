package com.eainde.policylens.policy;

import com.eainde.policylens.model.ImpactReport;
import com.eainde.policylens.model.PolicyChangeRecord;
import com.eainde.policylens.model.ReevaluationTicket;

import java.util.Optional;

/**
 * Everything a policy update produced.
 *
 * @param oldDocId   superseded version, now inactive
 * @param newVersion the ingested replacement
 * @param change     detected change
 * @param report     impact report
 * @param ticket     re-evaluation ticket, or null when none was queued
 */
public record PolicyUpdateOutcome(
        String oldDocId,
        PolicyIngestion newVersion,
        PolicyChangeRecord change,
        ImpactReport report,
        ReevaluationTicket ticket
) {

    public Optional<ReevaluationTicket> reevaluationTicket() {
        return Optional.ofNullable(ticket);
    }
}
