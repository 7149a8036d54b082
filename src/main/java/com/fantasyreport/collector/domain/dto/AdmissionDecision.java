package com.fantasyreport.collector.domain.dto;

import com.fantasyreport.collector.domain.enums.ContentCategory;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.domain.enums.League;

public record AdmissionDecision(
        boolean admitted,
        IngestReason reason,
        String detail,
        League league,
        ContentCategory category
) {
    public static AdmissionDecision admit(League league, ContentCategory category) {
        return new AdmissionDecision(true, null, null, league, category);
    }

    public static AdmissionDecision reject(IngestReason reason, String detail) {
        return new AdmissionDecision(false, reason, detail, null, null);
    }

    public static AdmissionDecision reject(IngestReason reason, String detail, League league, ContentCategory category) {
        return new AdmissionDecision(false, reason, detail, league, category);
    }
}
