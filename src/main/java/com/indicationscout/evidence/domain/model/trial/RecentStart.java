package com.indicationscout.evidence.domain.model.trial;

public record RecentStart(String nctId, String sponsor, String drug, String phase, String startDate) {}
