package com.indicationscout.evidence.infrastructure.adapter.clinicaltrials;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query parameters for the registry's {@code studies} search.
 *
 * <p>The first-posted cutoff and the phase filter are not separate
 * parameters; they are appended to {@code query.term} as {@code AREA[...]}
 * clauses, date first.
 */
final class StudySearchParams {

    static final int PAGE_SIZE = 100;

    private String drug;
    private String condition;
    private String term;
    private LocalDate postedOnOrBefore;
    private String phaseFilter;
    private String statusFilter;
    private String pageToken;
    private int pageSize = PAGE_SIZE;

    private StudySearchParams() {
    }

    static StudySearchParams search() {
        return new StudySearchParams();
    }

    StudySearchParams drug(String drug) {
        this.drug = drug;
        return this;
    }

    StudySearchParams condition(String condition) {
        this.condition = condition;
        return this;
    }

    StudySearchParams term(String term) {
        this.term = term;
        return this;
    }

    StudySearchParams postedOnOrBefore(LocalDate date) {
        this.postedOnOrBefore = date;
        return this;
    }

    StudySearchParams phases(String phaseFilter) {
        this.phaseFilter = phaseFilter;
        return this;
    }

    StudySearchParams statuses(String statusFilter) {
        this.statusFilter = statusFilter;
        return this;
    }

    StudySearchParams pageToken(String pageToken) {
        this.pageToken = pageToken;
        return this;
    }

    StudySearchParams pageSize(int pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    Map<String, String> toQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("format", "json");
        query.put("pageSize", String.valueOf(pageSize));
        query.put("countTotal", "true");

        if (hasText(condition)) {
            query.put("query.cond", condition);
        }
        if (hasText(drug)) {
            query.put("query.intr", drug);
        }

        String fullTerm = hasText(term) ? term.strip() : "";
        if (postedOnOrBefore != null) {
            fullTerm = appendClause(fullTerm, "AREA[StudyFirstPostDate]RANGE[MIN, "
                    + postedOnOrBefore.format(DateTimeFormatter.ISO_LOCAL_DATE) + "]");
        }
        if (hasText(phaseFilter)) {
            fullTerm = appendClause(fullTerm, "AREA[Phase]" + phaseFilter);
        }
        if (!fullTerm.isEmpty()) {
            query.put("query.term", fullTerm);
        }

        if (hasText(statusFilter)) {
            query.put("filter.overallStatus", statusFilter);
        }
        if (hasText(pageToken)) {
            query.put("pageToken", pageToken);
        }
        return query;
    }

    private static String appendClause(String term, String clause) {
        return term.isEmpty() ? clause : term + " " + clause;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
