package com.indicationscout.evidence.infrastructure.adapter.clinicaltrials;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.indicationscout.evidence.domain.exception.MalformedResponseException;
import com.indicationscout.evidence.domain.model.trial.ConditionDrug;
import com.indicationscout.evidence.domain.model.trial.ConditionLandscape;
import com.indicationscout.evidence.domain.model.trial.Intervention;
import com.indicationscout.evidence.domain.model.trial.TerminatedTrial;
import com.indicationscout.evidence.domain.model.trial.Trial;
import com.indicationscout.evidence.domain.model.trial.TrialPhases;
import com.indicationscout.evidence.domain.model.trial.WhitespaceResult;
import com.indicationscout.evidence.domain.port.out.TrialRegistryProvider;
import com.indicationscout.evidence.infrastructure.adapter.FanOut;
import com.indicationscout.evidence.infrastructure.adapter.ResponseFields;
import com.indicationscout.evidence.infrastructure.cache.CacheStats;
import com.indicationscout.evidence.infrastructure.cache.TwoTierCache;
import com.indicationscout.evidence.infrastructure.cache.TwoTierCacheFactory;
import com.indicationscout.evidence.infrastructure.http.RequestExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link TrialRegistryProvider} over the ClinicalTrials.gov v2 {@code studies}
 * endpoint. Search results are cached by their query parameters and result
 * limit, count queries by their query parameters; derived results are
 * recomputed on every call.
 */
@Component
public class ClinicalTrialsClient implements TrialRegistryProvider, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ClinicalTrialsClient.class);

    static final String STUDIES_PATH = "studies";
    static final String SEARCH_NAMESPACE = "clinical_trials_search";
    static final String RESULT_LIMIT_PARAM = "maxResults";

    static final int EXACT_MATCH_LIMIT = 50;
    static final int CONDITION_TRIAL_LIMIT = 500;
    static final int CONDITION_DRUG_LIMIT = 50;
    static final String STOPPED_STATUSES = "TERMINATED,WITHDRAWN,SUSPENDED";

    private static final Set<String> ACTIVE_STATUSES = Set.of(
            "RECRUITING", "ACTIVE_NOT_RECRUITING", "ENROLLING_BY_INVITATION");

    private final RequestExecutor executor;
    private final ClinicalTrialsMapper mapper;
    private final LandscapeAggregator landscapeAggregator;
    private final TwoTierCache cache;
    private final Executor asyncExecutor;

    public ClinicalTrialsClient(@Qualifier("clinicalTrialsExecutor") RequestExecutor executor,
                                ClinicalTrialsMapper mapper,
                                LandscapeAggregator landscapeAggregator,
                                TwoTierCacheFactory cacheFactory,
                                @Qualifier("asyncExecutor") Executor asyncExecutor) {
        this.executor = executor;
        this.mapper = mapper;
        this.landscapeAggregator = landscapeAggregator;
        this.cache = cacheFactory.create(ClinicalTrialsMapper.SOURCE);
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public List<Trial> searchTrials(String drug, String condition, LocalDate dateBefore,
                                    String phaseFilter, int maxResults) {
        StudySearchParams params = StudySearchParams.search()
                .drug(drug)
                .condition(condition)
                .postedOnOrBefore(dateBefore)
                .phases(phaseFilter);
        return fetchTrials("search", params, maxResults);
    }

    @Override
    public WhitespaceResult detectWhitespace(String drug, String condition, LocalDate dateBefore) {
        FanOut fanOut = new FanOut(asyncExecutor, ClinicalTrialsMapper.SOURCE, "whitespace");
        CompletableFuture<List<Trial>> exactCall = fanOut.submit(
                () -> searchTrials(drug, condition, dateBefore, null, EXACT_MATCH_LIMIT));
        CompletableFuture<Integer> drugOnlyCall = fanOut.submit(
                () -> countTrials(StudySearchParams.search().drug(drug).postedOnOrBefore(dateBefore)));
        CompletableFuture<Integer> conditionOnlyCall = fanOut.submit(
                () -> countTrials(StudySearchParams.search().condition(condition).postedOnOrBefore(dateBefore)));
        fanOut.awaitAll();

        List<Trial> exactMatches = exactCall.join();
        int drugOnly = drugOnlyCall.join();
        int conditionOnly = conditionOnlyCall.join();

        boolean whitespace = exactMatches.isEmpty();
        List<ConditionDrug> conditionDrugs = List.of();
        if (whitespace) {
            List<Trial> conditionTrials = fetchTrials("whitespace",
                    StudySearchParams.search()
                            .condition(condition)
                            .postedOnOrBefore(dateBefore)
                            .phases(TrialPhases.PHASE_2_OR_LATER),
                    CONDITION_TRIAL_LIMIT);
            conditionDrugs = rankConditionDrugs(conditionTrials);
        }

        logger.info("Whitespace check {} / {}: exact={}, drugOnly={}, conditionOnly={}, whitespace={}",
                drug, condition, exactMatches.size(), drugOnly, conditionOnly, whitespace);
        return new WhitespaceResult(whitespace, exactMatches.size(), drugOnly, conditionOnly, conditionDrugs);
    }

    @Override
    public ConditionLandscape getLandscape(String condition, LocalDate dateBefore, int topN) {
        List<Trial> trials = fetchTrials("landscape",
                StudySearchParams.search()
                        .condition(condition)
                        .postedOnOrBefore(dateBefore)
                        .phases(TrialPhases.ANY_PHASE),
                Integer.MAX_VALUE);

        ConditionLandscape landscape = landscapeAggregator.aggregate(trials, topN);
        logger.info("Landscape for {}: {} trials, {} competitors",
                condition, landscape.totalTrialCount(), landscape.competitors().size());
        return landscape;
    }

    @Override
    public List<TerminatedTrial> getTerminated(String query, LocalDate dateBefore, int maxResults) {
        List<Trial> trials = fetchTrials("terminated",
                StudySearchParams.search()
                        .term(query)
                        .postedOnOrBefore(dateBefore)
                        .statuses(STOPPED_STATUSES),
                maxResults);

        return trials.stream()
                .map(trial -> new TerminatedTrial(
                        trial,
                        trial.primaryDrug().map(Intervention::name).orElse(null),
                        StopReasonClassifier.classify(trial.whyStopped())))
                .toList();
    }

    /**
     * Drops the cached result of one {@link #searchTrials} call.
     */
    public void invalidateSearch(String drug, String condition, LocalDate dateBefore,
                                 String phaseFilter, int maxResults) {
        StudySearchParams params = StudySearchParams.search()
                .drug(drug)
                .condition(condition)
                .postedOnOrBefore(dateBefore)
                .phases(phaseFilter);
        cache.invalidate(SEARCH_NAMESPACE, resultKey(params, maxResults));
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    @Override
    public void close() {
        cache.close();
    }

    /**
     * One drug or biologic per trial, most advanced phase first and active
     * trials ahead of closed ones at equal phase, one entry per drug name.
     */
    static List<ConditionDrug> rankConditionDrugs(List<Trial> trials) {
        List<ConditionDrug> candidates = new ArrayList<>();
        for (Trial trial : trials) {
            Optional<Intervention> primary = trial.primaryDrug();
            primary.ifPresent(drug -> candidates.add(new ConditionDrug(
                    trial.nctId(),
                    drug.name(),
                    trial.firstCondition().orElse(null),
                    trial.phase(),
                    trial.overallStatus())));
        }

        candidates.sort(Comparator.comparingInt((ConditionDrug c) -> TrialPhases.rank(c.phase()))
                .thenComparing(c -> c.status() != null && ACTIVE_STATUSES.contains(c.status()))
                .reversed());

        Set<String> seen = new HashSet<>();
        return candidates.stream()
                .filter(candidate -> seen.add(candidate.drugName()))
                .limit(CONDITION_DRUG_LIMIT)
                .toList();
    }

    /**
     * Follows page tokens until {@code maxResults} studies are collected and
     * caches the assembled studies as one entry. Continuation tokens are
     * never cached: they are only valid against the search that issued them.
     */
    private List<Trial> fetchTrials(String operation, StudySearchParams params, int maxResults) {
        Map<String, Object> key = resultKey(params, maxResults);
        Optional<JsonNode> cached = cache.get(SEARCH_NAMESPACE, key, JsonNode.class);
        if (cached.isPresent()) {
            return mapper.toTrials(cached.get());
        }

        ObjectNode assembled = JsonNodeFactory.instance.objectNode();
        ArrayNode studies = assembled.putArray("studies");
        String pageToken = null;

        while (studies.size() < maxResults) {
            JsonNode page = executor.get(operation, STUDIES_PATH, params.pageToken(pageToken).toQuery());
            List<JsonNode> pageStudies = ResponseFields.elements(page, "studies");
            pageStudies.stream()
                    .limit(maxResults - studies.size())
                    .forEach(studies::add);

            pageToken = ResponseFields.optionalText(page, "nextPageToken");
            if (pageToken == null || pageStudies.size() < StudySearchParams.PAGE_SIZE) {
                break;
            }
            logger.debug("Fetched {} trials for {}, continuing", studies.size(), operation);
        }

        List<Trial> trials = mapper.toTrials(assembled);
        cache.set(SEARCH_NAMESPACE, key, assembled);
        return trials;
    }

    private static Map<String, Object> resultKey(StudySearchParams params, int maxResults) {
        Map<String, Object> key = new LinkedHashMap<>(params.pageToken(null).toQuery());
        key.put(RESULT_LIMIT_PARAM, maxResults);
        return key;
    }

    private int countTrials(StudySearchParams params) {
        JsonNode page = fetchCountPage("count", params.pageSize(1).toQuery());
        JsonNode total = page.get("totalCount");
        if (total == null || !total.isNumber()) {
            throw new MalformedResponseException(ClinicalTrialsMapper.SOURCE, "count",
                    "Missing 'totalCount' for " + params.toQuery());
        }
        return total.asInt();
    }

    private JsonNode fetchCountPage(String operation, Map<String, String> query) {
        Optional<JsonNode> cached = cache.get(SEARCH_NAMESPACE, query, JsonNode.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        JsonNode page = executor.get(operation, STUDIES_PATH, query);
        cache.set(SEARCH_NAMESPACE, query, page);
        return page;
    }
}
