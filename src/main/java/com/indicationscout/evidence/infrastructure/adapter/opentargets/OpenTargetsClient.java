package com.indicationscout.evidence.infrastructure.adapter.opentargets;

import com.fasterxml.jackson.databind.JsonNode;
import com.indicationscout.evidence.domain.exception.EntityNotFoundException;
import com.indicationscout.evidence.domain.exception.MalformedResponseException;
import com.indicationscout.evidence.domain.model.disease.DiseaseSynonyms;
import com.indicationscout.evidence.domain.model.drug.DrugNameNormalizer;
import com.indicationscout.evidence.domain.model.drug.DrugProfile;
import com.indicationscout.evidence.domain.model.drug.DrugTarget;
import com.indicationscout.evidence.domain.model.drug.DrugWithTargets;
import com.indicationscout.evidence.domain.model.drug.Indication;
import com.indicationscout.evidence.domain.model.target.Association;
import com.indicationscout.evidence.domain.model.target.DrugSummary;
import com.indicationscout.evidence.domain.model.target.TargetProfile;
import com.indicationscout.evidence.domain.port.out.KnowledgeGraphProvider;
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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link KnowledgeGraphProvider} backed by the Open Targets Platform GraphQL API.
 *
 * <p>Drug and target profiles are cached for the configured TTL. Name
 * resolution is not cached; the search endpoint is cheap and its ranking
 * may change.
 */
@Component
public class OpenTargetsClient implements KnowledgeGraphProvider, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OpenTargetsClient.class);

    static final String GRAPHQL_PATH = "graphql";
    static final int PAGE_SIZE = 500;
    static final int DISEASE_DRUGS_SIZE = 200;
    static final double LATE_STAGE_PHASE = 3;
    static final int MAX_COMPETITOR_DISEASES = 10;

    static final String DRUG_NAMESPACE = "drug";
    static final String TARGET_NAMESPACE = "target";

    private final RequestExecutor executor;
    private final OpenTargetsMapper mapper;
    private final TwoTierCache cache;
    private final Executor asyncExecutor;

    public OpenTargetsClient(@Qualifier("openTargetsExecutor") RequestExecutor executor,
                             OpenTargetsMapper mapper,
                             TwoTierCacheFactory cacheFactory,
                             @Qualifier("asyncExecutor") Executor asyncExecutor) {
        this.executor = executor;
        this.mapper = mapper;
        this.cache = cacheFactory.create(OpenTargetsMapper.SOURCE);
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public DrugProfile getDrug(String name) {
        String chemblId = resolve("drug_search", OpenTargetsQueries.DRUG_SEARCH, "drug", name);
        Map<String, String> key = Map.of("chembl_id", chemblId);

        var cached = cache.get(DRUG_NAMESPACE, key, DrugProfile.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        logger.info("Fetching drug {} ({}) from Open Targets", chemblId, name);
        JsonNode data = executor.graphQl("drug", GRAPHQL_PATH, OpenTargetsQueries.DRUG, Map.of("id", chemblId));
        JsonNode raw = data.get("drug");
        if (raw == null || raw.isNull()) {
            throw new EntityNotFoundException(OpenTargetsMapper.SOURCE, "drug", chemblId);
        }

        DrugProfile drug = mapper.toDrugProfile(raw, chemblId);
        cache.set(DRUG_NAMESPACE, key, drug);
        return drug;
    }

    @Override
    public TargetProfile getTarget(String targetId) {
        Map<String, String> key = Map.of("target_id", targetId);

        var cached = cache.get(TARGET_NAMESPACE, key, TargetProfile.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        TargetProfile target = fetchTarget(targetId);
        cache.set(TARGET_NAMESPACE, key, target);
        return target;
    }

    @Override
    public DrugWithTargets getDrugWithTargets(String name) {
        DrugProfile drug = getDrug(name);

        List<String> targetIds = List.copyOf(drug.targetIds());
        logger.debug("Fetching {} targets for {}", targetIds.size(), drug.chemblId());

        List<Supplier<TargetProfile>> calls = new ArrayList<>();
        targetIds.forEach(targetId -> calls.add(() -> getTarget(targetId)));
        List<TargetProfile> fetched = FanOut.joinAll(calls, asyncExecutor,
                OpenTargetsMapper.SOURCE, "drug_with_targets");

        Map<String, TargetProfile> targets = new LinkedHashMap<>();
        for (int i = 0; i < targetIds.size(); i++) {
            targets.put(targetIds.get(i), fetched.get(i));
        }
        return new DrugWithTargets(drug, targets);
    }

    @Override
    public List<Indication> getDrugIndications(String name) {
        return getDrug(name).indications();
    }

    @Override
    public List<Association> getTargetAssociations(String targetId, double minScore) {
        return getTarget(targetId).associations().stream()
                .filter(association -> association.overallScore() >= minScore)
                .toList();
    }

    @Override
    public Map<String, List<DrugSummary>> getDrugTargetCompetitors(String name) {
        Map<String, List<DrugSummary>> byTarget = new LinkedHashMap<>();
        for (DrugTarget target : getDrug(name).targets()) {
            byTarget.put(target.targetSymbol(), getTarget(target.targetId()).drugSummaries());
        }
        return byTarget;
    }

    @Override
    public Map<String, Set<String>> getDrugCompetitors(String name) {
        String queryDrug = DrugNameNormalizer.normalize(name);
        DrugProfile drug = getDrug(name);

        Map<String, Set<String>> byDisease = new HashMap<>();
        for (String targetId : drug.targetIds()) {
            for (DrugSummary summary : getTarget(targetId).drugSummaries()) {
                if (summary.phase() == null || summary.phase() < LATE_STAGE_PHASE
                        || summary.diseaseName() == null || summary.drugName() == null) {
                    continue;
                }
                byDisease.computeIfAbsent(summary.diseaseName(), disease -> new LinkedHashSet<>())
                        .add(DrugNameNormalizer.normalize(summary.drugName()));
            }
        }
        byDisease.values().removeIf(drugs -> drugs.contains(queryDrug));

        Map<String, Set<String>> top = new LinkedHashMap<>();
        byDisease.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, Set<String>> e) -> e.getValue().size())
                        .reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_COMPETITOR_DISEASES)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    @Override
    public List<DrugSummary> getDiseaseDrugs(String diseaseId) {
        JsonNode data = executor.graphQl("disease_drugs", GRAPHQL_PATH, OpenTargetsQueries.DISEASE_DRUGS,
                Map.of("id", diseaseId, "size", DISEASE_DRUGS_SIZE));
        JsonNode disease = data.get("disease");
        if (disease == null || disease.isNull()) {
            logger.debug("No disease node for {}", diseaseId);
            return List.of();
        }
        return mapper.toDiseaseDrugs(disease, diseaseId);
    }

    @Override
    public DiseaseSynonyms getDiseaseSynonyms(String diseaseName) {
        String diseaseId = resolve("disease_search", OpenTargetsQueries.DISEASE_SEARCH, "disease", diseaseName);
        JsonNode data = executor.graphQl("disease_synonyms", GRAPHQL_PATH, OpenTargetsQueries.DISEASE_SYNONYMS,
                Map.of("id", diseaseId));
        JsonNode disease = data.get("disease");
        if (disease == null || disease.isNull()) {
            throw new EntityNotFoundException(OpenTargetsMapper.SOURCE, "disease_synonyms", diseaseId);
        }
        return mapper.toDiseaseSynonyms(disease, diseaseId);
    }

    /**
     * Drops cached drug or target profiles, e.g. after an upstream data release.
     */
    public void invalidateDrug(String chemblId) {
        cache.invalidate(DRUG_NAMESPACE, Map.of("chembl_id", chemblId));
    }

    public void invalidateTarget(String targetId) {
        cache.invalidate(TARGET_NAMESPACE, Map.of("target_id", targetId));
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    @Override
    public void close() {
        cache.close();
    }

    /**
     * Search and take the first hit of the wanted entity type.
     */
    private String resolve(String operation, String document, String entity, String name) {
        JsonNode data = executor.graphQl(operation, GRAPHQL_PATH, document, Map.of("q", name));
        for (JsonNode hit : ResponseFields.elements(data.path("search"), "hits")) {
            String id = ResponseFields.optionalText(hit, "id");
            if (entity.equals(hit.path("entity").asText()) && id != null && !id.isBlank()) {
                logger.debug("Resolved {} '{}' to {}", entity, name, id);
                return id;
            }
        }
        throw new EntityNotFoundException(OpenTargetsMapper.SOURCE, operation, name);
    }

    private TargetProfile fetchTarget(String targetId) {
        logger.info("Fetching target {} from Open Targets", targetId);
        JsonNode data = executor.graphQl("target", GRAPHQL_PATH, OpenTargetsQueries.TARGET, Map.of("id", targetId));
        JsonNode raw = data.get("target");
        if (raw == null || raw.isNull()) {
            throw new EntityNotFoundException(OpenTargetsMapper.SOURCE, "target", targetId);
        }

        TargetProfile target = mapper.toTargetProfile(raw, targetId);
        if (target.associations().size() < PAGE_SIZE) {
            return target;
        }

        int total = raw.path("associatedDiseases").path("count").asInt(Integer.MAX_VALUE);
        List<Association> associations = new ArrayList<>(target.associations());
        int pageIndex = 1;
        while (associations.size() < total) {
            JsonNode page = executor.graphQl("target_associations", GRAPHQL_PATH, OpenTargetsQueries.ASSOCIATIONS_PAGE,
                    Map.of("id", targetId, "index", pageIndex, "size", PAGE_SIZE));
            JsonNode pageTarget = page.get("target");
            if (pageTarget == null || pageTarget.isNull()) {
                throw new MalformedResponseException(OpenTargetsMapper.SOURCE, "target_associations",
                        "Association page " + pageIndex + " has no target node for " + targetId);
            }

            List<Association> rows = mapper.toAssociations(pageTarget, targetId);
            associations.addAll(rows);
            logger.debug("Association page {} for {}: {} rows ({} of {})",
                    pageIndex, targetId, rows.size(), associations.size(), total);
            if (rows.size() < PAGE_SIZE) {
                break;
            }
            pageIndex++;
        }
        return target.withAssociations(associations);
    }
}
