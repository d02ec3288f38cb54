package com.indicationscout.evidence.infrastructure.adapter.opentargets;

/**
 * GraphQL documents sent to the Open Targets Platform.
 */
final class OpenTargetsQueries {

    static final String DRUG_SEARCH = """
            query($q: String!) {
                search(queryString: $q, entityNames: ["drug"], page: {index: 0, size: 1}) {
                    hits { id entity }
                }
            }
            """;

    static final String DISEASE_SEARCH = """
            query($q: String!) {
                search(queryString: $q, entityNames: ["disease"], page: {index: 0, size: 1}) {
                    hits { id entity }
                }
            }
            """;

    static final String DRUG = """
            query($id: String!) {
                drug(chemblId: $id) {
                    id name synonyms tradeNames drugType
                    isApproved maximumClinicalTrialPhase yearOfFirstApproval

                    mechanismsOfAction {
                        rows {
                            mechanismOfAction actionType
                            targets { id approvedSymbol }
                        }
                    }

                    indications {
                        approvedIndications
                        rows {
                            maxPhaseForIndication
                            disease { id name }
                            references { source ids }
                        }
                    }

                    drugWarnings {
                        warningType description toxicityClass
                        country year efoId efoTerm
                    }

                    adverseEvents(page: {index: 0, size: 100}) {
                        rows { name meddraCode count logLR }
                        criticalValue
                    }
                }
            }
            """;

    static final String TARGET = """
            query($id: String!) {
                target(ensemblId: $id) {
                    id approvedSymbol approvedName

                    associatedDiseases(page: {index: 0, size: 500}) {
                        count
                        rows {
                            disease {
                                id name
                                therapeuticAreas { id name }
                            }
                            score
                            datatypeScores { id score }
                        }
                    }

                    pathways { pathwayId pathway topLevelTerm }

                    interactions(page: {index: 0, size: 200}) {
                        rows {
                            intB intBBiologicalRole score
                            sourceDatabase count
                            targetB { id approvedSymbol }
                        }
                    }

                    knownDrugs(size: 200) {
                        rows {
                            drugId prefName diseaseId label
                            phase status mechanismOfAction ctIds
                        }
                    }

                    expressions {
                        tissue { id label anatomicalSystems }
                        rna { value unit level }
                        protein {
                            level reliability
                            cellType { name level reliability }
                        }
                    }

                    mousePhenotypes {
                        modelPhenotypeId modelPhenotypeLabel
                        modelPhenotypeClasses { id label }
                        biologicalModels { allelicComposition geneticBackground id literature }
                    }

                    safetyLiabilities {
                        event eventId
                        effects { direction dosing }
                        datasource literature url
                    }

                    geneticConstraint {
                        constraintType score exp obs
                        oe oeLower oeUpper upperBin upperBin6
                    }
                }
            }
            """;

    static final String ASSOCIATIONS_PAGE = """
            query($id: String!, $index: Int!, $size: Int!) {
                target(ensemblId: $id) {
                    associatedDiseases(page: {index: $index, size: $size}) {
                        count
                        rows {
                            disease {
                                id name
                                therapeuticAreas { id name }
                            }
                            score
                            datatypeScores { id score }
                        }
                    }
                }
            }
            """;

    static final String DISEASE_DRUGS = """
            query($id: String!, $size: Int!) {
                disease(efoId: $id) {
                    knownDrugs(size: $size) {
                        rows {
                            drugId prefName targetId approvedSymbol
                            diseaseId label phase status
                            mechanismOfAction ctIds
                        }
                    }
                }
            }
            """;

    static final String DISEASE_SYNONYMS = """
            query($id: String!) {
                disease(efoId: $id) {
                    id name
                    parents { name }
                    synonyms { relation terms }
                }
            }
            """;

    private OpenTargetsQueries() {
    }
}
