package com.indicationscout.evidence.domain.model.drug;

import java.util.List;
import java.util.Locale;

/**
 * Lower-cases a drug name and strips a trailing salt form, so that
 * "Bupropion Hydrochloride" and "bupropion" compare equal.
 */
public final class DrugNameNormalizer {

    private static final List<String> SALT_SUFFIXES = List.of(
            " hydrochloride", " hydrobromide", " sulfate", " succinate", " chloride",
            " dimesylate", " tartrate", " citrate", " tosylate", " mesylate",
            " saccharate", " hemihydrate", " maleate", " phosphate", " malate",
            " esylate", " anhydrous"
    );

    private DrugNameNormalizer() {
    }

    public static String normalize(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String suffix : SALT_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return lower.substring(0, lower.length() - suffix.length()).strip();
            }
        }
        return lower;
    }
}
