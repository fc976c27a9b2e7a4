package com.repolens.core.scoring;

/**
 * Tunable weights of the {@link RelevanceScorer}.
 *
 * @param fileNameWeight    multiplier for a keyword found in the file name
 * @param pathWeight        multiplier for a keyword found in a directory segment
 * @param contentWeight     multiplier for keyword occurrences in content, applied to {@code log(1 + count)}
 * @param contentSaturation occurrences beyond this count add nothing
 * @param languageBonus     added when the file's language is named in the prompt
 * @param depthPrior        prior divided by path depth; root files get all of it
 * @param entryPointPrior   prior for conventional entry points ({@code main.py}, {@code index.js}, ...)
 * @param manifestPrior     prior for build manifests and project documents
 * @param sizePrior         prior scaled down as files grow
 * @param recencyPrior      prior for files changed within a week of the newest file in the scan,
 *                          a third of it within a month
 * @param seedThreshold     minimum score for a matched file to donate to its neighbours
 * @param propagationFactor share of the donor's score given to a direct neighbour
 * @param hopDecay          multiplier applied per additional hop
 * @param maxHops           how far donations travel
 * @param unmatchedCeiling  unmatched files score at most this fraction of the weakest matched file
 */
public record ScoringWeights(
    double fileNameWeight,
    double pathWeight,
    double contentWeight,
    int contentSaturation,
    double languageBonus,
    double depthPrior,
    double entryPointPrior,
    double manifestPrior,
    double sizePrior,
    double recencyPrior,
    double seedThreshold,
    double propagationFactor,
    double hopDecay,
    int maxHops,
    double unmatchedCeiling
) {
    public ScoringWeights {
        requireNonNegative("fileNameWeight", fileNameWeight);
        requireNonNegative("pathWeight", pathWeight);
        requireNonNegative("contentWeight", contentWeight);
        requireNonNegative("languageBonus", languageBonus);
        requireNonNegative("depthPrior", depthPrior);
        requireNonNegative("entryPointPrior", entryPointPrior);
        requireNonNegative("manifestPrior", manifestPrior);
        requireNonNegative("sizePrior", sizePrior);
        requireNonNegative("recencyPrior", recencyPrior);
        requireNonNegative("seedThreshold", seedThreshold);
        if (contentSaturation < 1) {
            throw new IllegalArgumentException("contentSaturation must be >= 1");
        }
        if (maxHops < 0) {
            throw new IllegalArgumentException("maxHops must be >= 0");
        }
        if (propagationFactor < 0 || propagationFactor > 1 || hopDecay < 0 || hopDecay > 1) {
            throw new IllegalArgumentException("propagationFactor and hopDecay must be within [0, 1]");
        }
        if (unmatchedCeiling < 0 || unmatchedCeiling >= 1) {
            throw new IllegalArgumentException("unmatchedCeiling must be within [0, 1)");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(3.0, 2.0, 1.0, 64, 2.0,
                0.3, 0.2, 0.15, 0.1, 0.15,
                1.0, 0.5, 0.5, 1, 0.95);
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(name + " must be >= 0: " + value);
        }
    }
}
