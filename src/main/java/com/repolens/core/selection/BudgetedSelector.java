package com.repolens.core.selection;

import com.repolens.core.model.BundleEntry;
import com.repolens.core.model.ContextBudget;
import com.repolens.core.model.ContextBundle;
import com.repolens.core.model.ScoredFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Greedily fills a {@link ContextBundle} from scored files, highest score first.
 * <p>
 * Every file is first cut to {@code maxCharsPerFile} at a line boundary. A file
 * that still does not fit the remaining tokens is skipped, except the highest
 * scored file, which is cut further to whole lines that fit. The bundle never
 * exceeds the token or file ceilings.
 * <p>
 * When any file matched the prompt, files scored by priors alone are left out,
 * so unrelated files never fill budget a skipped match left over.
 */
public class BudgetedSelector {

    private static final Logger log = LoggerFactory.getLogger(BudgetedSelector.class);

    private static final Comparator<ScoredFile> RANKING =
            Comparator.comparingDouble(ScoredFile::score).reversed().thenComparing(ScoredFile::path);

    private final TokenEstimator estimator;

    public BudgetedSelector(TokenEstimator estimator) {
        this.estimator = estimator;
    }

    public ContextBundle select(List<ScoredFile> scoredFiles, ContextBudget budget) {
        var ordered = new ArrayList<>(scoredFiles);
        ordered.sort(RANKING);

        boolean anyMatched = ordered.stream().anyMatch(ScoredFile::matched);

        var entries = new ArrayList<BundleEntry>();
        int tokens = 0;
        int considered = 0;

        for (int rank = 0; rank < ordered.size(); rank++) {
            if (entries.size() >= budget.maxFiles() || tokens >= budget.maxTokens()) {
                break;
            }
            ScoredFile candidate = ordered.get(rank);
            if (anyMatched && !candidate.matched()) {
                continue;
            }
            considered++;

            Optional<String> content = candidate.file().content();
            if (content.isEmpty()) {
                continue;
            }
            String text = content.get();
            boolean truncated = false;
            if (text.length() > budget.maxCharsPerFile()) {
                text = LineTruncator.truncate(text, budget.maxCharsPerFile());
                truncated = true;
                if (text.isEmpty()) {
                    continue;
                }
            }

            int remaining = budget.maxTokens() - tokens;
            int cost = estimator.estimate(text);
            if (cost > remaining) {
                if (rank != 0) {
                    log.debug("Skipping {}: {} tokens, {} left", candidate.path(), cost, remaining);
                    continue;
                }
                text = LineTruncator.truncateToTokens(text, remaining);
                if (text.isEmpty()) {
                    continue;
                }
                truncated = true;
                cost = estimator.estimate(text);
            }

            entries.add(new BundleEntry(candidate.path(), candidate.file().language(), text,
                    candidate.score(), cost, truncated, candidate.matchReasons()));
            tokens += cost;
        }

        return new ContextBundle(entries, tokens, considered, scoredFiles.size(), false);
    }
}
