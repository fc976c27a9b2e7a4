package com.repolens.core.scoring;

import com.repolens.core.model.DependencyGraph;
import com.repolens.core.model.FileRecord;
import com.repolens.core.model.Keyword;
import com.repolens.core.model.KeywordSet;
import com.repolens.core.model.ScoredFile;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores every scanned file against a prompt's keywords.
 * <p>
 * A file's score has three parts:
 * <ol>
 *   <li>relevance: keyword hits in the file name, directories and content, plus a
 *       bonus when the prompt names the file's language;</li>
 *   <li>priors: shallow depth, entry-point and manifest names, small size, and
 *       modification within a week or a month of the newest file scanned;</li>
 *   <li>propagation: files whose score reaches the seed threshold donate a share to
 *       their import neighbours, decaying per hop, over at most {@code maxHops} hops.</li>
 * </ol>
 * Files without any relevance are held below the weakest file that has some, so
 * neither priors nor propagation let an unrelated file outrank a real match.
 * Results are ordered by descending score, then ascending path.
 */
public class RelevanceScorer {

    static final Comparator<ScoredFile> RANKING =
            Comparator.comparingDouble(ScoredFile::score).reversed().thenComparing(ScoredFile::path);

    private static final Set<String> ENTRY_POINTS = Set.of(
            "main.py", "__main__.py", "app.py", "manage.py", "wsgi.py",
            "index.js", "index.ts", "main.js", "main.ts", "app.js", "app.ts", "server.js", "server.ts",
            "main.go", "main.rs", "lib.rs", "main.java", "application.java", "main.kt",
            "main.c", "main.cpp", "program.cs", "app.rb"
    );

    private static final Set<String> MANIFESTS = Set.of(
            "package.json", "requirements.txt", "cargo.toml", "go.mod", "pom.xml", "gemfile",
            "composer.json", "pubspec.yaml", "build.gradle", "build.gradle.kts", "settings.gradle",
            "cmakelists.txt", "readme.md", "dockerfile", "docker-compose.yml", "pyproject.toml",
            "setup.py", "makefile", "webpack.config.js", "tsconfig.json"
    );

    private static final Duration RECENT = Duration.ofDays(7);
    private static final Duration LATELY = Duration.ofDays(30);

    private final ScoringWeights weights;

    public RelevanceScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public RelevanceScorer() {
        this(ScoringWeights.defaults());
    }

    public List<ScoredFile> score(List<FileRecord> files, KeywordSet keywords, DependencyGraph graph) {
        Instant newest = Instant.EPOCH;
        for (FileRecord file : files) {
            if (file.lastModified().isAfter(newest)) {
                newest = file.lastModified();
            }
        }
        Map<String, Partial> partials = new HashMap<>();
        for (FileRecord file : files) {
            partials.put(file.path(), baseScore(file, keywords, newest));
        }

        propagate(partials, graph);

        double weakestMatch = Double.MAX_VALUE;
        for (Partial p : partials.values()) {
            if (p.relevance > 0) {
                weakestMatch = Math.min(weakestMatch, p.total());
            }
        }
        double ceiling = weakestMatch == Double.MAX_VALUE ? Double.MAX_VALUE : weakestMatch * weights.unmatchedCeiling();

        var scored = new ArrayList<ScoredFile>(files.size());
        for (FileRecord file : files) {
            Partial p = partials.get(file.path());
            double total = p.total();
            if (p.relevance == 0 && total > ceiling) {
                total = ceiling;
            }
            scored.add(new ScoredFile(file, total, p.relevance > 0 || p.boost > 0, p.reasons));
        }
        scored.sort(RANKING);
        return scored;
    }

    private Partial baseScore(FileRecord file, KeywordSet keywords, Instant newest) {
        var p = new Partial();
        String path = file.path().toLowerCase(Locale.ROOT);
        String name = file.fileName().toLowerCase(Locale.ROOT);
        String directories = path.length() > name.length() ? path.substring(0, path.length() - name.length()) : "";
        String content = file.content().map(c -> c.toLowerCase(Locale.ROOT)).orElse("");

        for (Keyword keyword : keywords.keywords()) {
            String term = keyword.term();
            if (name.contains(term) || (term.indexOf('/') > 0 && path.endsWith(term))) {
                p.relevance += keyword.weight() * weights.fileNameWeight();
                p.reasons.add("name:" + term);
            } else if (directories.contains(term)) {
                p.relevance += keyword.weight() * weights.pathWeight();
                p.reasons.add("path:" + term);
            }
            if (!content.isEmpty()) {
                int hits = countOccurrences(content, term, weights.contentSaturation());
                if (hits > 0) {
                    p.relevance += keyword.weight() * weights.contentWeight() * Math.log1p(hits);
                    p.reasons.add("content:" + term + " x" + hits);
                }
            }
        }

        if (keywords.languageHints().contains(file.language())) {
            p.relevance += weights.languageBonus();
            p.reasons.add("language:" + file.language().id());
        }

        p.prior += weights.depthPrior() / file.depth();
        if (ENTRY_POINTS.contains(name)) {
            p.prior += weights.entryPointPrior();
            p.reasons.add("entry-point");
        }
        if (MANIFESTS.contains(name)) {
            p.prior += weights.manifestPrior();
            p.reasons.add("manifest");
        }
        double kilobytes = file.sizeBytes() / 1024.0;
        p.prior += weights.sizePrior() / (1.0 + Math.log1p(kilobytes));

        // age relative to the newest scanned file, not the wall clock
        Duration age = Duration.between(file.lastModified(), newest);
        if (age.compareTo(RECENT) < 0) {
            p.prior += weights.recencyPrior();
            p.reasons.add("recent");
        } else if (age.compareTo(LATELY) < 0) {
            p.prior += weights.recencyPrior() / 3;
        }
        return p;
    }

    /**
     * Breadth-first over both edge directions from every seed. Each file keeps the
     * largest single donation it receives; the visited set bounds the walk on
     * cyclic graphs.
     */
    private void propagate(Map<String, Partial> partials, DependencyGraph graph) {
        if (weights.maxHops() == 0 || weights.propagationFactor() == 0) {
            return;
        }
        var seeds = new ArrayList<String>();
        for (var entry : partials.entrySet()) {
            Partial p = entry.getValue();
            if (p.relevance > 0 && p.base() >= weights.seedThreshold()) {
                seeds.add(entry.getKey());
            }
        }
        seeds.sort(Comparator.naturalOrder());

        Map<String, Donation> best = new HashMap<>();
        for (String seed : seeds) {
            double donorScore = partials.get(seed).base();
            Set<String> visited = new HashSet<>();
            visited.add(seed);
            var frontier = new ArrayDeque<String>();
            frontier.add(seed);
            for (int hop = 1; hop <= weights.maxHops() && !frontier.isEmpty(); hop++) {
                double amount = donorScore * weights.propagationFactor() * Math.pow(weights.hopDecay(), hop - 1);
                var next = new ArrayDeque<String>();
                for (String current : frontier) {
                    for (String neighbour : graph.neighborsOf(current)) {
                        if (!visited.add(neighbour) || !partials.containsKey(neighbour)) {
                            continue;
                        }
                        next.add(neighbour);
                        Donation existing = best.get(neighbour);
                        if (existing == null || amount > existing.amount) {
                            best.put(neighbour, new Donation(seed, amount));
                        }
                    }
                }
                frontier = next;
            }
        }

        for (var entry : best.entrySet()) {
            Partial p = partials.get(entry.getKey());
            p.boost = entry.getValue().amount;
            p.reasons.add("propagated:" + entry.getValue().donor);
        }
    }

    /**
     * Occurrences of {@code term} in {@code text}, stopping at {@code cap}. Terms of
     * three characters or fewer must stand alone so "db" does not match "feedback".
     */
    static int countOccurrences(String text, String term, int cap) {
        boolean wholeWord = term.length() <= 3;
        int count = 0;
        int from = 0;
        while (count < cap) {
            int at = text.indexOf(term, from);
            if (at < 0) {
                break;
            }
            if (!wholeWord || standsAlone(text, at, term.length())) {
                count++;
            }
            from = at + term.length();
        }
        return count;
    }

    private static boolean standsAlone(String text, int start, int length) {
        boolean before = start == 0 || !Character.isLetterOrDigit(text.charAt(start - 1));
        int end = start + length;
        boolean after = end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
        return before && after;
    }

    private record Donation(String donor, double amount) {}

    private static final class Partial {
        double relevance;
        double prior;
        double boost;
        final List<String> reasons = new ArrayList<>();

        double base() {
            return relevance + prior;
        }

        double total() {
            return relevance + prior + boost;
        }
    }
}
