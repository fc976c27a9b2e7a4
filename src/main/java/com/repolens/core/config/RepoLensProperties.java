package com.repolens.core.config;

import com.repolens.core.model.ContextBudget;
import com.repolens.core.scoring.ScoringWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "repolens")
public class RepoLensProperties {

    private Context context = new Context();
    private Scan scan = new Scan();
    private Cache cache = new Cache();
    private Scoring scoring = new Scoring();

    public Context getContext() { return context; }
    public void setContext(Context context) { this.context = context; }
    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }

    /** Budget used when a request does not set its own limits. */
    public ContextBudget defaultBudget() {
        return new ContextBudget(context.maxTokens, context.maxFiles, context.maxCharsPerFile, context.maxDepth);
    }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(scan.timeoutSeconds);
    }

    public static class Context {
        private int maxTokens = 15000;
        private int maxFiles = 20;
        private int maxCharsPerFile = 10000;
        private int maxDepth = 4;

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public int getMaxFiles() { return maxFiles; }
        public void setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; }
        public int getMaxCharsPerFile() { return maxCharsPerFile; }
        public void setMaxCharsPerFile(int maxCharsPerFile) { this.maxCharsPerFile = maxCharsPerFile; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    }

    public static class Scan {
        private long maxFileSizeBytes = 40000;
        private int workerPoolSize = 8;
        private int timeoutSeconds = 30;
        private List<String> excludePatterns = new ArrayList<>();

        public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(long maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }
        public int getWorkerPoolSize() { return workerPoolSize; }
        public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public List<String> getExcludePatterns() { return excludePatterns; }
        public void setExcludePatterns(List<String> excludePatterns) { this.excludePatterns = excludePatterns; }
    }

    public static class Cache {
        private int capacity = 10;
        private long ttlSeconds = 300;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
    }

    /** Mirrors {@link ScoringWeights}; defaults match {@link ScoringWeights#defaults()}. */
    public static class Scoring {
        private double fileNameWeight = 3.0;
        private double pathWeight = 2.0;
        private double contentWeight = 1.0;
        private int contentSaturation = 64;
        private double languageBonus = 2.0;
        private double depthPrior = 0.3;
        private double entryPointPrior = 0.2;
        private double manifestPrior = 0.15;
        private double sizePrior = 0.1;
        private double recencyPrior = 0.15;
        private double seedThreshold = 1.0;
        private double propagationFactor = 0.5;
        private double hopDecay = 0.5;
        private int maxHops = 1;
        private double unmatchedCeiling = 0.95;

        public ScoringWeights toWeights() {
            return new ScoringWeights(fileNameWeight, pathWeight, contentWeight, contentSaturation,
                    languageBonus, depthPrior, entryPointPrior, manifestPrior, sizePrior, recencyPrior,
                    seedThreshold, propagationFactor, hopDecay, maxHops, unmatchedCeiling);
        }

        public double getFileNameWeight() { return fileNameWeight; }
        public void setFileNameWeight(double fileNameWeight) { this.fileNameWeight = fileNameWeight; }
        public double getPathWeight() { return pathWeight; }
        public void setPathWeight(double pathWeight) { this.pathWeight = pathWeight; }
        public double getContentWeight() { return contentWeight; }
        public void setContentWeight(double contentWeight) { this.contentWeight = contentWeight; }
        public int getContentSaturation() { return contentSaturation; }
        public void setContentSaturation(int contentSaturation) { this.contentSaturation = contentSaturation; }
        public double getLanguageBonus() { return languageBonus; }
        public void setLanguageBonus(double languageBonus) { this.languageBonus = languageBonus; }
        public double getDepthPrior() { return depthPrior; }
        public void setDepthPrior(double depthPrior) { this.depthPrior = depthPrior; }
        public double getEntryPointPrior() { return entryPointPrior; }
        public void setEntryPointPrior(double entryPointPrior) { this.entryPointPrior = entryPointPrior; }
        public double getManifestPrior() { return manifestPrior; }
        public void setManifestPrior(double manifestPrior) { this.manifestPrior = manifestPrior; }
        public double getSizePrior() { return sizePrior; }
        public void setSizePrior(double sizePrior) { this.sizePrior = sizePrior; }
        public double getRecencyPrior() { return recencyPrior; }
        public void setRecencyPrior(double recencyPrior) { this.recencyPrior = recencyPrior; }
        public double getSeedThreshold() { return seedThreshold; }
        public void setSeedThreshold(double seedThreshold) { this.seedThreshold = seedThreshold; }
        public double getPropagationFactor() { return propagationFactor; }
        public void setPropagationFactor(double propagationFactor) { this.propagationFactor = propagationFactor; }
        public double getHopDecay() { return hopDecay; }
        public void setHopDecay(double hopDecay) { this.hopDecay = hopDecay; }
        public int getMaxHops() { return maxHops; }
        public void setMaxHops(int maxHops) { this.maxHops = maxHops; }
        public double getUnmatchedCeiling() { return unmatchedCeiling; }
        public void setUnmatchedCeiling(double unmatchedCeiling) { this.unmatchedCeiling = unmatchedCeiling; }
    }
}
