package com.repolens.core.cache;

import com.repolens.core.keywords.PromptNormalizer;
import com.repolens.core.model.ContextBudget;
import com.repolens.core.model.KeywordSet;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of a cached bundle.
 *
 * @param repositoryIdentity stable name of the repository
 * @param treeVersion        state of the working tree the bundle was built from
 * @param promptHash         SHA-256 of the case-folded, whitespace-collapsed prompt and its keywords
 * @param budget             ceilings the bundle was selected under
 */
public record CacheKey(String repositoryIdentity, String treeVersion, String promptHash, ContextBudget budget) {

    public CacheKey {
        Objects.requireNonNull(repositoryIdentity, "repositoryIdentity");
        Objects.requireNonNull(treeVersion, "treeVersion");
        Objects.requireNonNull(promptHash, "promptHash");
        Objects.requireNonNull(budget, "budget");
    }

    public static CacheKey of(String repositoryIdentity, String treeVersion, String prompt,
                              KeywordSet keywords, ContextBudget budget) {
        return new CacheKey(repositoryIdentity, treeVersion, hashPrompt(prompt, keywords), budget);
    }

    /** Same repository, prompt and budget; possibly another tree version. */
    boolean sameSlot(CacheKey other) {
        return repositoryIdentity.equals(other.repositoryIdentity)
                && promptHash.equals(other.promptHash)
                && budget.equals(other.budget);
    }

    static String hashPrompt(String prompt, KeywordSet keywords) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(PromptNormalizer.cacheForm(prompt).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
            digest.update(keywords.fingerprint().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
