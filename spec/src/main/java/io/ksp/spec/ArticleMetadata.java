package io.ksp.spec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.ksp.common.KspErrorMessages;
import io.ksp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Article metadata, as found in the frontmatter block of an article source file.
 * <p>
 * The five well-known fields are typed; anything else the frontmatter carries is kept in
 * {@link #frontmatter()} and sent along unchanged on publication.
 *
 * @param title the article title (required, non-blank)
 * @param tags the article tags, in order
 * @param category the article category
 * @param difficulty the difficulty label
 * @param author the author name
 * @param frontmatter additional frontmatter fields, excluding the five above
 */
public record ArticleMetadata(String title, List<String> tags, String category, String difficulty, String author,
                              Map<String, Object> frontmatter) {

    static final String TITLE = "title";
    static final String TAGS = "tags";
    static final String CATEGORY = "category";
    static final String DIFFICULTY = "difficulty";
    static final String AUTHOR = "author";

    private static final List<String> REQUIRED_FIELDS = List.of(TITLE, TAGS, CATEGORY, DIFFICULTY, AUTHOR);

    public ArticleMetadata {
        Assert.checkNotNullParam(TITLE, title);
        Assert.checkNotNullParam(CATEGORY, category);
        Assert.checkNotNullParam(DIFFICULTY, difficulty);
        Assert.checkNotNullParam(AUTHOR, author);
        tags = tags == null ? List.of() : List.copyOf(tags);
        frontmatter = frontmatter == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(frontmatter));
    }

    /**
     * Builds metadata from a parsed frontmatter map.
     * <p>
     * {@code title}, {@code tags}, {@code category}, {@code difficulty} and {@code author} are
     * required and must be non-null. The title must be a non-blank string and the tags a list
     * of strings. Other fields are kept as additional frontmatter.
     *
     * @param frontmatter the parsed frontmatter
     * @return the metadata
     * @throws KspValidationException if a required field is missing or has the wrong type
     */
    public static ArticleMetadata fromFrontmatter(@Nullable Map<String, ?> frontmatter) throws KspValidationException {
        if (frontmatter == null) {
            throw new KspValidationException(KspErrorMessages.FRONTMATTER_REQUIRED);
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (frontmatter.get(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new KspValidationException("Missing required fields: " + String.join(", ", missing));
        }

        if (!(frontmatter.get(TITLE) instanceof String) || ((String) frontmatter.get(TITLE)).isBlank()) {
            throw new KspValidationException("Title must be a non-empty string");
        }
        if (!(frontmatter.get(TAGS) instanceof List)) {
            throw new KspValidationException("Tags must be a list");
        }
        List<String> tags = new ArrayList<>();
        for (Object tag : (List<?>) frontmatter.get(TAGS)) {
            if (!(tag instanceof String)) {
                throw new KspValidationException("All tags must be strings");
            }
            tags.add((String) tag);
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : frontmatter.entrySet()) {
            if (!REQUIRED_FIELDS.contains(entry.getKey())) {
                extra.put(entry.getKey(), entry.getValue());
            }
        }

        return new ArticleMetadata(
                (String) frontmatter.get(TITLE),
                tags,
                String.valueOf(frontmatter.get(CATEGORY)),
                String.valueOf(frontmatter.get(DIFFICULTY)),
                String.valueOf(frontmatter.get(AUTHOR)),
                extra);
    }

    /**
     * Returns the complete frontmatter: the additional fields followed by the five well-known ones.
     *
     * @return a new mutable map
     */
    public Map<String, Object> toFrontmatter() {
        Map<String, Object> result = new LinkedHashMap<>(frontmatter);
        result.put(TITLE, title);
        result.put(TAGS, tags);
        result.put(CATEGORY, category);
        result.put(DIFFICULTY, difficulty);
        result.put(AUTHOR, author);
        return result;
    }
}
