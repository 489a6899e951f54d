/**
 * Client for the BugBountyKE-KSP platform API.
 *
 * <p>{@link io.ksp.client.KspClient} verifies its API key when created, then publishes, fetches
 * and deletes articles. {@link io.ksp.client.KspClientConfig} holds the connection settings.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * KspClientConfig config = KspClientConfig.builder()
 *         .baseUrl("https://staging-api.bugbounty-ksp.com")
 *         .requestTimeout(Duration.ofSeconds(60))
 *         .build();
 *
 * try (KspClient client = new KspClient(System.getenv("KSP_API_KEY"), config)) {
 *     ArticleMetadata metadata = ArticleMetadata.fromFrontmatter(frontmatter);
 *     PublishResult published = client.publishArticle(metadata, markdown, images, "articles/ssrf.md");
 *     client.deleteArticle(published.publishedId());
 * } catch (KspApiException e) {
 *     switch (e.getKind()) {
 *         case AUTHENTICATION -> System.err.println("Check your API key: " + e.getMessage());
 *         case RATE_LIMIT -> System.err.println("Slow down");
 *         default -> System.err.println(e.getMessage());
 *     }
 * }
 * }</pre>
 */
@NullMarked
package io.ksp.client;

import org.jspecify.annotations.NullMarked;
