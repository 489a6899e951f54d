package io.ksp.client;

/**
 * Response bodies returned by the platform.
 */
public class JsonMessages {

    static final String VERIFY_OK = """
            {
              "valid": true,
              "user_id": "usr_42"
            }""";

    static final String PUBLISH_RESPONSE = """
            {
              "article_id": "art_01HZX3",
              "published_id": "sql-injection-login-form",
              "web_url": "https://bugbounty-ksp.com/articles/sql-injection-login-form",
              "images": {
                "poc.png": "https://cdn.bugbounty-ksp.com/images/art_01HZX3/poc.png"
              },
              "created_at": "2025-03-14T09:26:53Z"
            }""";

    static final String PUBLISH_RESPONSE_WITHOUT_IMAGES = """
            {
              "article_id": "art_01HZX4",
              "published_id": "stored-xss-comments",
              "web_url": "https://bugbounty-ksp.com/articles/stored-xss-comments",
              "created_at": "2025-03-14T10:00:00Z"
            }""";

    static final String PUBLISH_RESPONSE_MISSING_WEB_URL = """
            {
              "article_id": "art_01HZX5",
              "published_id": "idor-invoices",
              "images": {},
              "created_at": "2025-03-14T11:00:00Z"
            }""";

    static final String ARTICLE = """
            {
              "published_id": "sql-injection-login-form",
              "title": "SQL Injection in Login Form",
              "views": 1337,
              "tags": ["sqli", "web"],
              "author": {"name": "Theoriest"}
            }""";

    static final String DELETE_RESPONSE = """
            {
              "article_id": "art_01HZX3",
              "published_id": "sql-injection-login-form",
              "deleted_at": "2025-03-15T08:00:00Z"
            }""";

    static final String DELETE_RESPONSE_NOT_ARCHIVED = """
            {
              "article_id": "art_01HZX3",
              "published_id": "sql-injection-login-form",
              "deleted_at": "2025-03-15T08:00:00Z",
              "archived": false
            }""";
}
