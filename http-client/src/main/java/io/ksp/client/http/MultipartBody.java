package io.ksp.client.http;

import java.io.ByteArrayOutputStream;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * A {@code multipart/form-data} request body (RFC 7578).
 * <p>
 * Parts are encoded in the order they were added. Form fields carry no {@code Content-Type};
 * file parts carry a filename and a content type guessed from it, falling back to
 * {@code application/octet-stream}.
 */
public final class MultipartBody {

    private static final String CRLF = "\r\n";
    private static final String DEFAULT_FILE_CONTENT_TYPE = "application/octet-stream";

    private final String boundary;
    private final List<Part> parts;

    private MultipartBody(String boundary, List<Part> parts) {
        this.boundary = boundary;
        this.parts = List.copyOf(parts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String boundary() {
        return boundary;
    }

    /**
     * @return the value for the request's {@code Content-Type} header
     */
    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public List<Part> parts() {
        return parts;
    }

    /**
     * Encodes the form.
     *
     * @return the encoded body
     */
    public byte[] toByteArray() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Part part : parts) {
            StringBuilder head = new StringBuilder()
                    .append("--").append(boundary).append(CRLF)
                    .append("Content-Disposition: form-data; name=\"").append(escape(part.name())).append('"');
            if (part.filename() != null) {
                head.append("; filename=\"").append(escape(part.filename())).append('"');
            }
            head.append(CRLF);
            if (part.contentType() != null) {
                head.append("Content-Type: ").append(part.contentType()).append(CRLF);
            }
            head.append(CRLF);

            out.writeBytes(head.toString().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(part.content());
            out.writeBytes(CRLF.getBytes(StandardCharsets.UTF_8));
        }
        out.writeBytes(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    // Quotes and line breaks would end the header value early.
    private static String escape(String value) {
        return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    /**
     * One part of the form.
     *
     * @param name the form field name
     * @param filename the filename for file parts, {@code null} for plain fields
     * @param contentType the part content type, {@code null} for plain fields
     * @param content the raw part content
     */
    public record Part(String name, @Nullable String filename, @Nullable String contentType, byte[] content) {

        public boolean isFile() {
            return filename != null;
        }
    }

    public static class Builder {
        private @Nullable String boundary;
        private final List<Part> parts = new ArrayList<>();

        private Builder() {
        }

        /**
         * Overrides the generated boundary.
         *
         * @param boundary the boundary, which must not occur in any part content
         * @return this builder for method chaining
         */
        public Builder boundary(String boundary) {
            this.boundary = boundary;
            return this;
        }

        public Builder addFormField(String name, String value) {
            parts.add(new Part(name, null, null, value.getBytes(StandardCharsets.UTF_8)));
            return this;
        }

        public Builder addFilePart(String name, String filename, byte[] content) {
            String contentType = URLConnection.guessContentTypeFromName(filename);
            return addFilePart(name, filename, contentType == null ? DEFAULT_FILE_CONTENT_TYPE : contentType, content);
        }

        public Builder addFilePart(String name, String filename, String contentType, byte[] content) {
            parts.add(new Part(name, filename, contentType, content));
            return this;
        }

        public MultipartBody build() {
            String b = boundary != null ? boundary : "KspFormBoundary" + UUID.randomUUID().toString().replace("-", "");
            return new MultipartBody(b, parts);
        }
    }
}
