package io.github.orkee.live;

import io.github.orkee.live.errors.LiveException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Builds absolute API and stream URIs from the server base URL.
 * <p>
 * The stream transport cannot carry custom headers, so the token is sent as a
 * {@code token} query parameter there; REST calls send it as a bearer header.
 */
public final class EndpointResolver {

    private final String baseUrl;
    private final Supplier<String> tokenSupplier;

    /**
     * Creates a resolver.
     *
     * @param baseUrl       the server base URL
     * @param tokenSupplier supplies the current token, or null when there is none
     */
    public EndpointResolver(String baseUrl, Supplier<String> tokenSupplier) {
        if (baseUrl == null || baseUrl.isEmpty()) {
            throw new LiveException("baseUrl cannot be empty");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tokenSupplier = tokenSupplier == null ? () -> null : tokenSupplier;
    }

    /**
     * Returns the base URL without a trailing slash.
     *
     * @return the base URL
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Returns the current token.
     *
     * @return the token, empty when none is available
     */
    public Optional<String> token() {
        String token = tokenSupplier.get();
        return token == null || token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * Resolves a REST path.
     *
     * @param path the path, starting with {@code /}
     * @return the absolute URI
     */
    public URI resource(String path) {
        return URI.create(baseUrl + path);
    }

    /**
     * Resolves the event stream of a resource endpoint, {@code {endpoint}/events}, with the
     * token appended when available.
     *
     * @param endpoint the resource endpoint path
     * @return the absolute stream URI
     */
    public URI events(String endpoint) {
        String url = baseUrl + endpoint + "/events";
        Optional<String> token = token();
        if (token.isPresent()) {
            url += (url.contains("?") ? "&" : "?") + "token=" + URLEncoder.encode(token.get(), StandardCharsets.UTF_8);
        }
        return URI.create(url);
    }

    /**
     * Encodes a resource id for use as path segments, keeping slashes.
     *
     * @param path the raw id
     * @return the encoded path
     */
    public static String encodePath(String path) {
        // URI encoding (space -> %20), not form encoding (space -> +)
        StringBuilder encoded = new StringBuilder();
        for (String segment : path.split("/", -1)) {
            if (encoded.length() > 0) {
                encoded.append("/");
            }
            String formEncoded = URLEncoder.encode(segment, StandardCharsets.UTF_8);
            encoded.append(formEncoded.replace("+", "%20"));
        }
        return encoded.toString();
    }
}
