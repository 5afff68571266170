package com.relayclaw.providers;

/**
 * One (base URL, API key) pair of a provider. {@code urlPriority} orders a provider's
 * URLs, lower first.
 */
public record Endpoint(String url, String apiKey, int urlPriority) {

    public Endpoint {
        if (url == null || url.isBlank()) throw new InvalidProviderException("Endpoint url is required");
        url = url.trim().replaceAll("/+$", "");
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new InvalidProviderException("Endpoint url must be http(s): " + url);
        }
        if (apiKey == null || apiKey.isBlank()) throw new InvalidProviderException("Endpoint api key is required for " + url);
        apiKey = apiKey.trim();
    }

    @Override
    public String toString() {
        return "Endpoint[url=" + url + ", key=" + maskKey(apiKey) + ", urlPriority=" + urlPriority + "]";
    }

    public static String maskKey(String key) {
        if (key == null) return "null";
        if (key.length() <= 8) return "****";
        return key.substring(0, 4) + "…" + key.substring(key.length() - 4);
    }
}
