package org.tsappend.datapipeline.staging;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Picks the {@link IStagingClient} for a URL by its scheme. URLs without a scheme are local
 * paths.
 */
public class StagingClients {

    private final Map<String, IStagingClient> clients = new HashMap<>();

    /**
     * Registers a client for a scheme, replacing any previous one.
     */
    public StagingClients register(String scheme, IStagingClient client) {
        clients.put(scheme, client);
        return this;
    }

    /**
     * @throws IllegalArgumentException if no client handles the URL's scheme
     */
    public IStagingClient forUrl(String url) {
        String scheme = schemeOf(url);
        IStagingClient client = clients.get(scheme);
        if (client == null) {
            throw new IllegalArgumentException("Unsupported URL scheme '" + scheme + "' in " + url
                    + " (supported: " + clients.keySet() + ")");
        }
        return client;
    }

    static String schemeOf(String url) {
        try {
            String scheme = URI.create(url).getScheme();
            return scheme == null ? LocalStagingClient.SCHEME : scheme;
        } catch (IllegalArgumentException e) {
            // Not a URI (e.g. spaces in a plain path)
            return LocalStagingClient.SCHEME;
        }
    }
}
