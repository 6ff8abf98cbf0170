package deckhand.cluster.model;

import java.util.List;

/**
 * Secret metadata. Values are never read back.
 */
public record SecretInfo(String name, String group, List<String> keys) {

    public SecretInfo {
        keys = List.copyOf(keys);
    }
}
