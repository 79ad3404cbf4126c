package io.bundlemesh.model;

import java.util.Locale;

/**
 * Logical bundle address of the form {@code scheme://scope/topic}.
 *
 * <p>The scope selects the delivery mode: a 64-hex node address for unicast,
 * {@code *} for every subscriber of the topic, {@code trusted} for the trusted
 * audience. The topic segment is optional.
 */
public record Destination(String scheme, String scope, String topic) {
    public static final String SCHEME = "dtn";
    public static final String MULTICAST_SCOPE = "*";
    public static final String TRUSTED_SCOPE = "trusted";
    private static final int NODE_ADDRESS_HEX = 64;

    public enum Kind {
        UNICAST,
        MULTICAST,
        TRUSTED_BROADCAST
    }

    public Destination {
        if (scheme == null || !SCHEME.equals(scheme)) {
            throw new IllegalArgumentException("Unsupported destination scheme: " + scheme);
        }
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("Destination scope must not be blank");
        }
        if (isNodeAddress(scope)) {
            scope = scope.toLowerCase(Locale.ROOT);
        } else if (!MULTICAST_SCOPE.equals(scope) && !TRUSTED_SCOPE.equals(scope)) {
            throw new IllegalArgumentException("Destination scope must be a node address, '*' or 'trusted': " + scope);
        }
        topic = topic == null ? "" : topic;
    }

    public static Destination parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Destination must not be blank");
        }
        String value = raw.trim();
        int sep = value.indexOf("://");
        if (sep <= 0) {
            throw new IllegalArgumentException("Destination must look like scheme://scope/topic: " + raw);
        }
        String scheme = value.substring(0, sep).toLowerCase(Locale.ROOT);
        String rest = value.substring(sep + 3);
        int slash = rest.indexOf('/');
        String scope = slash < 0 ? rest : rest.substring(0, slash);
        String topic = slash < 0 ? "" : rest.substring(slash + 1);
        return new Destination(scheme, scope, topic);
    }

    public static Destination unicast(String nodeAddress, String topic) {
        return new Destination(SCHEME, nodeAddress, topic);
    }

    public static Destination multicast(String topic) {
        return new Destination(SCHEME, MULTICAST_SCOPE, topic);
    }

    public static Destination trusted(String topic) {
        return new Destination(SCHEME, TRUSTED_SCOPE, topic);
    }

    public Kind kind() {
        if (MULTICAST_SCOPE.equals(scope)) {
            return Kind.MULTICAST;
        }
        if (TRUSTED_SCOPE.equals(scope)) {
            return Kind.TRUSTED_BROADCAST;
        }
        return Kind.UNICAST;
    }

    /**
     * Node address of a unicast destination, empty string otherwise.
     */
    public String nodeAddress() {
        return kind() == Kind.UNICAST ? scope : "";
    }

    public static boolean isNodeAddress(String value) {
        if (value == null || value.length() != NODE_ADDRESS_HEX) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return topic.isEmpty() ? scheme + "://" + scope : scheme + "://" + scope + "/" + topic;
    }
}
