package io.bundlemesh.propagation;

import io.bundlemesh.model.Bundle;

import java.util.List;

/**
 * What an exchange session needs to know about the node it runs on.
 */
public interface LocalNode {

    /** Hex box public key of this node. */
    String address();

    List<String> subscribedTopics();

    /** Whether this node belongs to the trusted audience. */
    boolean trustedMember();

    /** Whether trusted-audience bundles may be handed to this neighbor. */
    boolean trustsNeighbor(String neighborId);

    boolean isLocalRecipient(Bundle bundle);

    /**
     * Called once for every newly stored bundle addressed to this node.
     */
    void deliverLocally(Bundle bundle);
}
