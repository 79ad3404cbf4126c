package io.bundlemesh.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class PayloadBoxTest {

    @Test
    void recipientOpensWhatSenderSealed() {
        KeyHandle sender = KeyHandle.ephemeral("sender", NodeIdentity.newCommunitySecret());
        KeyHandle recipient = KeyHandle.ephemeral("recipient", NodeIdentity.newCommunitySecret());
        byte[] plaintext = "meet at the north shelter".getBytes(StandardCharsets.UTF_8);

        byte[] sealed = PayloadBox.encryptFor(plaintext, PayloadBox.publicKeyOf(recipient), sender);

        Assertions.assertEquals(PayloadBox.NONCE_BYTES + PayloadBox.TAG_BYTES + plaintext.length, sealed.length);
        byte[] opened = PayloadBox.decryptFrom(sealed, PayloadBox.publicKeyOf(sender), recipient);
        Assertions.assertArrayEquals(plaintext, opened);
    }

    @Test
    void sealingTwiceUsesFreshNonces() {
        KeyHandle sender = KeyHandle.ephemeral("sender", NodeIdentity.newCommunitySecret());
        byte[] recipientPublic = PayloadBox.publicKeyOf(KeyHandle.ephemeral("r", NodeIdentity.newCommunitySecret()));
        byte[] plaintext = new byte[]{7, 7, 7};

        Assertions.assertFalse(java.util.Arrays.equals(
                PayloadBox.encryptFor(plaintext, recipientPublic, sender),
                PayloadBox.encryptFor(plaintext, recipientPublic, sender)));
    }

    @Test
    void wrongKeyOrTamperingFailsAuthentication() {
        KeyHandle sender = KeyHandle.ephemeral("sender", NodeIdentity.newCommunitySecret());
        KeyHandle recipient = KeyHandle.ephemeral("recipient", NodeIdentity.newCommunitySecret());
        KeyHandle stranger = KeyHandle.ephemeral("stranger", NodeIdentity.newCommunitySecret());
        byte[] sealed = PayloadBox.encryptFor(new byte[]{1, 2, 3, 4}, PayloadBox.publicKeyOf(recipient), sender);
        byte[] senderPublic = PayloadBox.publicKeyOf(sender);

        Assertions.assertThrows(AuthenticationException.class,
                () -> PayloadBox.decryptFrom(sealed, senderPublic, stranger));

        byte[] tampered = sealed.clone();
        tampered[tampered.length - 1] ^= 0x01;
        Assertions.assertThrows(AuthenticationException.class,
                () -> PayloadBox.decryptFrom(tampered, senderPublic, recipient));

        Assertions.assertThrows(AuthenticationException.class,
                () -> PayloadBox.decryptFrom(new byte[10], senderPublic, recipient));
    }

    @Test
    void communityMembersReadCommunitySealedPayloads() {
        byte[] community = NodeIdentity.newCommunitySecret();
        NodeIdentity author = NodeIdentity.ephemeral(community);
        NodeIdentity member = NodeIdentity.ephemeral(community);
        NodeIdentity outsider = NodeIdentity.ephemeral(NodeIdentity.newCommunitySecret());
        byte[] plaintext = "river rising".getBytes(StandardCharsets.UTF_8);

        byte[] sealed = author.sealFor(plaintext, author.communityPublicKey());

        Assertions.assertArrayEquals(plaintext, member.openCommunity(sealed, author.boxPublicKey()));
        Assertions.assertThrows(AuthenticationException.class,
                () -> outsider.openCommunity(sealed, author.boxPublicKey()));
    }
}
