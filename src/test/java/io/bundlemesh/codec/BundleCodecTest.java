package io.bundlemesh.codec;

import io.bundlemesh.TestBundles;
import io.bundlemesh.model.Audience;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.Destination;
import io.bundlemesh.model.Priority;
import io.bundlemesh.security.NodeIdentity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

final class BundleCodecTest {
    private static final long T0 = 1_800_000_000_000L;

    private final NodeIdentity identity = NodeIdentity.ephemeral(NodeIdentity.newCommunitySecret());

    @Test
    void decodeOfEncodeReturnsEqualBundle() {
        Bundle original = TestBundles.signed(
                identity,
                Destination.unicast(identity.address(), "direct-messages"),
                "direct-messages",
                Priority.EXPEDITED,
                Audience.DESTINATION_ONLY,
                T0,
                TestBundles.HOUR_MS,
                12,
                true,
                "hello".getBytes(StandardCharsets.UTF_8)
        ).withHopCount(4);

        Bundle decoded = BundleCodec.decode(BundleCodec.encode(original));

        Assertions.assertEquals(original, decoded);
        Assertions.assertEquals(4, decoded.hopCount());
        Assertions.assertTrue(decoded.custodyRequested());
        Assertions.assertEquals(Destination.Kind.UNICAST, decoded.destination().kind());
    }

    @Test
    void uppercaseNodeAddressIsNormalizedBeforeSigning() {
        String upper = identity.address().toUpperCase(Locale.ROOT);
        Destination direct = new Destination(Destination.SCHEME, upper, "dm");

        Assertions.assertEquals(identity.address(), direct.nodeAddress());
        Assertions.assertEquals(Destination.parse("dtn://" + upper + "/dm"), direct);

        Bundle bundle = TestBundles.signed(identity, direct, Priority.NORMAL, T0, "hi");
        Bundle decoded = BundleCodec.decode(BundleCodec.encode(bundle));

        Assertions.assertEquals(bundle, decoded);
        Assertions.assertEquals(bundle.id(), BundleCodec.computeId(BundleCodec.signableBytes(decoded)));
    }

    @Test
    void idIsDeterministicAndIgnoresHopCount() {
        Bundle a = TestBundles.signed(identity, Destination.multicast("alerts"), Priority.EMERGENCY, T0, "flood");
        Bundle b = TestBundles.signed(identity, Destination.multicast("alerts"), Priority.EMERGENCY, T0, "flood");

        Assertions.assertEquals(a.id(), b.id());
        Assertions.assertEquals(a.id(), BundleCodec.computeId(a.withHopCount(7)));
        Assertions.assertEquals(64, a.id().length());
    }

    @Test
    void changingAnyImmutableFieldChangesId() {
        Bundle base = TestBundles.signed(identity, Destination.multicast("alerts"), Priority.EMERGENCY, T0, "flood");

        Assertions.assertNotEquals(base.id(),
                TestBundles.signed(identity, Destination.multicast("alerts"), Priority.EMERGENCY, T0, "fire").id());
        Assertions.assertNotEquals(base.id(),
                TestBundles.signed(identity, Destination.multicast("alerts"), Priority.NORMAL, T0, "flood").id());
        Assertions.assertNotEquals(base.id(),
                TestBundles.signed(identity, Destination.multicast("alerts"), Priority.EMERGENCY, T0 + 1, "flood").id());
        Assertions.assertNotEquals(base.id(),
                TestBundles.signed(identity, Destination.trusted("alerts"), Priority.EMERGENCY, T0, "flood").id());
        Bundle otherSource = TestBundles.signed(
                NodeIdentity.ephemeral(NodeIdentity.newCommunitySecret()),
                Destination.multicast("alerts"), Priority.EMERGENCY, T0, "flood");
        Assertions.assertNotEquals(base.id(), otherSource.id());
    }

    @Test
    void malformedFramesRaiseDecodeException() {
        Bundle bundle = TestBundles.signed(identity, Destination.multicast("alerts"), Priority.BULK, T0, "x");
        byte[] encoded = BundleCodec.encode(bundle);

        Assertions.assertThrows(DecodeException.class, () -> BundleCodec.decode(null));
        Assertions.assertThrows(DecodeException.class, () -> BundleCodec.decode(new byte[0]));
        Assertions.assertThrows(DecodeException.class,
                () -> BundleCodec.decode(Arrays.copyOf(encoded, encoded.length - 1)));

        byte[] badMagic = encoded.clone();
        badMagic[0] = 'X';
        Assertions.assertThrows(DecodeException.class, () -> BundleCodec.decode(badMagic));

        byte[] badVersion = encoded.clone();
        badVersion[4] = 9;
        Assertions.assertThrows(DecodeException.class, () -> BundleCodec.decode(badVersion));

        byte[] trailing = Arrays.copyOf(encoded, encoded.length + 1);
        Assertions.assertThrows(DecodeException.class, () -> BundleCodec.decode(trailing));
    }
}
