package in.cep.security;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Canonical JSON Tests")
public class CanonicalJsonTest {

    @Test
    @DisplayName("Key order does not change the canonical form")
    public void testKeyOrderIndependence() {
        ObjectNode a = CanonicalJson.object();
        a.put("b", 2);
        a.put("a", 1);
        a.putObject("nested").put("z", "last").put("m", "mid");

        ObjectNode b = CanonicalJson.object();
        b.putObject("nested").put("m", "mid").put("z", "last");
        b.put("a", 1);
        b.put("b", 2);

        assertEquals("{\"a\":1,\"b\":2,\"nested\":{\"m\":\"mid\",\"z\":\"last\"}}", CanonicalJson.canonicalize(a));
        assertEquals(CanonicalJson.fingerprint(a), CanonicalJson.fingerprint(b));
    }

    @Test
    @DisplayName("Array order is significant")
    public void testArrayOrderPreserved() {
        ObjectNode a = CanonicalJson.object();
        a.putArray("tags").add("x").add("y");
        ObjectNode b = CanonicalJson.object();
        b.putArray("tags").add("y").add("x");

        assertNotEquals(CanonicalJson.fingerprint(a), CanonicalJson.fingerprint(b));
    }

    @Test
    @DisplayName("SHA-256 of a known value")
    public void testSha256Hex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", CanonicalJson.sha256Hex(""));
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", CanonicalJson.sha256Hex("abc"));
    }

    @Test
    @DisplayName("Entity ids use the first 24 hex chars of the digest")
    public void testEntityId() {
        String digest = CanonicalJson.sha256Hex("abc");
        assertEquals("cepo_ba7816bf8f01cfea414140de", CanonicalJson.entityId("cepo", digest));
        assertThrows(IllegalArgumentException.class, () -> CanonicalJson.entityId("cepo", "abc"));
    }

    @Test
    @DisplayName("Null fields are part of the digest")
    public void testNullFieldChangesDigest() {
        ObjectNode withNull = CanonicalJson.object();
        withNull.put("a", 1);
        withNull.putNull("b");
        ObjectNode without = CanonicalJson.object();
        without.put("a", 1);

        assertNotEquals(CanonicalJson.fingerprint(withNull), CanonicalJson.fingerprint(without));
    }
}
