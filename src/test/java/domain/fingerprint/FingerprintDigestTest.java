package domain.fingerprint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FingerprintDigestTest {

    @Test
    void should_return_known_sha256_of_empty_string() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                FingerprintDigest.sha256Hex(""));
        assertEquals(FingerprintDigest.sha256Hex(""), FingerprintDigest.sha256Hex(null));
    }

    @Test
    void should_return_64_lowercase_hex_chars() {
        String h = FingerprintDigest.sha256Hex("select * from t where a = ?");
        assertEquals(64, h.length());
        assertTrue(h.matches("[0-9a-f]{64}"));
    }

    @Test
    void same_shape_same_hash() {
        SqlFingerprinter f = new SqlFingerprinter();
        assertEquals(
                FingerprintDigest.sha256Hex(f.fingerprint("SELECT * FROM t WHERE a = 1")),
                FingerprintDigest.sha256Hex(f.fingerprint("select *   from T where A = 42")));
        assertNotEquals(
                FingerprintDigest.sha256Hex(f.fingerprint("SELECT * FROM t WHERE a = 1")),
                FingerprintDigest.sha256Hex(f.fingerprint("SELECT * FROM t WHERE b = 1")));
    }
}
