package de.bsommerfeld.feedupdate.trust;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads an X.509 {@code SubjectPublicKeyInfo} public key from disk.
 *
 * <p>
 * Three encodings are accepted: PEM ({@code -----BEGIN PUBLIC KEY-----}),
 * bare Base64 text, and binary DER. The key algorithm is not stored
 * separately; it is found by offering the encoded key to each supported
 * key factory in turn.
 */
final class PublicKeyLoader {

    private static final List<String> KEY_ALGORITHMS = List.of("DSA", "RSA", "EC", "Ed25519");
    private static final String PEM_BEGIN = "-----BEGIN PUBLIC KEY-----";
    private static final String PEM_END = "-----END PUBLIC KEY-----";
    private static final Pattern BASE64_TEXT = Pattern.compile("[A-Za-z0-9+/=\\s]+");

    private PublicKeyLoader() {
    }

    /**
     * @throws IOException              if the file cannot be read
     * @throws GeneralSecurityException if the content is not a supported
     *                                  public key
     */
    static PublicKey load(Path keyFile) throws IOException, GeneralSecurityException {
        byte[] encoded = decode(Files.readAllBytes(keyFile));
        X509EncodedKeySpec spec = new X509EncodedKeySpec(encoded);
        InvalidKeySpecException failure = new InvalidKeySpecException("Unsupported public key in " + keyFile);
        for (String algorithm : KEY_ALGORITHMS) {
            try {
                return KeyFactory.getInstance(algorithm).generatePublic(spec);
            } catch (InvalidKeySpecException e) {
                failure.addSuppressed(e);
            }
        }
        throw failure;
    }

    private static byte[] decode(byte[] raw) throws InvalidKeySpecException {
        String text = new String(raw, StandardCharsets.US_ASCII).strip();
        if (text.startsWith(PEM_BEGIN)) {
            int end = text.indexOf(PEM_END);
            if (end < 0)
                throw new InvalidKeySpecException("PEM key has no end marker");
            text = text.substring(PEM_BEGIN.length(), end);
            return base64(text);
        }
        if (BASE64_TEXT.matcher(text).matches()) {
            return base64(text);
        }
        return raw;
    }

    private static byte[] base64(String text) throws InvalidKeySpecException {
        try {
            return Base64.getMimeDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Public key is not valid Base64", e);
        }
    }
}
