package de.bsommerfeld.feedupdate.trust;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a downloaded artifact may be executed.
 *
 * <h3>Verdicts</h3>
 * <pre>
 * no signature in the feed          -> NO_SIGNATURE_PRESENT (caller must warn)
 * signature matches artifact bytes  -> VERIFIED
 * anything else                     -> VERIFICATION_FAILED
 * </pre>
 *
 * <p>
 * An unreadable or unsupported key, an invalid Base64 signature, an
 * unreadable artifact or a crashing security provider counts as failed.
 * Causes are logged without key material or artifact bytes.
 *
 * <h3>Algorithms</h3>
 * Unless an algorithm is configured, it follows from the trusted key:
 * {@code SHA256withDSA}, {@code SHA256withRSA}, {@code SHA256withECDSA} or
 * {@code Ed25519}.
 *
 * <p>
 * The gate only reads. Deleting a rejected artifact is the caller's job.
 */
public class TrustGate {

    private static final Logger LOG = LoggerFactory.getLogger(TrustGate.class);
    private static final int BUFFER_SIZE = 8192;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String signatureAlgorithm;

    /** Creates a gate that derives the signature algorithm from the key. */
    public TrustGate() {
        this(null);
    }

    /**
     * @param signatureAlgorithm JCA signature algorithm name, or
     *                           {@code null}/blank to derive it from the key
     */
    public TrustGate(String signatureAlgorithm) {
        this.signatureAlgorithm = signatureAlgorithm == null || signatureAlgorithm.isBlank()
                ? null
                : signatureAlgorithm.strip();
    }

    public TrustVerdict verify(Optional<String> signature, Path artifact, Path publicKeyPath) {
        Optional<String> present = signature.filter(s -> !s.isBlank());
        if (present.isEmpty()) {
            return TrustVerdict.NO_SIGNATURE_PRESENT;
        }

        byte[] signatureBytes;
        try {
            signatureBytes = Base64.getDecoder().decode(WHITESPACE.matcher(present.get()).replaceAll(""));
        } catch (IllegalArgumentException e) {
            LOG.error("Signature for {} is not valid Base64", artifact.getFileName());
            return TrustVerdict.VERIFICATION_FAILED;
        }

        try {
            PublicKey key = PublicKeyLoader.load(publicKeyPath);
            Signature verifier = Signature.getInstance(algorithmFor(key));
            verifier.initVerify(key);
            try (InputStream in = Files.newInputStream(artifact)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    verifier.update(buffer, 0, read);
                }
            }
            if (verifier.verify(signatureBytes)) {
                return TrustVerdict.VERIFIED;
            }
            LOG.error("Signature does not match artifact {}", artifact.getFileName());
            return TrustVerdict.VERIFICATION_FAILED;
        } catch (IOException e) {
            LOG.error("Could not read artifact or trusted key while verifying {}: {}",
                    artifact.getFileName(), e.toString());
            return TrustVerdict.VERIFICATION_FAILED;
        } catch (GeneralSecurityException e) {
            LOG.error("Signature check for {} could not be performed: {}",
                    artifact.getFileName(), e.toString());
            return TrustVerdict.VERIFICATION_FAILED;
        } catch (RuntimeException e) {
            LOG.error("Signature check for {} failed unexpectedly", artifact.getFileName(), e);
            return TrustVerdict.VERIFICATION_FAILED;
        }
    }

    private String algorithmFor(PublicKey key) throws NoSuchAlgorithmException {
        if (signatureAlgorithm != null) {
            return signatureAlgorithm;
        }
        switch (key.getAlgorithm()) {
            case "DSA":
                return "SHA256withDSA";
            case "RSA":
                return "SHA256withRSA";
            case "EC":
                return "SHA256withECDSA";
            case "Ed25519":
            case "EdDSA":
                return "Ed25519";
            default:
                throw new NoSuchAlgorithmException("No signature algorithm for key type " + key.getAlgorithm());
        }
    }
}
