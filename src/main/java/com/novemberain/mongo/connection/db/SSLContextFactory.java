package com.novemberain.mongo.connection.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.CRL;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.ssl.SSLContextBuilder;
import org.apache.http.ssl.SSLContexts;
import org.apache.http.ssl.TrustStrategy;

/**
 * Allows to get an {@link SSLContext} from PEM encoded CA certificates, client
 * certificate and key, and revocation lists.
 */
public class SSLContextFactory {

    private static final String PRIVATE_KEY = "PRIVATE KEY";
    private static final String ENCRYPTED_PRIVATE_KEY = "ENCRYPTED PRIVATE KEY";
    private static final String PBES2_OID = "1.2.840.113549.1.5.13";
    private static final String[] KEY_ALGORITHMS = {"RSA", "EC", "DSA"};
    private static final String KEY_ALIAS = "client";
    // protects the in-memory key store only
    private static final char[] KEY_ENTRY_PASSWORD = "mongo-connection".toCharArray();

    /**
     * @return a context, or {@code null} when the options carry no TLS material
     * and keep certificate validation on, so the driver default applies.
     */
    public SSLContext getSSLContext(ConnectionOptions options) throws SSLException {
        final boolean trustAll = Boolean.FALSE.equals(options.getSslValidate());
        if (StringUtils.isAllBlank(options.getSslCa(), options.getSslCert(), options.getSslKey(), options.getSslCrl())
                && !trustAll) {
            return null;
        }
        try {
            SSLContextBuilder sslContextBuilder = SSLContexts.custom();
            if (trustAll) {
                sslContextBuilder.loadTrustMaterial((KeyStore) null, (chain, authType) -> true);
            } else {
                KeyStore trustStore = loadTrustStore(options.getSslCa());
                TrustStrategy revocation = loadRevocationStrategy(options.getSslCrl());
                if (trustStore != null || revocation != null) {
                    sslContextBuilder.loadTrustMaterial(trustStore, revocation);
                }
            }
            KeyStore keyStore = loadKeyStore(options.getSslCert(), options.getSslKey(), options.getSslPass());
            if (keyStore != null) {
                sslContextBuilder.loadKeyMaterial(keyStore, KEY_ENTRY_PASSWORD);
            }
            return sslContextBuilder.build();
        } catch (GeneralSecurityException | IOException e) {
            throw new SSLException("Cannot setup SSL context", e);
        }
    }

    private KeyStore loadTrustStore(String caPath) throws GeneralSecurityException, IOException {
        if (StringUtils.isBlank(caPath)) {
            return null;
        }
        KeyStore trustStore = emptyKeyStore();
        int i = 0;
        for (Certificate certificate : readCertificates(caPath)) {
            trustStore.setCertificateEntry("ca-" + i++, certificate);
        }
        return trustStore;
    }

    private TrustStrategy loadRevocationStrategy(String crlPath) throws GeneralSecurityException, IOException {
        if (StringUtils.isBlank(crlPath)) {
            return null;
        }
        final Collection<? extends CRL> crls;
        try (InputStream is = Files.newInputStream(Paths.get(crlPath))) {
            crls = CertificateFactory.getInstance("X.509").generateCRLs(is);
        }
        return new RevocationTrustStrategy(crls);
    }

    private KeyStore loadKeyStore(String certPath, String keyPath, String password)
            throws GeneralSecurityException, IOException {
        if (StringUtils.isBlank(certPath) && StringUtils.isBlank(keyPath)) {
            return null;
        }
        if (StringUtils.isAnyBlank(certPath, keyPath)) {
            throw new GeneralSecurityException("Both a client certificate and a client key are required.");
        }
        List<Certificate> chain = readCertificates(certPath);
        PrivateKey key = readPrivateKey(keyPath, password);
        KeyStore keyStore = emptyKeyStore();
        keyStore.setKeyEntry(KEY_ALIAS, key, KEY_ENTRY_PASSWORD, chain.toArray(new Certificate[0]));
        return keyStore;
    }

    private List<Certificate> readCertificates(String path) throws GeneralSecurityException, IOException {
        try (InputStream is = Files.newInputStream(Paths.get(path))) {
            List<Certificate> certificates = new ArrayList<>(CertificateFactory.getInstance("X.509").generateCertificates(is));
            if (certificates.isEmpty()) {
                throw new CertificateException("No certificate found in " + path);
            }
            return certificates;
        }
    }

    private PrivateKey readPrivateKey(String path, String password) throws GeneralSecurityException, IOException {
        String pem = new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.US_ASCII);
        PKCS8EncodedKeySpec keySpec;
        if (pem.contains(pemHeader(ENCRYPTED_PRIVATE_KEY))) {
            if (StringUtils.isEmpty(password)) {
                throw new GeneralSecurityException("Client key " + path + " is encrypted, a key password is required.");
            }
            keySpec = decrypt(new EncryptedPrivateKeyInfo(pemBody(pem, ENCRYPTED_PRIVATE_KEY)), password);
        } else if (pem.contains(pemHeader(PRIVATE_KEY))) {
            keySpec = new PKCS8EncodedKeySpec(pemBody(pem, PRIVATE_KEY));
        } else {
            throw new InvalidKeySpecException("Client key " + path + " is not a PEM encoded PKCS#8 key.");
        }
        InvalidKeySpecException failure = null;
        for (String algorithm : KEY_ALGORITHMS) {
            try {
                return KeyFactory.getInstance(algorithm).generatePrivate(keySpec);
            } catch (InvalidKeySpecException e) {
                failure = e;
            }
        }
        throw new InvalidKeySpecException("Unsupported client key algorithm in " + path, failure);
    }

    private PKCS8EncodedKeySpec decrypt(EncryptedPrivateKeyInfo info, String password) throws GeneralSecurityException {
        // PBES2 reports its OID as the algorithm name, the cipher is named by the parameters
        String algorithm = info.getAlgName();
        if (PBES2_OID.equals(algorithm) || "PBES2".equals(algorithm)) {
            algorithm = info.getAlgParameters().toString();
        }
        Key key = SecretKeyFactory.getInstance(algorithm).generateSecret(new PBEKeySpec(password.toCharArray()));
        Cipher cipher = Cipher.getInstance(algorithm);
        cipher.init(Cipher.DECRYPT_MODE, key, info.getAlgParameters());
        return info.getKeySpec(cipher);
    }

    private static byte[] pemBody(String pem, String type) {
        int start = pem.indexOf(pemHeader(type)) + pemHeader(type).length();
        int end = pem.indexOf("-----END " + type + "-----", start);
        return Base64.decodeBase64(pem.substring(start, end));
    }

    private static String pemHeader(String type) {
        return "-----BEGIN " + type + "-----";
    }

    private static KeyStore emptyKeyStore() throws GeneralSecurityException, IOException {
        KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        keyStore.load(null, null);
        return keyStore;
    }

    /**
     * Rejects chains holding a revoked certificate, otherwise defers to the
     * regular trust manager.
     */
    static class RevocationTrustStrategy implements TrustStrategy {

        private final Collection<? extends CRL> crls;

        RevocationTrustStrategy(Collection<? extends CRL> crls) {
            this.crls = crls;
        }

        @Override
        public boolean isTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            for (X509Certificate certificate : chain) {
                for (CRL crl : crls) {
                    if (crl.isRevoked(certificate)) {
                        throw new CertificateException("Certificate " + certificate.getSubjectX500Principal()
                                + " was revoked by " + ((X509CRL) crl).getIssuerX500Principal());
                    }
                }
            }
            return false;
        }
    }
}
