package tech.gmsaprovisioner.directory.ldap;

import com.unboundid.ldap.sdk.Attribute;
import com.unboundid.ldap.sdk.DN;
import com.unboundid.ldap.sdk.Entry;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.RDN;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.UUID;

/**
 * Builds the {@code msKds-ProvRootKey} entry for a new Group Key Distribution
 * Service root key, with the same algorithm choices the Windows tooling uses:
 * SP800-108 counter-mode HMAC-SHA512 for key derivation and 2048-bit
 * Diffie-Hellman (RFC 3526 group 14) for secret agreement.
 */
final class KdsRootKeyTemplate {

    static final String OBJECT_CLASS = "msKds-ProvRootKey";
    static final String ROOT_KEYS_CONTAINER = "CN=Master Root Keys,CN=Group Key Distribution Service,CN=Services";

    static final String ATTR_VERSION = "msKds-Version";
    static final String ATTR_KDF_ALGORITHM = "msKds-KDFAlgorithmID";
    static final String ATTR_KDF_PARAM = "msKds-KDFParam";
    static final String ATTR_SECRET_AGREEMENT_ALGORITHM = "msKds-SecretAgreementAlgorithmID";
    static final String ATTR_SECRET_AGREEMENT_PARAM = "msKds-SecretAgreementParam";
    static final String ATTR_PUBLIC_KEY_LENGTH = "msKds-PublicKeyLength";
    static final String ATTR_PRIVATE_KEY_LENGTH = "msKds-PrivateKeyLength";
    static final String ATTR_ROOT_KEY_DATA = "msKds-RootKeyData";
    static final String ATTR_DOMAIN_ID = "msKds-DomainID";
    static final String ATTR_CREATE_TIME = "msKds-CreateTime";
    static final String ATTR_USE_START_TIME = "msKds-UseStartTime";

    private static final String KDF_ALGORITHM = "SP800_108_CTR_HMAC";
    private static final String KDF_HASH = "SHA512";
    private static final String SECRET_AGREEMENT_ALGORITHM = "DH";
    private static final int PUBLIC_KEY_BITS = 2048;
    private static final int PRIVATE_KEY_BITS = 512;
    private static final int ROOT_KEY_BYTES = 64;
    private static final int BCRYPT_DH_PARAMETERS_MAGIC = 0x4D504844;

    private static final BigInteger MODP_2048_PRIME = new BigInteger(
        "FFFFFFFFFFFFFFFFC90FDAA22168C234C4C6628B80DC1CD1"
            + "29024E088A67CC74020BBEA63B139B22514A08798E3404DD"
            + "EF9519B3CD3A431B302B0A6DF25F14374FE1356D6D51C245"
            + "E485B576625E7EC6F44C42E9A637ED6B0BFF5CB6F406B7ED"
            + "EE386BFB5A899FA5AE9F24117C4B1FE649286651ECE45B3D"
            + "C2007CB8A163BF0598DA48361C55D39A69163FA8FD24CF5F"
            + "83655D23DCA3AD961C62F356208552BB9ED529077096966D"
            + "670C354E4ABC9804F1746C08CA18217C32905E462E36CE3B"
            + "E39E772C180E86039B2783A2EC07A28FB5C55DF06F4C52C9"
            + "DE2BCBF6955817183995497CEA956AE515D2261898FA0510"
            + "15728E5A8AACAA68FFFFFFFFFFFFFFFF", 16);
    private static final BigInteger MODP_2048_GENERATOR = BigInteger.TWO;

    private static final SecureRandom RANDOM = new SecureRandom();

    private KdsRootKeyTemplate() {
    }

    static DN containerDn(String configurationDn) throws LDAPException {
        return new DN(ROOT_KEYS_CONTAINER + "," + configurationDn);
    }

    /**
     * New root key entry.
     *
     * @param container     root keys container DN
     * @param domainId      DN of the domain controller computer object
     * @param createTime    creation time
     * @param effectiveTime time from which the key may derive passwords
     */
    static Entry newRootKey(DN container, String keyId, String domainId, Instant createTime, Instant effectiveTime) {
        byte[] rootKeyData = new byte[ROOT_KEY_BYTES];
        RANDOM.nextBytes(rootKeyData);

        Entry entry = new Entry(new DN(new RDN("cn", keyId), container));
        entry.addAttribute("objectClass", "top", OBJECT_CLASS);
        entry.addAttribute("cn", keyId);
        entry.addAttribute(ATTR_VERSION, "1");
        entry.addAttribute(ATTR_KDF_ALGORITHM, KDF_ALGORITHM);
        entry.addAttribute(new Attribute(ATTR_KDF_PARAM, kdfParameters()));
        entry.addAttribute(ATTR_SECRET_AGREEMENT_ALGORITHM, SECRET_AGREEMENT_ALGORITHM);
        entry.addAttribute(new Attribute(ATTR_SECRET_AGREEMENT_PARAM, diffieHellmanParameters()));
        entry.addAttribute(ATTR_PUBLIC_KEY_LENGTH, Integer.toString(PUBLIC_KEY_BITS));
        entry.addAttribute(ATTR_PRIVATE_KEY_LENGTH, Integer.toString(PRIVATE_KEY_BITS));
        entry.addAttribute(new Attribute(ATTR_ROOT_KEY_DATA, rootKeyData));
        entry.addAttribute(ATTR_DOMAIN_ID, domainId);
        entry.addAttribute(ATTR_CREATE_TIME, Long.toString(AdValues.toFileTime(createTime)));
        entry.addAttribute(ATTR_USE_START_TIME, Long.toString(AdValues.toFileTime(effectiveTime)));
        return entry;
    }

    /**
     * Identifier of the key this service creates when a forest has none. Every
     * instance derives the same value from the container, so concurrent
     * creations collide on the entry name instead of adding a second key.
     */
    static String bootstrapKeyId(DN container) {
        return UUID.nameUUIDFromBytes(
            ("msKds-ProvRootKey:" + container.toNormalizedString()).getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * KDF parameter blob: two reserved words, the byte length of the hash name,
     * a reserved word, then the hash name as null-terminated UTF-16LE.
     */
    static byte[] kdfParameters() {
        byte[] hashName = (KDF_HASH + "\0").getBytes(StandardCharsets.UTF_16LE);
        return ByteBuffer.allocate(16 + hashName.length)
            .order(ByteOrder.LITTLE_ENDIAN)
            .putInt(0)
            .putInt(1)
            .putInt(hashName.length)
            .putInt(0)
            .put(hashName)
            .array();
    }

    /**
     * BCRYPT_DH_PARAMETER_HEADER followed by the big-endian prime and generator.
     */
    static byte[] diffieHellmanParameters() {
        int keyLength = PUBLIC_KEY_BITS / 8;
        return ByteBuffer.allocate(12 + 2 * keyLength)
            .order(ByteOrder.LITTLE_ENDIAN)
            .putInt(12 + 2 * keyLength)
            .putInt(BCRYPT_DH_PARAMETERS_MAGIC)
            .putInt(keyLength)
            .put(unsigned(MODP_2048_PRIME, keyLength))
            .put(unsigned(MODP_2048_GENERATOR, keyLength))
            .array();
    }

    private static byte[] unsigned(BigInteger value, int length) {
        byte[] raw = value.toByteArray();
        byte[] out = new byte[length];
        int copy = Math.min(raw.length, length);
        System.arraycopy(raw, raw.length - copy, out, length - copy, copy);
        return out;
    }
}
