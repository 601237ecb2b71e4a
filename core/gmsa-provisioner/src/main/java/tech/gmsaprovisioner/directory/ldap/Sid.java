package tech.gmsaprovisioner.directory.ldap;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Windows security identifier in string ({@code S-1-5-21-...}) and binary form.
 *
 * Binary layout: revision (1 byte), sub-authority count (1 byte), identifier
 * authority (6 bytes, big-endian), sub-authorities (4 bytes each, little-endian).
 */
public final class Sid {

    /** BUILTIN\Administrators, owner of gMSA password-retrieval descriptors. */
    public static final Sid BUILTIN_ADMINISTRATORS = parse("S-1-5-32-544");

    private static final int MAX_SUB_AUTHORITIES = 15;

    private final int revision;
    private final long identifierAuthority;
    private final long[] subAuthorities;

    private Sid(int revision, long identifierAuthority, long[] subAuthorities) {
        this.revision = revision;
        this.identifierAuthority = identifierAuthority;
        this.subAuthorities = subAuthorities;
    }

    public static boolean looksLikeSid(String value) {
        return value != null && value.regionMatches(true, 0, "S-1-", 0, 4);
    }

    /**
     * Parse the string form.
     *
     * @throws IllegalArgumentException if the string is not a SID
     */
    public static Sid parse(String value) {
        if (!looksLikeSid(value)) {
            throw new IllegalArgumentException("Not a SID: " + value);
        }
        String[] parts = value.split("-");
        if (parts.length < 3 || parts.length - 3 > MAX_SUB_AUTHORITIES) {
            throw new IllegalArgumentException("Not a SID: " + value);
        }
        try {
            int revision = Integer.parseInt(parts[1]);
            long authority = Long.parseLong(parts[2]);
            long[] subs = new long[parts.length - 3];
            for (int i = 0; i < subs.length; i++) {
                subs[i] = Long.parseLong(parts[i + 3]);
                if (subs[i] < 0 || subs[i] > 0xFFFFFFFFL) {
                    throw new IllegalArgumentException("SID sub-authority out of range: " + value);
                }
            }
            return new Sid(revision, authority, subs);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a SID: " + value, e);
        }
    }

    /**
     * Decode the binary form (objectSid attribute value).
     */
    public static Sid fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < 8) {
            throw new IllegalArgumentException("SID too short: " + bytes.length + " bytes");
        }
        int revision = bytes[0] & 0xFF;
        int count = bytes[1] & 0xFF;
        if (bytes.length != 8 + 4 * count) {
            throw new IllegalArgumentException("SID length mismatch: " + bytes.length + " bytes for " + count + " sub-authorities");
        }
        long authority = 0;
        for (int i = 2; i < 8; i++) {
            authority = (authority << 8) | (bytes[i] & 0xFF);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes, 8, 4 * count).order(ByteOrder.LITTLE_ENDIAN);
        long[] subs = new long[count];
        for (int i = 0; i < count; i++) {
            subs[i] = buffer.getInt() & 0xFFFFFFFFL;
        }
        return new Sid(revision, authority, subs);
    }

    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(length());
        out.write(revision);
        out.write(subAuthorities.length);
        for (int shift = 40; shift >= 0; shift -= 8) {
            out.write((int) ((identifierAuthority >>> shift) & 0xFF));
        }
        ByteBuffer buffer = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        for (long sub : subAuthorities) {
            buffer.clear();
            buffer.putInt((int) sub);
            out.write(buffer.array(), 0, 4);
        }
        return out.toByteArray();
    }

    /**
     * Size of the binary form in bytes.
     */
    public int length() {
        return 8 + 4 * subAuthorities.length;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        parts.add("S");
        parts.add(Integer.toString(revision));
        parts.add(Long.toString(identifierAuthority));
        for (long sub : subAuthorities) {
            parts.add(Long.toString(sub));
        }
        return String.join("-", parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sid other)) return false;
        return toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
