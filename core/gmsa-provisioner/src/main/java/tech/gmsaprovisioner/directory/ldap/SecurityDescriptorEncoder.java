package tech.gmsaprovisioner.directory.ldap;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the self-relative security descriptor stored in
 * {@code msDS-GroupMSAMembership}, which decides who may retrieve a gMSA password.
 *
 * <p>The descriptor equals the SDDL {@code O:BAD:(A;;0xf01ff;;;<sid>)...}: owner
 * BUILTIN\Administrators, no group, no SACL, and one access-allowed ACE per
 * principal, in request order.
 */
public final class SecurityDescriptorEncoder {

    static final int SD_REVISION = 1;
    static final int SE_DACL_PRESENT = 0x0004;
    static final int SE_SELF_RELATIVE = 0x8000;
    static final int ACL_REVISION = 2;
    static final int ACCESS_ALLOWED_ACE_TYPE = 0x00;
    static final int PASSWORD_READ_MASK = 0x000F01FF;

    private static final int HEADER_SIZE = 20;
    private static final int ACL_HEADER_SIZE = 8;
    private static final int ACE_HEADER_SIZE = 8;

    private SecurityDescriptorEncoder() {
    }

    public static byte[] encode(List<Sid> allowed) {
        Sid owner = Sid.BUILTIN_ADMINISTRATORS;

        int aclSize = ACL_HEADER_SIZE;
        for (Sid sid : allowed) {
            aclSize += ACE_HEADER_SIZE + sid.length();
        }

        int ownerOffset = HEADER_SIZE;
        int daclOffset = ownerOffset + owner.length();

        ByteBuffer buffer = ByteBuffer.allocate(daclOffset + aclSize).order(ByteOrder.LITTLE_ENDIAN);

        buffer.put((byte) SD_REVISION);
        buffer.put((byte) 0);
        buffer.putShort((short) (SE_DACL_PRESENT | SE_SELF_RELATIVE));
        buffer.putInt(ownerOffset);
        buffer.putInt(0); // group
        buffer.putInt(0); // sacl
        buffer.putInt(daclOffset);

        buffer.put(owner.toBytes());

        buffer.put((byte) ACL_REVISION);
        buffer.put((byte) 0);
        buffer.putShort((short) aclSize);
        buffer.putShort((short) allowed.size());
        buffer.putShort((short) 0);

        for (Sid sid : allowed) {
            buffer.put((byte) ACCESS_ALLOWED_ACE_TYPE);
            buffer.put((byte) 0);
            buffer.putShort((short) (ACE_HEADER_SIZE + sid.length()));
            buffer.putInt(PASSWORD_READ_MASK);
            buffer.put(sid.toBytes());
        }

        return buffer.array();
    }

    /**
     * SIDs granted by the access-allowed ACEs of a descriptor, in ACE order.
     */
    public static List<Sid> allowedSids(byte[] descriptor) {
        ByteBuffer buffer = ByteBuffer.wrap(descriptor).order(ByteOrder.LITTLE_ENDIAN);
        int daclOffset = buffer.getInt(16);
        if (daclOffset == 0) {
            return List.of();
        }
        int aceCount = buffer.getShort(daclOffset + 4) & 0xFFFF;
        List<Sid> sids = new ArrayList<>(aceCount);
        int position = daclOffset + ACL_HEADER_SIZE;
        for (int i = 0; i < aceCount; i++) {
            int aceType = descriptor[position] & 0xFF;
            int aceSize = buffer.getShort(position + 2) & 0xFFFF;
            if (aceType == ACCESS_ALLOWED_ACE_TYPE) {
                byte[] sidBytes = new byte[aceSize - ACE_HEADER_SIZE];
                System.arraycopy(descriptor, position + ACE_HEADER_SIZE, sidBytes, 0, sidBytes.length);
                sids.add(Sid.fromBytes(sidBytes));
            }
            position += aceSize;
        }
        return sids;
    }
}
