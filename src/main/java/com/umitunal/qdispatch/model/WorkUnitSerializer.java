package com.umitunal.qdispatch.model;

import com.umitunal.qdispatch.core.JobState;
import com.umitunal.qdispatch.serialization.PayloadCodec;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for WorkUnit using ByteBuffer.
 *
 * Binary format (version 1):
 * - format version (1 byte)
 * - id length (4 bytes) + id bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes
 * - maxAttempts (4 bytes)
 * - timeoutMillis (8 bytes)
 * - enqueuedAt (8 bytes)
 * - state ordinal (1 byte)
 * - attempts (4 bytes)
 * - reclaimCount (4 bytes)
 * - eligibleAt (8 bytes)
 * - leaseOwner length (4 bytes) + owner bytes (UTF-8), length -1 for null
 * - leaseStartedAt (8 bytes)
 * - leaseExpiresAt (8 bytes)
 * - lastError length (4 bytes) + error bytes (UTF-8), length -1 for null
 * - finishedAt (8 bytes)
 * - lastModified (8 bytes)
 * - version (8 bytes)
 *
 * @param <T> the type of job payload
 */
public class WorkUnitSerializer<T> {
    static final byte FORMAT_VERSION = 1;

    private final PayloadCodec<T> payloadCodec;

    public WorkUnitSerializer(PayloadCodec<T> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(WorkUnit<T> unit) {
        byte[] idBytes = unit.getId().getBytes(UTF_8);
        byte[] payloadBytes = payloadCodec.encode(unit.getPayload());
        byte[] ownerBytes = BinaryFields.bytesOrNull(unit.getLeaseOwner());
        byte[] errorBytes = BinaryFields.bytesOrNull(unit.getLastError());

        int totalSize = 1 +                                     // format version
                       4 + idBytes.length +                     // id
                       4 + payloadBytes.length +                // payload
                       4 + 8 + 8 +                              // maxAttempts, timeout, enqueuedAt
                       1 + 4 + 4 + 8 +                          // state, attempts, reclaims, eligibleAt
                       BinaryFields.sizeOf(ownerBytes) + 8 + 8 + // lease
                       BinaryFields.sizeOf(errorBytes) +        // lastError
                       8 + 8 + 8;                               // finishedAt, lastModified, version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);

        buffer.putInt(idBytes.length);
        buffer.put(idBytes);
        buffer.putInt(payloadBytes.length);
        buffer.put(payloadBytes);

        buffer.putInt(unit.getMaxAttempts());
        buffer.putLong(unit.getTimeoutMillis());
        buffer.putLong(unit.getEnqueuedAt());

        buffer.put((byte) unit.getState().ordinal());
        buffer.putInt(unit.getAttempts());
        buffer.putInt(unit.getReclaimCount());
        buffer.putLong(unit.getEligibleAt());

        BinaryFields.putNullable(buffer, ownerBytes);
        buffer.putLong(unit.getLeaseStartedAt());
        buffer.putLong(unit.getLeaseExpiresAt());

        BinaryFields.putNullable(buffer, errorBytes);

        buffer.putLong(unit.getFinishedAt());
        buffer.putLong(unit.getLastModified());
        buffer.putLong(unit.getVersion());

        return buffer.array();
    }

    public WorkUnit<T> deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        try {
            byte format = buffer.get();
            if (format != FORMAT_VERSION) {
                throw new IllegalStateException("Unsupported work unit format: " + format);
            }

            String id = BinaryFields.getString(buffer);

            byte[] payloadBytes = new byte[buffer.getInt()];
            buffer.get(payloadBytes);
            T payload = payloadCodec.decode(payloadBytes);

            int maxAttempts = buffer.getInt();
            long timeoutMillis = buffer.getLong();
            long enqueuedAt = buffer.getLong();

            WorkUnit<T> unit = new WorkUnit<>(id, payload, maxAttempts, timeoutMillis, enqueuedAt, enqueuedAt);

            unit.setState(JobState.values()[buffer.get()]);
            unit.setAttempts(buffer.getInt());
            unit.setReclaimCount(buffer.getInt());
            unit.setEligibleAt(buffer.getLong());

            unit.setLeaseOwner(BinaryFields.getNullableString(buffer));
            unit.setLeaseStartedAt(buffer.getLong());
            unit.setLeaseExpiresAt(buffer.getLong());

            unit.setLastError(BinaryFields.getNullableString(buffer));

            unit.setFinishedAt(buffer.getLong());
            unit.setLastModified(buffer.getLong());
            unit.setVersion(buffer.getLong());
            return unit;
        } catch (BufferUnderflowException | ArrayIndexOutOfBoundsException | NegativeArraySizeException e) {
            throw new IllegalStateException("Corrupt work unit record (" + bytes.length + " bytes)", e);
        }
    }
}
