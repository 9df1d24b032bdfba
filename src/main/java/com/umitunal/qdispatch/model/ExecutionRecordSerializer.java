package com.umitunal.qdispatch.model;

import com.umitunal.qdispatch.core.ExecutionRecord;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for ExecutionRecord.
 *
 * Binary format:
 * - jobId length (4 bytes) + jobId bytes (UTF-8)
 * - attempt (4 bytes)
 * - workerId length (4 bytes) + bytes, -1 for null
 * - startedAt (8 bytes)
 * - finishedAt (8 bytes)
 * - outcome ordinal (1 byte)
 * - resultOrError length (4 bytes) + bytes, -1 for null
 */
public final class ExecutionRecordSerializer {

    private ExecutionRecordSerializer() {
    }

    public static byte[] serialize(ExecutionRecord record) {
        byte[] jobIdBytes = record.jobId().getBytes(UTF_8);
        byte[] workerBytes = BinaryFields.bytesOrNull(record.workerId());
        byte[] messageBytes = BinaryFields.bytesOrNull(record.resultOrError());

        ByteBuffer buffer = ByteBuffer.allocate(
                4 + jobIdBytes.length + 4
                + BinaryFields.sizeOf(workerBytes)
                + 8 + 8 + 1
                + BinaryFields.sizeOf(messageBytes));

        buffer.putInt(jobIdBytes.length);
        buffer.put(jobIdBytes);
        buffer.putInt(record.attempt());
        BinaryFields.putNullable(buffer, workerBytes);
        buffer.putLong(record.startedAt());
        buffer.putLong(record.finishedAt());
        buffer.put((byte) record.outcome().ordinal());
        BinaryFields.putNullable(buffer, messageBytes);
        return buffer.array();
    }

    public static ExecutionRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        try {
            String jobId = BinaryFields.getString(buffer);
            int attempt = buffer.getInt();
            String workerId = BinaryFields.getNullableString(buffer);
            long startedAt = buffer.getLong();
            long finishedAt = buffer.getLong();
            ExecutionRecord.Outcome outcome = ExecutionRecord.Outcome.values()[buffer.get()];
            String message = BinaryFields.getNullableString(buffer);
            return new ExecutionRecord(jobId, attempt, workerId, startedAt, finishedAt, outcome, message);
        } catch (BufferUnderflowException | ArrayIndexOutOfBoundsException | NegativeArraySizeException e) {
            throw new IllegalStateException("Corrupt execution record (" + bytes.length + " bytes)", e);
        }
    }
}
