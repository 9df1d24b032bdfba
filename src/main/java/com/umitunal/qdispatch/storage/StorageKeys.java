package com.umitunal.qdispatch.storage;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Key layouts for the column families. All numbers are big-endian so byte order matches numeric order
 * for the non-negative timestamps used here.
 *
 * <pre>
 * jobs:     [jobId]
 * dispatch: [eligibleAt(8)][jobId]
 * records:  [jobIdLength(4)][jobId][attempt(4)]
 * history:  [finishedAt(8)][jobIdLength(4)][jobId][attempt(4)]
 * </pre>
 */
final class StorageKeys {

    private StorageKeys() {
    }

    static byte[] jobKey(String jobId) {
        return jobId.getBytes(UTF_8);
    }

    static String jobId(byte[] jobKey) {
        return new String(jobKey, UTF_8);
    }

    static byte[] dispatchKey(long eligibleAt, String jobId) {
        byte[] idBytes = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(8 + idBytes.length)
                .putLong(eligibleAt)
                .put(idBytes)
                .array();
    }

    static long dispatchTime(byte[] dispatchKey) {
        return ByteBuffer.wrap(dispatchKey).getLong();
    }

    static String dispatchJobId(byte[] dispatchKey) {
        return new String(dispatchKey, 8, dispatchKey.length - 8, UTF_8);
    }

    /**
     * Prefix shared by every record key of one job. The length prefix keeps "job-1" from matching "job-10".
     */
    static byte[] recordPrefix(String jobId) {
        byte[] idBytes = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(4 + idBytes.length)
                .putInt(idBytes.length)
                .put(idBytes)
                .array();
    }

    static byte[] recordKey(String jobId, int attempt) {
        byte[] prefix = recordPrefix(jobId);
        return ByteBuffer.allocate(prefix.length + 4)
                .put(prefix)
                .putInt(attempt)
                .array();
    }

    static byte[] historyKey(long finishedAt, String jobId, int attempt) {
        byte[] recordKey = recordKey(jobId, attempt);
        return ByteBuffer.allocate(8 + recordKey.length)
                .putLong(finishedAt)
                .put(recordKey)
                .array();
    }

    static byte[] historyLowerBound(long finishedAt) {
        return ByteBuffer.allocate(8).putLong(finishedAt).array();
    }

    static long historyTime(byte[] historyKey) {
        return ByteBuffer.wrap(historyKey).getLong();
    }

    /**
     * The record key embedded after the timestamp of a history key.
     */
    static byte[] historyRecordKey(byte[] historyKey) {
        byte[] recordKey = new byte[historyKey.length - 8];
        System.arraycopy(historyKey, 8, recordKey, 0, recordKey.length);
        return recordKey;
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
