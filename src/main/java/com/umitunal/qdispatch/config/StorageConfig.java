package com.umitunal.qdispatch.config;

/**
 * Where and how the job store keeps its RocksDB files.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int writeBufferSizeMB;
    private final int maxWriteBuffers;
    private final int backgroundJobs;
    private final long blockCacheSizeMB;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.writeBufferSizeMB = builder.writeBufferSizeMB;
        this.maxWriteBuffers = builder.maxWriteBuffers;
        this.backgroundJobs = builder.backgroundJobs;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getWriteBufferSizeMB() { return writeBufferSizeMB; }
    public int getMaxWriteBuffers() { return maxWriteBuffers; }
    public int getBackgroundJobs() { return backgroundJobs; }
    public long getBlockCacheSizeMB() { return blockCacheSizeMB; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    @Override
    public String toString() {
        return String.format("StorageConfig{dir=%s, durable=%b, writeBuffer=%dMBx%d, cache=%dMB}",
            dataDirectory, durableWrites, writeBufferSizeMB, maxWriteBuffers, blockCacheSizeMB);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int writeBufferSizeMB = 32;
        private int maxWriteBuffers = 3;
        private int backgroundJobs = 2;
        private long blockCacheSizeMB = 64;

        private Builder(String dataDirectory) {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be blank");
            }
            this.dataDirectory = dataDirectory;
        }

        /**
         * fsync the write-ahead log on every commit. Job state must survive a process crash, so only
         * tests turn this off.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Default: 32 MB
         */
        public Builder withWriteBufferSize(int sizeMB) {
            this.writeBufferSizeMB = sizeMB;
            return this;
        }

        public Builder withMaxWriteBuffers(int count) {
            this.maxWriteBuffers = count;
            return this;
        }

        /**
         * Flush and compaction threads.
         * Default: 2
         */
        public Builder withBackgroundJobs(int count) {
            this.backgroundJobs = count;
            return this;
        }

        /**
         * LRU block cache shared by the job, dispatch and record column families.
         * Default: 64 MB
         */
        public Builder withBlockCacheSize(long sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        public StorageConfig build() {
            if (writeBufferSizeMB < 1 || maxWriteBuffers < 1 || backgroundJobs < 1) {
                throw new IllegalArgumentException(
                    "write buffer size, write buffer count and background jobs must be at least 1");
            }
            if (blockCacheSizeMB < 0) {
                throw new IllegalArgumentException("blockCacheSizeMB must not be negative");
            }
            return new StorageConfig(this);
        }
    }
}
