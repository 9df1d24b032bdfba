package com.umitunal.qdispatch.storage;

import com.umitunal.qdispatch.config.StorageConfig;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.exception.TransientStoreException;
import com.umitunal.qdispatch.model.ExecutionRecordSerializer;
import com.umitunal.qdispatch.model.WorkUnit;
import com.umitunal.qdispatch.serialization.PayloadCodec;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.Cache;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.Filter;
import org.rocksdb.FlushOptions;
import org.rocksdb.LRUCache;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.OptimisticTransactionOptions;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Status;
import org.rocksdb.Transaction;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed job store.
 *
 * <p>Opened as an {@link OptimisticTransactionDB} so the queue can change a job, its dispatch index
 * entry and its execution record in one atomic commit. Column families:
 * <ul>
 *   <li>{@code jobs}: job id to serialized {@link WorkUnit}</li>
 *   <li>{@code dispatch}: WAITING and DELAYED jobs ordered by eligibility time</li>
 *   <li>{@code records}: execution records keyed by job id and attempt</li>
 *   <li>{@code history}: execution records ordered by finish time</li>
 * </ul>
 *
 * @param <T> the type of job payload
 */
public class RocksJobStore<T> implements JobStore<T> {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    static final String JOBS_CF = "jobs";
    static final String DISPATCH_CF = "dispatch";
    static final String RECORDS_CF = "records";
    static final String HISTORY_CF = "history";
    private static final byte[] EMPTY = new byte[0];
    private static final byte[] CODEC_KEY = "codec".getBytes(UTF_8);

    private final PayloadCodec<T> codec;
    private final String dataDirectory;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final ColumnFamilyOptions cfOptions;
    private final DBOptions dbOptions;
    private final List<ColumnFamilyHandle> handles = new ArrayList<>();
    private final OptimisticTransactionDB transactionDB;
    private final ColumnFamilyHandle jobsHandle;
    private final ColumnFamilyHandle dispatchHandle;
    private final ColumnFamilyHandle recordsHandle;
    private final ColumnFamilyHandle historyHandle;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions pointReadOpts;
    private final ReadOptions scanReadOpts;
    private final boolean durableWrites;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RocksJobStore(StorageConfig config, PayloadCodec<T> codec) throws TransientStoreException {
        this.codec = codec;
        this.dataDirectory = config.getDataDirectory();
        this.durableWrites = config.isDurableWrites();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getWriteBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxWriteBuffers())
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundJobs())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setMaxOpenFiles(-1);

        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions),
                new ColumnFamilyDescriptor(JOBS_CF.getBytes(UTF_8), cfOptions),
                new ColumnFamilyDescriptor(DISPATCH_CF.getBytes(UTF_8), cfOptions),
                new ColumnFamilyDescriptor(RECORDS_CF.getBytes(UTF_8), cfOptions),
                new ColumnFamilyDescriptor(HISTORY_CF.getBytes(UTF_8), cfOptions));

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, dataDirectory, descriptors, handles);
        } catch (RocksDBException e) {
            closeOptions();
            throw new TransientStoreException("Failed to open job store at " + dataDirectory, e);
        }
        this.jobsHandle = handles.get(1);
        this.dispatchHandle = handles.get(2);
        this.recordsHandle = handles.get(3);
        this.historyHandle = handles.get(4);

        // The WAL stays on either way; durable writes add an fsync per commit.
        this.writeOpts = new WriteOptions().setSync(durableWrites);
        this.txnOpts = new OptimisticTransactionOptions().setSetSnapshot(true);
        this.pointReadOpts = new ReadOptions();
        // Scans must not pollute the block cache
        this.scanReadOpts = new ReadOptions().setFillCache(false);

        verifyCodec(handles.get(0));
        log.info("Opened job store (codec={}) with {}", codec.name(), config);
    }

    /**
     * Record the codec name on first open; later opens must use the same one.
     */
    private void verifyCodec(ColumnFamilyHandle metaHandle) throws TransientStoreException {
        String stored;
        try {
            byte[] value = transactionDB.get(metaHandle, CODEC_KEY);
            if (value == null) {
                transactionDB.put(metaHandle, writeOpts, CODEC_KEY, codec.name().getBytes(UTF_8));
                return;
            }
            stored = new String(value, UTF_8);
        } catch (RocksDBException e) {
            close();
            throw new TransientStoreException("Failed to read codec marker at " + dataDirectory, e);
        }
        if (!stored.equals(codec.name())) {
            close();
            throw new IllegalStateException(
                    "Job store at " + dataDirectory + " was written with codec " + stored + ", not " + codec.name());
        }
    }

    @Override
    public void persist(WorkUnit<T> unit) throws TransientStoreException {
        try (Transaction txn = beginTransaction()) {
            writeJob(txn, unit);
            if (unit.getState().isDispatchable()) {
                addToDispatch(txn, unit);
            }
            txn.commit();
        } catch (RocksDBException e) {
            throw new TransientStoreException("Failed to persist job " + unit.getId(), e);
        }
    }

    @Override
    public void persist(ExecutionRecord record) throws TransientStoreException {
        try (Transaction txn = beginTransaction()) {
            appendRecord(txn, record);
            txn.commit();
        } catch (RocksDBException e) {
            throw new TransientStoreException(
                    "Failed to persist record " + record.jobId() + "#" + record.attempt(), e);
        }
    }

    @Override
    public Optional<WorkUnit<T>> loadJob(String jobId) throws TransientStoreException {
        try {
            byte[] value = transactionDB.get(jobsHandle, pointReadOpts, StorageKeys.jobKey(jobId));
            return value == null ? Optional.empty() : Optional.of(WorkUnit.deserialize(value, codec));
        } catch (RocksDBException e) {
            throw new TransientStoreException("Failed to load job " + jobId, e);
        }
    }

    @Override
    public List<WorkUnit<T>> listJobs(JobFilter filter) throws TransientStoreException {
        List<WorkUnit<T>> matches = new ArrayList<>();
        try (RocksIterator iter = newJobIterator()) {
            for (iter.seekToFirst(); iter.isValid() && matches.size() < filter.getLimit(); iter.next()) {
                WorkUnit<T> unit = WorkUnit.deserialize(iter.value(), codec);
                if (filter.matches(unit)) {
                    matches.add(unit);
                }
            }
            checkIterator(iter, "list jobs");
        }
        return matches;
    }

    @Override
    public List<ExecutionRecord> listRecords(String jobId) throws TransientStoreException {
        List<ExecutionRecord> records = new ArrayList<>();
        byte[] prefix = StorageKeys.recordPrefix(jobId);
        try (RocksIterator iter = transactionDB.newIterator(recordsHandle, scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && StorageKeys.startsWith(iter.key(), prefix); iter.next()) {
                records.add(ExecutionRecordSerializer.deserialize(iter.value()));
            }
            checkIterator(iter, "list records of " + jobId);
        }
        return records;
    }

    @Override
    public List<ExecutionRecord> listRecords(long fromMs, long toMs, int limit) throws TransientStoreException {
        List<ExecutionRecord> records = new ArrayList<>();
        try (RocksIterator iter = transactionDB.newIterator(historyHandle, scanReadOpts)) {
            for (iter.seek(StorageKeys.historyLowerBound(Math.max(0, fromMs)));
                 iter.isValid() && records.size() < limit;
                 iter.next()) {
                byte[] key = iter.key();
                if (StorageKeys.historyTime(key) >= toMs) {
                    break;
                }
                byte[] value = transactionDB.get(recordsHandle, pointReadOpts, StorageKeys.historyRecordKey(key));
                if (value != null) {
                    records.add(ExecutionRecordSerializer.deserialize(value));
                }
            }
            checkIterator(iter, "list history");
        } catch (RocksDBException e) {
            throw new TransientStoreException("Failed to list records between " + fromMs + " and " + toMs, e);
        }
        return records;
    }

    @Override
    public List<ExecutionRecord> listRecentRecords(int limit) throws TransientStoreException {
        List<ExecutionRecord> records = new ArrayList<>();
        try (RocksIterator iter = transactionDB.newIterator(historyHandle, scanReadOpts)) {
            for (iter.seekToLast(); iter.isValid() && records.size() < limit; iter.prev()) {
                byte[] value = transactionDB.get(recordsHandle, pointReadOpts, StorageKeys.historyRecordKey(iter.key()));
                if (value != null) {
                    records.add(ExecutionRecordSerializer.deserialize(value));
                }
            }
            checkIterator(iter, "list recent history");
        } catch (RocksDBException e) {
            throw new TransientStoreException("Failed to list recent records", e);
        }
        return records;
    }

    @Override
    public boolean deleteJob(String jobId) throws TransientStoreException {
        try (Transaction txn = beginTransaction()) {
            WorkUnit<T> unit = readJob(txn, jobId);
            if (unit == null) {
                return false;
            }
            txn.delete(jobsHandle, StorageKeys.jobKey(jobId));
            if (unit.getState().isDispatchable()) {
                removeFromDispatch(txn, StorageKeys.dispatchKey(unit.getEligibleAt(), jobId));
            }
            txn.commit();
            return true;
        } catch (RocksDBException e) {
            throw new TransientStoreException("Failed to delete job " + jobId, e);
        }
    }

    @Override
    public boolean isReachable() {
        if (closed.get()) {
            return false;
        }
        try {
            transactionDB.getProperty(jobsHandle, "rocksdb.estimate-num-keys");
            return true;
        } catch (RocksDBException e) {
            log.warn("Job store at {} is not reachable: {}", dataDirectory, e.getMessage());
            return false;
        }
    }

    public String getDataDirectory() {
        return dataDirectory;
    }

    // ---- Transactional building blocks for the queue ----

    Transaction beginTransaction() {
        return transactionDB.beginTransaction(writeOpts, txnOpts);
    }

    /**
     * Read a job inside a transaction, registering it for conflict detection at commit.
     */
    WorkUnit<T> readJob(Transaction txn, String jobId) throws RocksDBException {
        byte[] value = txn.getForUpdate(pointReadOpts, jobsHandle, StorageKeys.jobKey(jobId), true);
        return value == null ? null : WorkUnit.deserialize(value, codec);
    }

    void writeJob(Transaction txn, WorkUnit<T> unit) throws RocksDBException {
        txn.put(jobsHandle, StorageKeys.jobKey(unit.getId()), unit.serialize(codec));
    }

    void removeJob(Transaction txn, String jobId) throws RocksDBException {
        txn.delete(jobsHandle, StorageKeys.jobKey(jobId));
    }

    void addToDispatch(Transaction txn, WorkUnit<T> unit) throws RocksDBException {
        txn.put(dispatchHandle, StorageKeys.dispatchKey(unit.getEligibleAt(), unit.getId()), EMPTY);
    }

    void removeFromDispatch(Transaction txn, byte[] dispatchKey) throws RocksDBException {
        txn.delete(dispatchHandle, dispatchKey);
    }

    void appendRecord(Transaction txn, ExecutionRecord record) throws RocksDBException {
        byte[] key = StorageKeys.recordKey(record.jobId(), record.attempt());
        if (txn.getForUpdate(pointReadOpts, recordsHandle, key, true) != null) {
            throw new IllegalStateException(
                    "Execution record already exists: " + record.jobId() + "#" + record.attempt());
        }
        txn.put(recordsHandle, key, ExecutionRecordSerializer.serialize(record));
        txn.put(historyHandle, StorageKeys.historyKey(record.finishedAt(), record.jobId(), record.attempt()), EMPTY);
    }

    RocksIterator newJobIterator() {
        return transactionDB.newIterator(jobsHandle, scanReadOpts);
    }

    RocksIterator newDispatchIterator() {
        return transactionDB.newIterator(dispatchHandle, scanReadOpts);
    }

    PayloadCodec<T> getCodec() {
        return codec;
    }

    /**
     * Whether a commit failed because another transaction touched the same keys first.
     */
    static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    static void checkIterator(RocksIterator iter, String operation) throws TransientStoreException {
        try {
            iter.status();
        } catch (RocksDBException e) {
            throw new TransientStoreException("Iterator failed during " + operation, e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!durableWrites) {
            try (FlushOptions flushOptions = new FlushOptions().setWaitForFlush(true)) {
                transactionDB.flush(flushOptions, handles);
            } catch (RocksDBException e) {
                log.warn("Flush before close failed for {}: {}", dataDirectory, e.getMessage());
            }
        }
        scanReadOpts.close();
        pointReadOpts.close();
        txnOpts.close();
        writeOpts.close();
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        transactionDB.close();
        closeOptions();
        log.info("Closed job store at {}", dataDirectory);
    }

    private void closeOptions() {
        // BlockBasedTableConfig has no close(); it goes away with the options
        dbOptions.close();
        cfOptions.close();
        blockCache.close();
        bloomFilter.close();
    }
}
