package org.carma.influence.ledger;

import org.carma.influence.model.GridPoint;
import org.carma.influence.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The only owner of the ledger's append handle.
 *
 * Rows from any number of workers are funnelled through one writer thread. Each row is
 * encoded to a single line and written with one {@code write} followed by
 * {@code force}, so rows never interleave and a row is durable before
 * {@link #append} returns. A grid point already in the ledger is refused.
 *
 * The first I/O failure breaks the writer: that append and every later one throw
 * {@link LedgerWriteException}.
 */
public class LedgerWriter implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(LedgerWriter.class);

    /**
     * Destination of encoded rows. Each call receives one complete line and returns
     * once it is durable.
     */
    interface AppendTarget extends Closeable {
        void append(ByteBuffer line) throws IOException;
    }

    private final Path path;
    private final ResultRowCodec codec;
    private final AppendTarget target;
    private final ExecutorService executor;
    private final Set<GridPoint> keys;
    private final AtomicInteger written = new AtomicInteger();
    private volatile IOException failure;

    LedgerWriter(Path path, ResultRowCodec codec, Collection<GridPoint> existingKeys,
                 AppendTarget target) {
        this.path = path;
        this.codec = codec;
        this.keys = new HashSet<>(existingKeys);
        this.target = target;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ledger-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Persist a row, blocking until it is on disk.
     *
     * @return {@code true} if written, {@code false} if the grid point already had a row
     * @throws LedgerWriteException if the row could not be written, now or earlier
     */
    public boolean append(ResultRow row) {
        Future<Boolean> result = executor.submit(() -> write(row));
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerWriteException("Interrupted while persisting " + row.gridPoint(),
                new InterruptedIOException(e.getMessage()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LedgerWriteException) {
                throw (LedgerWriteException) cause;
            }
            throw new LedgerWriteException("Cannot persist " + row.gridPoint(),
                new IOException(cause));
        }
    }

    private boolean write(ResultRow row) {
        if (failure != null) {
            throw new LedgerWriteException("Ledger writer for " + path + " is broken", failure);
        }
        if (!keys.add(row.gridPoint())) {
            log.warn("Refusing second row for {} in {}", row.gridPoint(), path);
            return false;
        }
        ByteBuffer buffer = ByteBuffer.wrap(codec.encode(row).getBytes(StandardCharsets.UTF_8));
        try {
            target.append(buffer);
        } catch (IOException e) {
            failure = e;
            keys.remove(row.gridPoint());
            throw new LedgerWriteException("Cannot append row for " + row.gridPoint() + " to " + path, e);
        }
        written.incrementAndGet();
        return true;
    }

    public int getWrittenCount() {
        return written.get();
    }

    public boolean isBroken() {
        return failure != null;
    }

    @Override
    public void close() throws IOException {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Ledger writer for {} did not drain in time", path);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            target.close();
        }
    }

    /**
     * Appends to the file through one channel, forcing every line to disk.
     */
    static AppendTarget fileTarget(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        return new AppendTarget() {
            @Override
            public void append(ByteBuffer line) throws IOException {
                while (line.hasRemaining()) {
                    channel.write(line);
                }
                channel.force(false);
            }

            @Override
            public void close() throws IOException {
                channel.close();
            }
        };
    }
}
