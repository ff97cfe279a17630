package io.contractdb.core.database;

import io.contractdb.core.metrics.DatabaseMetrics;
import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.Value;

import java.util.function.BiConsumer;

/**
 * Borrowed views handed out by a database. A read handle has no mutators, so it
 * cannot be cast into a writer; both become unusable after close().
 */
final class MapHandles {
    private MapHandles() {}

    static DataMapView read(DataMap target, BorrowRegistry.Borrow borrow, boolean metrics) {
        return new ReadHandle(target, borrow, metrics);
    }

    static DataMap write(DataMap target, BorrowRegistry.Borrow borrow, boolean metrics) {
        return new WriteHandle(target, borrow, metrics);
    }

    private static class ReadHandle implements DataMapView {
        final DataMap target;
        final BorrowRegistry.Borrow borrow;
        final boolean metrics;

        ReadHandle(DataMap target, BorrowRegistry.Borrow borrow, boolean metrics) {
            this.target = target;
            this.borrow = borrow;
            this.metrics = metrics;
        }

        void ensureOpen() {
            if (borrow.isReleased()) {
                throw new IllegalStateException("Handle for map '" + borrow.mapName() + "' is closed");
            }
        }

        RuntimeException mismatch(TypeMismatchException e) {
            if (metrics) DatabaseMetrics.recordTypeMismatch();
            return e;
        }

        @Override
        public Value fetchEntry(Value key) {
            ensureOpen();
            try {
                Value v = target.fetchEntry(key);
                if (metrics) DatabaseMetrics.recordRead();
                return v;
            } catch (TypeMismatchException e) {
                throw mismatch(e);
            }
        }

        @Override
        public TupleTypeSignature keyType() {
            ensureOpen();
            return target.keyType();
        }

        @Override
        public TupleTypeSignature valueType() {
            ensureOpen();
            return target.valueType();
        }

        @Override
        public long size() {
            ensureOpen();
            return target.size();
        }

        @Override
        public void forEachEntry(BiConsumer<Value, Value> visitor) {
            ensureOpen();
            target.forEachEntry(visitor);
        }

        @Override
        public void close() {
            borrow.release();
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + borrow.mapName() + "]";
        }
    }

    private static final class WriteHandle extends ReadHandle implements DataMap {

        WriteHandle(DataMap target, BorrowRegistry.Borrow borrow, boolean metrics) {
            super(target, borrow, metrics);
        }

        @Override
        public void setEntry(Value key, Value value) {
            ensureOpen();
            try {
                target.setEntry(key, value);
                if (metrics) DatabaseMetrics.recordWrite();
            } catch (TypeMismatchException e) {
                throw mismatch(e);
            }
        }

        @Override
        public boolean insertEntry(Value key, Value value) {
            ensureOpen();
            try {
                boolean inserted = target.insertEntry(key, value);
                if (metrics && inserted) DatabaseMetrics.recordWrite();
                return inserted;
            } catch (TypeMismatchException e) {
                throw mismatch(e);
            }
        }

        @Override
        public boolean deleteEntry(Value key) {
            ensureOpen();
            try {
                boolean deleted = target.deleteEntry(key);
                if (metrics && deleted) DatabaseMetrics.recordWrite();
                return deleted;
            } catch (TypeMismatchException e) {
                throw mismatch(e);
            }
        }
    }
}
