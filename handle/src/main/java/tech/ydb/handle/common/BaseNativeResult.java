package tech.ydb.handle.common;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

public abstract class BaseNativeResult implements NativeResult {
    private final NativeResultKind kind;
    private final AtomicBoolean isClaimed = new AtomicBoolean(false);
    private final AtomicBoolean isReleased = new AtomicBoolean(false);

    protected BaseNativeResult(NativeResultKind kind) {
        this.kind = kind;
    }

    protected abstract void doRelease() throws SQLException;

    @Override
    public NativeResultKind getKind() {
        return kind;
    }

    @Override
    public boolean claim() {
        return isClaimed.compareAndSet(false, true);
    }

    @Override
    public boolean isReleased() {
        return isReleased.get();
    }

    @Override
    public int findColumn(String identifier) {
        String name = Identifiers.unquote(identifier);
        for (int idx = 0; idx < getColumnCount(); idx += 1) {
            if (name.equals(getColumnName(idx))) {
                return idx;
            }
        }
        return -1;
    }

    @Override
    public void release() throws SQLException {
        if (isReleased.compareAndSet(false, true)) {
            doRelease();
        }
    }

    @Override
    public String toString() {
        return kind.name();
    }
}
