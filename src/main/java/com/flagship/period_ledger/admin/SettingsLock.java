package com.flagship.period_ledger.admin;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Guards the live configuration and period.
 *
 * Payment pipelines hold the read lock from classification to ledger commit,
 * so they see one consistent period and fee/payout for their whole run.
 * Administrative setters take the write lock and therefore wait for in-flight
 * pipelines, which are themselves bounded by the oracle deadline.
 *
 * Changes go through {@link #change}, which serializes write and announcement
 * together, so notifications leave in the same order the writes happened.
 */
public class SettingsLock {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock changeLock = new ReentrantLock(true);

    public Lock readLock() {
        return lock.readLock();
    }

    public <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void write(Runnable writer) {
        lock.writeLock().lock();
        try {
            writer.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies {@code update} under the write lock, then runs {@code announce}
     * before any other change may start. Readers wait only for the update.
     */
    public void change(Runnable update, Runnable announce) {
        changeLock.lock();
        try {
            write(update);
            announce.run();
        } finally {
            changeLock.unlock();
        }
    }
}
