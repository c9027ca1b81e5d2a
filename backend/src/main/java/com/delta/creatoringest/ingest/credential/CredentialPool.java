package com.delta.creatoringest.ingest.credential;

import com.delta.creatoringest.ingest.model.ApiCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Round-robin rotation over the configured API keys.
 * <p>
 * Exhaustion is discovered reactively (a call fails with a quota or auth error) and stays set for
 * the lifetime of the pool. Once every credential is exhausted {@link #acquire()} returns empty and
 * the run has to stop.
 */
public class CredentialPool {
    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    private final List<ApiCredential> credentials;
    private final boolean[] exhausted;
    private final ReentrantLock lock = new ReentrantLock();
    private int cursor;

    public CredentialPool(List<ApiCredential> credentials) {
        this.credentials = List.copyOf(credentials);
        this.exhausted = new boolean[this.credentials.size()];
    }

    public static CredentialPool fromSecrets(List<String> secrets) {
        List<ApiCredential> credentials = new ArrayList<>();
        int id = 1;
        for (String secret : secrets) {
            credentials.add(new ApiCredential(id++, secret));
        }
        return new CredentialPool(credentials);
    }

    public Optional<ApiCredential> acquire() {
        lock.lock();
        try {
            int size = credentials.size();
            for (int probe = 0; probe < size; probe++) {
                int index = (cursor + probe) % size;
                if (!exhausted[index]) {
                    cursor = (index + 1) % size;
                    return Optional.of(credentials.get(index));
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public void markExhausted(int id) {
        lock.lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                log.warn("Ignoring exhaustion for unknown credential {}", id);
                return;
            }
            if (!exhausted[index]) {
                exhausted[index] = true;
                log.warn("Credential {} marked exhausted ({} of {} still available)", id, countAvailable(), credentials.size());
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isExhausted(int id) {
        lock.lock();
        try {
            int index = indexOf(id);
            return index < 0 || exhausted[index];
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return credentials.size();
    }

    public int availableCount() {
        lock.lock();
        try {
            return countAvailable();
        } finally {
            lock.unlock();
        }
    }

    public boolean allExhausted() {
        return availableCount() == 0;
    }

    private int countAvailable() {
        int available = 0;
        for (boolean flag : exhausted) {
            if (!flag) {
                available++;
            }
        }
        return available;
    }

    private int indexOf(int id) {
        for (int i = 0; i < credentials.size(); i++) {
            if (credentials.get(i).id() == id) {
                return i;
            }
        }
        return -1;
    }
}
