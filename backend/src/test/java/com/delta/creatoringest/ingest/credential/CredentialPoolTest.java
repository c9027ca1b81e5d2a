package com.delta.creatoringest.ingest.credential;

import com.delta.creatoringest.ingest.model.ApiCredential;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialPoolTest {

    @Test
    void rotatesRoundRobinInConfigurationOrder() {
        CredentialPool pool = CredentialPool.fromSecrets(List.of("a", "b", "c"));

        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(pool.acquire().map(ApiCredential::id).orElseThrow());
        }

        assertThat(ids).containsExactly(1, 2, 3, 1, 2);
    }

    @Test
    void skipsExhaustedCredentials() {
        CredentialPool pool = CredentialPool.fromSecrets(List.of("a", "b", "c"));
        pool.markExhausted(2);

        assertThat(pool.acquire()).map(ApiCredential::id).contains(1);
        assertThat(pool.acquire()).map(ApiCredential::id).contains(3);
        assertThat(pool.acquire()).map(ApiCredential::id).contains(1);
        assertThat(pool.availableCount()).isEqualTo(2);
    }

    @Test
    void returnsEmptyOnceEveryCredentialIsExhausted() {
        CredentialPool pool = CredentialPool.fromSecrets(List.of("a", "b"));
        pool.markExhausted(1);
        pool.markExhausted(2);
        pool.markExhausted(2);

        assertThat(pool.acquire()).isEmpty();
        assertThat(pool.allExhausted()).isTrue();
    }

    @Test
    void unknownIdsAreIgnored() {
        CredentialPool pool = CredentialPool.fromSecrets(List.of("a"));
        pool.markExhausted(99);

        assertThat(pool.availableCount()).isEqualTo(1);
        assertThat(pool.isExhausted(99)).isTrue();
    }

    @Test
    void emptyPoolNeverHandsOutCredentials() {
        CredentialPool pool = CredentialPool.fromSecrets(List.of());

        assertThat(pool.acquire()).isEmpty();
        assertThat(pool.size()).isZero();
    }

    @Test
    void secretIsNotPrinted() {
        ApiCredential credential = new ApiCredential(3, "AIza-very-secret");

        assertThat(credential.toString()).doesNotContain("AIza-very-secret").contains("3");
    }

    @Test
    void exhaustionIsVisibleToConcurrentCallers() throws Exception {
        CredentialPool pool = CredentialPool.fromSecrets(List.of("a", "b", "c", "d"));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int id = 1; id <= 4; id++) {
                int target = id;
                executor.submit(() -> {
                    start.await();
                    pool.markExhausted(target);
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        Optional<ApiCredential> next = pool.acquire();
        assertThat(next).isEmpty();
    }
}
