package org.silica.compiler.frontend.io;

import org.silica.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.stream.Stream;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@Tag("unit")
@ExtendWith({LogWatchExtension.class, MockitoExtension.class})
class WorkerPoolTest {

    @Mock
    private WorkerPool.ChunkTask task;

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    @Test
    void chunksAreSplitEvenlyAcrossThreads() {
        pool = new WorkerPool(2);

        pool.dispatch(10, task);

        verify(task).run(0, 5);
        verify(task).run(5, 10);
        verifyNoMoreInteractions(task);
    }

    @Test
    void everySlotIsWrittenExactlyOnce() {
        pool = new WorkerPool(4);
        int[] hits = new int[103];

        pool.dispatch(hits.length, (from, to) -> {
            for (int i = from; i < to; i++) {
                hits[i]++;
            }
        });

        assertThat(hits).containsOnly(1);
    }

    @Test
    void fewerItemsThanThreads() {
        pool = new WorkerPool(4);
        String[] slots = new String[1];

        pool.dispatch(1, (from, to) -> {
            for (int i = from; i < to; i++) {
                slots[i] = "parsed";
            }
        });

        assertThat(slots).containsExactly("parsed");
    }

    @Test
    void zeroItemsDoesNothing() {
        pool = new WorkerPool(2);
        AtomicInteger calls = new AtomicInteger();

        pool.dispatch(0, (from, to) -> calls.incrementAndGet());

        assertThat(calls).hasValue(0);
    }

    @Test
    void workerFailureIsRethrownOnTheCaller() {
        pool = new WorkerPool(2);

        assertThatThrownBy(() -> pool.dispatch(10, (from, to) -> {
            if (from > 0) {
                throw new IllegalStateException("chunk " + from);
            }
        })).isInstanceOf(IllegalStateException.class).hasMessage("chunk 5");
    }

    @Test
    void everyFailureIsKeptOnTheRethrownOne() {
        pool = new WorkerPool(3);

        Throwable thrown = catchThrowable(() -> pool.dispatch(9, (from, to) -> {
            throw new IllegalStateException("chunk " + from);
        }));

        assertThat(thrown).isInstanceOf(IllegalStateException.class);
        assertThat(thrown.getMessage()).isIn("chunk 3", "chunk 6");
        assertThat(Stream.concat(Stream.of(thrown), Arrays.stream(thrown.getSuppressed())).map(Throwable::getMessage))
                .containsExactlyInAnyOrder("chunk 0", "chunk 3", "chunk 6");
    }

    @Test
    void poolCanBeReusedForSeveralDispatches() {
        pool = new WorkerPool(3);
        long[] sums = new long[3];

        for (int round = 0; round < sums.length; round++) {
            long[] values = new long[50];
            pool.dispatch(values.length, (from, to) -> {
                for (int i = from; i < to; i++) {
                    values[i] = i;
                }
            });
            sums[round] = Arrays.stream(values).sum();
        }

        assertThat(sums).containsOnly(1225L);
    }

    @Test
    void dispatchAfterCloseIsRejected() {
        pool = new WorkerPool(2);
        pool.close();

        assertThatThrownBy(() -> pool.dispatch(1, (from, to) -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parallelismBelowTwoIsRejected() {
        assertThatThrownBy(() -> new WorkerPool(1)).isInstanceOf(IllegalArgumentException.class);
    }
}
