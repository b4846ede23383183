package com.consullo.viewer.window;

import com.consullo.viewer.codec.CodecException;
import com.consullo.viewer.codec.GzipLineCodec;
import com.consullo.viewer.core.events.RepaintEvent;
import com.consullo.viewer.core.events.RepaintListener;
import com.consullo.viewer.store.ChunkStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for windowed viewport resolution over compressed chunks.
 *
 * @since 1.0
 */
public class WindowManagerTest {

  private static final String LOADING = "...";

  @Test
  @DisplayName("Should answer a miss with placeholders and serve lines once the reload lands")
  void resolve_MissThenHit_ServesLoadedLines() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 25);
    final ManualExecutor executor = new ManualExecutor();
    final RepaintListener listener = mock(RepaintListener.class);
    final WindowManager window = new WindowManager(store, executor, listener, LOADING);

    assertThat(window.resolve(12, 5)).containsExactly(LOADING, LOADING, LOADING, LOADING, LOADING);
    assertThat(window.currentChunkIndex()).isEqualTo(1);
    assertThat(executor.pending()).isEqualTo(1);
    verifyNoInteractions(listener);

    executor.runAll();

    final ArgumentCaptor<RepaintEvent> event = ArgumentCaptor.forClass(RepaintEvent.class);
    verify(listener).onRepaint(event.capture());
    assertThat(event.getValue().chunkIndex()).isEqualTo(1);
    assertThat(window.resolve(12, 5)).containsExactly("line 12", "line 13", "line 14", "line 15", "line 16");
    assertThat(window.residentChunkIndexes()).containsExactly(0, 1, 2);
    assertThat(executor.pending()).isZero();
  }

  @Test
  @DisplayName("Should not schedule a second reload while one for the same chunk is in flight")
  void resolve_RepeatedMissSameChunk_SchedulesOnce() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 25);
    final ManualExecutor executor = new ManualExecutor();
    final WindowManager window = new WindowManager(store, executor, e -> { }, LOADING);

    window.resolve(20, 3);
    final List<String> second = window.resolve(21, 3);

    assertThat(second).containsOnly(LOADING);
    assertThat(executor.pending()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should serve the line after a chunk boundary from the next chunk")
  void resolve_ViewportAcrossBoundary_UsesNextChunk() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 50_000, 60_000);
    final WindowManager window = new WindowManager(store, Runnable::run, e -> { }, LOADING);

    window.resolve(49_995, 10);
    final List<String> lines = window.resolve(49_995, 10);

    assertThat(window.currentChunkIndex()).isZero();
    assertThat(lines.get(4)).isEqualTo("line 49999");
    assertThat(lines.get(5)).isEqualTo("line 50000");
    assertThat(lines.get(9)).isEqualTo("line 50004");
  }

  @Test
  @DisplayName("Should move to chunk 1 when the viewport starts at line 50000")
  void resolve_ViewportStartsInNextChunk_TransitionsWindow() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 50_000, 60_000);
    final ManualExecutor executor = new ManualExecutor();
    final WindowManager window = new WindowManager(store, executor, e -> { }, LOADING);
    window.resolve(49_990, 10);
    executor.runAll();
    assertThat(window.resolve(49_990, 10)).endsWith("line 49999");

    assertThat(window.resolve(50_000, 10)).containsOnly(LOADING);
    assertThat(window.currentChunkIndex()).isEqualTo(1);
    executor.runAll();

    final List<String> lines = window.resolve(50_000, 10);
    assertThat(lines.get(0)).isEqualTo("line 50000");
    assertThat(window.residentChunkIndexes()).containsExactly(0, 1);
  }

  @Test
  @DisplayName("Should return empty strings past the end of the document")
  void resolve_PastEnd_ReturnsEmptyStrings() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 13);
    final WindowManager window = new WindowManager(store, Runnable::run, e -> { }, LOADING);

    window.resolve(10, 6);
    assertThat(window.resolve(10, 6)).containsExactly("line 10", "line 11", "line 12", "", "", "");

    window.resolve(500, 3);
    assertThat(window.resolve(500, 3)).containsExactly("", "", "");
  }

  @Test
  @DisplayName("Should return a full viewport of empty strings near the largest line index")
  void resolve_StartNearIntMax_ReturnsFullViewport() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 50_000, 1);
    final WindowManager window = new WindowManager(store, Runnable::run, e -> { }, LOADING);

    assertThat(window.resolve(Integer.MAX_VALUE - 2, 5)).hasSize(5).containsOnly(LOADING);
    assertThat(window.resolve(Integer.MAX_VALUE - 2, 5)).containsExactly("", "", "", "", "");
  }

  @Test
  @DisplayName("Should resolve positions before the first line to empty strings")
  void resolve_NegativeStart_EmptyStringsBeforeFirstLine() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 5);
    final WindowManager window = new WindowManager(store, Runnable::run, e -> { }, LOADING);

    window.resolve(-3, 5);
    assertThat(window.currentChunkIndex()).isZero();
    assertThat(window.resolve(-3, 5)).containsExactly("", "", "", "line 0", "line 1");
  }

  @Test
  @DisplayName("Should keep only the most recent target when two jumps race")
  void resolve_TwoRapidJumps_EndsOnSecondTarget() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 50);
    final ManualExecutor executor = new ManualExecutor();
    final RepaintListener listener = mock(RepaintListener.class);
    final WindowManager window = new WindowManager(store, executor, listener, LOADING);

    window.resolve(20, 5);
    window.resolve(40, 5);
    executor.runAll();

    assertThat(window.currentChunkIndex()).isEqualTo(4);
    assertThat(window.residentChunkIndexes()).containsExactly(3, 4);
    assertThat(window.resolve(40, 5)).containsExactly("line 40", "line 41", "line 42", "line 43", "line 44");
    assertThat(window.residentLines(2)).isEmpty();
    verify(listener, times(1)).onRepaint(any());
  }

  @Test
  @DisplayName("Should end on the second target even when the superseded reload runs last")
  void resolve_SupersededReloadRunsLast_IsDropped() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 50);
    final ManualExecutor executor = new ManualExecutor();
    final WindowManager window = new WindowManager(store, executor, e -> { }, LOADING);

    window.resolve(40, 5);
    window.resolve(0, 5);
    executor.runAllReversed();

    assertThat(window.currentChunkIndex()).isZero();
    assertThat(window.residentChunkIndexes()).containsExactly(0, 1);
    assertThat(window.resolve(0, 2)).containsExactly("line 0", "line 1");
  }

  @Test
  @DisplayName("Should drop a completion whose key no longer matches the current chunk")
  void commit_StaleTask_Dropped() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 50);
    final WindowManager window = new WindowManager(store, Runnable::run, e -> { }, LOADING);
    window.resolve(0, 5);

    final ReloadTask stale = new ReloadTask(window, store, 3);
    window.commit(stale, List.of("x"), List.of("y"), List.of("z"));

    assertThat(window.residentChunkIndexes()).containsExactly(0, 1);
    assertThat(window.resolve(0, 1)).containsExactly("line 0");
  }

  @Test
  @DisplayName("Should retry on the next resolve after a failed reload")
  void resolve_ReloadFails_RetriesOnNextResolve() throws Exception {
    final GzipLineCodec codec = spy(new GzipLineCodec());
    final ChunkStore store = storeWithLines(codec, 10, 30);
    doThrow(new CodecException("corrupt")).doCallRealMethod().when(codec).decompress(any(byte[].class));
    final ManualExecutor executor = new ManualExecutor();
    final WindowManager window = new WindowManager(store, executor, e -> { }, LOADING);

    window.resolve(0, 3);
    executor.runAll();

    assertThat(window.currentChunkIndex()).isEqualTo(-1);
    assertThat(window.residentChunkIndexes()).isEmpty();

    assertThat(window.resolve(0, 3)).containsOnly(LOADING);
    executor.runAll();
    assertThat(window.resolve(0, 3)).containsExactly("line 0", "line 1", "line 2");
  }

  @Test
  @DisplayName("Should refresh resident buffers and restart overlapping reloads when chunks are written")
  void chunksWritten_OverlappingPendingReload_Restarted() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 5);
    final ManualExecutor executor = new ManualExecutor();
    final WindowManager window = new WindowManager(store, executor, e -> { }, LOADING);
    window.resolve(0, 8);

    final List<String> grown = lines(0, 8);
    store.commit(List.of(store.stage(0, grown)), 3);
    window.chunksWritten(Collections.singletonMap(0, grown));
    assertThat(executor.pending()).isEqualTo(2);
    executor.runAll();

    assertThat(window.resolve(0, 8)).containsExactlyElementsOf(grown);
  }

  @Test
  @DisplayName("Should drop buffers and answer with empty strings after close")
  void close_DropsBuffers() throws Exception {
    final ChunkStore store = storeWithLines(new GzipLineCodec(), 10, 20);
    final WindowManager window = new WindowManager(store, Runnable::run, e -> { }, LOADING);
    window.resolve(0, 2);

    window.close();

    assertThat(window.residentChunkIndexes()).isEmpty();
    assertThat(window.resolve(0, 2)).containsExactly("", "");
  }

  private static ChunkStore storeWithLines(GzipLineCodec codec, int chunkSize, int lineCount) throws Exception {
    final ChunkStore store = new ChunkStore(codec, chunkSize);
    for (int index = 0; index * chunkSize < lineCount; index++) {
      final int from = index * chunkSize;
      store.writeChunk(index, lines(from, Math.min(lineCount, from + chunkSize)));
    }
    store.commit(List.of(), lineCount);
    return store;
  }

  private static List<String> lines(int fromInclusive, int toExclusive) {
    final List<String> out = new ArrayList<>(toExclusive - fromInclusive);
    for (int i = fromInclusive; i < toExclusive; i++) {
      out.add("line " + i);
    }
    return out;
  }
}
