package com.consullo.viewer.demo;

import com.consullo.viewer.session.ChunkLoader;
import com.consullo.viewer.session.ChunkLoaderConfig;
import java.io.BufferedReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a large text file (or generated lines) into chunked mode and prints a few viewport pages.
 *
 * <p>Usage: {@code ChunkedViewerDemo [file] [chunkSize]}. Without a file, 250 000 numbered lines are
 * generated.
 *
 * @since 1.0
 */
public final class ChunkedViewerDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedViewerDemo.class);

  private static final int VIEWPORT_SIZE = 10;
  private static final int BATCH_SIZE = 10_000;
  private static final int GENERATED_LINES = 250_000;
  private static final long REPAINT_TIMEOUT_MILLIS = 5_000L;

  private ChunkedViewerDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional file path and chunk size
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final int chunkSize = args.length > 1 ? Integer.parseInt(args[1]) : ChunkLoaderConfig.DEFAULT_CHUNK_SIZE;
    final ConsoleHostViewer viewer = new ConsoleHostViewer(System.out, VIEWPORT_SIZE);

    try (ChunkLoader loader = new ChunkLoader(viewer)) {
      loader.activate(chunkSize);

      final long started = System.nanoTime();
      if (args.length > 0) {
        loadFile(loader, Path.of(args[0]));
      } else {
        loadGenerated(loader);
      }
      LOGGER.info("Loaded {} lines into {} chunks ({} compressed bytes) in {} ms",
          loader.totalLines(), loader.chunkCount(), loader.compressedSize(),
          (System.nanoTime() - started) / 1_000_000L);

      final int total = loader.totalLines();
      for (int start : new int[]{0, Math.max(0, chunkSize - VIEWPORT_SIZE / 2), Math.max(0, total - VIEWPORT_SIZE)}) {
        viewer.scrollTo(start);
        viewer.printViewport(ChunkLoaderConfig.DEFAULT_LOADING_PLACEHOLDER, REPAINT_TIMEOUT_MILLIS);
      }

      System.out.println("=== " + loader.stats() + " ===");
    }
  }

  private static void loadFile(ChunkLoader loader, Path file) throws Exception {
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      List<String> batch = new ArrayList<>(BATCH_SIZE);
      String line;
      while ((line = reader.readLine()) != null) {
        batch.add(line);
        if (batch.size() == BATCH_SIZE) {
          loader.appendLines(batch, true).join();
          batch = new ArrayList<>(BATCH_SIZE);
        }
      }
      if (!batch.isEmpty()) {
        loader.appendLines(batch).join();
      }
    }
  }

  private static void loadGenerated(ChunkLoader loader) {
    for (int from = 0; from < GENERATED_LINES; from += BATCH_SIZE) {
      final List<String> batch = new ArrayList<>(BATCH_SIZE);
      for (int i = from; i < Math.min(from + BATCH_SIZE, GENERATED_LINES); i++) {
        batch.add("generated line " + i);
      }
      loader.appendLines(batch, true).join();
    }
  }
}
