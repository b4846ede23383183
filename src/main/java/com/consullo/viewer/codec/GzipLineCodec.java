package com.consullo.viewer.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LineCodec} backed by gzip streams.
 *
 * <p>Encoding:
 * <ul>
 * <li>Lines are joined with {@code '\n'} and encoded as UTF-8 before compression.</li>
 * <li>An empty line list is encoded as a zero-length buffer, so it stays distinguishable from a single
 * empty line.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class GzipLineCodec implements LineCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(GzipLineCodec.class);

  private static final char SEPARATOR = '\n';
  private static final int BUFFER_SIZE = 8192;
  private static final byte[] EMPTY = new byte[0];

  @Override
  public byte[] compress(final List<String> lines) throws CodecException {
    Validate.notNull(lines, "lines must not be null");
    if (lines.isEmpty()) {
      return EMPTY;
    }

    final StringBuilder text = new StringBuilder();
    for (int i = 0; i < lines.size(); i++) {
      final String line = lines.get(i);
      Validate.notNull(line, "line %d must not be null", i);
      Validate.isTrue(line.indexOf(SEPARATOR) < 0, "line %d contains an embedded newline", i);
      if (i > 0) {
        text.append(SEPARATOR);
      }
      text.append(line);
    }

    final byte[] raw = text.toString().getBytes(StandardCharsets.UTF_8);
    final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out, BUFFER_SIZE)) {
      gzip.write(raw);
    } catch (IOException e) {
      throw new CodecException("Failed compressing " + lines.size() + " lines", e);
    }

    final byte[] compressed = out.toByteArray();
    LOGGER.debug("compress: {} lines, {} bytes -> {} bytes", lines.size(), raw.length, compressed.length);
    return compressed;
  }

  @Override
  public List<String> decompress(final byte[] data) throws CodecException {
    Validate.notNull(data, "data must not be null");
    if (data.length == 0) {
      return Collections.emptyList();
    }

    final ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 4);
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data), BUFFER_SIZE)) {
      final byte[] buffer = new byte[BUFFER_SIZE];
      int n;
      while ((n = gzip.read(buffer)) >= 0) {
        out.write(buffer, 0, n);
      }
    } catch (IOException e) {
      throw new CodecException("Failed decompressing " + data.length + " bytes", e);
    }

    // Limit -1 keeps trailing empty lines.
    final String text = out.toString(StandardCharsets.UTF_8);
    final List<String> lines = new ArrayList<>(Arrays.asList(text.split(String.valueOf(SEPARATOR), -1)));
    LOGGER.debug("decompress: {} bytes -> {} lines", data.length, lines.size());
    return lines;
  }
}
