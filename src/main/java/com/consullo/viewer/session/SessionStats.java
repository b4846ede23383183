package com.consullo.viewer.session;

import java.util.List;

/**
 * Immutable snapshot of chunked-mode counters.
 */
public final class SessionStats {

  private final int chunkSize;
  private final int totalLines;
  private final int chunkCount;
  private final long compressedSize;
  private final List<Integer> residentChunks;

  private SessionStats(Builder b) {
    this.chunkSize = b.chunkSize;
    this.totalLines = b.totalLines;
    this.chunkCount = b.chunkCount;
    this.compressedSize = b.compressedSize;
    this.residentChunks = b.residentChunks;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public int getTotalLines() {
    return totalLines;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public long getCompressedSize() {
    return compressedSize;
  }

  /**
   * Indexes of the chunks currently held decompressed, in ascending order.
   */
  public List<Integer> getResidentChunks() {
    return residentChunks;
  }

  @Override
  public String toString() {
    return "SessionStats[totalLines=" + totalLines + ", chunkCount=" + chunkCount
        + ", compressedSize=" + compressedSize + ", residentChunks=" + residentChunks + "]";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private int chunkSize;
    private int totalLines;
    private int chunkCount;
    private long compressedSize;
    private List<Integer> residentChunks = List.of();

    private Builder() {
    }

    public Builder chunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    public Builder totalLines(int totalLines) {
      this.totalLines = totalLines;
      return this;
    }

    public Builder chunkCount(int chunkCount) {
      this.chunkCount = chunkCount;
      return this;
    }

    public Builder compressedSize(long compressedSize) {
      this.compressedSize = compressedSize;
      return this;
    }

    public Builder residentChunks(List<Integer> residentChunks) {
      this.residentChunks = List.copyOf(residentChunks);
      return this;
    }

    public SessionStats build() {
      if (chunkSize <= 0) {
        throw new IllegalArgumentException("chunkSize must be positive.");
      }
      if (totalLines < 0 || chunkCount < 0 || compressedSize < 0) {
        throw new IllegalArgumentException("counters must be non-negative.");
      }
      return new SessionStats(this);
    }
  }
}
