package com.example.fanout.model;

/** 複数行の状態更新結果。件数 0 も正常系。 */
public record BulkUpdateResult(long matched, long modified) {

  public static BulkUpdateResult ofModified(long count) {
    return new BulkUpdateResult(count, count);
  }
}
