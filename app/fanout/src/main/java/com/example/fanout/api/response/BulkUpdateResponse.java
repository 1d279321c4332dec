package com.example.fanout.api.response;

import com.example.fanout.model.BulkUpdateResult;

public record BulkUpdateResponse(long matched, long modified) {

  public static BulkUpdateResponse from(BulkUpdateResult result) {
    return new BulkUpdateResponse(result.matched(), result.modified());
  }
}
