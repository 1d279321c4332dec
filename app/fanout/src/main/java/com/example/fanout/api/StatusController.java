/*
 * どこで: fan-out API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 手動で疎通確認できるようにするため
 */
package com.example.fanout.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "fanout: ok";
  }
}
