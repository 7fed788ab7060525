/*
 * どこで: Scheduler 宛先解決
 * 何を: ディレクトリ/設定ストアの失敗で宛先を確定できないことを表す例外
 * なぜ: 発火を中断して claim を解放すべき失敗を配信失敗と区別するため
 */
package com.example.scheduler.recipient;

public class RecipientResolutionException extends RuntimeException {

  public RecipientResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
