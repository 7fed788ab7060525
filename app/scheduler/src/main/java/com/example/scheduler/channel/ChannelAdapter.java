/*
 * どこで: Scheduler チャネル配信
 * 何を: チャネル配信の抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.example.scheduler.channel;

public interface ChannelAdapter {

  /**
   * request.channel() で指定されたチャネルへ送る。正常終了を成功とみなす。
   *
   * @throws ChannelDeliveryException 送信に失敗した場合
   */
  void send(DeliveryRequest request);
}
