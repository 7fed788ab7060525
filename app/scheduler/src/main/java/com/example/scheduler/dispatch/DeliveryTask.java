/*
 * どこで: Scheduler 発火処理
 * 何を: 配信 1 件を配信プールで実行し、送信を始めた時刻か打ち切りを記録する
 * なぜ: 配信タイムアウトをキュー待ちではなく送信開始から数え、開始期限を過ぎた配信は送らずに済ませるため
 */
package com.example.scheduler.dispatch;

import com.example.scheduler.channel.ChannelAdapter;
import com.example.scheduler.channel.DeliveryRequest;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class DeliveryTask implements Runnable {

  private static final int QUEUED = 0;
  private static final int RUNNING = 1;
  private static final int ABANDONED = 2;

  private final DeliveryRequest request;
  private final ChannelAdapter channelAdapter;
  private final long startDeadlineNanos;
  private final AtomicInteger state = new AtomicInteger(QUEUED);
  // RUNNING か ABANDONED に確定した時点で外れる
  private final CountDownLatch settled = new CountDownLatch(1);
  private volatile long startedAtNanos;

  DeliveryTask(DeliveryRequest request, ChannelAdapter channelAdapter, long startDeadlineNanos) {
    this.request = request;
    this.channelAdapter = channelAdapter;
    this.startDeadlineNanos = startDeadlineNanos;
  }

  DeliveryRequest request() {
    return request;
  }

  @Override
  public void run() {
    if (System.nanoTime() - startDeadlineNanos > 0) {
      if (state.compareAndSet(QUEUED, ABANDONED)) {
        settled.countDown();
      }
      return;
    }
    if (!state.compareAndSet(QUEUED, RUNNING)) {
      return;
    }
    startedAtNanos = System.nanoTime();
    settled.countDown();
    channelAdapter.send(request);
  }

  /**
   * 送信開始を開始期限まで待つ。期限までに始まらなければ以後も送らないよう打ち切る。
   *
   * @return 送信を始めた時刻 (System.nanoTime 基準)。打ち切った場合は empty
   */
  OptionalLong awaitStart() throws InterruptedException {
    settled.await(Math.max(0, startDeadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
    if (state.compareAndSet(QUEUED, ABANDONED)) {
      return OptionalLong.empty();
    }
    // 実行側が状態を確定させた直後なので待ちはすぐ終わる
    settled.await();
    return state.get() == RUNNING ? OptionalLong.of(startedAtNanos) : OptionalLong.empty();
  }
}
