/*
 * どこで: Scheduler 宛先解決
 * 何を: 抽象的な宛先をユーザ ID 集合へ展開するディレクトリの境界
 * なぜ: ユーザ/ロール/グループの保存方式をスケジューラ本体から切り離すため
 */
package com.example.scheduler.recipient;

import com.example.scheduler.model.RecipientDescriptor;
import java.time.Instant;
import java.util.Set;

public interface RecipientDirectory {

  /**
   * asOf 時点で有効なユーザ ID を返す。存在しない宛先は空集合とする。
   *
   * @throws org.springframework.dao.DataAccessException ディレクトリに到達できない場合
   */
  Set<String> expand(RecipientDescriptor descriptor, Instant asOf);
}
