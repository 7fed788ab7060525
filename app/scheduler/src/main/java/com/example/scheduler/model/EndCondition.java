/*
 * どこで: Scheduler ドメインモデル
 * 何を: 繰り返しスケジュールの終了条件
 * なぜ: never/on_date/after_occurrences を型で区別し、使う側の分岐を閉じるため
 */
package com.example.scheduler.model;

import java.time.Instant;

public sealed interface EndCondition
    permits EndCondition.Never, EndCondition.OnDate, EndCondition.AfterOccurrences {

  /** 候補時刻と発火済み回数から、この条件で打ち切るべきかを判定する。 */
  boolean exhausts(Instant candidate, int occurrenceCount);

  static EndCondition never() {
    return Never.INSTANCE;
  }

  record Never() implements EndCondition {
    static final Never INSTANCE = new Never();

    @Override
    public boolean exhausts(Instant candidate, int occurrenceCount) {
      return false;
    }
  }

  record OnDate(Instant endDate) implements EndCondition {
    public OnDate {
      if (endDate == null) {
        throw new IllegalArgumentException("end_condition.end_date is required");
      }
    }

    @Override
    public boolean exhausts(Instant candidate, int occurrenceCount) {
      return candidate.isAfter(endDate);
    }
  }

  record AfterOccurrences(int occurrences) implements EndCondition {
    public AfterOccurrences {
      if (occurrences < 1) {
        throw new IllegalArgumentException("end_condition.occurrences must be >= 1");
      }
    }

    @Override
    public boolean exhausts(Instant candidate, int occurrenceCount) {
      return occurrenceCount >= occurrences;
    }
  }
}
