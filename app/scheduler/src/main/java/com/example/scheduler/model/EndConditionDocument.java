/*
 * どこで: Scheduler の入出力/保存形式
 * 何を: 終了条件のフラットな JSON 表現
 * なぜ: never/on_date/after_occurrences を type 文字列で受け取るため
 */
package com.example.scheduler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EndConditionDocument(String type, Instant endDate, Integer occurrences) {

  private static final String NEVER = "never";
  private static final String ON_DATE = "on_date";
  private static final String AFTER_OCCURRENCES = "after_occurrences";

  public EndCondition toEndCondition() {
    if (type == null || type.isBlank() || NEVER.equals(type)) {
      return EndCondition.never();
    }
    if (ON_DATE.equals(type)) {
      if (endDate == null) {
        throw new IllegalArgumentException("end_condition.end_date is required for on_date");
      }
      return new EndCondition.OnDate(endDate);
    }
    if (AFTER_OCCURRENCES.equals(type)) {
      if (occurrences == null) {
        throw new IllegalArgumentException(
            "end_condition.occurrences is required for after_occurrences");
      }
      return new EndCondition.AfterOccurrences(occurrences);
    }
    throw new IllegalArgumentException("unsupported end_condition.type: " + type);
  }

  public static EndConditionDocument from(EndCondition endCondition) {
    if (endCondition instanceof EndCondition.OnDate onDate) {
      return new EndConditionDocument(ON_DATE, onDate.endDate(), null);
    }
    if (endCondition instanceof EndCondition.AfterOccurrences after) {
      return new EndConditionDocument(AFTER_OCCURRENCES, null, after.occurrences());
    }
    return new EndConditionDocument(NEVER, null, null);
  }
}
