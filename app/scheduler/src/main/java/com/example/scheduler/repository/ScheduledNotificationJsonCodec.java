/*
 * どこで: Scheduler データアクセス
 * 何を: channels/recipients/schedule の jsonb 列とドメイン型を相互変換する
 * なぜ: JSON の形を ScheduleDocument/RecipientDocument に揃え、API と保存形式を一致させるため
 */
package com.example.scheduler.repository;

import com.example.scheduler.model.RecipientDescriptor;
import com.example.scheduler.model.RecipientDocument;
import com.example.scheduler.model.ScheduleDescriptor;
import com.example.scheduler.model.ScheduleDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ScheduledNotificationJsonCodec {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<List<RecipientDocument>> RECIPIENT_LIST =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String writeChannels(Set<String> channels) {
    // 並び順を固定し、同じ集合が常に同じ JSON になるようにする
    return write(new TreeSet<>(channels));
  }

  public Set<String> readChannels(String json) {
    return new LinkedHashSet<>(read(json, STRING_LIST));
  }

  public String writeRecipients(List<RecipientDescriptor> recipients) {
    return write(recipients.stream().map(RecipientDocument::from).toList());
  }

  public List<RecipientDescriptor> readRecipients(String json) {
    return read(json, RECIPIENT_LIST).stream().map(RecipientDocument::toDescriptor).toList();
  }

  public String writeSchedule(ScheduleDescriptor schedule) {
    return write(ScheduleDocument.from(schedule));
  }

  public ScheduleDescriptor readSchedule(String json, Instant createdAt) {
    try {
      return objectMapper.readValue(json, ScheduleDocument.class).toDescriptor(createdAt);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored schedule parse failure", ex);
    }
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("scheduled notification serialization failure", ex);
    }
  }

  private <T> T read(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored scheduled notification parse failure", ex);
    }
  }
}
