/*
 * どこで: Scheduler の入出力/保存形式
 * 何を: 宛先のフラットな JSON 表現 ({type, id})
 * なぜ: 旧来の class/all 表記も受け付けつつドメインの宛先型へ正規化するため
 */
package com.example.scheduler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecipientDocument(String type, String id) {

  public RecipientDescriptor toDescriptor() {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("recipients[].type is required");
    }
    return switch (type.trim().toLowerCase(Locale.ROOT)) {
      case "user" -> RecipientDescriptor.user(id);
      case "role" -> RecipientDescriptor.role(id);
      case "group", "class" -> RecipientDescriptor.group(id);
      case "everyone", "all" -> RecipientDescriptor.everyone();
      default -> throw new IllegalArgumentException("unsupported recipients[].type: " + type);
    };
  }

  public static RecipientDocument from(RecipientDescriptor descriptor) {
    if (descriptor instanceof RecipientDescriptor.User user) {
      return new RecipientDocument("user", user.userId());
    }
    if (descriptor instanceof RecipientDescriptor.Role role) {
      return new RecipientDocument("role", role.roleId());
    }
    if (descriptor instanceof RecipientDescriptor.Group group) {
      return new RecipientDocument("group", group.groupId());
    }
    return new RecipientDocument("everyone", null);
  }
}
