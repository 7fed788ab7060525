/*
 * どこで: Scheduler ドメインモデル
 * 何を: 未解決の宛先 (ユーザ/ロール/グループ/全員)
 * なぜ: 送信時点のディレクトリで展開するまで抽象的な宛先のまま保持するため
 */
package com.example.scheduler.model;

import java.util.Objects;

public sealed interface RecipientDescriptor
    permits RecipientDescriptor.User,
        RecipientDescriptor.Role,
        RecipientDescriptor.Group,
        RecipientDescriptor.Everyone {

  static RecipientDescriptor user(String userId) {
    return new User(userId);
  }

  static RecipientDescriptor role(String roleId) {
    return new Role(roleId);
  }

  static RecipientDescriptor group(String groupId) {
    return new Group(groupId);
  }

  static RecipientDescriptor everyone() {
    return Everyone.INSTANCE;
  }

  record User(String userId) implements RecipientDescriptor {
    public User {
      requireId(userId, "user");
    }
  }

  record Role(String roleId) implements RecipientDescriptor {
    public Role {
      requireId(roleId, "role");
    }
  }

  /** クラスなどのユーザ集合。 */
  record Group(String groupId) implements RecipientDescriptor {
    public Group {
      requireId(groupId, "group");
    }
  }

  record Everyone() implements RecipientDescriptor {
    static final Everyone INSTANCE = new Everyone();
  }

  private static void requireId(String id, String kind) {
    if (Objects.requireNonNullElse(id, "").isBlank()) {
      throw new IllegalArgumentException("recipients[].id is required for " + kind + " recipients");
    }
  }
}
