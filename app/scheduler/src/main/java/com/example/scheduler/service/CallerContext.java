/*
 * どこで: Scheduler サービス層
 * 何を: 操作を呼び出したユーザとロールを表す
 * なぜ: セッション等の暗黙の現在ユーザに頼らず、各操作へ明示的に渡すため
 */
package com.example.scheduler.service;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record CallerContext(String userId, Set<String> roles) {

  public static final String ROLE_ADMIN = "admin";

  public CallerContext {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("caller user id is required");
    }
    // ロール名は大小文字を区別しない
    roles =
        roles == null
            ? Set.of()
            : roles.stream()
                .filter(role -> role != null && !role.isBlank())
                .map(role -> role.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
  }

  public boolean hasRole(String role) {
    return roles.contains(role.toLowerCase(Locale.ROOT));
  }

  public boolean isAdmin() {
    return hasRole(ROLE_ADMIN);
  }
}
