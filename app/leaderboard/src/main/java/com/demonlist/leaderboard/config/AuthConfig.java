/*
 * どこで: Leaderboard アプリの設定
 * 何を: パスワードのハッシュ化に使う PasswordEncoder と、トークン発行時刻の Clock を提供する
 * なぜ: 登録/認証/失効の各コマンドで同じアルゴリズムを共有し、発行時刻をテストで固定できるようにするため
 */
package com.demonlist.leaderboard.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class AuthConfig {

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
