package com.demonlist.leaderboard.auth;

import com.demonlist.leaderboard.model.UserRecord;

public interface AccessTokenCodec {

  String issue(UserRecord user);

  // 署名を検証せずにユーザー ID だけを取り出す。形式不正なら UNAUTHORIZED
  int decodeUnverifiedId(String token);

  // 署名鍵はユーザーのパスワードハッシュに依存するので、ユーザーを引いてから検証する
  boolean verify(String token, UserRecord user);
}
