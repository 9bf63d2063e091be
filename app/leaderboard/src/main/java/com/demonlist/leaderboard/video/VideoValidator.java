package com.demonlist.leaderboard.video;

// 生の動画 URL を検証し、保存用の正規形を返す。不正なら INVALID_VIDEO を投げる
public interface VideoValidator {

  String validate(String rawUrl);
}
