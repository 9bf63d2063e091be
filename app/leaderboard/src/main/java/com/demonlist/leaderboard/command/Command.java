/*
 * どこで: コマンドキュー
 * 何を: ワーカー上で実行される型付きの作業単位
 * なぜ: キューは中身を知らずにルーティングだけを行い、結果型はコマンド側で静的に決めるため
 */
package com.demonlist.leaderboard.command;

public interface Command<R> {

  R execute(CommandScope scope);

  // メトリクス/ログのタグに使う。既定はクラス名
  default String name() {
    return getClass().getSimpleName();
  }
}
