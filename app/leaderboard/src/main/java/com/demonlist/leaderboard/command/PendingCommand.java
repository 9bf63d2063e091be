package com.demonlist.leaderboard.command;

import java.util.concurrent.CompletableFuture;

// キュー内で待機中のコマンドと、その結果を待つ呼び出し側の Future の組
final class PendingCommand<R> {

  private final Command<R> command;
  private final CompletableFuture<R> result = new CompletableFuture<>();

  PendingCommand(Command<R> command) {
    this.command = command;
  }

  Command<R> command() {
    return command;
  }

  CompletableFuture<R> result() {
    return result;
  }

  R execute(CommandScope scope) {
    return command.execute(scope);
  }

  void complete(R value) {
    result.complete(value);
  }

  void fail(Throwable error) {
    result.completeExceptionally(error);
  }
}
