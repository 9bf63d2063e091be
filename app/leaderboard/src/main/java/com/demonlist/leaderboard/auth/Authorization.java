package com.demonlist.leaderboard.auth;

// Authorization ヘッダの中身。パース自体は呼び出し側(HTTP 層)の責務
public sealed interface Authorization permits Authorization.Basic, Authorization.Token {

  record Basic(String username, String password) implements Authorization {

    @Override
    public String toString() {
      return "Basic[username=" + username + "]";
    }
  }

  record Token(String token) implements Authorization {

    @Override
    public String toString() {
      return "Token[***]";
    }
  }
}
