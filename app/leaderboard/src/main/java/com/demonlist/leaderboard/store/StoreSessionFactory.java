package com.demonlist.leaderboard.store;

import com.demonlist.leaderboard.api.ConnectionUnavailableException;

public interface StoreSessionFactory {

  StoreSession open() throws ConnectionUnavailableException;
}
