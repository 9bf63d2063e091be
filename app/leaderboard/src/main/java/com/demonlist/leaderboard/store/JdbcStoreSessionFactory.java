package com.demonlist.leaderboard.store;

import com.demonlist.leaderboard.api.ConnectionUnavailableException;
import java.sql.SQLException;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class JdbcStoreSessionFactory implements StoreSessionFactory {

  private final DataSource dataSource;

  @Override
  public StoreSession open() {
    try {
      return new JdbcStoreSession(dataSource.getConnection());
    } catch (SQLException ex) {
      throw new ConnectionUnavailableException(ex);
    }
  }
}
