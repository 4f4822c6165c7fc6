package com.finalsentence.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finalsentence.application.port.PersistenceGateway;
import com.finalsentence.domain.MatchRecord;
import com.finalsentence.domain.Phrase;
import com.finalsentence.domain.PlayerProfile;
import com.finalsentence.domain.PlayerSnapshot;
import com.finalsentence.domain.PlayerStats;
import com.finalsentence.domain.RoomSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.sqlite.SQLiteConfig;

/**
 * Persistence gateway backed by a local SQLite database.
 *
 * <p>One JDBC connection, guarded by a lock, serves every call; all statements are
 * parameterized. Room snapshots and the phrase list of a match are stored as JSON. Failures
 * surface as {@link IllegalStateException} so the write-behind caller can log them.
 */
@Service
public class SqlitePersistenceGateway implements PersistenceGateway {
  private static final Logger log = LoggerFactory.getLogger(SqlitePersistenceGateway.class);

  private static final String[] SCHEMA = {
    "CREATE TABLE IF NOT EXISTS players ("
        + "id TEXT PRIMARY KEY, display_name TEXT NOT NULL, last_seen TEXT NOT NULL)",
    "CREATE TABLE IF NOT EXISTS rooms ("
        + "id TEXT PRIMARY KEY, code TEXT NOT NULL, data TEXT NOT NULL, created_at TEXT NOT NULL)",
    "CREATE INDEX IF NOT EXISTS rooms_code ON rooms(code)",
    "CREATE TABLE IF NOT EXISTS matches ("
        + "id TEXT PRIMARY KEY, room_id TEXT NOT NULL, winner_id TEXT, duration_seconds INTEGER,"
        + " played_at TEXT NOT NULL, phrases TEXT NOT NULL)",
    "CREATE INDEX IF NOT EXISTS matches_played_at ON matches(played_at)",
    "CREATE TABLE IF NOT EXISTS match_players ("
        + "match_id TEXT NOT NULL, player_id TEXT NOT NULL, display_name TEXT, status TEXT,"
        + " wpm REAL, errors INTEGER, progress REAL, PRIMARY KEY (match_id, player_id))",
    "CREATE TABLE IF NOT EXISTS phrases ("
        + "id INTEGER PRIMARY KEY AUTOINCREMENT, text TEXT NOT NULL, difficulty TEXT,"
        + " category TEXT, added_at TEXT NOT NULL)"
  };

  /** Corpus written to an empty phrase table: text, difficulty. */
  static final String[][] SEED_PHRASES = {
    {"La sombra avanzaba silenciosa por el pasillo.", "media"},
    {"Al abrir la puerta, nadie respondió al llamado.", "baja"},
    {"El susurro decía mi nombre al oído sin moverse nadie.", "media"},
    {"Las luces titilaron y la figura estaba ya detrás de mí.", "alta"},
    {"No había teléfonos en la casa, pero alguien marcó desde adentro.", "media"},
    {"Encontré una nota en mi almohada que decía: vuelve a dormir.", "baja"},
    {"El espejo reflejó una habitación que no era la mía.", "media"},
    {"Cada vez que parpadeaba, alguien estaba más cerca.", "alta"},
    {"La casa respiraba y yo no estaba dentro de ella.", "alta"},
    {"Las marcas en la pared formaban mi nombre, escrito de atrás hacia adelante.", "alta"}
  };

  private static final String SQL_UPSERT_PLAYER =
      "INSERT INTO players(id, display_name, last_seen) VALUES (?, ?, ?) "
          + "ON CONFLICT(id) DO UPDATE SET display_name = excluded.display_name,"
          + " last_seen = excluded.last_seen";
  private static final String SQL_PLAYER = "SELECT id, display_name FROM players WHERE id = ?";
  private static final String SQL_INSERT_ROOM =
      "INSERT OR REPLACE INTO rooms(id, code, data, created_at) VALUES (?, ?, ?, ?)";
  private static final String SQL_ROOM = "SELECT data FROM rooms WHERE id = ?";
  private static final String SQL_ROOM_BY_CODE =
      "SELECT data FROM rooms WHERE code = ? ORDER BY created_at DESC LIMIT 1";
  private static final String SQL_UPDATE_ROOM = "UPDATE rooms SET code = ?, data = ? WHERE id = ?";
  private static final String SQL_DELETE_ROOM = "DELETE FROM rooms WHERE id = ?";
  private static final String SQL_INSERT_MATCH =
      "INSERT INTO matches(id, room_id, winner_id, duration_seconds, played_at, phrases)"
          + " VALUES (?, ?, ?, ?, ?, ?)";
  private static final String SQL_INSERT_MATCH_PLAYER =
      "INSERT INTO match_players(match_id, player_id, display_name, status, wpm, errors, progress)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?)";
  private static final String SQL_PHRASES =
      "SELECT id, text, difficulty, category FROM phrases ORDER BY id LIMIT ?";
  private static final String SQL_COUNT_PHRASES = "SELECT COUNT(*) FROM phrases";
  private static final String SQL_INSERT_PHRASE =
      "INSERT INTO phrases(text, difficulty, category, added_at) VALUES (?, ?, ?, ?)";
  private static final String SQL_STATS =
      "SELECT COUNT(*), SUM(CASE WHEN m.winner_id = mp.player_id THEN 1 ELSE 0 END),"
          + " AVG(mp.wpm), MAX(mp.wpm), SUM(mp.errors), MAX(mp.display_name)"
          + " FROM match_players mp JOIN matches m ON m.id = mp.match_id"
          + " WHERE mp.player_id = ?";

  private final String jdbcUrl;
  private final ObjectMapper json;
  private final Object lock = new Object();

  private Connection conn;

  public SqlitePersistenceGateway(
      @Value("${finalsentence.database-jdbc-url:jdbc:sqlite:final_sentence.db}") String jdbcUrl,
      ObjectMapper json) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "finalsentence.database-jdbc-url");
    this.json = json;
  }

  /**
   * Open the database, create missing tables and seed the phrase corpus if the table is empty.
   *
   * @throws SQLException if the database cannot be opened or the schema cannot be created
   */
  @PostConstruct
  public void open() throws SQLException {
    long t0 = System.nanoTime();
    try {
      SQLiteConfig cfg = new SQLiteConfig();
      cfg.enforceForeignKeys(true);
      cfg.setBusyTimeout(3000);

      synchronized (lock) {
        conn = DriverManager.getConnection(jdbcUrl, cfg.toProperties());
        conn.setAutoCommit(true);
        try (Statement s = conn.createStatement()) {
          for (String ddl : SCHEMA) {
            s.execute(ddl);
          }
        }
        seedPhrases();
      }

      long ms = (System.nanoTime() - t0) / 1_000_000;
      log.info("Game database ready at {} ({} ms).", jdbcUrl, ms);
    } catch (SQLException e) {
      close();
      throw e;
    }
  }

  @PreDestroy
  public void close() {
    synchronized (lock) {
      try {
        if (conn != null) conn.close();
      } catch (SQLException e) {
        log.debug("Closing game database failed: {}", e.getMessage());
      }
      conn = null;
    }
  }

  @Override
  public Optional<PlayerProfile> getPlayer(String id) {
    synchronized (lock) {
      try (PreparedStatement ps = connection().prepareStatement(SQL_PLAYER)) {
        ps.setString(1, id);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next()
              ? Optional.of(new PlayerProfile(rs.getString(1), rs.getString(2)))
              : Optional.empty();
        }
      } catch (SQLException e) {
        throw failure("getPlayer", e);
      }
    }
  }

  @Override
  public void savePlayer(PlayerProfile player) {
    update("savePlayer", SQL_UPSERT_PLAYER, player.id(), player.displayName(), now());
  }

  @Override
  public String createRoom(RoomSnapshot room) {
    update("createRoom", SQL_INSERT_ROOM, room.id(), room.code(), write(room), now());
    return room.id();
  }

  @Override
  public Optional<RoomSnapshot> getRoom(String id) {
    return queryString("getRoom", SQL_ROOM, id).map(this::readRoom);
  }

  @Override
  public Optional<RoomSnapshot> getRoomByCode(String code) {
    return queryString("getRoomByCode", SQL_ROOM_BY_CODE, code).map(this::readRoom);
  }

  @Override
  public void updateRoom(RoomSnapshot room) {
    update("updateRoom", SQL_UPDATE_ROOM, room.code(), write(room), room.id());
  }

  @Override
  public void deleteRoom(String id) {
    update("deleteRoom", SQL_DELETE_ROOM, id);
  }

  /** Insert the match and one row per player in a single transaction. */
  @Override
  public String saveMatch(MatchRecord record) {
    synchronized (lock) {
      Connection c = connection();
      try {
        c.setAutoCommit(false);
        try (PreparedStatement m = c.prepareStatement(SQL_INSERT_MATCH);
            PreparedStatement p = c.prepareStatement(SQL_INSERT_MATCH_PLAYER)) {
          m.setString(1, record.id());
          m.setString(2, record.roomId());
          m.setString(3, record.winnerId());
          m.setInt(4, record.durationSeconds());
          m.setString(5, record.playedAt().toString());
          m.setString(6, write(record.phrasesUsed()));
          m.executeUpdate();

          for (PlayerSnapshot s : record.players()) {
            p.setString(1, record.id());
            p.setString(2, s.id());
            p.setString(3, s.displayName());
            p.setString(4, s.status().name());
            p.setDouble(5, s.wpm());
            p.setInt(6, s.errors());
            p.setDouble(7, s.progress());
            p.addBatch();
          }
          p.executeBatch();
        }
        c.commit();
        return record.id();
      } catch (SQLException e) {
        rollback(c);
        throw failure("saveMatch", e);
      } finally {
        try {
          c.setAutoCommit(true);
        } catch (SQLException e) {
          log.debug("Restoring auto-commit failed: {}", e.getMessage());
        }
      }
    }
  }

  @Override
  public List<Phrase> getPhrases(int limit) {
    synchronized (lock) {
      try (PreparedStatement ps = connection().prepareStatement(SQL_PHRASES)) {
        ps.setInt(1, limit);
        try (ResultSet rs = ps.executeQuery()) {
          List<Phrase> out = new ArrayList<>();
          while (rs.next()) {
            out.add(
                new Phrase(
                    String.valueOf(rs.getLong(1)),
                    rs.getString(2),
                    rs.getString(3),
                    rs.getString(4)));
          }
          return out;
        }
      } catch (SQLException e) {
        throw failure("getPhrases", e);
      }
    }
  }

  /**
   * Aggregate every saved match the player took part in.
   *
   * @return totals, or {@link PlayerStats#empty} if the player has no matches
   */
  @Override
  public PlayerStats getPlayerStats(String playerId) {
    synchronized (lock) {
      try (PreparedStatement ps = connection().prepareStatement(SQL_STATS)) {
        ps.setString(1, playerId);
        try (ResultSet rs = ps.executeQuery()) {
          if (!rs.next() || rs.getInt(1) == 0) {
            return PlayerStats.empty(playerId);
          }
          return new PlayerStats(
              playerId,
              rs.getString(6),
              rs.getInt(1),
              rs.getInt(2),
              round2(rs.getDouble(3)),
              round2(rs.getDouble(4)),
              rs.getInt(5));
        }
      } catch (SQLException e) {
        throw failure("getPlayerStats", e);
      }
    }
  }

  /** Caller holds the lock. */
  private void seedPhrases() throws SQLException {
    try (Statement s = conn.createStatement();
        ResultSet rs = s.executeQuery(SQL_COUNT_PHRASES)) {
      if (rs.next() && rs.getInt(1) > 0) return;
    }
    try (PreparedStatement ps = conn.prepareStatement(SQL_INSERT_PHRASE)) {
      String added = now();
      for (String[] p : SEED_PHRASES) {
        ps.setString(1, p[0]);
        ps.setString(2, p[1]);
        ps.setString(3, "terror");
        ps.setString(4, added);
        ps.addBatch();
      }
      ps.executeBatch();
    }
    log.info("Seeded {} phrases.", SEED_PHRASES.length);
  }

  private void update(String op, String sql, String... params) {
    synchronized (lock) {
      try (PreparedStatement ps = connection().prepareStatement(sql)) {
        for (int i = 0; i < params.length; i++) {
          ps.setString(i + 1, params[i]);
        }
        ps.executeUpdate();
      } catch (SQLException e) {
        throw failure(op, e);
      }
    }
  }

  private Optional<String> queryString(String op, String sql, String param) {
    synchronized (lock) {
      try (PreparedStatement ps = connection().prepareStatement(sql)) {
        ps.setString(1, param);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
        }
      } catch (SQLException e) {
        throw failure(op, e);
      }
    }
  }

  private Connection connection() {
    if (conn == null) {
      throw new IllegalStateException("Game database is not open");
    }
    return conn;
  }

  private String write(Object value) {
    try {
      return json.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
    }
  }

  private RoomSnapshot readRoom(String data) {
    try {
      return json.readValue(data, new TypeReference<RoomSnapshot>() {});
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt room row", e);
    }
  }

  private static void rollback(Connection c) {
    try {
      c.rollback();
    } catch (SQLException e) {
      log.debug("Rollback failed: {}", e.getMessage());
    }
  }

  private static IllegalStateException failure(String op, SQLException e) {
    return new IllegalStateException(op + " failed: " + e.getMessage(), e);
  }

  private static String now() {
    return Instant.now().toString();
  }

  private static double round2(double v) {
    return Math.round(v * 100.0) / 100.0;
  }
}
