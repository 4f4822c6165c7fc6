package com.finalsentence.application.port;

import com.finalsentence.domain.MatchRecord;
import com.finalsentence.domain.Phrase;
import com.finalsentence.domain.PlayerProfile;
import com.finalsentence.domain.PlayerStats;
import com.finalsentence.domain.RoomSnapshot;
import java.util.List;
import java.util.Optional;

/**
 * Storage contract used by the orchestrator. Writes are best-effort; callers never wait on them
 * to make progress.
 */
public interface PersistenceGateway {
  Optional<PlayerProfile> getPlayer(String id);

  void savePlayer(PlayerProfile player);

  String createRoom(RoomSnapshot room);

  Optional<RoomSnapshot> getRoom(String id);

  Optional<RoomSnapshot> getRoomByCode(String code);

  void updateRoom(RoomSnapshot room);

  void deleteRoom(String id);

  String saveMatch(MatchRecord record);

  List<Phrase> getPhrases(int limit);

  PlayerStats getPlayerStats(String playerId);
}
